package com.scatterbrain.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * The task in focus together with where it sits in the tree.
 *
 * @param path      the current path ({@link IndexPath#ROOT} when focus is on the plan itself)
 * @param level     the task's level; {@link Level#PLANNING} at the root
 * @param task      snapshot of the task, children included
 * @param ancestors descriptions of the tasks on the way down, outermost first, excluding the task itself
 */
public record CurrentTask(
    IndexPath path,
    Level level,
    Task task,
    List<String> ancestors
) implements Serializable {

    public CurrentTask {
        ancestors = ancestors == null ? List.of() : List.copyOf(ancestors);
    }
}
