package com.scatterbrain.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Node of the focused tree in a {@link DistilledContext}. Children are only filled in for
 * nodes on the path to the current task.
 */
public record TaskTreeNode(
    IndexPath path,
    String description,
    Level level,
    boolean completed,
    boolean current,
    String summary,
    String notes,
    List<TaskTreeNode> children
) implements Serializable {

    public TaskTreeNode {
        children = children == null ? List.of() : List.copyOf(children);
    }
}
