package com.scatterbrain.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Immutable snapshot of one node in a plan's task tree.
 *
 * @param description what the task is about
 * @param level       advisory abstraction level
 * @param notes       free-form notes; null when none are set
 * @param completed   whether the task has been marked done
 * @param summary     what was done, recorded at completion; null when absent or not completed
 * @param leased      whether an unconsumed completion lease is outstanding for the task
 * @param children    subtasks in insertion (addressing) order
 */
public record Task(
    String description,
    Level level,
    String notes,
    boolean completed,
    String summary,
    boolean leased,
    List<Task> children
) implements Serializable {

    public Task {
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Resolves a path relative to this task.
     *
     * @return the task at {@code path}, or null if the path leaves the tree
     */
    public Task find(IndexPath path) {
        Task current = this;
        for (int i = 0; i < path.depth(); i++) {
            int offset = path.get(i);
            if (offset >= current.children().size()) {
                return null;
            }
            current = current.children().get(offset);
        }
        return current;
    }
}
