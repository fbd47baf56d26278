package com.scatterbrain.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Immutable snapshot of a plan.
 *
 * @param id        store-assigned identifier, stable for the lifetime of the process
 * @param goal      the prompt the plan was created from
 * @param notes     free-form plan notes; null when none
 * @param root      the synthetic root task; its children are the plan's top-level tasks
 * @param current   path of the task currently in focus
 */
public record Plan(
    long id,
    String goal,
    String notes,
    Task root,
    IndexPath current
) implements Serializable {

    /** Top-level tasks in addressing order. */
    public List<Task> tasks() {
        return root.children();
    }

    /** Whether the plan as a whole has been completed. */
    public boolean completed() {
        return root.completed();
    }

    /**
     * @return the task at {@code path} (the root task for the empty path), or null if unresolvable
     */
    public Task find(IndexPath path) {
        return root.find(path);
    }
}
