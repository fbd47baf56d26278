package com.scatterbrain.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Coarse "something changed" signal for one plan. Carries no diff: receivers are expected to
 * re-fetch the plan.
 *
 * @param eventType one of the constants below (e.g. "task.completed")
 * @param planId    the plan that changed
 * @param path      textual index path of the task involved; null for plan-level events
 * @param payload   small descriptive attributes, never the plan state itself
 * @param timestamp when the mutation committed
 */
public record PlanEvent(
    String eventType,
    long planId,
    String path,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String PLAN_CREATED = "plan.created";
    public static final String PLAN_DELETED = "plan.deleted";
    public static final String FOCUS_MOVED = "focus.moved";
    public static final String TASK_ADDED = "task.added";
    public static final String TASK_REMOVED = "task.removed";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_UNCOMPLETED = "task.uncompleted";
    public static final String TASK_LEVEL_CHANGED = "task.level_changed";
    public static final String TASK_NOTES_CHANGED = "task.notes_changed";

    public PlanEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
