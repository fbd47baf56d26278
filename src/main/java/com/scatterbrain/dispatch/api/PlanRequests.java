package com.scatterbrain.dispatch.api;

import com.scatterbrain.core.model.IndexPath;

/**
 * Inbound JSON bodies of the plan endpoints. Paths are integer arrays; levels are either
 * the ordinal (0-3) or the level name.
 */
public final class PlanRequests {

    private PlanRequests() {}

    /** POST /api/v1/plans */
    public record CreatePlan(String goal, String notes) {}

    /**
     * POST /api/v1/plans/{id}/tasks
     *
     * @param parent parent path; null adds under the task in focus
     */
    public record AddTask(IndexPath parent, String description, String level, String notes) {}

    /** POST /api/v1/plans/{id}/tasks/{path}/complete */
    public record CompleteTask(Long lease, Boolean force, String summary) {}

    /** PUT /api/v1/plans/{id}/tasks/{path}/level */
    public record ChangeLevel(String level) {}

    /** PUT /api/v1/plans/{id}/tasks/{path}/notes */
    public record SetNotes(String notes) {}

    /** POST /api/v1/plans/{id}/move */
    public record Move(IndexPath path) {}
}
