package com.scatterbrain.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scatterbrain.core.model.IndexPath;

/**
 * Small JSON responses of the plan endpoints. Snapshots are returned as the core records.
 */
public final class PlanResponses {

    private PlanResponses() {}

    public record PlanCreated(@JsonProperty("plan_id") long planId) {}

    public record TaskAdded(IndexPath path) {}

    public record Notes(IndexPath path, String notes) {}
}
