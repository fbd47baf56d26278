package com.scatterbrain.core.model;

import java.io.Serializable;

/**
 * One line of a plan listing.
 */
public record PlanSummary(long id, String goal) implements Serializable {}
