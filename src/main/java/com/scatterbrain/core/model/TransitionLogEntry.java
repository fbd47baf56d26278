package com.scatterbrain.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One entry of a plan's recent mutation history.
 */
public record TransitionLogEntry(Instant timestamp, String action, String details) implements Serializable {}
