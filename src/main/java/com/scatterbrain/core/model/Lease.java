package com.scatterbrain.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A freshly issued completion lease.
 *
 * @param planId                  the plan the task belongs to
 * @param path                    the task the lease was issued for, as resolved at issue time
 * @param token                   the value to present to {@code completeTask}
 * @param verificationSuggestions checks to run before completing; only populated for the plan root
 */
public record Lease(
    long planId,
    IndexPath path,
    long token,
    List<String> verificationSuggestions
) implements Serializable {

    public Lease {
        verificationSuggestions = verificationSuggestions == null ? List.of() : List.copyOf(verificationSuggestions);
    }
}
