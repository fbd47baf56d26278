package com.scatterbrain.core.plan;

/**
 * Kinds of failure a plan operation can report. Adapters choose how to present each kind but
 * always keep it visible to the caller.
 */
public enum ErrorKind {

    /** A plan id or index path does not resolve. */
    NOT_FOUND,

    /** The request is structurally disallowed, e.g. removing the root or an empty description. */
    INVALID_OPERATION,

    /** Completion without a lease and without force. */
    LEASE_REQUIRED,

    /** Completion with a lease that is stale, superseded or was never issued for the task. */
    LEASE_INVALID,

    /** The task is already completed. */
    ALREADY_COMPLETED,

    /** The plan's lock could not be acquired in a valid state. */
    LOCK_FAILURE
}
