package com.scatterbrain.core.plan;

import com.scatterbrain.core.model.IndexPath;

/**
 * Typed failure of a plan operation. The store never retries; the kind travels unchanged to
 * whichever adapter made the call.
 */
public class PlanException extends RuntimeException {

    private final ErrorKind kind;

    public PlanException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PlanException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static PlanException planNotFound(long planId) {
        return new PlanException(ErrorKind.NOT_FOUND, "Plan " + planId + " not found");
    }

    public static PlanException taskNotFound(long planId, IndexPath path) {
        return new PlanException(ErrorKind.NOT_FOUND,
                "No task at path " + path + " in plan " + planId);
    }

    public static PlanException notFound(String message) {
        return new PlanException(ErrorKind.NOT_FOUND, message);
    }

    public static PlanException invalid(String message) {
        return new PlanException(ErrorKind.INVALID_OPERATION, message);
    }

    public static PlanException leaseRequired(IndexPath path) {
        return new PlanException(ErrorKind.LEASE_REQUIRED,
                "Completing task " + path + " requires a lease; generate one first or use force");
    }

    public static PlanException leaseInvalid(IndexPath path, long token) {
        return new PlanException(ErrorKind.LEASE_INVALID,
                "Lease " + token + " is not the outstanding lease for task " + path);
    }

    public static PlanException alreadyCompleted(IndexPath path) {
        return new PlanException(ErrorKind.ALREADY_COMPLETED, "Task " + path + " is already completed");
    }

    public static PlanException lockFailure(long planId, String reason) {
        return new PlanException(ErrorKind.LOCK_FAILURE, "Plan " + planId + " is unavailable: " + reason);
    }

    public static PlanException lockFailure(long planId, String reason, Throwable cause) {
        return new PlanException(ErrorKind.LOCK_FAILURE, "Plan " + planId + " is unavailable: " + reason, cause);
    }
}
