package com.scatterbrain.core.lease;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Server-held completion leases.
 * <p>
 * A lease is keyed by task identity (plan id plus the task's internal id, which survives
 * sibling removals) and valued by a number drawn from a process-wide monotonic counter.
 * Only the most recently issued, unconsumed value for a task authorizes a completion.
 */
@Component
public class LeaseRegistry {

    private static final Logger log = LoggerFactory.getLogger(LeaseRegistry.class);

    /** Result of presenting a token for a task. */
    public enum Outcome {
        /** The token was the outstanding lease and has now been used up. */
        CONSUMED,
        /** A lease is outstanding but the token is not it. */
        MISMATCH,
        /** No lease is outstanding for the task. */
        NONE
    }

    private record TaskKey(long planId, long taskId) {}

    private final AtomicLong counter = new AtomicLong();
    private final ConcurrentHashMap<TaskKey, Long> outstanding = new ConcurrentHashMap<>();

    /**
     * Issues a new lease for the task, superseding any unconsumed one.
     *
     * @return the new token
     */
    public long issue(long planId, long taskId) {
        long token = counter.incrementAndGet();
        Long previous = outstanding.put(new TaskKey(planId, taskId), token);
        if (previous != null) {
            log.debug("Lease {} on plan {} task #{} superseded by {}", previous, planId, taskId, token);
        }
        return token;
    }

    /**
     * Atomically checks the token against the outstanding lease and consumes it on a match.
     */
    public Outcome consume(long planId, long taskId, long token) {
        TaskKey key = new TaskKey(planId, taskId);
        if (outstanding.remove(key, token)) {
            return Outcome.CONSUMED;
        }
        return outstanding.containsKey(key) ? Outcome.MISMATCH : Outcome.NONE;
    }

    public boolean isOutstanding(long planId, long taskId) {
        return outstanding.containsKey(new TaskKey(planId, taskId));
    }

    /** Drops the task's lease, if any. */
    public void revoke(long planId, long taskId) {
        Long token = outstanding.remove(new TaskKey(planId, taskId));
        if (token != null) {
            log.debug("Revoked lease {} on plan {} task #{}", token, planId, taskId);
        }
    }

    public void revokeAll(long planId, Iterable<Long> taskIds) {
        for (Long taskId : taskIds) {
            revoke(planId, taskId);
        }
    }

    /** Drops every lease of a deleted plan. */
    public void revokePlan(long planId) {
        outstanding.keySet().removeIf(key -> key.planId() == planId);
    }

    public int outstandingCount() {
        return outstanding.size();
    }
}
