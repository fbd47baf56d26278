package com.scatterbrain.core.plan;

import com.scatterbrain.core.context.ContextProjector;
import com.scatterbrain.core.events.EventBus;
import com.scatterbrain.core.events.PlanEvent;
import com.scatterbrain.core.lease.LeaseRegistry;
import com.scatterbrain.core.logging.MdcContext;
import com.scatterbrain.core.metrics.PlanMetrics;
import com.scatterbrain.core.model.CurrentTask;
import com.scatterbrain.core.model.DistilledContext;
import com.scatterbrain.core.model.IndexPath;
import com.scatterbrain.core.model.Lease;
import com.scatterbrain.core.model.Level;
import com.scatterbrain.core.model.Plan;
import com.scatterbrain.core.model.PlanSummary;
import com.scatterbrain.core.model.Task;
import com.scatterbrain.core.model.TransitionLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;

/**
 * Authoritative, concurrency-safe owner of all plans.
 * <p>
 * Each plan is guarded by its own reader-writer lock: reads share it, mutations hold it
 * exclusively for the duration of the tree edit. Operations on different plans never contend.
 * Change events are recorded while the write lock is held and published once it has been
 * released, in commit order. A mutation that fails with an unexpected exception leaves the
 * plan poisoned; every later operation on it fails with {@link ErrorKind#LOCK_FAILURE} until
 * the plan is deleted.
 * <p>
 * Index paths are resolved against the live tree on every call. After a removal, paths to
 * later siblings shift down by one and callers must re-resolve them.
 */
@Service
public class PlanStore {

    private static final Logger log = LoggerFactory.getLogger(PlanStore.class);

    static final List<String> ROOT_VERIFICATION_SUGGESTIONS = List.of(
            "Ensure compilation passes successfully.",
            "Ensure new logic is tested in the most concise and isolated way possible.",
            "Ensure the code written is DRY, idiomatic, and conforms to existing conventions.",
            "Review code for clarity, maintainability, and potential edge cases.");

    private final ConcurrentHashMap<Long, PlanState> plans = new ConcurrentHashMap<>();
    private final AtomicLong planIds = new AtomicLong();

    private final LeaseRegistry leases;
    private final EventBus eventBus;
    private final ContextProjector projector;
    private final PlanMetrics metrics;
    private final PlanProperties properties;

    public PlanStore(LeaseRegistry leases, EventBus eventBus, ContextProjector projector,
                     PlanMetrics metrics, PlanProperties properties) {
        this.leases = leases;
        this.eventBus = eventBus;
        this.projector = projector;
        this.metrics = metrics;
        this.properties = properties;
    }

    // --- Plans ---

    /**
     * Creates a plan with no tasks and focus on the root.
     *
     * @return the new plan's id
     */
    public long createPlan(String goal, String notes) {
        if (goal == null || goal.isBlank()) {
            throw fail(PlanException.invalid("A plan needs a non-empty goal"));
        }
        long id = planIds.incrementAndGet();
        PlanState state = new PlanState(id, goal, blankToNull(notes), properties.getHistorySize());
        state.record("create_plan", "Created plan: '" + state.goal() + "'");
        plans.put(id, state);
        metrics.recordMutation(PlanEvent.PLAN_CREATED);
        MdcContext.setPlan(id);
        try {
            log.info("Created plan {}: {}", id, state.goal());
        } finally {
            MdcContext.clear();
        }
        eventBus.publish(event(PlanEvent.PLAN_CREATED, id, null, Map.of("goal", state.goal())));
        return id;
    }

    public Plan getPlan(long planId) {
        return read(planId, null, this::snapshot);
    }

    /** All plans ordered by id. */
    public List<PlanSummary> listPlans() {
        return plans.values().stream()
                .sorted(Comparator.comparingLong(s -> s.id))
                .map(s -> new PlanSummary(s.id, s.goal()))
                .toList();
    }

    /**
     * Deletes a plan, its leases and its event topic. Works on a poisoned plan too, which
     * is the only way to get rid of one.
     */
    public void deletePlan(long planId) {
        PlanState state = plans.get(planId);
        if (state == null) {
            throw fail(PlanException.planNotFound(planId));
        }
        MdcContext.setPlan(planId);
        Lock lock = state.lock.writeLock();
        try {
            acquire(state, lock);
            try {
                if (state.deleted) {
                    throw PlanException.planNotFound(planId);
                }
                state.deleted = true;
                plans.remove(planId, state);
                leases.revokePlan(planId);
                state.outbox.add(event(PlanEvent.PLAN_DELETED, planId, null, Map.of()));
                metrics.recordMutation(PlanEvent.PLAN_DELETED);
                log.info("Deleted plan {}", planId);
            } finally {
                lock.unlock();
            }
            flush(state);
            eventBus.removeTopic(planId);
        } catch (PlanException e) {
            throw fail(e);
        } finally {
            MdcContext.clear();
        }
    }

    // --- Tasks ---

    /**
     * Appends a task as the last child of {@code parentPath}. Completed ancestors, the plan
     * root included, are reopened since they now have open work below them.
     *
     * @param parentPath where to add; null adds under the task currently in focus
     * @return the path of the new task
     */
    public IndexPath addTask(long planId, IndexPath parentPath, String description, Level level, String notes) {
        if (description == null || description.isBlank()) {
            throw fail(PlanException.invalid("A task needs a non-empty description"));
        }
        if (level == null) {
            throw fail(PlanException.invalid("A task needs a level"));
        }
        return write(planId, parentPath, state -> {
            IndexPath parentAt = parentPath != null ? parentPath : state.cursor;
            List<TaskNode> chain = state.root.chain(parentAt);
            if (chain == null) {
                throw PlanException.taskNotFound(planId, parentAt);
            }
            TaskNode parent = chain.get(chain.size() - 1);
            TaskNode task = new TaskNode(state.nextTaskId(), description, level, blankToNull(notes));
            parent.children.add(task);
            IndexPath path = parentAt.child(parent.children.size() - 1);
            state.record("add_task", "Added '" + task.description + "' at " + path + " with level " + level);

            for (int depth = chain.size() - 1; depth >= 0; depth--) {
                TaskNode ancestor = chain.get(depth);
                if (ancestor.completed) {
                    ancestor.uncomplete();
                    leases.revoke(planId, ancestor.id);
                    IndexPath ancestorPath = IndexPath.of(parentAt.segments().subList(0, depth));
                    state.record("uncomplete_parent", "Reopened " + ancestorPath);
                    log.debug("Reopened completed ancestor {}", ancestorPath);
                }
            }
            emit(state, PlanEvent.TASK_ADDED, path, Map.of("description", task.description, "level", level.name()));
            log.debug("Added task {} at {}", task.description, path);
            return path;
        });
    }

    /**
     * Removes the task at {@code path} together with its subtree. Later siblings shift down by
     * one. Focus inside the removed subtree moves to the removed task's parent.
     *
     * @return a snapshot of the removed task
     */
    public Task removeTask(long planId, IndexPath path) {
        if (path.isRoot()) {
            throw fail(PlanException.invalid("The plan root cannot be removed; delete the plan instead"));
        }
        return write(planId, path, state -> {
            TaskNode parent = state.root.resolve(path.parent());
            if (parent == null || path.last() >= parent.children.size()) {
                throw PlanException.taskNotFound(planId, path);
            }
            TaskNode removed = parent.children.remove(path.last());
            leases.revokeAll(planId, removed.subtreeIds());
            state.record("remove_task", "Removed '" + removed.description + "' from " + path);

            if (state.cursor.startsWith(path)) {
                state.cursor = path.parent();
                state.record("cursor_adjusted_after_removal", "Focus moved to " + state.cursor);
            }
            emit(state, PlanEvent.TASK_REMOVED, path, Map.of("description", removed.description));
            log.debug("Removed task {} at {}", removed.description, path);
            return removed.snapshot(id -> false);
        });
    }

    /** Relabels a task. Any outstanding lease on it is revoked. */
    public void changeLevel(long planId, IndexPath path, Level level) {
        if (path.isRoot()) {
            throw fail(PlanException.invalid("The plan root has no level to change"));
        }
        if (level == null) {
            throw fail(PlanException.invalid("A level is required"));
        }
        write(planId, path, state -> {
            TaskNode task = resolve(state, path);
            Level previous = task.level;
            task.level = level;
            leases.revoke(planId, task.id);
            state.record("change_level", "Level of " + path + " changed from " + previous + " to " + level);
            emit(state, PlanEvent.TASK_LEVEL_CHANGED, path, Map.of("level", level.name()));
            return null;
        });
    }

    /**
     * Marks a task completed.
     * <ul>
     *   <li>with {@code force}, the lease is not checked at all</li>
     *   <li>with a lease, it must be the task's outstanding lease and is consumed</li>
     *   <li>with neither, the call fails with {@link ErrorKind#LEASE_REQUIRED}</li>
     * </ul>
     * A completed task fails with {@link ErrorKind#ALREADY_COMPLETED} regardless. Completion
     * cascades to every descendant; only the target keeps the summary. Completing the root
     * completes the plan.
     */
    public void completeTask(long planId, IndexPath path, Long lease, boolean force, String summary) {
        write(planId, path, state -> {
            TaskNode task = resolve(state, path);
            if (task.completed) {
                metrics.recordCompletion("already_completed");
                throw PlanException.alreadyCompleted(path);
            }
            if (!force) {
                if (lease == null) {
                    metrics.recordCompletion("lease_required");
                    throw PlanException.leaseRequired(path);
                }
                if (leases.consume(planId, task.id, lease) != LeaseRegistry.Outcome.CONSUMED) {
                    metrics.recordCompletion("lease_invalid");
                    throw PlanException.leaseInvalid(path, lease);
                }
            }
            task.completeCascading(blankToNull(summary));
            leases.revokeAll(planId, task.subtreeIds());
            state.record("complete_task", "Completed " + path + (force ? " (forced)" : " with lease " + lease));
            metrics.recordCompletion(force ? "forced" : "leased");

            Map<String, Object> payload = new HashMap<>();
            payload.put("forced", force);
            if (task.summary != null) {
                payload.put("summary", task.summary);
            }
            emit(state, PlanEvent.TASK_COMPLETED, path, payload);
            log.info("Completed task {} '{}'{}", path, task.description, force ? " (forced)" : "");
            return null;
        });
    }

    /** Reopens a completed task and clears its summary. Descendants stay as they are. */
    public void uncompleteTask(long planId, IndexPath path) {
        write(planId, path, state -> {
            TaskNode task = resolve(state, path);
            if (!task.completed) {
                throw PlanException.invalid("Task " + path + " is not completed");
            }
            task.uncomplete();
            state.record("uncomplete_task", "Reopened " + path);
            emit(state, PlanEvent.TASK_UNCOMPLETED, path, Map.of());
            return null;
        });
    }

    // --- Notes ---

    /** Replaces a task's notes; on the root this sets the plan notes. Revokes the task's lease. */
    public void setNotes(long planId, IndexPath path, String notes) {
        if (notes == null || notes.isBlank()) {
            throw fail(PlanException.invalid("Notes must not be empty; delete them instead"));
        }
        updateNotes(planId, path, notes, "set_notes");
    }

    public Optional<String> getNotes(long planId, IndexPath path) {
        return read(planId, path, state -> Optional.ofNullable(resolve(state, path).notes));
    }

    public void deleteNotes(long planId, IndexPath path) {
        updateNotes(planId, path, null, "delete_notes");
    }

    private void updateNotes(long planId, IndexPath path, String notes, String action) {
        write(planId, path, state -> {
            TaskNode task = resolve(state, path);
            task.notes = notes;
            leases.revoke(planId, task.id);
            state.record(action, (notes == null ? "Cleared notes of " : "Updated notes of ") + path);
            emit(state, PlanEvent.TASK_NOTES_CHANGED, path, Map.of("present", notes != null));
            return null;
        });
    }

    // --- Focus ---

    public void moveTo(long planId, IndexPath path) {
        write(planId, path, state -> {
            TaskNode task = resolve(state, path);
            IndexPath previous = state.cursor;
            state.cursor = path;
            state.record("move_to", "Moved focus from " + previous + " to " + path);
            emit(state, PlanEvent.FOCUS_MOVED, path, Map.of("description", task.description));
            return null;
        });
    }

    /**
     * The task in focus. A focus path that no longer resolves is reported as the root.
     */
    public CurrentTask getCurrent(long planId) {
        return read(planId, null, state -> {
            IndexPath path = state.cursor;
            List<TaskNode> chain = state.root.chain(path);
            if (chain == null) {
                path = IndexPath.ROOT;
                chain = List.of(state.root);
            }
            TaskNode task = chain.get(chain.size() - 1);
            List<String> ancestors = new ArrayList<>();
            for (int i = 1; i < chain.size() - 1; i++) {
                ancestors.add(chain.get(i).description);
            }
            Level level = path.isRoot() ? Level.PLANNING : task.level;
            return new CurrentTask(path, level, task.snapshot(id -> leases.isOutstanding(planId, id)), ancestors);
        });
    }

    public DistilledContext distilledContext(long planId) {
        record Snapshot(Plan plan, List<TransitionLogEntry> history) {}
        Snapshot view = read(planId, null, state -> new Snapshot(snapshot(state), state.history()));
        return projector.project(view.plan(), view.history());
    }

    // --- Leases ---

    /**
     * Issues a completion lease for an open task, superseding any earlier one. Leases on the
     * root carry checks to run before the plan is declared done.
     */
    public Lease generateLease(long planId, IndexPath path) {
        return write(planId, path, state -> {
            TaskNode task = state.root.resolve(path);
            if (task == null) {
                throw PlanException.taskNotFound(planId, path);
            }
            if (task.completed) {
                throw PlanException.notFound("No open task at path " + path + " in plan " + planId
                        + ": it is already completed");
            }
            long token = leases.issue(planId, task.id);
            List<String> suggestions = path.isRoot() ? ROOT_VERIFICATION_SUGGESTIONS : List.of();
            state.record("generate_lease", "Generated lease " + token + " for " + path);
            metrics.recordLeaseIssued();
            log.debug("Issued lease {} for {}", token, path);
            return new Lease(planId, path, token, suggestions);
        });
    }

    // --- Internals ---

    private Plan snapshot(PlanState state) {
        return state.snapshot(id -> leases.isOutstanding(state.id, id));
    }

    private TaskNode resolve(PlanState state, IndexPath path) {
        TaskNode node = state.root.resolve(path);
        if (node == null) {
            throw PlanException.taskNotFound(state.id, path);
        }
        return node;
    }

    private PlanState require(long planId) {
        PlanState state = plans.get(planId);
        if (state == null) {
            throw PlanException.planNotFound(planId);
        }
        return state;
    }

    private <T> T read(long planId, IndexPath path, Function<PlanState, T> operation) {
        setMdc(planId, path);
        try {
            PlanState state = require(planId);
            Lock lock = state.lock.readLock();
            acquire(state, lock);
            try {
                checkUsable(state);
                return operation.apply(state);
            } finally {
                lock.unlock();
            }
        } catch (PlanException e) {
            throw fail(e);
        } finally {
            MdcContext.clear();
        }
    }

    private <T> T write(long planId, IndexPath path, Function<PlanState, T> operation) {
        setMdc(planId, path);
        try {
            PlanState state = require(planId);
            Lock lock = state.lock.writeLock();
            acquire(state, lock);
            T result;
            try {
                checkUsable(state);
                state.pending.clear();
                result = operation.apply(state);
                commit(state);
            } catch (PlanException e) {
                state.pending.clear();
                throw e;
            } catch (RuntimeException e) {
                state.pending.clear();
                state.poisoned = true;
                log.error("Mutation of plan {} failed unexpectedly; the plan is now unusable", planId, e);
                throw PlanException.lockFailure(planId, "mutation failed: " + e.getMessage(), e);
            } finally {
                lock.unlock();
            }
            flush(state);
            return result;
        } catch (PlanException e) {
            throw fail(e);
        } finally {
            MdcContext.clear();
        }
    }

    private void acquire(PlanState state, Lock lock) {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the lock of plan {}", state.id);
            throw PlanException.lockFailure(state.id, "interrupted while waiting for its lock", e);
        }
    }

    private void checkUsable(PlanState state) {
        if (state.deleted) {
            throw PlanException.planNotFound(state.id);
        }
        if (state.poisoned) {
            log.warn("Refusing operation on poisoned plan {}", state.id);
            throw PlanException.lockFailure(state.id, "a previous mutation failed; delete and recreate the plan");
        }
    }

    /**
     * Moves the events of a successful mutation to the outbox and counts them. Called under the
     * write lock, so the outbox holds events in commit order.
     */
    private void commit(PlanState state) {
        for (PlanEvent event : state.pending) {
            state.outbox.add(event);
            metrics.recordMutation(event.eventType());
        }
        state.pending.clear();
    }

    /** Publishes queued events in commit order. Called only after the plan lock is released. */
    private void flush(PlanState state) {
        state.publishLock.lock();
        try {
            PlanEvent event;
            while ((event = state.outbox.poll()) != null) {
                eventBus.publish(event);
            }
        } finally {
            state.publishLock.unlock();
        }
    }

    private void emit(PlanState state, String type, IndexPath path, Map<String, Object> payload) {
        state.pending.add(event(type, state.id, path, payload));
    }

    private static PlanEvent event(String type, long planId, IndexPath path, Map<String, Object> payload) {
        return new PlanEvent(type, planId, path == null ? null : path.toString(), payload, Instant.now());
    }

    private PlanException fail(PlanException e) {
        metrics.recordError(e.kind());
        log.debug("{} failed: {}", e.kind().name().toLowerCase(Locale.ROOT), e.getMessage());
        return e;
    }

    private static void setMdc(long planId, IndexPath path) {
        if (path == null) {
            MdcContext.setPlan(planId);
        } else {
            MdcContext.setTask(planId, path.toString());
        }
    }

    private static String blankToNull(String text) {
        return text == null || text.isBlank() ? null : text;
    }
}
