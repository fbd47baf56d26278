package com.scatterbrain.core.plan;

import com.scatterbrain.core.events.PlanEvent;
import com.scatterbrain.core.model.IndexPath;
import com.scatterbrain.core.model.Level;
import com.scatterbrain.core.model.Plan;
import com.scatterbrain.core.model.TransitionLogEntry;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongPredicate;

/**
 * Live state of one plan plus the lock that guards it.
 * <p>
 * The root node stands for the plan itself: its description is the goal, its notes are the
 * plan notes and its children are the top-level tasks. Every field other than the lock, the
 * flags and the outbox queue is only read under the read lock and only written under the write lock.
 */
final class PlanState {

    final long id;
    final TaskNode root;
    IndexPath cursor = IndexPath.ROOT;

    final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Set when a mutation failed halfway; every later operation reports a lock failure. */
    volatile boolean poisoned;
    /** Set once the plan has been deleted, for callers that looked it up just before. */
    volatile boolean deleted;

    /** Events of the mutation in progress. Only touched under the write lock. */
    final List<PlanEvent> pending = new ArrayList<>();
    /** Events committed under the write lock, published after it is released. */
    final Queue<PlanEvent> outbox = new ConcurrentLinkedQueue<>();
    /** Serializes outbox draining so events leave in commit order. */
    final ReentrantLock publishLock = new ReentrantLock();

    private final Deque<TransitionLogEntry> history = new ArrayDeque<>();
    private final int historySize;
    private long nextTaskId = 1;

    PlanState(long id, String goal, String notes, int historySize) {
        this.id = id;
        this.historySize = historySize;
        this.root = new TaskNode(0, goal, Level.PLANNING, notes);
    }

    String goal() {
        return root.description;
    }

    long nextTaskId() {
        return nextTaskId++;
    }

    void record(String action, String details) {
        if (historySize <= 0) {
            return;
        }
        history.addLast(new TransitionLogEntry(Instant.now(), action, details));
        while (history.size() > historySize) {
            history.removeFirst();
        }
    }

    List<TransitionLogEntry> history() {
        return new ArrayList<>(history);
    }

    Plan snapshot(LongPredicate leased) {
        return new Plan(id, root.description, root.notes, root.snapshot(leased), cursor);
    }
}
