package com.scatterbrain.core.plan;

import com.scatterbrain.core.model.IndexPath;
import com.scatterbrain.core.model.Level;
import com.scatterbrain.core.model.Task;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongPredicate;

/**
 * Mutable tree node owned by exactly one {@link PlanState}. Only touched while that plan's
 * lock is held; everything leaving the store is a {@link Task} snapshot.
 */
final class TaskNode {

    /** Identity that survives reindexing; used to key leases. */
    final long id;
    String description;
    Level level;
    String notes;
    boolean completed;
    String summary;
    final List<TaskNode> children = new ArrayList<>();

    TaskNode(long id, String description, Level level, String notes) {
        this.id = id;
        this.description = description;
        this.level = level;
        this.notes = notes;
    }

    TaskNode resolve(IndexPath path) {
        TaskNode node = this;
        for (int i = 0; i < path.depth(); i++) {
            int offset = path.get(i);
            if (offset >= node.children.size()) {
                return null;
            }
            node = node.children.get(offset);
        }
        return node;
    }

    /**
     * Nodes from this one down to the end of {@code path}, both ends included, or null if the
     * path does not resolve.
     */
    List<TaskNode> chain(IndexPath path) {
        List<TaskNode> chain = new ArrayList<>(path.depth() + 1);
        TaskNode node = this;
        chain.add(node);
        for (int i = 0; i < path.depth(); i++) {
            int offset = path.get(i);
            if (offset >= node.children.size()) {
                return null;
            }
            node = node.children.get(offset);
            chain.add(node);
        }
        return chain;
    }

    /** Ids of this node and all its descendants. */
    List<Long> subtreeIds() {
        List<Long> ids = new ArrayList<>();
        collectIds(ids);
        return ids;
    }

    private void collectIds(List<Long> ids) {
        ids.add(id);
        for (TaskNode child : children) {
            child.collectIds(ids);
        }
    }

    /** Marks this node done with the given summary and every open descendant done without one. */
    void completeCascading(String summary) {
        this.completed = true;
        this.summary = summary;
        for (TaskNode child : children) {
            child.markSubtreeCompleted();
        }
    }

    private void markSubtreeCompleted() {
        if (!completed) {
            completed = true;
            summary = null;
        }
        for (TaskNode child : children) {
            child.markSubtreeCompleted();
        }
    }

    void uncomplete() {
        completed = false;
        summary = null;
    }

    Task snapshot(LongPredicate leased) {
        List<Task> childSnapshots = new ArrayList<>(children.size());
        for (TaskNode child : children) {
            childSnapshots.add(child.snapshot(leased));
        }
        return new Task(description, level, notes, completed, summary, leased.test(id), childSnapshots);
    }
}
