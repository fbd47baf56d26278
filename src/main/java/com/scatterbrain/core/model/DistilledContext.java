package com.scatterbrain.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Bounded view of a plan centred on its current task.
 *
 * @param planId            the plan
 * @param goal              the plan goal
 * @param planNotes         plan notes, if any
 * @param usageSummary      short reminder of how to work with plans
 * @param currentPath       path in focus (root if the stored path no longer resolves)
 * @param currentTask       the focused task without its subtree; null when focus is the root
 * @param currentLevel      level of the focused task ({@link Level#PLANNING} at the root)
 * @param ancestors         tasks from the top level down to the focused task's parent
 * @param children          immediate subtasks of the focused task
 * @param taskTree          top-level tasks, expanded one level below every node on the focus path
 * @param levels            all abstraction levels
 * @param transitionHistory most recent mutations, oldest first
 */
public record DistilledContext(
    long planId,
    String goal,
    String planNotes,
    String usageSummary,
    IndexPath currentPath,
    TaskTreeNode currentTask,
    Level currentLevel,
    List<TaskTreeNode> ancestors,
    List<TaskTreeNode> children,
    List<TaskTreeNode> taskTree,
    List<LevelInfo> levels,
    List<TransitionLogEntry> transitionHistory
) implements Serializable {

    public DistilledContext {
        ancestors = ancestors == null ? List.of() : List.copyOf(ancestors);
        children = children == null ? List.of() : List.copyOf(children);
        taskTree = taskTree == null ? List.of() : List.copyOf(taskTree);
        levels = levels == null ? List.of() : List.copyOf(levels);
        transitionHistory = transitionHistory == null ? List.of() : List.copyOf(transitionHistory);
    }
}
