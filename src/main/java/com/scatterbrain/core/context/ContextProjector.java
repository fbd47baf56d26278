package com.scatterbrain.core.context;

import com.scatterbrain.core.model.DistilledContext;
import com.scatterbrain.core.model.IndexPath;
import com.scatterbrain.core.model.Level;
import com.scatterbrain.core.model.LevelInfo;
import com.scatterbrain.core.model.Plan;
import com.scatterbrain.core.model.Task;
import com.scatterbrain.core.model.TaskTreeNode;
import com.scatterbrain.core.model.TransitionLogEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Derives the distilled view of a plan from a snapshot.
 * <p>
 * The view is centred on the plan's current task: the task itself, the chain of tasks above
 * it, its immediate subtasks and a task tree in which only nodes on the focus path are
 * expanded. A current path that no longer resolves is treated as the root.
 */
@Component
public class ContextProjector {

    static final String USAGE_SUMMARY = "Scatterbrain breaks a large goal into a tree of tasks, each "
            + "labelled with an abstraction level from high-level planning down to implementation. "
            + "Add tasks under the task in focus, move the focus with 'move <path>', and finish a task "
            + "by taking a lease and completing it with that lease. Paths are comma-separated child "
            + "offsets such as 0,1,2. Run 'scatterbrain guide' for the full workflow.";

    private static final List<LevelInfo> LEVELS = Arrays.stream(Level.values()).map(LevelInfo::of).toList();

    public DistilledContext project(Plan plan, List<TransitionLogEntry> history) {
        IndexPath current = plan.find(plan.current()) != null ? plan.current() : IndexPath.ROOT;

        List<TaskTreeNode> ancestors = new ArrayList<>();
        Task node = plan.root();
        IndexPath path = IndexPath.ROOT;
        for (int i = 0; i < current.depth(); i++) {
            if (!path.isRoot()) {
                ancestors.add(leaf(path, node, current));
            }
            path = path.child(current.get(i));
            node = node.children().get(current.get(i));
        }

        TaskTreeNode currentTask = current.isRoot() ? null : leaf(current, node, current);
        Level currentLevel = current.isRoot() ? Level.PLANNING : node.level();

        List<TaskTreeNode> children = new ArrayList<>(node.children().size());
        for (int i = 0; i < node.children().size(); i++) {
            children.add(leaf(current.child(i), node.children().get(i), current));
        }

        return new DistilledContext(
                plan.id(),
                plan.goal(),
                plan.notes(),
                USAGE_SUMMARY,
                current,
                currentTask,
                currentLevel,
                ancestors,
                children,
                focusedTree(plan.root(), IndexPath.ROOT, current),
                LEVELS,
                history);
    }

    /**
     * Children of {@code task}; a child is expanded only if the focus path runs through it.
     */
    private List<TaskTreeNode> focusedTree(Task task, IndexPath path, IndexPath current) {
        List<TaskTreeNode> nodes = new ArrayList<>(task.children().size());
        for (int i = 0; i < task.children().size(); i++) {
            Task child = task.children().get(i);
            IndexPath childPath = path.child(i);
            List<TaskTreeNode> grandChildren = current.startsWith(childPath)
                    ? focusedTree(child, childPath, current)
                    : List.of();
            nodes.add(node(childPath, child, current, grandChildren));
        }
        return nodes;
    }

    private TaskTreeNode leaf(IndexPath path, Task task, IndexPath current) {
        return node(path, task, current, List.of());
    }

    private TaskTreeNode node(IndexPath path, Task task, IndexPath current, List<TaskTreeNode> children) {
        return new TaskTreeNode(path, task.description(), task.level(), task.completed(),
                path.equals(current), task.summary(), task.notes(), children);
    }
}
