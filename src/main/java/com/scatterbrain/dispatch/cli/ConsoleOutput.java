package com.scatterbrain.dispatch.cli;

import com.scatterbrain.core.model.CurrentTask;
import com.scatterbrain.core.model.DistilledContext;
import com.scatterbrain.core.model.IndexPath;
import com.scatterbrain.core.model.Plan;
import com.scatterbrain.core.model.Task;
import com.scatterbrain.core.model.TaskTreeNode;
import com.scatterbrain.core.model.TransitionLogEntry;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Scatterbrain CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SCATTERBRAIN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SCATTERBRAIN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void plan(Plan plan) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold PLAN " + plan.id() + "|@" + (plan.completed() ? " @|fg(green) (completed)|@" : "")));
        System.out.println("Goal: " + plan.goal());
        if (plan.notes() != null) {
            System.out.println("Notes: " + plan.notes());
        }
        System.out.println("Focus: " + plan.current());
        System.out.println();
        if (plan.tasks().isEmpty()) {
            System.out.println("  (no tasks)");
        }
        printTasks(plan.tasks(), IndexPath.ROOT, plan.current(), 1);
    }

    private static void printTasks(List<Task> tasks, IndexPath parent, IndexPath current, int depth) {
        for (int i = 0; i < tasks.size(); i++) {
            Task task = tasks.get(i);
            IndexPath path = parent.child(i);
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  ".repeat(depth) + checkbox(task.completed()) + " @|fg(cyan) " + path + "|@ "
                            + task.description() + " @|faint (" + task.level() + ")|@"
                            + (path.equals(current) ? " @|bold,fg(yellow) <- focus|@" : "")
                            + (task.leased() ? " @|fg(magenta) [leased]|@" : "")));
            if (task.summary() != null) {
                System.out.println("  ".repeat(depth + 2) + "summary: " + task.summary());
            }
            printTasks(task.children(), path, current, depth + 1);
        }
    }

    public static void current(CurrentTask current) {
        if (current.path().isRoot()) {
            info("Focus is on the plan root: " + current.task().description());
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|bold CURRENT " + current.path() + "|@ " + current.task().description()));
            System.out.println("Level: " + current.level());
            if (!current.ancestors().isEmpty()) {
                System.out.println("Path: " + String.join(" > ", current.ancestors()));
            }
        }
        Task task = current.task();
        System.out.println("Completed: " + (task.completed() ? "yes" : "no")
                + (task.summary() != null ? " (" + task.summary() + ")" : ""));
        if (task.notes() != null) {
            System.out.println("Notes: " + task.notes());
        }
        if (!task.children().isEmpty()) {
            System.out.println("Subtasks:");
            for (int i = 0; i < task.children().size(); i++) {
                Task child = task.children().get(i);
                System.out.println("  " + checkbox(child.completed()) + " " + current.path().child(i)
                        + " " + child.description());
            }
        }
    }

    public static void distilled(DistilledContext context) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold GOAL|@ " + context.goal()));
        if (context.planNotes() != null) {
            System.out.println("Notes: " + context.planNotes());
        }
        System.out.println();
        System.out.println(context.usageSummary());
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold TASKS|@"));
        printTree(context.taskTree(), 1);
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold FOCUS|@ " + context.currentPath()
                        + (context.currentTask() != null ? " " + context.currentTask().description() : " (plan root)")));
        System.out.println(context.currentLevel().guidance());
        if (!context.children().isEmpty()) {
            System.out.println();
            System.out.println("Next steps:");
            for (TaskTreeNode child : context.children()) {
                System.out.println("  " + checkbox(child.completed()) + " " + child.path() + " " + child.description());
            }
        }
        if (!context.transitionHistory().isEmpty()) {
            System.out.println();
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold RECENT|@"));
            for (TransitionLogEntry entry : context.transitionHistory()) {
                System.out.println("  " + entry.timestamp() + " " + entry.action() + ": " + entry.details());
            }
        }
    }

    private static void printTree(List<TaskTreeNode> nodes, int depth) {
        for (TaskTreeNode node : nodes) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  ".repeat(depth) + checkbox(node.completed()) + " @|fg(cyan) " + node.path() + "|@ "
                            + node.description() + (node.current() ? " @|bold,fg(yellow) <- focus|@" : "")));
            printTree(node.children(), depth + 1);
        }
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "plan.created", "plan.deleted" -> "@|fg(cyan) [PLAN]|@";
            case "focus.moved" -> "@|fg(yellow) [FOCUS]|@";
            case "task.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "task.uncompleted" -> "@|fg(red) [REOPEN]|@";
            case "task.added", "task.removed", "task.level_changed", "task.notes_changed" -> "@|fg(blue) [TASK]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + eventType + " " + data));
    }

    private static String checkbox(boolean completed) {
        return completed ? "[x]" : "[ ]";
    }
}
