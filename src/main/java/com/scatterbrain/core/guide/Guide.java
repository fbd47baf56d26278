package com.scatterbrain.core.guide;

import com.scatterbrain.core.model.Level;

import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Static usage guide: overview, abstraction levels, the lease workflow and a reference of the
 * operations available on the chosen surface.
 */
public final class Guide {

    private Guide() {}

    private static final String OVERVIEW = """
            Scatterbrain keeps a plan as a tree of tasks. The root of the tree is the goal the
            plan was created from; every task below it carries a description, an abstraction
            level, optional notes and a completion state. One task at a time is in focus, and
            the distilled context shows that task with its ancestors and immediate subtasks so
            you can keep working without reading the whole tree.

            Tasks are addressed by index paths: comma-separated child offsets from the root.
            0 is the first top-level task, 0,2 is its third subtask. The root itself is
            written as 'root'. Paths are positional, so after a removal the later siblings
            move up by one and any path you kept must be looked up again.""";

    private static final String LEASES_CLI = """
            COMPLETING TASKS
            Completion is a two-step exchange so that two workers cannot both finish the same
            task:
              1. scatterbrain task lease <path>        prints a lease token
              2. do the work
              3. scatterbrain task complete <path> --lease <token> --summary "what was done"
            Only the newest lease for a task is valid, and it works once. A task whose level or
            notes change loses its lease. --force skips the check; use it only to repair state.
            Completing a task completes all of its subtasks. Leasing the root returns a short
            verification checklist to run before the whole plan is declared done.""";

    private static final String LEASES_MCP = """
            COMPLETING TASKS
            Completion is a two-step exchange so that two agents cannot both finish the same
            task:
              1. call generate_lease with the task's path and keep the returned token
              2. do the work
              3. call complete_task with the same path, the token and a short summary
            Only the newest lease for a task is valid, and it works once. A task whose level or
            notes change loses its lease. force=true skips the check; use it only to repair
            state. Completing a task completes all of its subtasks. Leasing the root returns a
            short verification checklist to run before the whole plan is declared done.""";

    private static final String REFERENCE_CLI = """
            COMMANDS
              serve [--port N] [--example]            run the server the other commands talk to
              plan create <goal> [--notes TEXT]       create a plan and print its id
              plan list | show [id] | delete <id>     manage plans
              task add <description> --level N       add under the focused task (or --parent PATH)
              task lease <path>                       take a completion lease
              task complete <path> --lease T          complete with a lease (--summary, --force)
              task uncomplete <path>                  reopen a completed task
              task remove <path>                      remove a task and its subtree
              task change-level <path> <level>        relabel a task
              task notes view|set|delete <path>       manage task notes
              move <path>                             change focus
              current                                 show the focused task
              distilled                               show the distilled context
              watch                                   stream change events of a plan
              guide                                   print this guide
              completions                             print a bash completion script
            Every plan-scoped command takes --plan ID; without it SCATTERBRAIN_PLAN_ID is used.
            --server URL selects the server (default http://localhost:3000).""";

    private static final String REFERENCE_MCP = """
            TOOLS
              create_plan, get_plan, list_plans, delete_plan
              add_task, complete_task, uncomplete_task, remove_task, change_level
              move_to, get_current, get_distilled_context
              get_task_notes, set_task_notes, delete_task_notes
              generate_lease
              get_guide
            Paths are passed as strings such as "0,1" or "root". Failed calls report the error
            kind in brackets, e.g. [LEASE_INVALID], so you can decide whether to re-read state
            and retry.""";

    private static final String PRACTICES = """
            GOOD PRACTICE
            - Start at the planning level and work down; do not write implementation tasks
              before the parts they belong to are isolated and ordered.
            - Keep descriptions short and record details in notes.
            - Check the distilled context after every structural change.
            - Complete the root only after its verification checklist passes.""";

    public static String render(GuideMode mode) {
        boolean cli = mode == GuideMode.CLI;
        return Stream.of(
                        "=== Scatterbrain Guide (" + (cli ? "command line" : "tool interface") + ") ===",
                        OVERVIEW,
                        levels(),
                        cli ? LEASES_CLI : LEASES_MCP,
                        cli ? REFERENCE_CLI : REFERENCE_MCP,
                        PRACTICES)
                .collect(Collectors.joining("\n\n", "", "\n"));
    }

    private static String levels() {
        StringBuilder sb = new StringBuilder("ABSTRACTION LEVELS");
        for (Level level : Level.values()) {
            sb.append("\n  ").append(level.ordinal()).append(" ").append(level.name())
                    .append(": ").append(level.description());
            sb.append("\n     ").append(level.focus());
        }
        return sb.toString();
    }
}
