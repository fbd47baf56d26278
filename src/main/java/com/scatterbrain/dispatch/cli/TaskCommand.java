package com.scatterbrain.dispatch.cli;

import com.scatterbrain.core.model.IndexPath;
import com.scatterbrain.core.model.Lease;
import com.scatterbrain.core.model.Level;
import com.scatterbrain.core.model.Task;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * CLI command group: scatterbrain task add|complete|uncomplete|remove|change-level|lease|notes
 */
@Command(name = "task", mixinStandardHelpOptions = true, description = "Add, complete and edit tasks",
        subcommands = {
                TaskCommand.Add.class,
                TaskCommand.Complete.class,
                TaskCommand.Uncomplete.class,
                TaskCommand.Remove.class,
                TaskCommand.ChangeLevel.class,
                TaskCommand.GenerateLease.class,
                NotesCommand.class
        })
@Component
public class TaskCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "add", mixinStandardHelpOptions = true,
            description = "Add a task under the task in focus, or under --parent")
    @Component
    public static class Add extends PlanClientCommand {

        @Parameters(index = "0", description = "Task description")
        String description;

        @Option(names = {"--level", "-l"}, required = true, converter = LevelConverter.class,
                description = "Abstraction level: 0-3 or planning, isolation, ordering, implementation")
        Level level;

        @Option(names = "--parent", converter = IndexPathConverter.class,
                description = "Parent path, e.g. 0,1 or root (default: the task in focus)")
        IndexPath parent;

        @Option(names = {"--notes", "-n"}, description = "Task notes")
        String notes;

        public Add(PlanApiClients clients, CliProperties properties) {
            super(clients, properties);
        }

        @Override
        protected int execute() {
            IndexPath path = client().addTask(planId(), parent, description, level, notes);
            ConsoleOutput.success("Added task " + path + ": " + description);
            return 0;
        }
    }

    @Command(name = "complete", mixinStandardHelpOptions = true,
            description = "Complete a task with a lease from 'task lease'")
    @Component
    public static class Complete extends PlanClientCommand {

        @Parameters(index = "0", converter = IndexPathConverter.class, description = "Task path")
        IndexPath path;

        @Option(names = "--lease", description = "Lease token")
        Long lease;

        @Option(names = {"--summary", "-s"}, description = "What was done")
        String summary;

        @Option(names = "--force", description = "Complete without a lease (repairs only)")
        boolean force;

        public Complete(PlanApiClients clients, CliProperties properties) {
            super(clients, properties);
        }

        @Override
        protected int execute() {
            client().completeTask(planId(), path, lease, force, summary);
            ConsoleOutput.success("Completed task " + path + (force ? " (forced)" : ""));
            return 0;
        }
    }

    @Command(name = "uncomplete", mixinStandardHelpOptions = true, description = "Reopen a completed task")
    @Component
    public static class Uncomplete extends PlanClientCommand {

        @Parameters(index = "0", converter = IndexPathConverter.class, description = "Task path")
        IndexPath path;

        public Uncomplete(PlanApiClients clients, CliProperties properties) {
            super(clients, properties);
        }

        @Override
        protected int execute() {
            client().uncompleteTask(planId(), path);
            ConsoleOutput.success("Reopened task " + path);
            return 0;
        }
    }

    @Command(name = "remove", mixinStandardHelpOptions = true,
            description = "Remove a task and its subtasks; later siblings move up by one")
    @Component
    public static class Remove extends PlanClientCommand {

        @Parameters(index = "0", converter = IndexPathConverter.class, description = "Task path")
        IndexPath path;

        public Remove(PlanApiClients clients, CliProperties properties) {
            super(clients, properties);
        }

        @Override
        protected int execute() {
            Task removed = client().removeTask(planId(), path);
            ConsoleOutput.success("Removed task " + path + ": " + removed.description()
                    + (removed.children().isEmpty() ? "" : " (with " + removed.children().size() + " subtasks)"));
            return 0;
        }
    }

    @Command(name = "change-level", mixinStandardHelpOptions = true, description = "Change a task's level")
    @Component
    public static class ChangeLevel extends PlanClientCommand {

        @Parameters(index = "0", converter = IndexPathConverter.class, description = "Task path")
        IndexPath path;

        @Parameters(index = "1", converter = LevelConverter.class, description = "New level: 0-3 or a level name")
        Level level;

        public ChangeLevel(PlanApiClients clients, CliProperties properties) {
            super(clients, properties);
        }

        @Override
        protected int execute() {
            client().changeLevel(planId(), path, level);
            ConsoleOutput.success("Task " + path + " is now at level " + level);
            return 0;
        }
    }

    @Command(name = "lease", mixinStandardHelpOptions = true, description = "Take a completion lease on a task")
    @Component
    public static class GenerateLease extends PlanClientCommand {

        @Parameters(index = "0", converter = IndexPathConverter.class, description = "Task path")
        IndexPath path;

        public GenerateLease(PlanApiClients clients, CliProperties properties) {
            super(clients, properties);
        }

        @Override
        protected int execute() {
            Lease lease = client().generateLease(planId(), path);
            ConsoleOutput.success("Lease " + lease.token() + " for task " + path);
            System.out.println("Complete with: scatterbrain task complete " + path + " --lease " + lease.token());
            if (!lease.verificationSuggestions().isEmpty()) {
                System.out.println();
                System.out.println("Before completing the plan:");
                lease.verificationSuggestions().forEach(s -> System.out.println("  - " + s));
            }
            return 0;
        }
    }
}
