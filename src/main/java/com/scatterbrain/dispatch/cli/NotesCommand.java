package com.scatterbrain.dispatch.cli;

import com.scatterbrain.core.model.IndexPath;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.Optional;

/**
 * CLI command group: scatterbrain task notes view|set|delete
 * <p>
 * On the root path ({@code root}) these read and write the plan notes.
 */
@Command(name = "notes", mixinStandardHelpOptions = true, description = "View, set or delete task notes",
        subcommands = {
                NotesCommand.View.class,
                NotesCommand.Set.class,
                NotesCommand.Delete.class
        })
@Component
public class NotesCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "view", mixinStandardHelpOptions = true, description = "Print a task's notes")
    @Component
    public static class View extends PlanClientCommand {

        @Parameters(index = "0", converter = IndexPathConverter.class, description = "Task path")
        IndexPath path;

        public View(PlanApiClients clients, CliProperties properties) {
            super(clients, properties);
        }

        @Override
        protected int execute() {
            Optional<String> notes = client().getNotes(planId(), path);
            if (notes.isPresent()) {
                System.out.println(notes.get());
            } else {
                ConsoleOutput.info("Task " + path + " has no notes");
            }
            return 0;
        }
    }

    @Command(name = "set", mixinStandardHelpOptions = true, description = "Replace a task's notes")
    @Component
    public static class Set extends PlanClientCommand {

        @Parameters(index = "0", converter = IndexPathConverter.class, description = "Task path")
        IndexPath path;

        @Parameters(index = "1", description = "Notes text")
        String notes;

        public Set(PlanApiClients clients, CliProperties properties) {
            super(clients, properties);
        }

        @Override
        protected int execute() {
            client().setNotes(planId(), path, notes);
            ConsoleOutput.success("Notes of task " + path + " updated");
            return 0;
        }
    }

    @Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete a task's notes")
    @Component
    public static class Delete extends PlanClientCommand {

        @Parameters(index = "0", converter = IndexPathConverter.class, description = "Task path")
        IndexPath path;

        public Delete(PlanApiClients clients, CliProperties properties) {
            super(clients, properties);
        }

        @Override
        protected int execute() {
            client().deleteNotes(planId(), path);
            ConsoleOutput.success("Notes of task " + path + " deleted");
            return 0;
        }
    }
}
