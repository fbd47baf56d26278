package com.scatterbrain.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Scatterbrain.
 * Routes to subcommands: serve, plan, task, move, current, distilled, watch, guide, completions.
 */
@Command(
        name = "scatterbrain",
        mixinStandardHelpOptions = true,
        version = "Scatterbrain 0.1.0",
        description = "Hierarchical planning with lease-based task completion",
        subcommands = {
                ServeCommand.class,
                PlanCommand.class,
                TaskCommand.class,
                MoveCommand.class,
                CurrentCommand.class,
                DistilledCommand.class,
                WatchCommand.class,
                GuideCommand.class,
                CompletionsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ScatterbrainCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
