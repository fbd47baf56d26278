package com.scatterbrain.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: scatterbrain distilled
 * <p>
 * Prints the plan as seen from the task in focus: its ancestors, its subtasks, the tree
 * expanded along the focus path and the recent history.
 */
@Command(name = "distilled", mixinStandardHelpOptions = true,
        description = "Show the distilled context around the task in focus")
@Component
public class DistilledCommand extends PlanClientCommand {

    public DistilledCommand(PlanApiClients clients, CliProperties properties) {
        super(clients, properties);
    }

    @Override
    protected int execute() {
        ConsoleOutput.distilled(client().getDistilledContext(planId()));
        return 0;
    }
}
