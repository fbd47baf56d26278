package com.scatterbrain.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: scatterbrain current
 */
@Command(name = "current", mixinStandardHelpOptions = true, description = "Show the task in focus")
@Component
public class CurrentCommand extends PlanClientCommand {

    public CurrentCommand(PlanApiClients clients, CliProperties properties) {
        super(clients, properties);
    }

    @Override
    protected int execute() {
        ConsoleOutput.current(client().getCurrent(planId()));
        return 0;
    }
}
