package com.scatterbrain.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: scatterbrain watch
 * <p>
 * Connects to the plan's SSE endpoint and prints every change event until the server ends
 * the stream (for instance because the plan was deleted).
 */
@Command(name = "watch", mixinStandardHelpOptions = true, description = "Stream a plan's change events")
@Component
public class WatchCommand extends PlanClientCommand {

    public WatchCommand(PlanApiClients clients, CliProperties properties) {
        super(clients, properties);
    }

    @Override
    protected int execute() {
        long planId = planId();
        PlanApiClient client = client();
        ConsoleOutput.info("Watching plan " + planId + " (connecting to " + client.baseUrl() + ")...");
        System.out.println();

        client.streamEvents(planId, ConsoleOutput::watchEvent);

        System.out.println();
        ConsoleOutput.info("Stream ended.");
        return 0;
    }
}
