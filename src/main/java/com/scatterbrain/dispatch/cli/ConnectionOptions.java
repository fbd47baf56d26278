package com.scatterbrain.dispatch.cli;

import picocli.CommandLine.Option;

/**
 * Options shared by every command that talks to the server.
 */
public class ConnectionOptions {

    @Option(names = {"--plan", "-p"}, description = "Plan id (default: $SCATTERBRAIN_PLAN_ID)")
    Long plan;

    @Option(names = "--server", description = "Server base URL (default: http://localhost:3000)")
    String server;
}
