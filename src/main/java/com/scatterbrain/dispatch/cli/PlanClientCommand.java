package com.scatterbrain.dispatch.cli;

import com.scatterbrain.core.plan.ErrorKind;
import com.scatterbrain.core.plan.PlanException;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * Base for commands that call the server. Plan errors are printed with their kind and turned
 * into a kind-specific exit code; transport failures exit with {@link #EXIT_TRANSPORT}.
 */
public abstract class PlanClientCommand implements Callable<Integer> {

    static final int EXIT_TRANSPORT = 2;

    @Mixin
    ConnectionOptions connection = new ConnectionOptions();

    private final PlanApiClients clients;
    private final CliProperties properties;

    protected PlanClientCommand(PlanApiClients clients, CliProperties properties) {
        this.clients = clients;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        try {
            return execute();
        } catch (PlanException e) {
            ConsoleOutput.error("[" + e.kind() + "] " + e.getMessage());
            return exitCode(e.kind());
        } catch (ApiClientException e) {
            ConsoleOutput.error(e.getMessage());
            ConsoleOutput.info("Start the server first: scatterbrain serve");
            return EXIT_TRANSPORT;
        }
    }

    protected abstract int execute();

    protected PlanApiClient client() {
        return clients.connect(connection.server);
    }

    /**
     * The plan named by --plan, else the configured default.
     */
    protected long planId() {
        if (connection.plan != null) {
            return connection.plan;
        }
        if (properties.getPlanId() != null) {
            return properties.getPlanId();
        }
        throw PlanException.invalid("No plan selected: pass --plan <id> or set SCATTERBRAIN_PLAN_ID");
    }

    static int exitCode(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> 3;
            case INVALID_OPERATION -> 4;
            case LEASE_REQUIRED -> 5;
            case LEASE_INVALID -> 6;
            case ALREADY_COMPLETED -> 7;
            case LOCK_FAILURE -> 8;
        };
    }
}
