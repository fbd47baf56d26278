package com.scatterbrain.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * CLI command: scatterbrain serve
 * <p>
 * Starts Scatterbrain as a long-running HTTP server exposing the REST API, SSE event
 * streaming and the MCP tool endpoint. The web server is enabled by
 * {@link com.scatterbrain.ScatterbrainApplication#main} detecting "serve" in args, which
 * also turns this command's options into Spring properties via {@link #serverProperties}.
 * <p>
 * In serve mode, {@link CliRunner} skips picocli so the embedded web server keeps the JVM
 * alive. The startup banner is printed via a Spring {@link WebServerInitializedEvent}
 * listener once Tomcat is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Scatterbrain server (REST API, event stream and MCP tools)")
@Component
public class ServeCommand implements Runnable {

    @Option(names = "--port", description = "HTTP port (default: 3000)")
    Integer port;

    @Option(names = "--example", description = "Seed an example plan at startup")
    boolean example;

    @Value("${server.port:3000}")
    private int configuredPort;

    @Override
    public void run() {
        // Not called in serve mode; kept for picocli subcommand registration and --help.
        printBanner(port != null ? port : configuredPort);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    /**
     * Parses the arguments following "serve" and returns them as Spring property assignments.
     */
    public static String[] serverProperties(String[] args) {
        int serveAt = Arrays.asList(args).indexOf("serve");
        String[] serveArgs = Arrays.copyOfRange(args, serveAt + 1, args.length);
        ServeCommand options = new ServeCommand();
        new CommandLine(options).setUnmatchedArgumentsAllowed(true).parseArgs(serveArgs);

        List<String> properties = new ArrayList<>();
        if (options.port != null) {
            properties.add("server.port=" + options.port);
        }
        if (options.example) {
            properties.add("scatterbrain.example=true");
        }
        return properties.toArray(String[]::new);
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Scatterbrain server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Events:  http://localhost:" + port + "/api/v1/plans/{id}/events");
        System.out.println("  MCP:     http://localhost:" + port + "/sse");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
