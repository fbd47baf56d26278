package com.scatterbrain.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ScatterbrainCommand scatterbrainCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ScatterbrainCommand scatterbrainCommand, IFactory factory) {
        this.scatterbrainCommand = scatterbrainCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // In serve mode the embedded web server handles everything. Skip picocli: its
        // execute() returns immediately, which could let the JVM exit before Tomcat is ready.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = newCommandLine(scatterbrainCommand, factory).execute(args);
    }

    static CommandLine newCommandLine(ScatterbrainCommand command, IFactory factory) {
        return new CommandLine(command, factory)
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
