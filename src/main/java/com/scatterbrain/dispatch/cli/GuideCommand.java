package com.scatterbrain.dispatch.cli;

import com.scatterbrain.core.guide.Guide;
import com.scatterbrain.core.guide.GuideMode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: scatterbrain guide
 * <p>
 * Prints the guide locally; no server is needed.
 */
@Command(name = "guide", mixinStandardHelpOptions = true, description = "Print the Scatterbrain guide")
@Component
public class GuideCommand implements Runnable {

    @Option(names = "--mode", defaultValue = "CLI", description = "Guide flavour: ${COMPLETION-CANDIDATES}")
    GuideMode mode;

    @Override
    public void run() {
        System.out.print(Guide.render(mode));
    }
}
