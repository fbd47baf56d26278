package com.scatterbrain.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.AutoComplete;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command: scatterbrain completions
 * <p>
 * Prints a bash/zsh completion script: {@code source <(scatterbrain completions)}.
 */
@Command(name = "completions", mixinStandardHelpOptions = true,
        description = "Print a bash completion script for scatterbrain")
@Component
public class CompletionsCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        System.out.print(AutoComplete.bash("scatterbrain", spec.root().commandLine()));
    }
}
