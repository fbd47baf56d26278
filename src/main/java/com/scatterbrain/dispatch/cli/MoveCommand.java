package com.scatterbrain.dispatch.cli;

import com.scatterbrain.core.model.CurrentTask;
import com.scatterbrain.core.model.IndexPath;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: scatterbrain move &lt;path&gt;
 */
@Command(name = "move", mixinStandardHelpOptions = true, description = "Move the focus to a task")
@Component
public class MoveCommand extends PlanClientCommand {

    @Parameters(index = "0", converter = IndexPathConverter.class, description = "Task path, e.g. 0,1 or root")
    IndexPath path;

    public MoveCommand(PlanApiClients clients, CliProperties properties) {
        super(clients, properties);
    }

    @Override
    protected int execute() {
        CurrentTask current = client().moveTo(planId(), path);
        ConsoleOutput.success("Moved to " + current.path() + ": " + current.task().description());
        return 0;
    }
}
