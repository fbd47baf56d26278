package com.scatterbrain.dispatch.cli;

import com.scatterbrain.core.model.PlanSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.List;

/**
 * CLI command group: scatterbrain plan create|list|show|delete
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Create, list, show and delete plans",
        subcommands = {
                PlanCommand.Create.class,
                PlanCommand.ListPlans.class,
                PlanCommand.Show.class,
                PlanCommand.Delete.class
        })
@Component
public class PlanCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "create", mixinStandardHelpOptions = true, description = "Create a plan from a goal")
    @Component
    public static class Create extends PlanClientCommand {

        @Parameters(index = "0", description = "The goal the plan is for")
        String goal;

        @Option(names = {"--notes", "-n"}, description = "Plan notes")
        String notes;

        public Create(PlanApiClients clients, CliProperties properties) {
            super(clients, properties);
        }

        @Override
        protected int execute() {
            long planId = client().createPlan(goal, notes);
            ConsoleOutput.success("Created plan " + planId);
            System.out.println("Use it by default with: export SCATTERBRAIN_PLAN_ID=" + planId);
            return 0;
        }
    }

    @Command(name = "list", mixinStandardHelpOptions = true, description = "List plans")
    @Component
    public static class ListPlans extends PlanClientCommand {

        public ListPlans(PlanApiClients clients, CliProperties properties) {
            super(clients, properties);
        }

        @Override
        protected int execute() {
            List<PlanSummary> plans = client().listPlans();
            if (plans.isEmpty()) {
                ConsoleOutput.info("No plans. Create one with: scatterbrain plan create \"<goal>\"");
                return 0;
            }
            System.out.printf("  %-6s %s%n", "ID", "GOAL");
            System.out.println("  " + "-".repeat(60));
            for (PlanSummary plan : plans) {
                System.out.printf("  %-6d %s%n", plan.id(), plan.goal());
            }
            return 0;
        }
    }

    @Command(name = "show", mixinStandardHelpOptions = true, description = "Show a plan's full task tree")
    @Component
    public static class Show extends PlanClientCommand {

        @Parameters(index = "0", arity = "0..1", description = "Plan id (default: --plan or $SCATTERBRAIN_PLAN_ID)")
        Long id;

        public Show(PlanApiClients clients, CliProperties properties) {
            super(clients, properties);
        }

        @Override
        protected int execute() {
            ConsoleOutput.plan(client().getPlan(id != null ? id : planId()));
            return 0;
        }
    }

    @Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete a plan")
    @Component
    public static class Delete extends PlanClientCommand {

        @Parameters(index = "0", description = "Plan id")
        long id;

        public Delete(PlanApiClients clients, CliProperties properties) {
            super(clients, properties);
        }

        @Override
        protected int execute() {
            client().deletePlan(id);
            ConsoleOutput.success("Deleted plan " + id);
            return 0;
        }
    }
}
