package com.scatterbrain.dispatch.cli;

import com.scatterbrain.core.model.CurrentTask;
import com.scatterbrain.core.model.IndexPath;
import com.scatterbrain.core.model.Lease;
import com.scatterbrain.core.model.Level;
import com.scatterbrain.core.model.Plan;
import com.scatterbrain.core.model.PlanSummary;
import com.scatterbrain.core.model.Task;
import com.scatterbrain.core.plan.ErrorKind;
import com.scatterbrain.core.plan.PlanException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Scatterbrain CLI command structure.
 * These tests exercise picocli directly without a Spring context; the HTTP client is mocked.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private PlanApiClient client;
    private PlanApiClients clients;
    private CliProperties properties;

    @BeforeEach
    void setUp() {
        client = mock(PlanApiClient.class);
        clients = mock(PlanApiClients.class);
        when(clients.connect(any())).thenReturn(client);
        when(client.baseUrl()).thenReturn("http://localhost:3000");
        properties = new CliProperties();
    }

    /**
     * Custom picocli IFactory that hands the mocked client to every server-bound command.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            public <K> K create(Class<K> cls) throws Exception {
                if (PlanClientCommand.class.isAssignableFrom(cls)) {
                    return cls.getConstructor(PlanApiClients.class, CliProperties.class)
                            .newInstance(clients, properties);
                }
                // Default: use picocli's default factory for other classes
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = CliRunner.newCommandLine(new ScatterbrainCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String command : List.of("serve", "plan", "task", "move", "current", "distilled", "watch",
                    "guide", "completions", "help")) {
                assertTrue(result.output().contains(command), "Help should list '" + command + "'");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Scatterbrain 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints the banner and usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SCATTERBRAIN v0.1.0"));
            assertTrue(result.output().contains("Usage: scatterbrain"));
        }

        @Test
        @DisplayName("task without a subcommand prints its usage")
        void taskGroupUsage() {
            CliResult result = execute("task");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("change-level"));
            assertTrue(result.output().contains("notes"));
        }

        @Test
        @DisplayName("task add --help documents --level and --parent")
        void taskAddHelp() {
            CliResult result = execute("task", "add", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--level"));
            assertTrue(result.output().contains("--parent"));
            assertTrue(result.output().contains("--plan"));
        }
    }

    // =====================================================================
    //  Plan commands
    // =====================================================================

    @Nested
    @DisplayName("plan commands")
    class PlanCommandTests {

        @Test
        @DisplayName("plan create prints the new id")
        void create() {
            when(client.createPlan("Build an API", null)).thenReturn(5L);

            CliResult result = execute("plan", "create", "Build an API");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Created plan 5"));
            assertTrue(result.output().contains("SCATTERBRAIN_PLAN_ID=5"));
        }

        @Test
        @DisplayName("plan list prints each plan")
        void list() {
            when(client.listPlans()).thenReturn(List.of(new PlanSummary(1, "Build an API"),
                    new PlanSummary(2, "Write docs")));

            CliResult result = execute("plan", "list");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Build an API"));
            assertTrue(result.output().contains("Write docs"));
        }

        @Test
        @DisplayName("plan list with no plans says so")
        void listEmpty() {
            when(client.listPlans()).thenReturn(List.of());
            CliResult result = execute("plan", "list");
            assertTrue(result.output().contains("No plans"));
        }

        @Test
        @DisplayName("plan show renders the tree and marks the focus")
        void show() {
            Task child = new Task("Define endpoints", Level.ISOLATION, null, true, "done", false, List.of());
            Task top = new Task("Design schema", Level.PLANNING, null, false, null, false, List.of(child));
            Task root = new Task("Build an API", Level.PLANNING, null, false, null, false, List.of(top));
            when(client.getPlan(3)).thenReturn(new Plan(3, "Build an API", null, root, IndexPath.of(0)));

            CliResult result = execute("plan", "show", "3");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Design schema"));
            assertTrue(result.output().contains("[x]"));
            assertTrue(result.output().contains("summary: done"));
        }

        @Test
        @DisplayName("--server selects the server")
        void serverOption() {
            when(client.listPlans()).thenReturn(List.of());
            execute("plan", "list", "--server", "http://planner:4000");
            verify(clients).connect("http://planner:4000");
        }
    }

    // =====================================================================
    //  Task commands
    // =====================================================================

    @Nested
    @DisplayName("task commands")
    class TaskCommandTests {

        @Test
        @DisplayName("task add parses the level in any form and adds under the focus")
        void add() {
            when(client.addTask(5, null, "Design schema", Level.PLANNING, null)).thenReturn(IndexPath.of(0));

            CliResult result = execute("task", "add", "Design schema", "--level", "planning", "--plan", "5");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Added task 0: Design schema"));
        }

        @Test
        @DisplayName("task add with --parent passes the parsed path")
        void addWithParent() {
            when(client.addTask(5, IndexPath.of(0), "Define endpoints", Level.ISOLATION, "REST"))
                    .thenReturn(IndexPath.of(0, 0));

            CliResult result = execute("task", "add", "Define endpoints", "-l", "1", "--parent", "0",
                    "--notes", "REST", "-p", "5");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Added task 0,0"));
        }

        @Test
        @DisplayName("an unknown level is a usage error")
        void badLevel() {
            CliResult result = execute("task", "add", "x", "--level", "design", "--plan", "5");
            assertEquals(2, result.exitCode());
            verify(client, never()).addTask(anyLong(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("a malformed path is a usage error")
        void badPath() {
            CliResult result = execute("move", "0,x", "--plan", "5");
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Invalid index path"));
        }

        @Test
        @DisplayName("task lease prints the token and the root checklist")
        void lease() {
            when(client.generateLease(5, IndexPath.ROOT))
                    .thenReturn(new Lease(5, IndexPath.ROOT, 42, List.of("Ensure compilation passes successfully.")));

            CliResult result = execute("task", "lease", "root", "--plan", "5");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Lease 42"));
            assertTrue(result.output().contains("--lease 42"));
            assertTrue(result.output().contains("Ensure compilation passes successfully."));
        }

        @Test
        @DisplayName("task complete passes lease, summary and force")
        void complete() {
            CliResult result = execute("task", "complete", "0,0", "--lease", "42", "-s", "done", "--plan", "5");

            assertEquals(0, result.exitCode());
            verify(client).completeTask(5, IndexPath.of(0, 0), 42L, false, "done");
        }

        @Test
        @DisplayName("a rejected lease prints the kind and exits with its code")
        void leaseRejected() {
            doThrow(new PlanException(ErrorKind.LEASE_INVALID, "Lease 41 is not valid"))
                    .when(client).completeTask(5, IndexPath.of(0), 41L, false, null);

            CliResult result = execute("task", "complete", "0", "--lease", "41", "--plan", "5");

            assertEquals(6, result.exitCode());
            assertTrue(result.output().contains("[LEASE_INVALID] Lease 41 is not valid"));
        }

        @Test
        @DisplayName("task notes view reports missing notes")
        void notesView() {
            when(client.getNotes(5, IndexPath.of(1))).thenReturn(Optional.empty());

            CliResult result = execute("task", "notes", "view", "1", "--plan", "5");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("has no notes"));
        }

        @Test
        @DisplayName("task change-level takes the path and level as parameters")
        void changeLevel() {
            CliResult result = execute("task", "change-level", "0", "IMPLEMENTATION", "--plan", "5");

            assertEquals(0, result.exitCode());
            verify(client).changeLevel(5, IndexPath.of(0), Level.IMPLEMENTATION);
        }
    }

    // =====================================================================
    //  Plan selection and failures
    // =====================================================================

    @Nested
    @DisplayName("plan selection")
    class PlanSelectionTests {

        private CurrentTask current() {
            Task task = new Task("Define endpoints", Level.ISOLATION, null, false, null, false, List.of());
            return new CurrentTask(IndexPath.of(0, 0), Level.ISOLATION, task, List.of("Design schema"));
        }

        @Test
        @DisplayName("without --plan or a configured default the command fails")
        void noPlanSelected() {
            CliResult result = execute("current");

            assertEquals(4, result.exitCode());
            assertTrue(result.output().contains("No plan selected"));
            verify(client, never()).getCurrent(anyLong());
        }

        @Test
        @DisplayName("the configured default plan is used when --plan is absent")
        void defaultPlan() {
            properties.setPlanId(7L);
            when(client.getCurrent(7)).thenReturn(current());

            CliResult result = execute("current");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Define endpoints"));
            assertTrue(result.output().contains("Design schema"));
        }

        @Test
        @DisplayName("--plan overrides the configured default")
        void planOverridesDefault() {
            properties.setPlanId(7L);
            when(client.getCurrent(8)).thenReturn(current());

            assertEquals(0, execute("current", "--plan", "8").exitCode());
            verify(client).getCurrent(8);
        }

        @Test
        @DisplayName("an unreachable server exits with the transport code")
        void serverDown() {
            when(client.getCurrent(7)).thenThrow(new ApiClientException("Cannot connect to Scatterbrain server"));

            CliResult result = execute("current", "--plan", "7");

            assertEquals(PlanClientCommand.EXIT_TRANSPORT, result.exitCode());
            assertTrue(result.output().contains("Cannot connect"));
        }

        @Test
        @DisplayName("each error kind has its own exit code")
        void exitCodes() {
            assertEquals(3, PlanClientCommand.exitCode(ErrorKind.NOT_FOUND));
            assertEquals(5, PlanClientCommand.exitCode(ErrorKind.LEASE_REQUIRED));
            assertEquals(7, PlanClientCommand.exitCode(ErrorKind.ALREADY_COMPLETED));
            assertEquals(8, PlanClientCommand.exitCode(ErrorKind.LOCK_FAILURE));
        }
    }

    // =====================================================================
    //  Local commands
    // =====================================================================

    @Nested
    @DisplayName("local commands")
    class LocalCommandTests {

        @Test
        @DisplayName("guide prints the command line guide by default")
        void guide() {
            CliResult result = execute("guide");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Scatterbrain Guide (command line)"));
        }

        @Test
        @DisplayName("guide --mode mcp prints the tool guide")
        void guideMcp() {
            CliResult result = execute("guide", "--mode", "mcp");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("create_plan"));
        }

        @Test
        @DisplayName("completions prints a bash completion script")
        void completions() {
            CliResult result = execute("completions");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("complete -F"));
            assertTrue(result.output().contains("scatterbrain"));
        }

        @Test
        @DisplayName("serve options become Spring properties")
        void serverProperties() {
            String[] properties = ServeCommand.serverProperties(new String[]{"serve", "--port", "4000", "--example"});
            assertArrayEquals(new String[]{"server.port=4000", "scatterbrain.example=true"}, properties);
            assertEquals(0, ServeCommand.serverProperties(new String[]{"serve"}).length);
        }
    }
}
