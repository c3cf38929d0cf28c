package com.mycelium.dispatch.cli;

import com.mycelium.agents.EchoAction;
import com.mycelium.core.bridge.ActionCatalog;
import com.mycelium.core.bus.DeadLetterReason;
import com.mycelium.core.bus.DeadLetterStore;
import com.mycelium.core.client.DirectiveClient;
import com.mycelium.core.client.DirectiveFailedException;
import com.mycelium.core.client.Submission;
import com.mycelium.core.config.Hierarchy;
import com.mycelium.core.events.TelemetryFeed;
import com.mycelium.core.health.HealthCheckService;
import com.mycelium.core.health.HealthStatus;
import com.mycelium.core.model.DirectivePayload;
import com.mycelium.core.model.Envelope;
import com.mycelium.core.model.EventPayload;
import com.mycelium.core.model.ReportPayload;
import com.mycelium.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the Mycelium CLI command structure.
 * These tests exercise picocli directly without Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private Hierarchy hierarchy;
    private DirectiveClient client;
    private HealthCheckService healthCheckService;
    private DeadLetterStore deadLetters;

    @BeforeEach
    void setUp() {
        client = mock(DirectiveClient.class);
        hierarchy = mock(Hierarchy.class);
        when(hierarchy.client()).thenReturn(client);
        healthCheckService = mock(HealthCheckService.class);
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("agents", HealthStatus.Status.UP, "5 agent(s) registered", Map.of("RUNNING", "5")),
                new HealthStatus("pools", HealthStatus.Status.UP, "All pools at full strength", Map.of())));
        deadLetters = new DeadLetterStore(10, MutableClock.startingAt("2026-03-01T12:00:00Z"), new TelemetryFeed());
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == SubmitCommand.class) {
                    return (K) new SubmitCommand(hierarchy, new ActionCatalog(List.of(EchoAction.values())),
                            new TelemetryFeed());
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                if (cls == DeadLettersCommand.class) {
                    return (K) new DeadLettersCommand(deadLetters);
                }
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
            CommandLine commandLine = new CommandLine(new MyceliumCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private void stubSubmission(CompletableFuture<ReportPayload> result) {
        when(client.submit(any(DirectivePayload.class), anyInt(), any()))
                .thenReturn(new Submission("corr-1", result));
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("submit"));
            assertTrue(result.output().contains("health"));
            assertTrue(result.output().contains("dead-letters"));
            assertTrue(result.output().contains("Hierarchical agent orchestration core"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Mycelium 0.1.0"));
        }

        @Test
        @DisplayName("submit --help shows its options")
        void submitHelp() {
            CliResult result = execute("submit", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--priority"));
            assertTrue(result.output().contains("--ttl-ms"));
        }
    }

    @Nested
    @DisplayName("submit")
    class SubmitTests {

        @Test
        @DisplayName("sends the parsed directive and prints the result")
        void submitsDirective() {
            stubSubmission(CompletableFuture.completedFuture(ReportPayload.success(Map.of("text", "olleh"))));

            CliResult result = execute("submit", "echo:REVERSE", "-p", "text=hello", "--priority", "8",
                    "--ttl-ms", "2000");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SUCCESS"));
            assertTrue(result.output().contains("olleh"));
            ArgumentCaptor<DirectivePayload> directive = ArgumentCaptor.forClass(DirectivePayload.class);
            verify(client).submit(directive.capture(), eq(8), eq(Duration.ofSeconds(2)));
            assertEquals(EchoAction.REVERSE, directive.getValue().action());
            assertEquals("hello", directive.getValue().param("text"));
        }

        @Test
        @DisplayName("a failed directive exits with 1 and shows the error code")
        void failedDirective() {
            stubSubmission(CompletableFuture.failedFuture(
                    new DirectiveFailedException("corr-1", "CIRCUIT_OPEN", "all open", true)));

            CliResult result = execute("submit", "echo:ECHO", "-p", "text=x");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("CIRCUIT_OPEN"));
            assertTrue(result.output().contains("retryable"));
        }

        @Test
        @DisplayName("an unknown action exits with 2 without submitting")
        void unknownAction() {
            CliResult result = execute("submit", "echo:SHOUT");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Unknown action"));
            verifyNoInteractions(client);
        }
    }

    @Nested
    @DisplayName("health and dead-letters")
    class StatusTests {

        @Test
        @DisplayName("health prints each component and succeeds when all are up")
        void healthAllUp() {
            CliResult result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("agents: 5 agent(s) registered"));
            assertTrue(result.output().contains("Overall"));
        }

        @Test
        @DisplayName("health exits with 1 when a component is degraded")
        void healthDegraded() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("pools", HealthStatus.Status.DEGRADED, "1 open circuit(s)", Map.of())));

            assertEquals(1, execute("health").exitCode());
        }

        @Test
        @DisplayName("dead-letters filters by reason")
        void deadLettersByReason() {
            Envelope envelope = Envelope.builder().id("env-9").from("a").to("b")
                    .event(EventPayload.of("e", Map.of()))
                    .createdAt(MutableClock.startingAt("2026-03-01T12:00:00Z").instant())
                    .build();
            deadLetters.record(envelope, "b", DeadLetterReason.EXPIRED);
            deadLetters.record(envelope, "c", DeadLetterReason.MAILBOX_FULL);

            CliResult result = execute("dead-letters", "--reason", "EXPIRED");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("1 retained of 2 recorded"));
            assertTrue(result.output().contains("env-9"));
            assertFalse(result.output().contains("MAILBOX_FULL"));
        }
    }
}
