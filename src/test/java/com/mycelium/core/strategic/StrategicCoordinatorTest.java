package com.mycelium.core.strategic;

import com.mycelium.agents.EchoAction;
import com.mycelium.core.bus.MessageBus;
import com.mycelium.core.events.TelemetryFeed;
import com.mycelium.core.model.ControlAction;
import com.mycelium.core.model.DirectivePayload;
import com.mycelium.core.model.Envelope;
import com.mycelium.core.model.ErrorCode;
import com.mycelium.core.model.EventPayload;
import com.mycelium.core.model.EventTypes;
import com.mycelium.core.model.GoalPayload;
import com.mycelium.core.model.MessageKind;
import com.mycelium.core.model.ReportPayload;
import com.mycelium.core.model.SummaryPayload;
import com.mycelium.core.model.Tier;
import com.mycelium.core.runtime.AgentContext;
import com.mycelium.core.runtime.DirectiveOutcome;
import com.mycelium.support.MutableClock;
import com.mycelium.support.TestPeer;
import com.mycelium.support.TestBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives {@link StrategicCoordinator} handlers directly on the test thread, with test peers
 * standing in for the gateway and the tactical supervisors.
 */
class StrategicCoordinatorTest {

    private MutableClock clock;
    private MessageBus bus;
    private TestPeer gateway;
    private TestPeer echoSupervisor;
    private StrategicCoordinator coordinator;
    private AgentContext context;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        bus = TestBus.create(clock);
        gateway = TestPeer.register(bus, "gateway", Tier.EXECUTION, null, "gateway");
        echoSupervisor = TestPeer.register(bus, "tactical-echo", Tier.TACTICAL, "strategic", "echo");
        coordinator = coordinator(CoordinatorSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private StrategicCoordinator coordinator(CoordinatorSettings settings) {
        var created = new StrategicCoordinator("strategic", GoalDecomposer.explicitSteps(), settings, new TelemetryFeed());
        bus.register(created.identity());
        context = new AgentContext(created.identity(), bus, () -> false);
        created.onInitialize(context);
        return created;
    }

    private Envelope fromGateway(DirectivePayload directive) {
        return Envelope.builder().from("gateway").to("strategic").directive(directive)
                .createdAt(clock.instant()).build();
    }

    private void answer(Envelope step, ReportPayload report) throws Exception {
        coordinator.onReport(Envelope.builder()
                .from(step.recipients().get(0))
                .to("strategic")
                .report(report)
                .correlationId(step.correlationKey())
                .createdAt(clock.instant())
                .build(), context);
    }

    private SummaryPayload summary(double successRate, double avgLatencyMs, int queueDepth) {
        return new SummaryPayload("tactical-echo", "echo", 10, (int) (successRate * 10),
                10 - (int) (successRate * 10), successRate, avgLatencyMs, queueDepth, 1, 2, clock.instant());
    }

    @Nested
    @DisplayName("goals")
    class Goals {

        @Test
        @DisplayName("routes a single directive to the capable supervisor and forwards its report")
        void singleDirective() throws Exception {
            Envelope origin = fromGateway(DirectivePayload.of(EchoAction.ECHO, Map.of("text", "hi")));

            DirectiveOutcome outcome = coordinator.onDirective(origin, context);

            assertTrue(outcome.isDeferred());
            Envelope step = echoSupervisor.expect(MessageKind.DIRECTIVE);
            assertEquals(origin.id() + "/0", step.correlationId());
            assertEquals(origin.createdAt(), step.createdAt());

            answer(step, ReportPayload.success(Map.of("text", "hi")));

            ReportPayload report = gateway.expectReport(origin.id()).payloadAs(ReportPayload.class);
            assertEquals("hi", report.data().get("text"));
            assertEquals(0, coordinator.goalsInProgress());
        }

        @Test
        @DisplayName("fails with NO_CAPABLE_SUPERVISOR before dispatching anything")
        void noCapableSupervisor() throws Exception {
            var goal = new GoalPayload("mixed", List.of(
                    DirectivePayload.of(EchoAction.ECHO, Map.of("text", "a")),
                    DirectivePayload.of(ControlAction.REDUCE_CONCURRENCY)));
            Envelope origin = Envelope.builder().from("gateway").to("strategic")
                    .kind(MessageKind.DIRECTIVE).payload(goal).requiresResponse(true)
                    .createdAt(clock.instant()).build();

            DirectiveOutcome outcome = coordinator.onDirective(origin, context);

            assertFalse(outcome.isDeferred());
            assertEquals(ErrorCode.NO_CAPABLE_SUPERVISOR.name(), outcome.report().errorCode());
            echoSupervisor.expectNone(e -> e.kind() == MessageKind.DIRECTIVE, Duration.ofMillis(100));
        }

        @Test
        @DisplayName("a multi-step goal completes once every step reported")
        void multiStepGoal() throws Exception {
            var goal = new GoalPayload("two echoes", List.of(
                    DirectivePayload.of(EchoAction.ECHO, Map.of("text", "a")),
                    DirectivePayload.of(EchoAction.REVERSE, Map.of("text", "bc"))));
            Envelope origin = Envelope.builder().from("gateway").to("strategic")
                    .kind(MessageKind.DIRECTIVE).payload(goal).requiresResponse(true)
                    .createdAt(clock.instant()).build();

            coordinator.onDirective(origin, context);
            Envelope first = echoSupervisor.expect(MessageKind.DIRECTIVE);
            Envelope second = echoSupervisor.expect(MessageKind.DIRECTIVE);

            answer(second, ReportPayload.success(Map.of("text", "cb")));
            gateway.expectNone(e -> e.kind() == MessageKind.REPORT, Duration.ofMillis(50));
            answer(first, ReportPayload.failed(ErrorCode.TRANSIENT_FAILURE, "flaky", true));

            ReportPayload report = gateway.expectReport(origin.id()).payloadAs(ReportPayload.class);
            assertFalse(report.succeeded());
            assertEquals(ErrorCode.TRANSIENT_FAILURE.name(), report.errorCode());
            assertTrue(report.retryable());
            assertEquals(2, ((List<?>) report.data().get("steps")).size());
        }

        @Test
        @DisplayName("abandon is forwarded to the supervisor for every open step")
        void abandonForwarded() throws Exception {
            Envelope origin = fromGateway(DirectivePayload.of(EchoAction.ECHO, Map.of("text", "x")));
            coordinator.onDirective(origin, context);
            Envelope step = echoSupervisor.expect(MessageKind.DIRECTIVE);

            coordinator.onEvent(Envelope.builder().from("gateway").to("strategic")
                    .event(EventPayload.of(EventTypes.ABANDON, Map.of("correlationId", origin.id())))
                    .createdAt(clock.instant()).build(), context);

            Envelope forwarded = echoSupervisor.expect(MessageKind.EVENT);
            assertEquals(step.correlationId(), forwarded.payloadAs(EventPayload.class).value("correlationId"));
        }
    }

    @Nested
    @DisplayName("summaries")
    class Summaries {

        @Test
        @DisplayName("a low success rate sends one REDUCE_CONCURRENCY, recovery sends RESTORE_CONCURRENCY")
        void reduceAndRestore() throws Exception {
            coordinator.onAggregatedReport(summary(0.5, 10, 0), context);
            coordinator.onAggregatedReport(summary(0.4, 10, 0), context);

            Envelope control = echoSupervisor.expect(MessageKind.DIRECTIVE);
            assertEquals(ControlAction.REDUCE_CONCURRENCY, control.payloadAs(DirectivePayload.class).action());
            assertEquals(StrategicCoordinator.CONTROL_PRIORITY, control.priority());
            echoSupervisor.expectNone(e -> e.kind() == MessageKind.DIRECTIVE, Duration.ofMillis(50));

            coordinator.onAggregatedReport(summary(1.0, 10, 0), context);

            Envelope restore = echoSupervisor.expect(MessageKind.DIRECTIVE);
            assertEquals(ControlAction.RESTORE_CONCURRENCY, restore.payloadAs(DirectivePayload.class).action());
        }

        @Test
        @DisplayName("high latency or a deep queue counts as overload")
        void overload() throws Exception {
            coordinator.onAggregatedReport(summary(1.0, 9_000, 0), context);

            Envelope control = echoSupervisor.expect(MessageKind.DIRECTIVE);
            assertEquals(ControlAction.REDUCE_CONCURRENCY, control.payloadAs(DirectivePayload.class).action());
        }

        @Test
        @DisplayName("a failing capability with an alternate gets PREFER_ALTERNATE")
        void preferAlternate() throws Exception {
            bus.unregister("strategic");
            coordinator = coordinator(new CoordinatorSettings(0.8, 5_000, 32, Duration.ofSeconds(30),
                    Map.of("echo", "echo-backup")));

            coordinator.onAggregatedReport(summary(0.2, 10, 0), context);

            DirectivePayload control = echoSupervisor.expect(MessageKind.DIRECTIVE).payloadAs(DirectivePayload.class);
            assertEquals(ControlAction.PREFER_ALTERNATE, control.action());
            assertEquals("echo-backup", control.param("alternate"));
        }

        @Test
        @DisplayName("control acknowledgements are not treated as step reports")
        void controlAckIgnored() throws Exception {
            coordinator.onAggregatedReport(summary(0.1, 10, 0), context);
            Envelope control = echoSupervisor.expect(MessageKind.DIRECTIVE);

            answer(control, ReportPayload.success(Map.of("echo", 1)));

            gateway.expectNone(e -> true, Duration.ofMillis(50));
        }
    }

    @Test
    @DisplayName("a silent supervisor is broadcast once per silence episode")
    void silenceBroadcastOnce() throws Exception {
        TestPeer other = TestPeer.register(bus, "tactical-other", Tier.TACTICAL, "strategic", "other");
        coordinator.sweep(context);

        clock.advance(Duration.ofSeconds(31));
        coordinator.onReport(Envelope.builder().from("tactical-other").to("strategic")
                .report(ReportPayload.success(Map.of())).createdAt(clock.instant()).build(), context);

        assertEquals(List.of("tactical-echo"), coordinator.sweep(context));
        assertTrue(coordinator.sweep(context).isEmpty());

        Envelope alert = other.expect(MessageKind.EVENT);
        assertEquals(EventTypes.SUPERVISOR_SILENT, alert.payloadAs(EventPayload.class).eventType());
        assertEquals("tactical-echo", alert.payloadAs(EventPayload.class).value("supervisorId"));

        coordinator.onReport(Envelope.builder().from("tactical-echo").to("strategic")
                .report(ReportPayload.success(Map.of())).createdAt(clock.instant()).build(), context);
        clock.advance(Duration.ofSeconds(31));
        assertEquals(List.of("tactical-echo", "tactical-other"), coordinator.sweep(context));
    }
}
