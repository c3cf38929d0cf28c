package com.mycelium.core.metrics;

import com.mycelium.core.events.TelemetryEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MyceliumMetricsTest {

    private SimpleMeterRegistry registry;
    private MyceliumMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MyceliumMetrics(registry);
    }

    private void publish(String type, Map<String, Object> data) {
        metrics.onTelemetry(TelemetryEvent.of(type, "agent", data, Instant.now()));
    }

    @Test
    @DisplayName("dead letters are counted by reason")
    void deadLetters() {
        publish(TelemetryEvent.DEAD_LETTERED, Map.of("reason", "EXPIRED"));
        publish(TelemetryEvent.DEAD_LETTERED, Map.of("reason", "EXPIRED"));
        publish(TelemetryEvent.DEAD_LETTERED, Map.of("reason", "MAILBOX_FULL"));

        var expired = registry.find("mycelium.dead_letters").tag("reason", "EXPIRED").counter();
        assertNotNull(expired);
        assertEquals(2.0, expired.count());
    }

    @Test
    @DisplayName("completed directives feed a counter and a latency timer")
    void directives() {
        publish(TelemetryEvent.DIRECTIVE_COMPLETED, Map.of("capability", "echo", "status", "SUCCESS", "latencyMs", 12.5));
        publish(TelemetryEvent.DIRECTIVE_COMPLETED, Map.of("capability", "echo", "status", "FAILED"));

        var success = registry.find("mycelium.directives.total").tag("status", "SUCCESS").counter();
        var failed = registry.find("mycelium.directives.total").tag("status", "FAILED").counter();
        var timer = registry.find("mycelium.directive.duration").tag("capability", "echo").timer();

        assertEquals(1.0, success.count());
        assertEquals(1.0, failed.count());
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("breaker transitions, retries and control directives are counted")
    void supervisionCounters() {
        publish(TelemetryEvent.BREAKER_TRANSITION, Map.of("to", "OPEN"));
        publish(TelemetryEvent.RETRY_SCHEDULED, Map.of("capability", "echo"));
        publish(TelemetryEvent.CONTROL_ISSUED, Map.of("action", "REDUCE_CONCURRENCY"));

        assertEquals(1.0, registry.find("mycelium.breaker.transitions").tag("to", "OPEN").counter().count());
        assertEquals(1.0, registry.find("mycelium.supervisor.retries").counter().count());
        assertEquals(1.0, registry.find("mycelium.coordinator.control")
                .tag("action", "REDUCE_CONCURRENCY").counter().count());
    }

    @Test
    @DisplayName("missing tag values are recorded as none")
    void missingTags() {
        publish(TelemetryEvent.ENVELOPE_SENT, Map.of());

        assertNotNull(registry.find("mycelium.envelopes.sent").tag("kind", "none").counter());
    }

    @Test
    @DisplayName("summaries record their success rate")
    void summaries() {
        publish(TelemetryEvent.SUMMARY_EMITTED, Map.of("capability", "echo", "successRate", 0.75));

        var summary = registry.find("mycelium.summary.success_rate").summary();
        assertNotNull(summary);
        assertEquals(0.75, summary.totalAmount(), 1e-9);
    }
}
