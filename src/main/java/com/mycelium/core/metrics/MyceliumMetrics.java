package com.mycelium.core.metrics;

import com.mycelium.core.events.TelemetryEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the agent hierarchy. Fed from the
 * {@link com.mycelium.core.events.TelemetryFeed}.
 */
@Service
public class MyceliumMetrics {

    private final MeterRegistry registry;

    public MyceliumMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void onTelemetry(TelemetryEvent event) {
        switch (event.eventType()) {
            case TelemetryEvent.ENVELOPE_SENT -> recordEnvelopeSent(event.value("kind"));
            case TelemetryEvent.DEAD_LETTERED -> recordDeadLetter(event.value("reason"));
            case TelemetryEvent.BREAKER_TRANSITION -> recordBreakerTransition(event.value("to"));
            case TelemetryEvent.RETRY_SCHEDULED -> recordRetry(event.value("capability"));
            case TelemetryEvent.CHILD_RESTARTED -> recordRestart(event.value("supervisorId"));
            case TelemetryEvent.DIRECTIVE_COMPLETED -> recordDirective(event.value("capability"),
                    event.value("status"), event.data().get("latencyMs"));
            case TelemetryEvent.SUMMARY_EMITTED -> recordSummary(event.value("capability"),
                    event.data().get("successRate"));
            case TelemetryEvent.CONTROL_ISSUED -> recordControl(event.value("action"));
            default -> { }
        }
    }

    public void recordEnvelopeSent(String kind) {
        Counter.builder("mycelium.envelopes.sent")
                .tag("kind", tag(kind))
                .register(registry)
                .increment();
    }

    public void recordDeadLetter(String reason) {
        Counter.builder("mycelium.dead_letters")
                .description("Envelopes that could not be delivered")
                .tag("reason", tag(reason))
                .register(registry)
                .increment();
    }

    public void recordBreakerTransition(String toState) {
        Counter.builder("mycelium.breaker.transitions")
                .tag("to", tag(toState))
                .register(registry)
                .increment();
    }

    public void recordRetry(String capability) {
        Counter.builder("mycelium.supervisor.retries")
                .tag("capability", tag(capability))
                .register(registry)
                .increment();
    }

    public void recordRestart(String supervisorId) {
        Counter.builder("mycelium.supervisor.restarts")
                .tag("supervisor", tag(supervisorId))
                .register(registry)
                .increment();
    }

    /**
     * @param latencyMs dispatch-to-report latency, or {@code null} when the directive
     *                  never reached a child
     */
    public void recordDirective(String capability, String status, Object latencyMs) {
        Counter.builder("mycelium.directives.total")
                .tag("capability", tag(capability))
                .tag("status", tag(status))
                .register(registry)
                .increment();
        if (latencyMs instanceof Number ms) {
            Timer.builder("mycelium.directive.duration")
                    .tag("capability", tag(capability))
                    .register(registry)
                    .record(Duration.ofNanos((long) (ms.doubleValue() * 1_000_000)));
        }
    }

    public void recordSummary(String capability, Object successRate) {
        if (successRate instanceof Number rate) {
            DistributionSummary.builder("mycelium.summary.success_rate")
                    .tag("capability", tag(capability))
                    .register(registry)
                    .record(rate.doubleValue());
        }
    }

    public void recordControl(String action) {
        Counter.builder("mycelium.coordinator.control")
                .description("Control directives issued by the coordinator")
                .tag("action", tag(action))
                .register(registry)
                .increment();
    }

    private static String tag(String value) {
        return value != null ? value : "none";
    }
}
