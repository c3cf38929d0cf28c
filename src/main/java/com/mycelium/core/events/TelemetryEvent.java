package com.mycelium.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * Observability event published on the {@link TelemetryFeed}. Not an envelope: nothing
 * here is routed to agents.
 *
 * @param eventType one of the constants below
 * @param agentId   agent the event concerns
 * @param data      event-specific attributes
 * @param timestamp when it happened
 */
public record TelemetryEvent(
    String eventType,
    String agentId,
    Map<String, Object> data,
    Instant timestamp
) {

    public static final String AGENT_REGISTERED = "agent.registered";
    public static final String AGENT_UNREGISTERED = "agent.unregistered";
    public static final String AGENT_STATE_CHANGED = "agent.state_changed";
    public static final String ENVELOPE_SENT = "envelope.sent";
    public static final String DEAD_LETTERED = "envelope.dead_lettered";
    public static final String BREAKER_TRANSITION = "breaker.transition";
    public static final String RETRY_SCHEDULED = "supervisor.retry";
    public static final String CHILD_RESTARTED = "supervisor.restart";
    public static final String DIRECTIVE_COMPLETED = "directive.completed";
    public static final String SUMMARY_EMITTED = "supervisor.summary";
    public static final String CONTROL_ISSUED = "coordinator.control";

    public TelemetryEvent {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static TelemetryEvent of(String eventType, String agentId, Map<String, Object> data, Instant timestamp) {
        return new TelemetryEvent(eventType, agentId, data, timestamp);
    }

    public String value(String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }
}
