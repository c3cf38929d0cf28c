package com.mycelium.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Liveness snapshot of an agent, owned by the registry.
 *
 * @param lastHeartbeat when the agent last reported in
 * @param state         lifecycle state at that heartbeat
 * @param failureCount  rolling failure count: +1 per failed handler call, -1 per success, floor 0
 */
public record AgentHealth(
    Instant lastHeartbeat,
    AgentState state,
    int failureCount
) {

    public static AgentHealth initial(Instant now) {
        return new AgentHealth(now, AgentState.CREATED, 0);
    }

    public boolean isStale(Instant now, Duration threshold) {
        return Duration.between(lastHeartbeat, now).compareTo(threshold) > 0;
    }

    public AgentHealth heartbeat(Instant now, AgentState newState) {
        return new AgentHealth(now, newState, failureCount);
    }

    public AgentHealth outcome(Instant now, boolean success) {
        int next = success ? Math.max(0, failureCount - 1) : failureCount + 1;
        return new AgentHealth(now, state, next);
    }
}
