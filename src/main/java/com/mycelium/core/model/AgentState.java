package com.mycelium.core.model;

/**
 * Lifecycle state of an agent runtime.
 * <p>
 * {@code CREATED -> INITIALIZING -> RUNNING <-> DEGRADED -> STOPPED}. STOPPED is terminal.
 */
public enum AgentState {
    CREATED,
    INITIALIZING,
    RUNNING,
    DEGRADED,  // still draining the mailbox, last handler call failed
    STOPPED;

    public boolean isLive() {
        return this == RUNNING || this == DEGRADED;
    }
}
