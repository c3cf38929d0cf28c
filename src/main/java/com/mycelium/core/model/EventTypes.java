package com.mycelium.core.model;

/**
 * Event names emitted by the core itself.
 */
public final class EventTypes {

    /** Health monitor to parent: child heartbeat is stale. */
    public static final String AGENT_UNHEALTHY = "agent-unhealthy";
    /** Runtime to parent: child stopped on a fatal handler error. */
    public static final String AGENT_FATAL = "agent-fatal";
    /** Runtime to parent: child failed its one-time setup. */
    public static final String AGENT_INIT_FAILED = "agent-init-failed";
    /** Supervisor to parent: a child was removed from its pool for good. */
    public static final String CAPACITY_REDUCED = "capacity-reduced";
    /** Coordinator to all supervisors: a supervisor stopped reporting. */
    public static final String SUPERVISOR_SILENT = "supervisor-silent";
    /** Anyone to a supervisor: stop working on a correlation id. */
    public static final String ABANDON = "abandon";
    /** Supervisor to itself: a backoff delay elapsed. */
    public static final String RETRY_DUE = "retry-due";

    private EventTypes() {}
}
