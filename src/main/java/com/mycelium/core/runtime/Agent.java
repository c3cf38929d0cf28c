package com.mycelium.core.runtime;

import com.mycelium.core.model.Envelope;
import com.mycelium.core.model.ErrorCode;
import com.mycelium.core.model.Payload;
import com.mycelium.core.model.ReportPayload;

/**
 * Behaviour of one agent. Every tier implements this same interface; supervisors differ
 * only in what they do inside the handlers.
 * <p>
 * The runtime calls at most one method at a time, always on the agent's own thread, so
 * implementations need no synchronization for state touched only from handlers.
 * Handlers may block; that only stalls this agent.
 */
public interface Agent {

    /** One-time setup. Throwing stops the agent and notifies its parent. */
    default void onInitialize(AgentContext context) throws Exception {
    }

    /**
     * Handle a directive. Return {@link DirectiveOutcome#completed} with the terminal
     * report, or {@link DirectiveOutcome#deferred} and send it later via
     * {@link AgentContext#report}. Throwing produces a failed report.
     */
    DirectiveOutcome onDirective(Envelope directive, AgentContext context) throws Exception;

    default void onReport(Envelope report, AgentContext context) throws Exception {
    }

    /** Answer a query. The returned payload is sent back as a REPORT. */
    default Payload onQuery(Envelope query, AgentContext context) throws Exception {
        return ReportPayload.failed(ErrorCode.UNSUPPORTED_ACTION,
                "Agent " + context.id() + " does not answer queries", false);
    }

    default void onCoordinate(Envelope proposal, AgentContext context) throws Exception {
    }

    default void onEvent(Envelope event, AgentContext context) throws Exception {
    }

    /** Called roughly once per heartbeat interval, between envelopes. */
    default void onTick(AgentContext context) throws Exception {
    }

    /** Called once on the agent thread after the agent has stopped accepting work. */
    default void onStop(AgentContext context) {
    }
}
