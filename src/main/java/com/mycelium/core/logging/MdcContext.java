package com.mycelium.core.logging;

import com.mycelium.core.model.AgentIdentity;
import com.mycelium.core.model.Envelope;
import org.slf4j.MDC;

/**
 * Utility for managing Mycelium-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String AGENT_ID = "agentId";
    public static final String TIER = "tier";
    public static final String ENVELOPE_ID = "envelopeId";
    public static final String CORRELATION_ID = "correlationId";

    private MdcContext() {}

    public static void setAgent(AgentIdentity identity) {
        MDC.put(AGENT_ID, identity.id());
        MDC.put(TIER, identity.tier().name());
    }

    public static void setEnvelope(Envelope envelope) {
        MDC.put(ENVELOPE_ID, envelope.id());
        MDC.put(CORRELATION_ID, envelope.correlationKey());
    }

    public static void clearEnvelope() {
        MDC.remove(ENVELOPE_ID);
        MDC.remove(CORRELATION_ID);
    }

    public static void clear() {
        MDC.remove(AGENT_ID);
        MDC.remove(TIER);
        clearEnvelope();
    }
}
