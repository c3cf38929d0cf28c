package com.mycelium.core.logging;

import com.mycelium.core.model.AgentIdentity;
import com.mycelium.core.model.Envelope;
import com.mycelium.core.model.EventPayload;
import com.mycelium.core.model.Tier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void setsAndClearsAgentAndEnvelopeKeys() {
        MdcContext.setAgent(AgentIdentity.of("worker", Tier.EXECUTION, "sup", "echo"));
        Envelope envelope = Envelope.builder().id("env-1").from("sup").to("worker")
                .event(EventPayload.of("e", Map.of()))
                .correlationId("corr-1")
                .createdAt(Instant.now())
                .build();
        MdcContext.setEnvelope(envelope);

        assertEquals("worker", MDC.get(MdcContext.AGENT_ID));
        assertEquals("EXECUTION", MDC.get(MdcContext.TIER));
        assertEquals("env-1", MDC.get(MdcContext.ENVELOPE_ID));
        assertEquals("corr-1", MDC.get(MdcContext.CORRELATION_ID));

        MdcContext.clearEnvelope();
        assertNull(MDC.get(MdcContext.ENVELOPE_ID));
        assertEquals("worker", MDC.get(MdcContext.AGENT_ID));

        MdcContext.clear();
        assertNull(MDC.get(MdcContext.AGENT_ID));
    }
}
