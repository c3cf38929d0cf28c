package com.mycelium.core.runtime;

import com.mycelium.core.bus.AgentRegistry;
import com.mycelium.core.bus.DeadLetterReason;
import com.mycelium.core.bus.MessageBus;
import com.mycelium.core.bus.SendResult;
import com.mycelium.core.model.AgentIdentity;
import com.mycelium.core.model.Envelope;
import com.mycelium.core.model.EventPayload;
import com.mycelium.core.model.MessageKind;
import com.mycelium.core.model.Payload;
import com.mycelium.core.model.ReportPayload;
import com.mycelium.core.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.function.BooleanSupplier;

/**
 * An agent's outlet to the rest of the hierarchy. Everything an agent sends goes
 * through here, stamped with its id and the current time. Once the agent is stopping,
 * outgoing envelopes are dead-lettered instead of sent.
 */
public class AgentContext {

    private static final Logger log = LoggerFactory.getLogger(AgentContext.class);

    private final AgentIdentity identity;
    private final MessageBus bus;
    private final BooleanSupplier stopping;

    public AgentContext(AgentIdentity identity, MessageBus bus, BooleanSupplier stopping) {
        this.identity = identity;
        this.bus = bus;
        this.stopping = stopping;
    }

    public AgentIdentity identity() {
        return identity;
    }

    public String id() {
        return identity.id();
    }

    public Clock clock() {
        return bus.clock();
    }

    public Instant now() {
        return bus.clock().instant();
    }

    public AgentRegistry registry() {
        return bus.registry();
    }

    public List<String> findByCapability(String capability) {
        return bus.findByCapability(capability);
    }

    /** Builder stamped with this agent as sender and the current time. */
    public Envelope.Builder envelope() {
        return Envelope.builder().from(identity.id()).createdAt(now());
    }

    public SendResult send(Envelope envelope) {
        if (stopping.getAsBoolean()) {
            log.debug("Agent {} is stopping, dropping outgoing {}", identity.id(), envelope.id());
            for (String recipient : envelope.recipients()) {
                bus.deadLetters().record(envelope, recipient, DeadLetterReason.AGENT_STOPPED);
            }
            return new SendResult(envelope.id(), List.of(), Map.of());
        }
        return bus.send(envelope);
    }

    public ScheduledFuture<?> sendLater(Envelope envelope, Duration delay) {
        return bus.sendLater(envelope, delay);
    }

    public SendResult broadcast(Tier tier, Envelope envelope) {
        return bus.broadcast(tier, envelope);
    }

    /**
     * Sends the terminal report for {@code cause} back to its sender, carrying the
     * cause's correlation key and priority.
     */
    public SendResult report(Envelope cause, ReportPayload report) {
        return reply(cause, report);
    }

    /** Sends a REPORT-kind reply to {@code cause}'s sender. */
    public SendResult reply(Envelope cause, Payload payload) {
        Envelope response = envelope()
                .to(cause.senderId())
                .kind(MessageKind.REPORT)
                .payload(payload)
                .priority(cause.priority())
                .correlationId(cause.correlationKey())
                .build();
        return send(response);
    }

    public SendResult emit(String recipientId, EventPayload event) {
        return send(envelope().to(recipientId).event(event).build());
    }

    /**
     * Sends an event to this agent's parent. Agents without a parent only log it.
     */
    public SendResult emitToParent(EventPayload event) {
        if (identity.parentId() == null) {
            log.info("Agent {} has no parent for event {}", identity.id(), event.eventType());
            return new SendResult("none", List.of(), Map.of());
        }
        return emit(identity.parentId(), event);
    }
}
