package com.mycelium.core.bus;

import com.mycelium.core.model.AgentHealth;
import com.mycelium.core.model.AgentIdentity;
import com.mycelium.core.model.AgentState;
import com.mycelium.core.model.Envelope;

import java.time.Clock;
import java.time.Duration;

/**
 * What {@link MessageBus#register} hands to the agent that owns a mailbox: the only way
 * to take envelopes out of it and the only way to report health for it.
 */
public class AgentHandle {

    private final AgentIdentity identity;
    private final Mailbox mailbox;
    private final AgentRegistry registry;
    private final MessageBus bus;
    private final Clock clock;

    AgentHandle(AgentIdentity identity, Mailbox mailbox, AgentRegistry registry, MessageBus bus, Clock clock) {
        this.identity = identity;
        this.mailbox = mailbox;
        this.registry = registry;
        this.bus = bus;
        this.clock = clock;
    }

    public AgentIdentity identity() {
        return identity;
    }

    public String id() {
        return identity.id();
    }

    /**
     * @return the next envelope, or {@code null} if none arrived within the timeout or
     *         the mailbox is closed
     */
    public Envelope poll(Duration timeout) throws InterruptedException {
        return mailbox.poll(timeout);
    }

    public boolean isClosed() {
        return mailbox.isClosed();
    }

    public int pending() {
        return mailbox.size();
    }

    public AgentHealth heartbeat(AgentState state) {
        return registry.updateHealth(identity.id(), mailbox, h -> h.heartbeat(clock.instant(), state));
    }

    public AgentHealth reportOutcome(boolean success) {
        return registry.updateHealth(identity.id(), mailbox, h -> h.outcome(clock.instant(), success));
    }

    /** Dead-letters an envelope this agent took from its mailbox but will not handle. */
    public void reject(Envelope envelope, DeadLetterReason reason) {
        bus.deadLetter(envelope, identity.id(), reason);
    }

    /**
     * Closes the mailbox and dead-letters anything still queued as {@code AGENT_STOPPED}.
     *
     * @return number of envelopes dead-lettered
     */
    public int close() {
        var remaining = mailbox.close();
        for (Envelope envelope : remaining) {
            bus.deadLetter(envelope, identity.id(), DeadLetterReason.AGENT_STOPPED);
        }
        return remaining.size();
    }
}
