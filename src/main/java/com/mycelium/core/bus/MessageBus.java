package com.mycelium.core.bus;

import com.mycelium.core.events.TelemetryEvent;
import com.mycelium.core.events.TelemetryFeed;
import com.mycelium.core.model.AgentIdentity;
import com.mycelium.core.model.Envelope;
import com.mycelium.core.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * In-process delivery of envelopes into agent mailboxes.
 * <p>
 * Delivery is best-effort and local, but never silent: every recipient that does not
 * receive an envelope produces exactly one dead letter and shows up in the returned
 * {@link SendResult}. Ordering is only guaranteed within one mailbox.
 */
public class MessageBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    private final AgentRegistry registry;
    private final DeadLetterStore deadLetters;
    private final TelemetryFeed telemetry;
    private final Clock clock;
    private final int defaultMailboxCapacity;
    private final ScheduledExecutorService timer;

    public MessageBus(AgentRegistry registry, DeadLetterStore deadLetters, TelemetryFeed telemetry,
                      Clock clock, int defaultMailboxCapacity) {
        this.registry = registry;
        this.deadLetters = deadLetters;
        this.telemetry = telemetry;
        this.clock = clock;
        this.defaultMailboxCapacity = defaultMailboxCapacity;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mycelium-bus-timer");
            t.setDaemon(true);
            return t;
        });
    }

    public AgentHandle register(AgentIdentity identity) {
        return register(identity, defaultMailboxCapacity);
    }

    /**
     * Registers an agent and creates its mailbox.
     *
     * @throws DuplicateIdentityException if the id is already registered
     */
    public AgentHandle register(AgentIdentity identity, int mailboxCapacity) {
        var mailbox = new Mailbox(mailboxCapacity);
        registry.add(identity, mailbox);
        return new AgentHandle(identity, mailbox, registry, this, clock);
    }

    /**
     * Removes an agent from every index and dead-letters its pending envelopes as
     * {@code AGENT_REMOVED}. Unknown ids are ignored.
     *
     * @return number of envelopes dead-lettered
     */
    public int unregister(String agentId) {
        return registry.remove(agentId)
                .map(entry -> {
                    List<Envelope> pending = entry.mailbox.close();
                    for (Envelope envelope : pending) {
                        deadLetter(envelope, agentId, DeadLetterReason.AGENT_REMOVED);
                    }
                    return pending.size();
                })
                .orElse(0);
    }

    public List<String> findByCapability(String capability) {
        return registry.findByCapability(capability);
    }

    public AgentRegistry registry() {
        return registry;
    }

    public DeadLetterStore deadLetters() {
        return deadLetters;
    }

    public Clock clock() {
        return clock;
    }

    public SendResult send(Envelope envelope) {
        List<String> delivered = new ArrayList<>();
        Map<String, DeadLetterReason> faults = new LinkedHashMap<>();
        boolean expired = envelope.isExpired(clock.instant());

        for (String recipient : envelope.recipients()) {
            DeadLetterReason fault = expired ? DeadLetterReason.EXPIRED : deliverTo(recipient, envelope);
            if (fault == null) {
                delivered.add(recipient);
            } else {
                faults.put(recipient, fault);
                deadLetter(envelope, recipient, fault);
            }
        }
        return new SendResult(envelope.id(), delivered, faults);
    }

    /**
     * Sends one copy of the envelope, keeping its id, to every agent currently
     * registered with the tier, the sender included when it belongs to the tier. Each
     * copy succeeds or fails on its own.
     */
    public SendResult broadcast(Tier tier, Envelope envelope) {
        List<String> recipients = registry.findByTier(tier);
        if (recipients.isEmpty()) {
            log.debug("Broadcast {} to {} tier found no recipients", envelope.id(), tier);
            return new SendResult(envelope.id(), List.of(), Map.of());
        }
        return send(envelope.withRecipients(recipients));
    }

    /**
     * Sends the envelope after a delay through the normal {@link #send} path, so TTL
     * and recipient checks apply at the time of delivery.
     */
    public ScheduledFuture<?> sendLater(Envelope envelope, Duration delay) {
        return timer.schedule(() -> {
            try {
                send(envelope);
            } catch (RuntimeException e) {
                log.error("Delayed send of {} failed: {}", envelope.id(), e.getMessage(), e);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    void deadLetter(Envelope envelope, String recipientId, DeadLetterReason reason) {
        deadLetters.record(envelope, recipientId, reason);
    }

    private DeadLetterReason deliverTo(String recipient, Envelope envelope) {
        var entry = registry.entry(recipient).orElse(null);
        if (entry == null) {
            return DeadLetterReason.UNKNOWN_RECIPIENT;
        }
        switch (entry.mailbox.offer(envelope)) {
            case ACCEPTED -> {
                log.debug("Delivered {} {} {} -> {} (priority {})", envelope.kind(), envelope.id(),
                        envelope.senderId(), recipient, envelope.priority());
                telemetry.publish(TelemetryEvent.of(TelemetryEvent.ENVELOPE_SENT, recipient,
                        Map.of("kind", envelope.kind().name(), "sender", envelope.senderId()), clock.instant()));
                return null;
            }
            case FULL -> {
                return DeadLetterReason.MAILBOX_FULL;
            }
            default -> {
                return DeadLetterReason.AGENT_STOPPED;
            }
        }
    }

    @Override
    public void close() {
        timer.shutdownNow();
    }
}
