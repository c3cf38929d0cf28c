package com.mycelium.core.bus;

import com.mycelium.core.events.TelemetryEvent;
import com.mycelium.core.events.TelemetryFeed;
import com.mycelium.core.model.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps the most recent dead letters and a running count per reason.
 * Counts survive eviction; the retained list does not.
 */
public class DeadLetterStore {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterStore.class);

    private final int retention;
    private final Clock clock;
    private final TelemetryFeed telemetry;
    private final Deque<DeadLetter> recent = new ArrayDeque<>();
    private final Map<DeadLetterReason, AtomicLong> counts = new EnumMap<>(DeadLetterReason.class);

    public DeadLetterStore(int retention, Clock clock, TelemetryFeed telemetry) {
        if (retention < 1) {
            throw new IllegalArgumentException("dead-letter retention must be positive");
        }
        this.retention = retention;
        this.clock = clock;
        this.telemetry = telemetry;
        for (DeadLetterReason reason : DeadLetterReason.values()) {
            counts.put(reason, new AtomicLong());
        }
    }

    public DeadLetter record(Envelope envelope, String recipientId, DeadLetterReason reason) {
        var letter = new DeadLetter(envelope, recipientId, reason, clock.instant());
        synchronized (recent) {
            recent.addLast(letter);
            while (recent.size() > retention) {
                recent.removeFirst();
            }
        }
        counts.get(reason).incrementAndGet();
        log.warn("Dead letter {} -> {} ({}): {} from {}", envelope.id(), recipientId, reason,
                envelope.kind(), envelope.senderId());
        telemetry.publish(TelemetryEvent.of(TelemetryEvent.DEAD_LETTERED, recipientId,
                Map.of("reason", reason.name(), "envelopeId", envelope.id(), "kind", envelope.kind().name()),
                letter.timestamp()));
        return letter;
    }

    /** Retained records, oldest first. */
    public List<DeadLetter> list() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }

    public List<DeadLetter> byReason(DeadLetterReason reason) {
        return list().stream().filter(d -> d.reason() == reason).toList();
    }

    /** Total dead letters recorded for a reason, including evicted ones. */
    public long count(DeadLetterReason reason) {
        return counts.get(reason).get();
    }

    public long count() {
        return counts.values().stream().mapToLong(AtomicLong::get).sum();
    }
}
