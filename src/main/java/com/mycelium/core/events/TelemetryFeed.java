package com.mycelium.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for hierarchy telemetry.
 * <p>
 * Supports per-agent subscriptions and global subscriptions that receive all events.
 * Subscribers run on the publishing thread, usually an agent thread, so they must
 * return quickly and never block.
 */
public class TelemetryFeed {

    private static final Logger log = LoggerFactory.getLogger(TelemetryFeed.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<TelemetryEvent>>> agentSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<TelemetryEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(TelemetryEvent event) {
        log.trace("Telemetry {} for {}", event.eventType(), event.agentId());

        if (event.agentId() != null) {
            List<Consumer<TelemetryEvent>> subs = agentSubscribers.get(event.agentId());
            if (subs != null) {
                for (Consumer<TelemetryEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<TelemetryEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events concerning one agent.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String agentId, Consumer<TelemetryEvent> consumer) {
        agentSubscribers.computeIfAbsent(agentId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<TelemetryEvent>> subs = agentSubscribers.get(agentId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<TelemetryEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<TelemetryEvent> subscriber, TelemetryEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Telemetry subscriber failed on {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
