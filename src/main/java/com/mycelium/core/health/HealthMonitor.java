package com.mycelium.core.health;

import com.mycelium.core.bus.AgentRegistry;
import com.mycelium.core.bus.MessageBus;
import com.mycelium.core.bus.SendResult;
import com.mycelium.core.model.AgentHealth;
import com.mycelium.core.model.AgentIdentity;
import com.mycelium.core.model.AgentState;
import com.mycelium.core.model.Envelope;
import com.mycelium.core.model.EventPayload;
import com.mycelium.core.model.EventTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically sweeps the registry for agents whose heartbeat is older than the
 * staleness threshold and tells each one's parent with an {@code agent-unhealthy} event.
 * An agent is reported once per staleness episode: a new alert needs a fresh heartbeat
 * in between.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    public static final String SENDER_ID = "health-monitor";
    static final int ALERT_PRIORITY = 8;

    private final MessageBus bus;
    private final Duration staleness;
    private final Duration interval;
    private final Map<String, Instant> alerted = new ConcurrentHashMap<>();
    private ScheduledExecutorService scheduler;

    public HealthMonitor(MessageBus bus, Duration staleness, Duration interval) {
        this.bus = bus;
        this.staleness = staleness;
        this.interval = interval;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mycelium-health-monitor");
            t.setDaemon(true);
            return t;
        });
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::safeTick, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Health monitor started (interval {}, staleness {})", interval, staleness);
    }

    /**
     * Runs one sweep.
     *
     * @return number of alerts sent or logged in this sweep
     */
    public int tick() {
        AgentRegistry registry = bus.registry();
        Instant now = bus.clock().instant();
        Set<String> seen = new HashSet<>();
        int alerts = 0;

        for (AgentRegistry.Registration registration : registry.snapshot()) {
            AgentIdentity identity = registration.identity();
            AgentHealth health = registration.health();
            seen.add(identity.id());

            if (health.state() == AgentState.STOPPED || !health.isStale(now, staleness)) {
                alerted.remove(identity.id());
                continue;
            }
            if (health.lastHeartbeat().equals(alerted.get(identity.id()))) {
                continue;
            }
            alerted.put(identity.id(), health.lastHeartbeat());
            alerts++;
            alert(identity, health, now);
        }
        alerted.keySet().retainAll(seen);
        return alerts;
    }

    private void alert(AgentIdentity identity, AgentHealth health, Instant now) {
        if (identity.parentId() == null) {
            log.warn("Agent {} is stale (last heartbeat {}) and has no parent to notify",
                    identity.id(), health.lastHeartbeat());
            return;
        }
        log.warn("Agent {} is stale (last heartbeat {}), notifying {}",
                identity.id(), health.lastHeartbeat(), identity.parentId());
        Envelope event = Envelope.builder()
                .from(SENDER_ID)
                .to(identity.parentId())
                .event(EventPayload.of(EventTypes.AGENT_UNHEALTHY, Map.of(
                        "agentId", identity.id(),
                        "lastHeartbeat", health.lastHeartbeat().toString(),
                        "state", health.state().name())))
                .priority(ALERT_PRIORITY)
                .createdAt(now)
                .build();
        SendResult result = bus.send(event);
        if (!result.allDelivered()) {
            log.warn("Unhealthy alert for {} not delivered: {}", identity.id(), result.faults());
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Health sweep failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
