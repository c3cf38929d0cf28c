package com.mycelium.core.bus;

import com.mycelium.core.events.TelemetryEvent;
import com.mycelium.core.events.TelemetryFeed;
import com.mycelium.core.model.AgentHealth;
import com.mycelium.core.model.AgentIdentity;
import com.mycelium.core.model.AgentState;
import com.mycelium.core.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Capability-indexed directory of registered agents, their mailboxes and their health.
 * <p>
 * Index mutations happen under one lock that is held for the update only. Health values
 * are swapped atomically per agent and only through {@link #updateHealth}.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    /** Identity plus current health, as seen at snapshot time. */
    public record Registration(AgentIdentity identity, AgentHealth health) {}

    static final class Entry {
        final AgentIdentity identity;
        final Mailbox mailbox;
        final AtomicReference<AgentHealth> health;

        Entry(AgentIdentity identity, Mailbox mailbox, AgentHealth health) {
            this.identity = identity;
            this.mailbox = mailbox;
            this.health = new AtomicReference<>(health);
        }
    }

    private final Clock clock;
    private final TelemetryFeed telemetry;
    private final Object lock = new Object();
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Map<String, Set<String>> byCapability = new LinkedHashMap<>();

    public AgentRegistry(Clock clock, TelemetryFeed telemetry) {
        this.clock = clock;
        this.telemetry = telemetry;
    }

    Entry add(AgentIdentity identity, Mailbox mailbox) {
        var entry = new Entry(identity, mailbox, AgentHealth.initial(clock.instant()));
        synchronized (lock) {
            if (entries.containsKey(identity.id())) {
                throw new DuplicateIdentityException(identity.id());
            }
            entries.put(identity.id(), entry);
            for (String capability : identity.capabilities()) {
                byCapability.computeIfAbsent(capability, k -> new LinkedHashSet<>()).add(identity.id());
            }
        }
        log.info("Registered {} agent {} with capabilities {}", identity.tier(), identity.id(),
                identity.capabilities());
        telemetry.publish(TelemetryEvent.of(TelemetryEvent.AGENT_REGISTERED, identity.id(),
                Map.of("tier", identity.tier().name()), clock.instant()));
        return entry;
    }

    Optional<Entry> remove(String id) {
        Entry removed;
        synchronized (lock) {
            removed = entries.remove(id);
            if (removed != null) {
                for (String capability : removed.identity.capabilities()) {
                    Set<String> ids = byCapability.get(capability);
                    if (ids != null) {
                        ids.remove(id);
                        if (ids.isEmpty()) {
                            byCapability.remove(capability);
                        }
                    }
                }
            }
        }
        if (removed != null) {
            log.info("Unregistered agent {}", id);
            telemetry.publish(TelemetryEvent.of(TelemetryEvent.AGENT_UNREGISTERED, id, Map.of(), clock.instant()));
        }
        return Optional.ofNullable(removed);
    }

    Optional<Entry> entry(String id) {
        synchronized (lock) {
            return Optional.ofNullable(entries.get(id));
        }
    }

    /** Agent ids advertising the capability, in registration order. */
    public List<String> findByCapability(String capability) {
        synchronized (lock) {
            Set<String> ids = byCapability.get(capability);
            return ids == null ? List.of() : List.copyOf(ids);
        }
    }

    public List<String> findByTier(Tier tier) {
        synchronized (lock) {
            return entries.values().stream()
                    .filter(e -> e.identity.tier() == tier)
                    .map(e -> e.identity.id())
                    .toList();
        }
    }

    public List<String> childrenOf(String parentId) {
        synchronized (lock) {
            return entries.values().stream()
                    .filter(e -> parentId.equals(e.identity.parentId()))
                    .map(e -> e.identity.id())
                    .toList();
        }
    }

    public Optional<AgentIdentity> identity(String id) {
        return entry(id).map(e -> e.identity);
    }

    public Optional<AgentHealth> health(String id) {
        return entry(id).map(e -> e.health.get());
    }

    public boolean isRegistered(String id) {
        synchronized (lock) {
            return entries.containsKey(id);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public List<Registration> snapshot() {
        List<Entry> copy;
        synchronized (lock) {
            copy = new ArrayList<>(entries.values());
        }
        return copy.stream().map(e -> new Registration(e.identity, e.health.get())).toList();
    }

    /**
     * Replaces the health of a registered agent. Publishes a state-change event when
     * the lifecycle state moves. Ignored when {@code owner} is no longer the agent's
     * mailbox, i.e. the caller belongs to a previous registration of the same id.
     */
    AgentHealth updateHealth(String id, Mailbox owner, UnaryOperator<AgentHealth> change) {
        Entry entry = entry(id).orElse(null);
        if (entry == null || entry.mailbox != owner) {
            return null;
        }
        AgentHealth before = entry.health.get();
        AgentHealth after = entry.health.updateAndGet(change);
        AgentState previous = before.state();
        if (previous != after.state()) {
            telemetry.publish(TelemetryEvent.of(TelemetryEvent.AGENT_STATE_CHANGED, id,
                    Map.of("from", previous.name(), "to", after.state().name()), after.lastHeartbeat()));
        }
        return after;
    }
}
