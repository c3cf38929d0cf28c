package com.mycelium.core.health;

import com.mycelium.core.bus.AgentRegistry;
import com.mycelium.core.bus.DeadLetterReason;
import com.mycelium.core.bus.DeadLetterStore;
import com.mycelium.core.config.Hierarchy;
import com.mycelium.core.model.AgentState;
import com.mycelium.core.supervisor.CircuitState;
import com.mycelium.core.supervisor.PoolSnapshot;
import com.mycelium.core.supervisor.TacticalSupervisor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Component-level health of the hierarchy, used by the {@code health} CLI command.
 */
@Service
public class HealthCheckService {

    private final AgentRegistry registry;
    private final DeadLetterStore deadLetters;
    private final Hierarchy hierarchy;

    public HealthCheckService(
            AgentRegistry registry,
            DeadLetterStore deadLetters,
            @Autowired(required = false) Hierarchy hierarchy) {
        this.registry = registry;
        this.deadLetters = deadLetters;
        this.hierarchy = hierarchy;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkAgents());
        results.add(checkPools());
        results.add(checkDeadLetters());
        return results;
    }

    HealthStatus checkAgents() {
        var byState = new EnumMap<AgentState, Integer>(AgentState.class);
        for (AgentRegistry.Registration registration : registry.snapshot()) {
            byState.merge(registration.health().state(), 1, Integer::sum);
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        byState.forEach((state, count) -> metadata.put(state.name(), String.valueOf(count)));

        if (byState.isEmpty()) {
            return new HealthStatus("agents", HealthStatus.Status.DOWN, "No agents registered", metadata);
        }
        int degraded = byState.getOrDefault(AgentState.DEGRADED, 0);
        int stopped = byState.getOrDefault(AgentState.STOPPED, 0);
        if (degraded > 0 || stopped > 0) {
            return new HealthStatus("agents", HealthStatus.Status.DEGRADED,
                    degraded + " degraded, " + stopped + " stopped of " + registry.size(), metadata);
        }
        return new HealthStatus("agents", HealthStatus.Status.UP,
                registry.size() + " agent(s) registered", metadata);
    }

    HealthStatus checkPools() {
        if (hierarchy == null) {
            return new HealthStatus("pools", HealthStatus.Status.DOWN, "Hierarchy not available", Map.of());
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        int openCircuits = 0;
        int shrunk = 0;
        for (TacticalSupervisor supervisor : hierarchy.supervisors().values()) {
            for (PoolSnapshot pool : supervisor.poolSnapshots()) {
                long open = pool.breakers().values().stream().filter(s -> s == CircuitState.OPEN).count();
                openCircuits += (int) open;
                if (pool.size() < pool.maxSize()) {
                    shrunk++;
                }
                metadata.put(supervisor.id() + "/" + pool.capability(),
                        pool.size() + "/" + pool.maxSize() + " children, " + pool.busy() + " busy, "
                                + pool.queued() + " queued, " + open + " open");
            }
        }
        if (openCircuits > 0 || shrunk > 0) {
            return new HealthStatus("pools", HealthStatus.Status.DEGRADED,
                    openCircuits + " open circuit(s), " + shrunk + " pool(s) below size", metadata);
        }
        return new HealthStatus("pools", HealthStatus.Status.UP, "All pools at full strength", metadata);
    }

    HealthStatus checkDeadLetters() {
        Map<String, String> metadata = new LinkedHashMap<>();
        for (DeadLetterReason reason : DeadLetterReason.values()) {
            long count = deadLetters.count(reason);
            if (count > 0) {
                metadata.put(reason.name(), String.valueOf(count));
            }
        }
        return new HealthStatus("dead-letters", HealthStatus.Status.UP,
                deadLetters.count() + " dead letter(s) recorded", metadata);
    }
}
