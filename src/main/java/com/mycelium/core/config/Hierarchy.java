package com.mycelium.core.config;

import com.mycelium.core.bus.AgentHandle;
import com.mycelium.core.bus.MessageBus;
import com.mycelium.core.client.DirectiveClient;
import com.mycelium.core.events.TelemetryFeed;
import com.mycelium.core.model.AgentState;
import com.mycelium.core.runtime.Agent;
import com.mycelium.core.runtime.AgentRuntime;
import com.mycelium.core.runtime.RuntimeSettings;
import com.mycelium.core.strategic.CoordinatorSettings;
import com.mycelium.core.strategic.GoalDecomposer;
import com.mycelium.core.strategic.StrategicCoordinator;
import com.mycelium.core.supervisor.AgentFactory;
import com.mycelium.core.supervisor.PoolSpec;
import com.mycelium.core.supervisor.SupervisorSettings;
import com.mycelium.core.supervisor.TacticalSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The running tree: one strategic coordinator, one tactical supervisor per domain and
 * the gateway client, registered and started in dependency order.
 */
public class Hierarchy implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Hierarchy.class);

    private final MessageBus bus;
    private final RuntimeSettings runtimeSettings;
    private final StrategicCoordinator coordinator;
    private final Map<String, TacticalSupervisor> supervisors = new LinkedHashMap<>();
    private final DirectiveClient client;
    private final List<AgentRuntime> runtimes = new ArrayList<>();
    private final List<CompletableFuture<AgentState>> startups = new ArrayList<>();
    private boolean started;

    /**
     * @param domains domain name to capability to pool size
     */
    public Hierarchy(MessageBus bus, TelemetryFeed telemetry, RuntimeSettings runtimeSettings,
                     SupervisorSettings supervisorSettings, CoordinatorSettings coordinatorSettings,
                     String coordinatorId, String gatewayId, Map<String, Map<String, Integer>> domains,
                     List<AgentFactory> factories, GoalDecomposer decomposer) {
        this.bus = bus;
        this.runtimeSettings = runtimeSettings;
        this.coordinator = new StrategicCoordinator(coordinatorId, decomposer, coordinatorSettings, telemetry);

        Map<String, AgentFactory> byCapability = new LinkedHashMap<>();
        for (AgentFactory factory : factories) {
            byCapability.put(factory.capability(), factory);
        }
        domains.forEach((domain, pools) -> {
            List<PoolSpec> specs = new ArrayList<>();
            pools.forEach((capability, size) -> {
                AgentFactory factory = byCapability.get(capability);
                if (factory == null) {
                    throw new IllegalArgumentException("Domain " + domain + " declares pool " + capability
                            + " but no AgentFactory provides it; known: " + byCapability.keySet());
                }
                specs.add(new PoolSpec(factory, size));
            });
            String supervisorId = "tactical-" + domain;
            supervisors.put(domain, new TacticalSupervisor(supervisorId, coordinatorId, specs, bus,
                    runtimeSettings, supervisorSettings, telemetry));
        });
        this.client = new DirectiveClient(gatewayId, coordinatorId, bus);
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        AgentHandle coordinatorHandle = bus.register(coordinator.identity(), runtimeSettings.mailboxCapacity());
        for (TacticalSupervisor supervisor : supervisors.values()) {
            launch(supervisor, bus.register(supervisor.identity(), runtimeSettings.mailboxCapacity()));
        }
        launch(coordinator, coordinatorHandle);
        launch(client, bus.register(client.identity(), runtimeSettings.mailboxCapacity()));
        log.info("Hierarchy started: coordinator {}, supervisors {}", coordinator.id(),
                supervisors.values().stream().map(TacticalSupervisor::id).toList());
    }

    private void launch(Agent agent, AgentHandle handle) {
        var runtime = new AgentRuntime(agent, handle, bus, runtimeSettings);
        runtimes.add(runtime);
        startups.add(runtime.start());
    }

    /**
     * Waits until every top-level agent finished initialising.
     *
     * @throws IllegalStateException if one failed or the timeout elapsed
     */
    public void awaitReady(Duration timeout) {
        try {
            CompletableFuture.allOf(startups.toArray(new CompletableFuture[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for hierarchy", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Hierarchy did not become ready: " + e.getMessage(), e);
        }
    }

    public DirectiveClient client() {
        return client;
    }

    public StrategicCoordinator coordinator() {
        return coordinator;
    }

    public Map<String, TacticalSupervisor> supervisors() {
        return supervisors;
    }

    public List<AgentRuntime> runtimes() {
        return List.copyOf(runtimes);
    }

    public MessageBus bus() {
        return bus;
    }

    /**
     * Stops the gateway, then the coordinator, then the supervisors (which stop their
     * children), and unregisters them.
     */
    @Override
    public synchronized void close() {
        if (!started) {
            return;
        }
        started = false;
        for (int i = runtimes.size() - 1; i >= 0; i--) {
            AgentRuntime runtime = runtimes.get(i);
            try {
                runtime.stop(ownerOf(runtime));
                runtime.terminated().get(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted stopping {}", runtime.id());
            } catch (ExecutionException | TimeoutException e) {
                log.warn("Agent {} did not stop cleanly: {}", runtime.id(), e.getMessage());
            }
            bus.unregister(runtime.id());
        }
        runtimes.clear();
        log.info("Hierarchy stopped");
    }

    /** The hierarchy stops supervisors on behalf of the coordinator that owns them. */
    private static String ownerOf(AgentRuntime runtime) {
        String parent = runtime.identity().parentId();
        return parent != null ? parent : AgentRuntime.OWNER;
    }
}
