package com.mycelium.core.config;

import com.mycelium.agents.EchoAction;
import com.mycelium.agents.EchoAgentFactory;
import com.mycelium.core.bridge.ActionCatalog;
import com.mycelium.core.bus.MessageBus;
import com.mycelium.core.events.TelemetryFeed;
import com.mycelium.core.health.HealthMonitor;
import com.mycelium.core.metrics.MyceliumMetrics;
import com.mycelium.core.model.DirectivePayload;
import com.mycelium.core.model.ReportPayload;
import com.mycelium.core.supervisor.AgentFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Calls the bean methods in dependency order, the way the application context does.
 */
class HierarchyConfigTest {

    private final HierarchyConfig config = new HierarchyConfig();

    @Test
    void wiresWorkingHierarchyFromProperties() throws Exception {
        var properties = new MyceliumProperties();
        var domain = new MyceliumProperties.Domain();
        domain.setPools(Map.of("echo", 1));
        properties.setDomains(Map.of("echo", domain));
        List<AgentFactory> factories = List.of(new EchoAgentFactory());

        var meters = new SimpleMeterRegistry();
        Clock clock = config.clock();
        TelemetryFeed telemetry = config.telemetryFeed(new MyceliumMetrics(meters));
        MessageBus bus = config.messageBus(config.agentRegistry(clock, telemetry),
                config.deadLetterStore(properties, clock, telemetry), telemetry, clock, properties);
        HealthMonitor monitor = config.healthMonitor(bus, properties);
        Hierarchy hierarchy = config.hierarchy(bus, telemetry, properties, factories, config.goalDecomposer());
        monitor.start();
        hierarchy.start();
        try {
            hierarchy.awaitReady(Duration.ofSeconds(5));
            ReportPayload report = hierarchy.client()
                    .submit(DirectivePayload.of(EchoAction.ECHO, Map.of("text", "wired")))
                    .result().get(5, TimeUnit.SECONDS);

            assertEquals("wired", report.data().get("text"));
            assertTrue(bus.registry().isRegistered("tactical-echo"));
            assertTrue(meters.find("mycelium.envelopes.sent").counters().stream()
                    .mapToDouble(c -> c.count()).sum() > 0);
        } finally {
            hierarchy.close();
            monitor.close();
            bus.close();
        }
    }

    @Test
    void actionCatalogCoversFactoriesAndControl() {
        ActionCatalog catalog = config.actionCatalog(List.of(new EchoAgentFactory()));

        assertEquals(EchoAction.REVERSE, catalog.resolve("echo:REVERSE"));
        assertTrue(catalog.contains("control:PREFER_ALTERNATE"));
        assertThrows(IllegalArgumentException.class, () -> catalog.resolve("echo:SHOUT"));
    }
}
