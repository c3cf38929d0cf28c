package com.mycelium.core.config;

import com.mycelium.core.bridge.ActionCatalog;
import com.mycelium.core.bridge.EnvelopeCodec;
import com.mycelium.core.bus.AgentRegistry;
import com.mycelium.core.bus.DeadLetterStore;
import com.mycelium.core.bus.MessageBus;
import com.mycelium.core.events.TelemetryFeed;
import com.mycelium.core.health.HealthMonitor;
import com.mycelium.core.metrics.MyceliumMetrics;
import com.mycelium.core.strategic.GoalDecomposer;
import com.mycelium.core.supervisor.AgentFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
public class HierarchyConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TelemetryFeed telemetryFeed(@Autowired(required = false) MyceliumMetrics metrics) {
        var feed = new TelemetryFeed();
        if (metrics != null) {
            feed.subscribeAll(metrics::onTelemetry);
        }
        return feed;
    }

    @Bean
    public AgentRegistry agentRegistry(Clock clock, TelemetryFeed telemetryFeed) {
        return new AgentRegistry(clock, telemetryFeed);
    }

    @Bean
    public DeadLetterStore deadLetterStore(MyceliumProperties properties, Clock clock, TelemetryFeed telemetryFeed) {
        return new DeadLetterStore(properties.getBus().getDeadLetterRetention(), clock, telemetryFeed);
    }

    @Bean(destroyMethod = "close")
    public MessageBus messageBus(AgentRegistry registry, DeadLetterStore deadLetters, TelemetryFeed telemetryFeed,
                                 Clock clock, MyceliumProperties properties) {
        return new MessageBus(registry, deadLetters, telemetryFeed, clock, properties.getBus().getMailboxCapacity());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public HealthMonitor healthMonitor(MessageBus bus, MyceliumProperties properties) {
        return new HealthMonitor(bus,
                Duration.ofMillis(properties.getHealth().getStalenessMs()),
                Duration.ofMillis(properties.getHealth().getIntervalMs()));
    }

    @Bean
    public ActionCatalog actionCatalog(List<AgentFactory> factories) {
        return new ActionCatalog(factories.stream().flatMap(f -> f.actions().stream()).toList());
    }

    @Bean
    public EnvelopeCodec envelopeCodec(ActionCatalog actionCatalog) {
        return new EnvelopeCodec(actionCatalog);
    }

    @Bean
    @ConditionalOnMissingBean
    public GoalDecomposer goalDecomposer() {
        return GoalDecomposer.explicitSteps();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public Hierarchy hierarchy(MessageBus bus, TelemetryFeed telemetryFeed, MyceliumProperties properties,
                               List<AgentFactory> factories, GoalDecomposer goalDecomposer) {
        Map<String, Map<String, Integer>> domains = new LinkedHashMap<>();
        properties.getDomains().forEach((name, domain) -> domains.put(name, domain.getPools()));
        return new Hierarchy(bus, telemetryFeed,
                properties.toRuntimeSettings(),
                properties.toSupervisorSettings(),
                properties.toCoordinatorSettings(),
                properties.getStrategic().getId(),
                properties.getGatewayId(),
                domains,
                factories,
                goalDecomposer);
    }
}
