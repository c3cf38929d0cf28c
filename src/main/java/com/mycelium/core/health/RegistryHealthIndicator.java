package com.mycelium.core.health;

import com.mycelium.core.bus.AgentRegistry;
import com.mycelium.core.config.MyceliumProperties;
import com.mycelium.core.model.AgentState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Actuator health indicator for the agent registry.
 * Reports DEGRADED while any live agent is degraded or has a stale heartbeat.
 */
@Component
public class RegistryHealthIndicator implements HealthIndicator {

    private final AgentRegistry registry;
    private final Clock clock;
    private final Duration staleness;

    public RegistryHealthIndicator(AgentRegistry registry, Clock clock,
                                   MyceliumProperties properties) {
        this.registry = registry;
        this.clock = clock;
        this.staleness = Duration.ofMillis(properties.getHealth().getStalenessMs());
    }

    @Override
    public Health health() {
        var snapshot = registry.snapshot();
        if (snapshot.isEmpty()) {
            return Health.unknown().withDetail("reason", "no agents registered").build();
        }

        var builder = Health.up().withDetail("agents", snapshot.size());
        boolean degraded = false;
        var now = clock.instant();
        for (var registration : snapshot) {
            var health = registration.health();
            if (health.state() == AgentState.DEGRADED || health.isStale(now, staleness)) {
                builder.withDetail(registration.identity().id(),
                        health.state() + ", last heartbeat " + health.lastHeartbeat());
                degraded = true;
            }
        }
        return degraded ? builder.status("DEGRADED").build() : builder.build();
    }
}
