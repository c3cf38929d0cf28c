package com.mycelium.core.supervisor;

import java.time.Duration;

/**
 * @param failureThreshold consecutive failures that open the circuit
 * @param openTimeout      how long the circuit stays open before one trial call is allowed
 */
public record CircuitBreakerSettings(int failureThreshold, Duration openTimeout) {

    public CircuitBreakerSettings {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (openTimeout == null || openTimeout.isNegative()) {
            throw new IllegalArgumentException("openTimeout must not be negative");
        }
    }

    public static CircuitBreakerSettings defaults() {
        return new CircuitBreakerSettings(5, Duration.ofSeconds(30));
    }
}
