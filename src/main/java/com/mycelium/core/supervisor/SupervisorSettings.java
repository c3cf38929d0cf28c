package com.mycelium.core.supervisor;

import java.time.Duration;
import java.util.Map;

/**
 * @param retry          backoff and retry cap for child failures
 * @param breaker        per-child circuit breaker thresholds
 * @param queueDepth     directives a pool may hold while all children are busy
 * @param summaryEvery   child reports per summary
 * @param summaryWindow  a summary is also sent when this much time passed since the last
 * @param maxRestarts    restarts tolerated per child before it is retired
 * @param retryOwnership per-capability override; capabilities not listed use SUPERVISOR
 */
public record SupervisorSettings(
    RetryPolicy retry,
    CircuitBreakerSettings breaker,
    int queueDepth,
    int summaryEvery,
    Duration summaryWindow,
    int maxRestarts,
    Map<String, RetryOwnership> retryOwnership
) {

    public SupervisorSettings {
        if (queueDepth < 0) {
            throw new IllegalArgumentException("queueDepth must not be negative");
        }
        if (summaryEvery < 1) {
            throw new IllegalArgumentException("summaryEvery must be at least 1");
        }
        retryOwnership = retryOwnership == null ? Map.of() : Map.copyOf(retryOwnership);
    }

    public static SupervisorSettings defaults() {
        return new SupervisorSettings(RetryPolicy.defaults(), CircuitBreakerSettings.defaults(),
                64, 20, Duration.ofSeconds(10), 3, Map.of());
    }

    public RetryOwnership ownershipFor(String capability) {
        return retryOwnership.getOrDefault(capability, RetryOwnership.SUPERVISOR);
    }
}
