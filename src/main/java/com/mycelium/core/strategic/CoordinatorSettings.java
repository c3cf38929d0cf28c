package com.mycelium.core.strategic;

import java.time.Duration;
import java.util.Map;

/**
 * Thresholds the coordinator applies to supervisor summaries.
 *
 * @param minSuccessRate    below this a capability is considered failing
 * @param maxAvgLatencyMs   above this a capability is considered overloaded
 * @param maxQueueDepth     above this a capability is considered overloaded
 * @param silenceThreshold  a supervisor that sent nothing for longer is reported silent
 * @param alternates        capability to failover capability
 */
public record CoordinatorSettings(
    double minSuccessRate,
    double maxAvgLatencyMs,
    int maxQueueDepth,
    Duration silenceThreshold,
    Map<String, String> alternates
) {

    public CoordinatorSettings {
        if (minSuccessRate < 0 || minSuccessRate > 1) {
            throw new IllegalArgumentException("minSuccessRate must be within 0..1");
        }
        if (silenceThreshold == null || silenceThreshold.isNegative() || silenceThreshold.isZero()) {
            throw new IllegalArgumentException("silenceThreshold must be positive");
        }
        alternates = alternates == null ? Map.of() : Map.copyOf(alternates);
    }

    public static CoordinatorSettings defaults() {
        return new CoordinatorSettings(0.8, 5_000, 32, Duration.ofSeconds(30), Map.of());
    }
}
