package com.mycelium.core.supervisor;

import java.util.Map;

public record PoolSnapshot(
    String capability,
    int size,
    int maxSize,
    int busy,
    int peakBusy,
    int queued,
    int concurrencyLimit,
    Map<String, CircuitState> breakers
) {
}
