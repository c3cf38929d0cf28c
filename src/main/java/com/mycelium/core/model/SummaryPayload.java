package com.mycelium.core.model;

import java.time.Instant;

/**
 * Aggregated report a tactical supervisor sends to its parent instead of forwarding
 * every child report.
 *
 * @param supervisorId  reporting supervisor
 * @param capability    pool capability the window covers
 * @param count         child reports in the window
 * @param successes     successful reports in the window
 * @param failures      failed reports in the window
 * @param successRate   successes / count, or 1.0 for an empty window
 * @param avgLatencyMs  mean dispatch-to-report latency
 * @param queueDepth    directives waiting for a free child at window end
 * @param busy          children busy at window end
 * @param poolSize      children in the pool at window end
 * @param windowEnd     when the window was closed
 */
public record SummaryPayload(
    String supervisorId,
    String capability,
    int count,
    int successes,
    int failures,
    double successRate,
    double avgLatencyMs,
    int queueDepth,
    int busy,
    int poolSize,
    Instant windowEnd
) implements Payload {
}
