package com.mycelium.core.supervisor;

import com.mycelium.core.model.SummaryPayload;

import java.time.Duration;
import java.time.Instant;

/**
 * Folds child reports of one pool into periodic {@link SummaryPayload}s. A window
 * closes after {@code every} reports or once {@code window} has elapsed, whichever
 * comes first; an empty window still yields a summary.
 */
public class ReportAggregator {

    private final String supervisorId;
    private final String capability;
    private final int every;
    private final Duration window;

    private Instant windowStart;
    private int count;
    private int successes;
    private double totalLatencyMs;

    public ReportAggregator(String supervisorId, String capability, int every, Duration window, Instant start) {
        this.supervisorId = supervisorId;
        this.capability = capability;
        this.every = every;
        this.window = window;
        this.windowStart = start;
    }

    /**
     * @return true when the window reached its report count and should be closed
     */
    public boolean record(boolean success, double latencyMs) {
        count++;
        if (success) {
            successes++;
        }
        totalLatencyMs += latencyMs;
        return count >= every;
    }

    public boolean windowElapsed(Instant now) {
        return !now.isBefore(windowStart.plus(window));
    }

    public SummaryPayload close(Instant now, int queueDepth, int busy, int poolSize) {
        double successRate = count == 0 ? 1.0 : (double) successes / count;
        double avgLatency = count == 0 ? 0.0 : totalLatencyMs / count;
        var summary = new SummaryPayload(supervisorId, capability, count, successes, count - successes,
                successRate, avgLatency, queueDepth, busy, poolSize, now);
        windowStart = now;
        count = 0;
        successes = 0;
        totalLatencyMs = 0;
        return summary;
    }

    public int pending() {
        return count;
    }
}
