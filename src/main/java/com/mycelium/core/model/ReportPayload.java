package com.mycelium.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal result of a directive, or the reply to a query.
 *
 * @param status    SUCCESS or FAILED
 * @param data      result data (success only)
 * @param errorCode machine-readable error code (failure only)
 * @param message   human-readable error message (failure only)
 * @param retryable whether retrying the same directive may succeed
 * @param metrics   implementation-chosen metrics, e.g. {@code latencyMs}
 */
public record ReportPayload(
    ReportStatus status,
    Map<String, Object> data,
    String errorCode,
    String message,
    boolean retryable,
    Map<String, Double> metrics
) implements Payload {

    public static final String LATENCY_MS = "latencyMs";

    public ReportPayload {
        if (status == null) {
            throw new IllegalArgumentException("report status is required");
        }
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public static ReportPayload success(Map<String, Object> data) {
        return new ReportPayload(ReportStatus.SUCCESS, data, null, null, false, Map.of());
    }

    public static ReportPayload failed(String errorCode, String message, boolean retryable) {
        return new ReportPayload(ReportStatus.FAILED, Map.of(), errorCode, message, retryable, Map.of());
    }

    public static ReportPayload failed(ErrorCode errorCode, String message, boolean retryable) {
        return failed(errorCode.name(), message, retryable);
    }

    public boolean succeeded() {
        return status == ReportStatus.SUCCESS;
    }

    public ReportPayload withMetric(String name, double value) {
        var merged = new LinkedHashMap<>(metrics);
        merged.put(name, value);
        return new ReportPayload(status, data, errorCode, message, retryable, merged);
    }

    public ReportPayload withData(String key, Object value) {
        var merged = new LinkedHashMap<>(data);
        merged.put(key, value);
        return new ReportPayload(status, merged, errorCode, message, retryable, metrics);
    }

    public Double metric(String name) {
        return metrics.get(name);
    }
}
