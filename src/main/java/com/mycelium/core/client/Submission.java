package com.mycelium.core.client;

import com.mycelium.core.model.ReportPayload;

import java.util.concurrent.CompletableFuture;

/**
 * A submitted directive: its correlation id and the future of its terminal report.
 */
public record Submission(String correlationId, CompletableFuture<ReportPayload> result) {
}
