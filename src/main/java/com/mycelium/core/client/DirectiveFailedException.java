package com.mycelium.core.client;

/**
 * Completes a submission future when the directive ended in a failed report.
 */
public class DirectiveFailedException extends RuntimeException {

    private final String correlationId;
    private final String errorCode;
    private final boolean retryable;

    public DirectiveFailedException(String correlationId, String errorCode, String message, boolean retryable) {
        super(errorCode + ": " + message);
        this.correlationId = correlationId;
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
