package com.mycelium.core.runtime;

/**
 * Thrown by a handler for failures that may go away on their own (timeouts, rate
 * limits, a dependency restarting). Failed reports produced from it are retryable.
 */
public class TransientAgentException extends RuntimeException {

    public TransientAgentException(String message) {
        super(message);
    }

    public TransientAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
