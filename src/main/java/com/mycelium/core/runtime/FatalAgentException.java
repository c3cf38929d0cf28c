package com.mycelium.core.runtime;

/**
 * Thrown by a handler when the agent cannot continue at all. The runtime stops the
 * agent and tells its parent.
 */
public class FatalAgentException extends RuntimeException {

    public FatalAgentException(String message) {
        super(message);
    }

    public FatalAgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
