package com.mycelium.core.model;

/**
 * Error codes produced by the core. Domain agents may use their own codes.
 */
public enum ErrorCode {
    HANDLER_ERROR,
    TRANSIENT_FAILURE,
    FATAL,
    RETRIES_EXHAUSTED,
    ABANDONED,
    EXPIRED,
    UNSUPPORTED_ACTION,
    CHILD_LOST,
    UNKNOWN_RECIPIENT,
    POOL_EXHAUSTED,
    NO_CAPABLE_SUPERVISOR,
    CIRCUIT_OPEN
}
