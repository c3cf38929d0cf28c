package com.mycelium.core.supervisor;

/**
 * Who retries a retryable child failure.
 */
public enum RetryOwnership {
    /** The tactical supervisor retries with backoff up to the policy's cap. */
    SUPERVISOR,
    /** The first failure is forwarded to the originator, which decides. */
    ESCALATE
}
