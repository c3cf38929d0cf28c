package com.mycelium.core.supervisor;

import java.time.Duration;

/**
 * Exponential backoff: the n-th retry waits {@code baseDelay * 2^(n-1)}, capped at
 * {@code maxDelay}.
 *
 * @param maxRetries retries allowed after the first attempt
 * @param baseDelay  delay before the first retry
 * @param maxDelay   upper bound for any delay
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least baseDelay");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(200), Duration.ofSeconds(10));
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO);
    }

    public boolean canRetry(int retriesSoFar) {
        return retriesSoFar < maxRetries;
    }

    /**
     * @param retry 1-based retry number
     */
    public Duration delayFor(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry numbers start at 1");
        }
        Duration delay = baseDelay;
        for (int i = 1; i < retry; i++) {
            delay = delay.multipliedBy(2);
            if (delay.compareTo(maxDelay) >= 0) {
                return maxDelay;
            }
        }
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
