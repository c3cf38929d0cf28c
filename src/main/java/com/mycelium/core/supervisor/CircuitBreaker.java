package com.mycelium.core.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Per-child circuit breaker.
 * <ul>
 *   <li>CLOSED to OPEN when consecutive failures reach the threshold</li>
 *   <li>OPEN to HALF_OPEN once the open timeout has elapsed, admitting exactly one trial</li>
 *   <li>HALF_OPEN to CLOSED when the trial succeeds, back to OPEN when it fails</li>
 * </ul>
 * Mutated only by the owning supervisor; {@link #state()} may be read from any thread.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(String name, CircuitState from, CircuitState to);
    }

    private final String name;
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final TransitionListener listener;

    private volatile CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant openUntil;
    private boolean trialInFlight;

    public CircuitBreaker(String name, CircuitBreakerSettings settings, Clock clock, TransitionListener listener) {
        this.name = name;
        this.settings = settings;
        this.clock = clock;
        this.listener = listener;
    }

    public CircuitBreaker(String name, CircuitBreakerSettings settings, Clock clock) {
        this(name, settings, clock, (n, from, to) -> { });
    }

    /** Whether {@link #tryAcquire()} would currently succeed. Does not change state. */
    public boolean allowsRequest() {
        return switch (state) {
            case CLOSED -> true;
            case OPEN -> !clock.instant().isBefore(openUntil);
            case HALF_OPEN -> !trialInFlight;
        };
    }

    /**
     * Claims permission for one call. In OPEN with the timeout elapsed this moves to
     * HALF_OPEN and hands out the single trial.
     */
    public boolean tryAcquire() {
        switch (state) {
            case CLOSED:
                return true;
            case OPEN:
                if (clock.instant().isBefore(openUntil)) {
                    return false;
                }
                transition(CircuitState.HALF_OPEN);
                trialInFlight = true;
                return true;
            case HALF_OPEN:
                if (trialInFlight) {
                    return false;
                }
                trialInFlight = true;
                return true;
            default:
                throw new IllegalStateException("Unknown circuit state " + state);
        }
    }

    public void recordSuccess() {
        consecutiveFailures = 0;
        trialInFlight = false;
        if (state != CircuitState.CLOSED) {
            openUntil = null;
            transition(CircuitState.CLOSED);
        }
    }

    public void recordFailure() {
        trialInFlight = false;
        if (state == CircuitState.HALF_OPEN) {
            open();
            return;
        }
        consecutiveFailures++;
        if (state == CircuitState.CLOSED && consecutiveFailures >= settings.failureThreshold()) {
            open();
        }
    }

    /** Gives back a claimed call that never reached the child. */
    public void releaseTrial() {
        trialInFlight = false;
    }

    public CircuitState state() {
        return state;
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    public Instant openUntil() {
        return openUntil;
    }

    private void open() {
        openUntil = clock.instant().plus(settings.openTimeout());
        log.warn("Circuit {} opened after {} consecutive failure(s), retry after {}",
                name, consecutiveFailures, openUntil);
        transition(CircuitState.OPEN);
    }

    private void transition(CircuitState next) {
        CircuitState previous = state;
        state = next;
        if (previous != next) {
            log.debug("Circuit {}: {} -> {}", name, previous, next);
            listener.onTransition(name, previous, next);
        }
    }
}
