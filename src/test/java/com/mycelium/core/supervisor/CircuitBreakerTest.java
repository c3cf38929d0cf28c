package com.mycelium.core.supervisor;

import com.mycelium.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {

    private MutableClock clock;
    private List<String> transitions;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        transitions = new ArrayList<>();
        breaker = new CircuitBreaker("worker-1", new CircuitBreakerSettings(3, Duration.ofSeconds(10)), clock,
                (name, from, to) -> transitions.add(from + "->" + to));
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            assertTrue(breaker.tryAcquire());
            breaker.recordFailure();
        }
    }

    @Test
    @DisplayName("opens once consecutive failures reach the threshold")
    void opensAtThreshold() {
        fail(2);
        assertEquals(CircuitState.CLOSED, breaker.state());

        fail(1);

        assertEquals(CircuitState.OPEN, breaker.state());
        assertFalse(breaker.allowsRequest());
        assertFalse(breaker.tryAcquire());
        assertEquals(clock.instant().plusSeconds(10), breaker.openUntil());
        assertEquals(List.of("CLOSED->OPEN"), transitions);
    }

    @Test
    @DisplayName("a success resets the consecutive failure count")
    void successResets() {
        fail(2);
        breaker.recordSuccess();
        fail(2);

        assertEquals(CircuitState.CLOSED, breaker.state());
        assertEquals(2, breaker.consecutiveFailures());
    }

    @Test
    @DisplayName("admits exactly one trial after the open timeout")
    void singleHalfOpenTrial() {
        fail(3);
        clock.advance(Duration.ofSeconds(10));

        assertTrue(breaker.allowsRequest());
        assertTrue(breaker.tryAcquire());
        assertEquals(CircuitState.HALF_OPEN, breaker.state());
        assertFalse(breaker.allowsRequest());
        assertFalse(breaker.tryAcquire());
    }

    @Test
    @DisplayName("a successful trial closes the circuit")
    void trialSuccessCloses() {
        fail(3);
        clock.advance(Duration.ofSeconds(11));
        breaker.tryAcquire();

        breaker.recordSuccess();

        assertEquals(CircuitState.CLOSED, breaker.state());
        assertNull(breaker.openUntil());
        assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), transitions);
    }

    @Test
    @DisplayName("a failed trial reopens for a fresh timeout")
    void trialFailureReopens() {
        fail(3);
        clock.advance(Duration.ofSeconds(10));
        breaker.tryAcquire();

        breaker.recordFailure();

        assertEquals(CircuitState.OPEN, breaker.state());
        assertEquals(clock.instant().plusSeconds(10), breaker.openUntil());
        assertFalse(breaker.tryAcquire());
    }
}
