package com.mycelium.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TelemetryFeed}.
 */
class TelemetryFeedTest {

    private TelemetryFeed feed;

    @BeforeEach
    void setUp() {
        feed = new TelemetryFeed();
    }

    private TelemetryEvent event(String type, String agentId) {
        return TelemetryEvent.of(type, agentId, Map.of("k", "v"), Instant.now());
    }

    @Nested
    @DisplayName("TelemetryEvent")
    class EventRecord {

        @Test
        @DisplayName("null data becomes an empty map")
        void nullData() {
            var event = new TelemetryEvent(TelemetryEvent.AGENT_REGISTERED, "a", null, Instant.now());
            assertTrue(event.data().isEmpty());
            assertNull(event.value("missing"));
        }
    }

    @Nested
    @DisplayName("subscriptions")
    class Subscriptions {

        @Test
        @DisplayName("per-agent subscribers only see their agent")
        void perAgent() {
            List<TelemetryEvent> received = new ArrayList<>();
            feed.subscribe("a", received::add);

            feed.publish(event(TelemetryEvent.ENVELOPE_SENT, "a"));
            feed.publish(event(TelemetryEvent.ENVELOPE_SENT, "b"));

            assertEquals(1, received.size());
            assertEquals("a", received.get(0).agentId());
        }

        @Test
        @DisplayName("global subscribers see everything")
        void global() {
            List<TelemetryEvent> received = new ArrayList<>();
            feed.subscribeAll(received::add);

            feed.publish(event(TelemetryEvent.ENVELOPE_SENT, "a"));
            feed.publish(event(TelemetryEvent.DEAD_LETTERED, "b"));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<TelemetryEvent> received = new ArrayList<>();
            TelemetryFeed.Subscription subscription = feed.subscribe("a", received::add);

            subscription.unsubscribe();
            feed.publish(event(TelemetryEvent.ENVELOPE_SENT, "a"));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("a failing subscriber does not stop the others")
        void failingSubscriber() {
            List<TelemetryEvent> received = new ArrayList<>();
            feed.subscribeAll(e -> {
                throw new IllegalStateException("boom");
            });
            feed.subscribeAll(received::add);

            feed.publish(event(TelemetryEvent.ENVELOPE_SENT, "a"));

            assertEquals(1, received.size());
        }
    }

    @Test
    @DisplayName("publishing from several threads reaches every subscriber")
    void concurrentPublish() throws InterruptedException {
        int threads = 8;
        CountDownLatch latch = new CountDownLatch(threads);
        feed.subscribeAll(e -> latch.countDown());

        for (int i = 0; i < threads; i++) {
            String agent = "agent-" + i;
            new Thread(() -> feed.publish(event(TelemetryEvent.ENVELOPE_SENT, agent))).start();
        }

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }
}
