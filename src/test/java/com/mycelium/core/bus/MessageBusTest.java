package com.mycelium.core.bus;

import com.mycelium.core.events.TelemetryEvent;
import com.mycelium.core.events.TelemetryFeed;
import com.mycelium.core.model.AgentIdentity;
import com.mycelium.core.model.AgentState;
import com.mycelium.core.model.Envelope;
import com.mycelium.core.model.EventPayload;
import com.mycelium.core.model.Tier;
import com.mycelium.support.MutableClock;
import com.mycelium.support.TestBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link MessageBus}.
 */
class MessageBusTest {

    private MutableClock clock;
    private TelemetryFeed telemetry;
    private MessageBus bus;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T12:00:00Z");
        telemetry = new TelemetryFeed();
        bus = TestBus.create(clock, telemetry, 4);
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private Envelope.Builder event(String... recipients) {
        return Envelope.builder()
                .from("sender")
                .to(List.of(recipients))
                .event(EventPayload.of("ping", Map.of()))
                .createdAt(clock.instant());
    }

    @Nested
    @DisplayName("send")
    class Send {

        @Test
        @DisplayName("delivers to every registered recipient")
        void deliversToAll() throws InterruptedException {
            AgentHandle a = bus.register(AgentIdentity.of("a", Tier.EXECUTION, "sup", "x"));
            AgentHandle b = bus.register(AgentIdentity.of("b", Tier.EXECUTION, "sup", "x"));

            SendResult result = bus.send(event("a", "b").build());

            assertTrue(result.allDelivered());
            assertEquals(List.of("a", "b"), result.delivered());
            assertNotNull(a.poll(Duration.ZERO));
            assertNotNull(b.poll(Duration.ZERO));
        }

        @Test
        @DisplayName("dead-letters unknown recipients without affecting known ones")
        void unknownRecipient() {
            bus.register(AgentIdentity.of("a", Tier.EXECUTION, "sup", "x"));

            SendResult result = bus.send(event("a", "ghost").build());

            assertEquals(List.of("a"), result.delivered());
            assertEquals(Map.of("ghost", DeadLetterReason.UNKNOWN_RECIPIENT), result.faults());
            assertEquals(1, bus.deadLetters().count(DeadLetterReason.UNKNOWN_RECIPIENT));
            RoutingException e = assertThrows(RoutingException.class, result::requireDelivered);
            assertEquals(RoutingFault.UNKNOWN_RECIPIENT, e.getFault());
        }

        @Test
        @DisplayName("an expired envelope is dead-lettered once and never enqueued")
        void expiredEnvelope() throws InterruptedException {
            AgentHandle a = bus.register(AgentIdentity.of("a", Tier.EXECUTION, "sup", "x"));
            Envelope envelope = event("a").ttl(Duration.ofSeconds(1)).build();
            clock.advance(Duration.ofSeconds(2));

            SendResult result = bus.send(envelope);

            assertFalse(result.anyDelivered());
            assertEquals(1, bus.deadLetters().count(DeadLetterReason.EXPIRED));
            assertEquals(1, bus.deadLetters().count());
            assertNull(a.poll(Duration.ZERO));
        }

        @Test
        @DisplayName("a full mailbox yields MAILBOX_FULL")
        void mailboxFull() {
            bus.register(AgentIdentity.of("a", Tier.EXECUTION, "sup", "x"), 1);
            bus.send(event("a").build());

            SendResult result = bus.send(event("a").build());

            assertEquals(DeadLetterReason.MAILBOX_FULL, result.faults().get("a"));
            RoutingException e = assertThrows(RoutingException.class, result::requireDelivered);
            assertEquals(RoutingFault.UNDELIVERABLE, e.getFault());
        }

        @Test
        @DisplayName("a closed mailbox yields AGENT_STOPPED")
        void stoppedAgent() {
            AgentHandle a = bus.register(AgentIdentity.of("a", Tier.EXECUTION, "sup", "x"));
            a.close();

            SendResult result = bus.send(event("a").build());

            assertEquals(DeadLetterReason.AGENT_STOPPED, result.faults().get("a"));
        }

        @Test
        @DisplayName("publishes a telemetry event per delivery")
        void publishesTelemetry() {
            List<TelemetryEvent> seen = new CopyOnWriteArrayList<>();
            telemetry.subscribeAll(seen::add);
            bus.register(AgentIdentity.of("a", Tier.EXECUTION, "sup", "x"));

            bus.send(event("a").build());

            assertTrue(seen.stream().anyMatch(e -> e.eventType().equals(TelemetryEvent.ENVELOPE_SENT)
                    && e.agentId().equals("a")));
        }
    }

    @Nested
    @DisplayName("registration")
    class Registration {

        @Test
        @DisplayName("rejects a second agent with the same id")
        void duplicateId() {
            bus.register(AgentIdentity.of("a", Tier.EXECUTION, "sup", "x"));

            assertThrows(DuplicateIdentityException.class,
                    () -> bus.register(AgentIdentity.of("a", Tier.TACTICAL, null, "y")));
        }

        @Test
        @DisplayName("unregister dead-letters every pending envelope and drops the capability index entry")
        void unregisterDrains() {
            bus.register(AgentIdentity.of("a", Tier.EXECUTION, "sup", "x"));
            bus.register(AgentIdentity.of("b", Tier.EXECUTION, "sup", "x"));
            bus.send(event("a").build());
            bus.send(event("a").build());
            bus.send(event("a").build());

            int drained = bus.unregister("a");

            assertEquals(3, drained);
            assertEquals(3, bus.deadLetters().count(DeadLetterReason.AGENT_REMOVED));
            assertEquals(List.of("b"), bus.findByCapability("x"));
            assertFalse(bus.registry().isRegistered("a"));
            assertEquals(0, bus.unregister("a"));
        }

        @Test
        @DisplayName("capability lookups follow registration order")
        void capabilityOrder() {
            bus.register(AgentIdentity.of("c", Tier.EXECUTION, "sup", "x"));
            bus.register(AgentIdentity.of("a", Tier.EXECUTION, "sup", "x", "y"));
            bus.register(AgentIdentity.of("b", Tier.EXECUTION, "sup", "y"));

            assertEquals(List.of("c", "a"), bus.findByCapability("x"));
            assertEquals(List.of("a", "b"), bus.findByCapability("y"));
            assertTrue(bus.findByCapability("z").isEmpty());
        }

        @Test
        @DisplayName("a handle from a previous registration cannot overwrite health")
        void staleHandleIgnored() {
            AgentHandle old = bus.register(AgentIdentity.of("a", Tier.EXECUTION, "sup", "x"));
            bus.unregister("a");
            AgentHandle fresh = bus.register(AgentIdentity.of("a", Tier.EXECUTION, "sup", "x"));
            fresh.heartbeat(AgentState.RUNNING);

            assertNull(old.heartbeat(AgentState.STOPPED));
            assertEquals(AgentState.RUNNING, bus.registry().health("a").orElseThrow().state());
        }
    }

    @Nested
    @DisplayName("broadcast")
    class Broadcast {

        @Test
        @DisplayName("reaches every agent of the tier, sender included, keeping the envelope id")
        void reachesWholeTier() throws InterruptedException {
            AgentHandle s1 = bus.register(AgentIdentity.of("s1", Tier.TACTICAL, "root", "x"));
            AgentHandle s2 = bus.register(AgentIdentity.of("s2", Tier.TACTICAL, "root", "y"));
            bus.register(AgentIdentity.of("w", Tier.EXECUTION, "s1", "x"));
            Envelope envelope = Envelope.builder()
                    .from("s1")
                    .to("placeholder")
                    .event(EventPayload.of("news", Map.of()))
                    .createdAt(clock.instant())
                    .build();

            SendResult result = bus.broadcast(Tier.TACTICAL, envelope);

            assertEquals(List.of("s1", "s2"), result.delivered());
            assertEquals(envelope.id(), s1.poll(Duration.ZERO).id());
            assertEquals(envelope.id(), s2.poll(Duration.ZERO).id());
        }

        @Test
        @DisplayName("an empty tier is a no-op")
        void emptyTier() {
            Envelope envelope = event("x").build();

            SendResult result = bus.broadcast(Tier.STRATEGIC, envelope);

            assertFalse(result.anyDelivered());
            assertEquals(0, bus.deadLetters().count());
        }
    }

    @Test
    @DisplayName("sendLater delivers through the normal send path")
    void sendLater() throws InterruptedException {
        AgentHandle a = bus.register(AgentIdentity.of("a", Tier.EXECUTION, "sup", "x"));

        bus.sendLater(event("a").build(), Duration.ofMillis(20));

        assertNotNull(a.poll(Duration.ofSeconds(5)));
    }
}
