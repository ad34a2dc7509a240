package com.ethnicthv.domain.event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DomainEventTest {

    static final class OrderPlaced extends DomainEvent {
        OrderPlaced() {
        }

        OrderPlaced(UUID id, Instant occurredOn) {
            super(id, occurredOn);
        }
    }

    static final class OrderShipped extends DomainEventWithMetadata {
        final String trackingCode;

        OrderShipped(String trackingCode) {
            this.trackingCode = trackingCode;
        }

        OrderShipped(String trackingCode, DomainEventMetadata metadata) {
            super(metadata);
            this.trackingCode = trackingCode;
        }

        @Override
        public OrderShipped withMetadata(DomainEventMetadata metadata) {
            return new OrderShipped(trackingCode, metadata);
        }
    }

    @Test
    @DisplayName("Explicit id and instant are kept")
    void explicitIdentity() {
        UUID id = UUID.randomUUID();
        Instant at = Instant.parse("2024-01-01T12:00:00Z");

        OrderPlaced event = new OrderPlaced(id, at);

        assertEquals(id, event.getId());
        assertEquals(at, event.getOccurredOn());
    }

    @Test
    @DisplayName("Default constructor assigns a fresh id and the current instant")
    void defaults() {
        Instant before = Instant.now();

        OrderPlaced event = new OrderPlaced();

        assertNotNull(event.getId());
        assertNotEquals(new OrderPlaced().getId(), event.getId());
        assertFalse(event.getOccurredOn().isBefore(before));
        assertFalse(event.getOccurredOn().isAfter(Instant.now()));
    }

    @Test
    @DisplayName("Null id or instant is rejected")
    void nullIdentity() {
        assertThrows(NullPointerException.class, () -> new OrderPlaced(null, Instant.now()));
        assertThrows(NullPointerException.class, () -> new OrderPlaced(UUID.randomUUID(), null));
    }

    @Test
    @DisplayName("Event name is the simple class name and appears in toString")
    void eventName() {
        UUID id = UUID.randomUUID();
        OrderPlaced event = new OrderPlaced(id, Instant.parse("2024-01-01T12:00:00Z"));

        assertEquals("OrderPlaced", event.getEventName());
        assertTrue(event.toString().contains("OrderPlaced"), event::toString);
        assertTrue(event.toString().contains(id.toString()), event::toString);
        assertTrue(event.toString().contains("2024-01-01T12:00:00Z"), event::toString);
    }

    @Test
    @DisplayName("Events of different types can share a collection")
    void collections() {
        List<DomainEvent> events = new ArrayList<>();
        OrderPlaced placed = new OrderPlaced();
        OrderShipped shipped = new OrderShipped("TRK-1");

        events.add(placed);
        events.add(shipped);

        assertEquals(2, events.size());
        assertTrue(events.contains(placed));
        assertTrue(events.contains(shipped));
    }

    @Test
    @DisplayName("Metadata supplies the event id and instant")
    void metadataIdentity() {
        DomainEventMetadata metadata = DomainEventMetadata.createWithUser("alice");

        OrderShipped event = new OrderShipped("TRK-1", metadata);

        assertSame(metadata, event.getMetadata());
        assertEquals(metadata.eventId(), event.getId());
        assertEquals(metadata.occurredOn(), event.getOccurredOn());
        assertEquals("alice", event.getUserId());
        assertNull(event.getCorrelationId());
        assertNull(event.getCausationId());
    }

    @Test
    @DisplayName("Default metadata is created when none is given")
    void defaultMetadata() {
        OrderShipped event = new OrderShipped("TRK-1");

        assertEquals(event.getId(), event.getMetadata().eventId());
        assertNull(event.getUserId());
    }

    @Test
    @DisplayName("withMetadata keeps the payload and replaces the tracking data")
    void withMetadata() {
        OrderShipped original = new OrderShipped("TRK-7");
        UUID correlation = UUID.randomUUID();
        DomainEventMetadata next = DomainEventMetadata.createWithCorrelation(correlation, original.getId(), "bob");

        OrderShipped copy = original.withMetadata(next);

        assertEquals("TRK-7", copy.trackingCode);
        assertEquals(next.eventId(), copy.getId());
        assertEquals(correlation, copy.getCorrelationId());
        assertEquals(original.getId(), copy.getCausationId());
        assertEquals("bob", copy.getUserId());
        assertNotEquals(original.getId(), copy.getId());
    }
}
