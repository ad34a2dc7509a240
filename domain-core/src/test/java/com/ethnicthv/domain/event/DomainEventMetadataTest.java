package com.ethnicthv.domain.event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DomainEventMetadataTest {

    @Test
    @DisplayName("create assigns a fresh id and leaves tracking fields empty")
    void create() {
        Instant before = Instant.now();

        DomainEventMetadata metadata = DomainEventMetadata.create();

        assertNotNull(metadata.eventId());
        assertNotEquals(DomainEventMetadata.create().eventId(), metadata.eventId());
        assertFalse(metadata.occurredOn().isBefore(before));
        assertNull(metadata.userId());
        assertNull(metadata.correlationId());
        assertNull(metadata.causationId());
        assertEquals(Optional.empty(), metadata.findUserId());
    }

    @Test
    @DisplayName("createWithUser records the user")
    void withUser() {
        DomainEventMetadata metadata = DomainEventMetadata.createWithUser("alice");

        assertEquals("alice", metadata.userId());
        assertEquals(Optional.of("alice"), metadata.findUserId());
        assertTrue(metadata.findCorrelationId().isEmpty());
    }

    @Test
    @DisplayName("createWithCorrelation records correlation, causation and user")
    void withCorrelation() {
        UUID correlation = UUID.randomUUID();
        UUID causation = UUID.randomUUID();

        DomainEventMetadata full = DomainEventMetadata.createWithCorrelation(correlation, causation, "bob");
        DomainEventMetadata bare = DomainEventMetadata.createWithCorrelation(correlation);

        assertEquals(correlation, full.correlationId());
        assertEquals(causation, full.causationId());
        assertEquals("bob", full.userId());
        assertEquals(correlation, bare.correlationId());
        assertNull(bare.causationId());
        assertNull(bare.userId());
    }

    @Test
    @DisplayName("causedBy chains correlation and causation")
    void causedBy() {
        DomainEventMetadata root = DomainEventMetadata.createWithUser("carol");
        DomainEventMetadata child = DomainEventMetadata.causedBy(root);
        DomainEventMetadata grandChild = DomainEventMetadata.causedBy(child);

        assertEquals(root.eventId(), child.correlationId());
        assertEquals(root.eventId(), child.causationId());
        assertEquals("carol", child.userId());
        assertEquals(root.eventId(), grandChild.correlationId());
        assertEquals(child.eventId(), grandChild.causationId());
    }

    @Test
    @DisplayName("Metadata with the same values is equal")
    void equality() {
        UUID id = UUID.randomUUID();
        Instant at = Instant.parse("2024-01-01T12:00:00Z");

        assertEquals(new DomainEventMetadata(id, at), new DomainEventMetadata(id, at, null, null, null));
        assertEquals(new DomainEventMetadata(id, at).hashCode(), new DomainEventMetadata(id, at).hashCode());
        assertNotEquals(new DomainEventMetadata(id, at), new DomainEventMetadata(id, at.plusSeconds(1)));
        assertNotEquals(new DomainEventMetadata(id, at), new DomainEventMetadata(UUID.randomUUID(), at));
    }

    @Test
    @DisplayName("Event id and instant are required")
    void requiredFields() {
        assertThrows(NullPointerException.class, () -> new DomainEventMetadata(null, Instant.now()));
        assertThrows(NullPointerException.class, () -> new DomainEventMetadata(UUID.randomUUID(), null));
    }
}
