package com.ethnicthv.domain.event;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Something that happened in the domain. Each event has a unique id and the instant it occurred.
 */
public abstract class DomainEvent {
    private final UUID id;
    private final Instant occurredOn;

    protected DomainEvent() {
        this(UUID.randomUUID(), Instant.now());
    }

    protected DomainEvent(UUID id, Instant occurredOn) {
        this.id = Objects.requireNonNull(id, "id");
        this.occurredOn = Objects.requireNonNull(occurredOn, "occurredOn");
    }

    public UUID getId() {
        return id;
    }

    public Instant getOccurredOn() {
        return occurredOn;
    }

    /**
     * Name used when publishing the event; defaults to the simple class name.
     */
    public String getEventName() {
        return getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return getEventName() + "[" + id + " @ " + occurredOn + "]";
    }
}
