package com.ethnicthv.domain.event;

import java.util.Objects;
import java.util.UUID;

/**
 * Domain event that carries {@link DomainEventMetadata}. The event id and instant are taken from the metadata.
 */
public abstract class DomainEventWithMetadata extends DomainEvent {
    private final DomainEventMetadata metadata;

    protected DomainEventWithMetadata() {
        this(DomainEventMetadata.create());
    }

    protected DomainEventWithMetadata(DomainEventMetadata metadata) {
        super(Objects.requireNonNull(metadata, "metadata").eventId(), metadata.occurredOn());
        this.metadata = metadata;
    }

    public DomainEventMetadata getMetadata() {
        return metadata;
    }

    public String getUserId() {
        return metadata.userId();
    }

    public UUID getCorrelationId() {
        return metadata.correlationId();
    }

    public UUID getCausationId() {
        return metadata.causationId();
    }

    /**
     * Copy of this event with the same payload and the given metadata.
     */
    public abstract DomainEventWithMetadata withMetadata(DomainEventMetadata metadata);
}
