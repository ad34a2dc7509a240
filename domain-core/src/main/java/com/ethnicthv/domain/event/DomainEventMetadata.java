package com.ethnicthv.domain.event;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Tracking data carried by a {@link DomainEventWithMetadata}.
 * <p>
 * {@code userId}, {@code correlationId} and {@code causationId} are optional and may be {@code null}.
 *
 * @param eventId       unique id of the event
 * @param occurredOn    when the event occurred
 * @param userId        user who triggered the event
 * @param correlationId id shared by related events
 * @param causationId   id of the event that caused this one
 */
public record DomainEventMetadata(UUID eventId, Instant occurredOn, String userId, UUID correlationId, UUID causationId) {

    public DomainEventMetadata {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(occurredOn, "occurredOn");
    }

    public DomainEventMetadata(UUID eventId, Instant occurredOn) {
        this(eventId, occurredOn, null, null, null);
    }

    public static DomainEventMetadata create() {
        return new DomainEventMetadata(UUID.randomUUID(), Instant.now());
    }

    public static DomainEventMetadata createWithUser(String userId) {
        return new DomainEventMetadata(UUID.randomUUID(), Instant.now(), userId, null, null);
    }

    public static DomainEventMetadata createWithCorrelation(UUID correlationId) {
        return createWithCorrelation(correlationId, null, null);
    }

    public static DomainEventMetadata createWithCorrelation(UUID correlationId, UUID causationId, String userId) {
        return new DomainEventMetadata(UUID.randomUUID(), Instant.now(), userId, correlationId, causationId);
    }

    /**
     * Metadata for an event caused by {@code cause}: same correlation and user, causation set to the cause's id.
     * When the cause has no correlation id its own id starts the chain.
     */
    public static DomainEventMetadata causedBy(DomainEventMetadata cause) {
        Objects.requireNonNull(cause, "cause");
        UUID correlation = cause.correlationId != null ? cause.correlationId : cause.eventId;
        return createWithCorrelation(correlation, cause.eventId, cause.userId);
    }

    public Optional<String> findUserId() {
        return Optional.ofNullable(userId);
    }

    public Optional<UUID> findCorrelationId() {
        return Optional.ofNullable(correlationId);
    }

    public Optional<UUID> findCausationId() {
        return Optional.ofNullable(causationId);
    }
}
