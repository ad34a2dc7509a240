package com.ethnicthv.domain.event;

/**
 * Handles domain events of one type.
 *
 * @param <E> the event type
 */
@FunctionalInterface
public interface DomainEventHandler<E extends DomainEvent> {

    void handle(E event);
}
