package com.ethnicthv.domain.event;

/**
 * Delivers domain events to their registered {@link DomainEventHandler}s.
 */
public interface DomainEventDispatcher {

    void dispatch(DomainEvent event);

    /**
     * Dispatches each event in iteration order. Stops at the first handler failure.
     */
    default void dispatch(Iterable<? extends DomainEvent> events) {
        if (events == null) return;
        for (DomainEvent event : events) {
            dispatch(event);
        }
    }
}
