package com.ethnicthv.domain.entity;

import com.ethnicthv.domain.event.DomainEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Entity at the root of a consistency boundary. Collects domain events raised by its behavior until
 * the application layer dispatches and clears them.
 *
 * @param <ID> the identifier type
 */
public abstract class AggregateRoot<ID> extends Entity<ID> {
    private final List<DomainEvent> domainEvents = new ArrayList<>();

    protected AggregateRoot(ID id) {
        super(id);
    }

    /**
     * Read-only view of the pending events, in the order they were raised.
     */
    public List<DomainEvent> getDomainEvents() {
        return Collections.unmodifiableList(domainEvents);
    }

    public void clearDomainEvents() {
        domainEvents.clear();
    }

    protected void addDomainEvent(DomainEvent domainEvent) {
        domainEvents.add(Objects.requireNonNull(domainEvent, "domainEvent"));
    }
}
