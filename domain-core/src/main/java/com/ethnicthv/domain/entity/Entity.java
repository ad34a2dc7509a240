package com.ethnicthv.domain.entity;

import java.util.Objects;

/**
 * Base class for entities: objects with a lifecycle whose equality is their identity.
 * <p>
 * Two entities are equal when they have the same concrete class and the same non-null id.
 * A transient entity (id not yet assigned) is only equal to itself.
 *
 * @param <ID> the identifier type
 */
public abstract class Entity<ID> {
    private final ID id;

    protected Entity(ID id) {
        this.id = id;
    }

    public ID getId() {
        return id;
    }

    public boolean isTransient() {
        return id == null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Entity<?> other = (Entity<?>) obj;
        if (isTransient() || other.isTransient()) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        if (isTransient()) return System.identityHashCode(this);
        return Objects.hash(getClass().getName(), id);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + id;
    }
}
