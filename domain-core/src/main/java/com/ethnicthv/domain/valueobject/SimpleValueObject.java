package com.ethnicthv.domain.valueobject;

import java.util.Objects;

/**
 * Value object wrapping exactly one non-null value. Equality and hashing are those of the wrapped value.
 * <p>
 * Subclasses should not declare additional instance fields; the processor warns when they do.
 *
 * @param <T> the concrete value object type
 * @param <V> the wrapped value type
 */
public abstract class SimpleValueObject<T extends SimpleValueObject<T, V>, V> extends ValueObject<T> {
    private final V value;

    protected SimpleValueObject(V value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public V getValue() {
        return value;
    }

    @Override
    protected boolean equalsCore(T other) {
        return value.equals(other.getValue());
    }

    @Override
    protected int hashCodeCore() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
