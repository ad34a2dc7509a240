package com.ethnicthv.domain.valueobject;

/**
 * Base class for value objects: immutable objects compared by value rather than identity.
 * <p>
 * Two value objects are equal only when they have the same concrete runtime class and
 * {@link #equalsCore(ValueObject)} holds. The type check is nominal: an instance of a subclass is never
 * equal to an instance of its superclass. The hash combines the concrete class name with {@link #hashCodeCore()}.
 * <p>
 * Subclasses annotated with {@link com.ethnicthv.domain.annotation.ValueObjectType} get both core methods
 * from the annotation processor.
 *
 * @param <T> the concrete value object type
 */
public abstract class ValueObject<T extends ValueObject<T>> {

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        @SuppressWarnings("unchecked")
        T other = (T) obj;
        return equalsCore(other);
    }

    @Override
    public final int hashCode() {
        return 31 * getClass().getName().hashCode() + hashCodeCore();
    }

    /**
     * Compares the values of this instance with another instance of the same concrete class.
     *
     * @param other a non-null instance whose runtime class equals this one's
     * @return true if the values are equal
     */
    protected abstract boolean equalsCore(T other);

    /**
     * Hash of the values compared by {@link #equalsCore(ValueObject)}.
     */
    protected abstract int hashCodeCore();
}
