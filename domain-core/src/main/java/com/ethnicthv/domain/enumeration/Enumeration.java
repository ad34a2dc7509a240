package com.ethnicthv.domain.enumeration;

import java.util.Objects;

/**
 * Base class for closed, named-constant enumerations that carry behavior, a type-safe alternative to
 * {@code enum} when constants need a stable integer value and a display name.
 * <p>
 * Constants are declared as {@code public static final} fields initialized with literal arguments:
 * <pre>{@code
 * @EnumerationType
 * public class OrderStatus extends Enumeration {
 *     public static final OrderStatus PENDING = new OrderStatus(1, "Pending");
 *     public static final OrderStatus SHIPPED = new OrderStatus(2, "Shipped");
 *
 *     private OrderStatus(int value, String name) { super(value, name); }
 * }
 * }</pre>
 * Equality is by concrete class and value; ordering is by value.
 */
public abstract class Enumeration implements Comparable<Enumeration> {
    private final int value;
    private final String name;

    protected Enumeration(int value, String name) {
        this.value = value;
        this.name = Objects.requireNonNull(name, "name");
    }

    public final int getValue() {
        return value;
    }

    public final String getName() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return value == ((Enumeration) obj).value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public int compareTo(Enumeration other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return name;
    }
}
