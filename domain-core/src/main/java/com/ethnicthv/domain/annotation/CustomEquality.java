package com.ethnicthv.domain.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Delegates equality and hashing of a field to two static companion methods declared on the value object.
 * <p>
 * For a field {@code lastName} of type {@code T} the host must declare non-private
 * {@code static boolean equals_LastName(T value, T otherValue)} and {@code static int hashCode_LastName(T value)}.
 * The suffix is the field name with one leading {@code _} or {@code m_} removed and its first character upper-cased.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.METHOD})
public @interface CustomEquality {
    /**
     * Evaluation order. Lower values are compared first.
     *
     * @return the evaluation order (default: 0)
     */
    int order() default 0;
}
