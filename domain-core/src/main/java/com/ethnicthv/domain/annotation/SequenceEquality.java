package com.ethnicthv.domain.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Compares an {@link Iterable} (or object array) field element by element.
 * <p>
 * Text types are not sequences for this purpose even if they expose their characters.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.METHOD})
public @interface SequenceEquality {
    /**
     * Evaluation order. Lower values are compared first.
     *
     * @return the evaluation order (default: 0)
     */
    int order() default 0;

    /**
     * When {@code true} sequences must hold equal elements at equal positions.
     * When {@code false} they are compared as multisets: every distinct element must occur the
     * same number of times in both, regardless of position.
     *
     * @return whether element order matters (default: true)
     */
    boolean orderMatters() default true;

    /**
     * When {@code true} elements are compared with {@code equals}; when {@code false} by reference.
     *
     * @return whether elements are compared by value (default: true)
     */
    boolean deepEquality() default true;
}
