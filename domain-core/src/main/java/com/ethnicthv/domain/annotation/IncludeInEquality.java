package com.ethnicthv.domain.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Includes a field in value object equality using the default comparison of its type.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.METHOD})
public @interface IncludeInEquality {
    /**
     * Evaluation order. Lower values are compared first; ties fall back to declaration order.
     *
     * @return the evaluation order (default: 0)
     */
    int order() default 0;
}
