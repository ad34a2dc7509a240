package com.ethnicthv.domain.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an {@link com.ethnicthv.domain.enumeration.Enumeration} subclass for lookup table generation.
 * <p>
 * The processor generates a {@code <Name>Values} class next to the host with {@code getAll()},
 * {@code fromValue(int)}, {@code fromName(String)}, {@code tryFromValue(int)} and {@code tryFromName(String)}.
 * Constants are the {@code static final} fields of the host type initialized with {@code new}. Private
 * constants are checked for duplicate values and names but are left out of the table.
 */
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.TYPE)
public @interface EnumerationType {

    /**
     * Also generate a Jackson serializer, deserializer and {@code jsonModule()} in the lookup class.
     * Ignored when Jackson databind is not on the compile classpath.
     */
    boolean generateJsonConverter() default true;
}
