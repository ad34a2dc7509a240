package com.ethnicthv.domain.processor;

import java.util.List;

/**
 * Fully qualified names of the runtime types the processors look for. Kept as strings so the
 * processor does not depend on {@code domain-core} at runtime.
 */
public final class TypeNames {
    private TypeNames() {}

    public static final String ANNOTATION_PACKAGE = "com.ethnicthv.domain.annotation";
    public static final String VALUE_OBJECT_TYPE = ANNOTATION_PACKAGE + ".ValueObjectType";
    public static final String ENUMERATION_TYPE = ANNOTATION_PACKAGE + ".EnumerationType";
    public static final String INCLUDE_IN_EQUALITY = ANNOTATION_PACKAGE + ".IncludeInEquality";
    public static final String IGNORE_EQUALITY = ANNOTATION_PACKAGE + ".IgnoreEquality";
    public static final String SEQUENCE_EQUALITY = ANNOTATION_PACKAGE + ".SequenceEquality";
    public static final String CUSTOM_EQUALITY = ANNOTATION_PACKAGE + ".CustomEquality";

    public static final String VALUE_OBJECT = "com.ethnicthv.domain.valueobject.ValueObject";
    public static final String SIMPLE_VALUE_OBJECT = "com.ethnicthv.domain.valueobject.SimpleValueObject";
    public static final String SEQUENCE_COMPARISON = "com.ethnicthv.domain.valueobject.SequenceComparison";
    public static final String ENUMERATION = "com.ethnicthv.domain.enumeration.Enumeration";

    /** Present when Jackson databind is on the processing classpath. */
    public static final String JACKSON_SERIALIZER = "com.fasterxml.jackson.databind.JsonSerializer";

    public static final List<String> STRATEGY_ANNOTATIONS = List.of(
            INCLUDE_IN_EQUALITY, IGNORE_EQUALITY, SEQUENCE_EQUALITY, CUSTOM_EQUALITY);
}
