package com.ethnicthv.domain.processor.model;

public enum HostShape {
    /** Class extending {@code ValueObject} (and not {@code SimpleValueObject}). */
    VALUE_OBJECT,
    /** Class extending {@code SimpleValueObject}: one wrapped value, fixed equality. */
    WRAPPER,
    /** Anything else, including interfaces, enums and records. */
    OTHER
}
