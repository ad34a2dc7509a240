package com.ethnicthv.domain.processor.model;

/**
 * Structural category of a member's declared type, as far as equality generation cares.
 */
public enum TypeCategory {
    PRIMITIVE,
    /** Any {@code CharSequence}. Never treated as a sequence. */
    TEXT,
    /** Any {@code Iterable} that is not text. */
    SEQUENCE,
    REFERENCE_ARRAY,
    PRIMITIVE_ARRAY,
    REFERENCE;

    public boolean isSequenceLike() {
        return this == SEQUENCE || this == REFERENCE_ARRAY || this == PRIMITIVE_ARRAY;
    }
}
