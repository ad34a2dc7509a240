package com.ethnicthv.domain.processor.model;

public enum MemberKind {
    /** Instance field without an accessor. */
    FIELD,
    /** Instance field exposed through {@code getX()}, {@code isX()} or {@code x()}. */
    PROPERTY;

    public String displayName() {
        return this == FIELD ? "field" : "property";
    }
}
