package com.ethnicthv.domain.processor.model;

import javax.lang.model.element.Element;

/**
 * Where a diagnostic points: a readable description plus the element javac should attach it to.
 * The element is opaque to the validators and may be {@code null} in unit tests.
 */
public record SourceLocation(String description, Element element) {

    public static SourceLocation of(String description) {
        return new SourceLocation(description, null);
    }

    @Override
    public String toString() {
        return description;
    }
}
