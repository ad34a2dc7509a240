package com.ethnicthv.domain.processor.model;

import java.util.List;

/**
 * Strategy annotations found on a method; methods never take part in equality.
 */
public record MisplacedStrategy(String methodName, List<String> annotationNames, SourceLocation location) {
    public MisplacedStrategy {
        annotationNames = List.copyOf(annotationNames);
    }
}
