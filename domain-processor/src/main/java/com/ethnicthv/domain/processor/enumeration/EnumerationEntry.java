package com.ethnicthv.domain.processor.enumeration;

import com.ethnicthv.domain.processor.model.SourceLocation;

/**
 * A constant whose value and name are statically known.
 */
public record EnumerationEntry(String ownerType, String fieldName, int value, String name, int declarationPosition, SourceLocation location) {
}
