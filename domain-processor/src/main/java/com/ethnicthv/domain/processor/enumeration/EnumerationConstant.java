package com.ethnicthv.domain.processor.enumeration;

import com.ethnicthv.domain.processor.model.SourceLocation;

/**
 * A {@code static final} constant of an enumeration host. {@code value} and {@code name} are only
 * known when the constructor arguments are literals.
 *
 * @param referenceable whether generated code can read the field, i.e. it is not private
 */
public record EnumerationConstant(String fieldName,
                                  Integer value,
                                  String name,
                                  boolean referenceable,
                                  int declarationPosition,
                                  SourceLocation location) {

    public boolean isLiteral() {
        return value != null && name != null;
    }
}
