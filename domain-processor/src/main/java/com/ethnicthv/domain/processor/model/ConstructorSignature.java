package com.ethnicthv.domain.processor.model;

import java.util.List;

/**
 * A non-private host constructor mirrored by the generated subclass.
 *
 * @param typeParameters rendered type parameter clause including angle brackets, or empty
 * @param parameters     parameters in order
 * @param varargs        whether the last parameter is variable arity
 * @param thrownTypes    declared exception types
 */
public record ConstructorSignature(String typeParameters, List<Parameter> parameters, boolean varargs, List<String> thrownTypes) {

    public ConstructorSignature {
        parameters = List.copyOf(parameters);
        thrownTypes = List.copyOf(thrownTypes);
    }

    public record Parameter(String type, String name) {
    }
}
