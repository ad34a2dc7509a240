package com.ethnicthv.domain.processor.enumeration;

import com.ethnicthv.domain.processor.model.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * An {@code Enumeration} subclass (or a type carrying {@code @EnumerationType}) as read from source.
 *
 * @param enumerationSubclass whether the host extends {@code Enumeration}
 * @param reachable           whether generated code in the same package can reference the host
 * @param publicType          whether the host and its enclosing types are public
 * @param jsonConverter       whether {@code @EnumerationType(generateJsonConverter)} asks for Jackson support
 * @param constants           every constant, private ones included
 */
public record EnumerationDeclaration(String qualifiedName,
                                     String simpleName,
                                     String packageName,
                                     String flatName,
                                     boolean marked,
                                     boolean enumerationSubclass,
                                     boolean reachable,
                                     boolean publicType,
                                     boolean jsonConverter,
                                     List<EnumerationConstant> constants,
                                     SourceLocation location) {

    public static final String GENERATED_SUFFIX = "Values";

    public EnumerationDeclaration {
        constants = List.copyOf(constants);
    }

    /** Constants with literal arguments, private ones included, in declaration order. */
    public List<EnumerationEntry> entries() {
        List<EnumerationEntry> out = new ArrayList<>();
        for (EnumerationConstant c : constants) {
            if (!c.isLiteral()) continue;
            out.add(new EnumerationEntry(qualifiedName, c.fieldName(), c.value(), c.name(), c.declarationPosition(), c.location()));
        }
        return out;
    }

    /** Constants the generated table can reference, in declaration order. */
    public List<EnumerationConstant> tableConstants() {
        List<EnumerationConstant> out = new ArrayList<>();
        for (EnumerationConstant c : constants) {
            if (c.referenceable()) out.add(c);
        }
        return out;
    }

    public String generatedQualifiedName() {
        String simple = flatName + GENERATED_SUFFIX;
        return packageName.isEmpty() ? simple : packageName + "." + simple;
    }
}
