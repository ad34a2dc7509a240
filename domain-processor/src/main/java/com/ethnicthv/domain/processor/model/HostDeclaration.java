package com.ethnicthv.domain.processor.model;

import java.util.List;

/**
 * Everything the validator and synthesizer need to know about a candidate host type, extracted
 * once from its declaration.
 *
 * @param qualifiedName        canonical name, e.g. {@code com.acme.Outer.Address}
 * @param simpleName           simple name
 * @param packageName          package, empty for the unnamed package
 * @param flatName             nesting path joined with {@code _}, e.g. {@code Outer_Address}
 * @param marked               whether {@code @ValueObjectType} is present
 * @param shape                base-class shape
 * @param extensible           whether a generated subclass can complete the host
 * @param selfType             type argument of the {@code ValueObject} supertype, {@code null} if none
 * @param selfTypeIsHost       whether {@code selfType} is the host type itself
 * @param typeParameters       declaration clause, e.g. {@code <T extends Comparable<T>>}, or empty
 * @param typeArguments        use clause, e.g. {@code <T>}, or empty
 * @param members              instance fields in declaration order
 * @param misplacedStrategies  strategy annotations on methods
 * @param methods              methods declared on the host (companion candidates)
 * @param constructors         non-private constructors
 * @param location             the host type itself
 */
public record HostDeclaration(String qualifiedName,
                              String simpleName,
                              String packageName,
                              String flatName,
                              boolean marked,
                              HostShape shape,
                              boolean extensible,
                              String selfType,
                              boolean selfTypeIsHost,
                              String typeParameters,
                              String typeArguments,
                              List<Member> members,
                              List<MisplacedStrategy> misplacedStrategies,
                              List<CompanionMethod> methods,
                              List<ConstructorSignature> constructors,
                              SourceLocation location) {

    public static final String GENERATED_SUFFIX = "__ValueObject";

    public HostDeclaration {
        members = List.copyOf(members);
        misplacedStrategies = List.copyOf(misplacedStrategies);
        methods = List.copyOf(methods);
        constructors = List.copyOf(constructors);
    }

    public String generatedSimpleName() {
        return flatName + GENERATED_SUFFIX;
    }

    public String generatedQualifiedName() {
        return packageName.isEmpty() ? generatedSimpleName() : packageName + "." + generatedSimpleName();
    }
}
