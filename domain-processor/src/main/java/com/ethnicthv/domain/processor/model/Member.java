package com.ethnicthv.domain.processor.model;

import java.util.List;

/**
 * One field-like slot of a host declaration.
 *
 * @param name               member name, unique within the host
 * @param kind               field or property
 * @param type               declared type
 * @param declarationPosition zero-based source order among instance fields
 * @param strategies         strategy annotations found on the member, in source order
 * @param finalField         whether the backing field is {@code final}
 * @param setterDeclared     whether the host declares a {@code setX(..)} mutator
 * @param accessExpression   how generated code reads the member ({@code name} or {@code getName()}),
 *                           {@code null} when generated code cannot read it
 * @param ignorableByPolicy  transient or compiler-synthesized; no missing-strategy warning
 * @param location           where diagnostics about the member point
 */
public record Member(String name,
                     MemberKind kind,
                     MemberType type,
                     int declarationPosition,
                     List<EqualityStrategy> strategies,
                     boolean finalField,
                     boolean setterDeclared,
                     String accessExpression,
                     boolean ignorableByPolicy,
                     SourceLocation location) {

    public Member {
        strategies = List.copyOf(strategies);
    }

    public boolean isReadable() {
        return accessExpression != null;
    }
}
