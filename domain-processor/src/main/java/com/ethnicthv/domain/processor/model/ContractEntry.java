package com.ethnicthv.domain.processor.model;

/**
 * A participating member with its resolved strategy; {@code companion} is set for custom members only.
 */
public record ContractEntry(Member member, EqualityStrategy strategy, CompanionFunctionRef companion) {
}
