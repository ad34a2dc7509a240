package com.ethnicthv.domain.processor.model;

/**
 * Declared type of a member: its source spelling plus its category.
 */
public record MemberType(String name, TypeCategory category) {
}
