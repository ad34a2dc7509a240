package com.ethnicthv.domain.processor.model;

/**
 * Names of the two static companions a {@code @CustomEquality} member delegates to.
 */
public record CompanionFunctionRef(String memberName, String suffix) {

    public static final String EQUALS_PREFIX = "equals_";
    public static final String HASH_CODE_PREFIX = "hashCode_";

    public static CompanionFunctionRef forMember(String memberName) {
        return new CompanionFunctionRef(memberName, cleanName(memberName));
    }

    public String equalsName() {
        return EQUALS_PREFIX + suffix;
    }

    public String hashCodeName() {
        return HASH_CODE_PREFIX + suffix;
    }

    /**
     * Strips one leading {@code _} or {@code m_} marker and capitalizes the first remaining character.
     * Returns {@code name} unchanged when the result would be empty or start with a digit.
     */
    public static String cleanName(String name) {
        String stripped = name;
        if (stripped.startsWith("m_")) {
            stripped = stripped.substring(2);
        } else if (stripped.startsWith("_")) {
            stripped = stripped.substring(1);
        }
        if (stripped.isEmpty() || Character.isDigit(stripped.charAt(0))) return name;
        return Character.toUpperCase(stripped.charAt(0)) + stripped.substring(1);
    }
}
