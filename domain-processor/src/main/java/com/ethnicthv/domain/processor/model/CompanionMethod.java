package com.ethnicthv.domain.processor.model;

/**
 * A method declared on the host, as seen by companion resolution.
 */
public record CompanionMethod(String name, int parameterCount, String returnType, boolean isStatic, boolean isPrivate) {

    public boolean matches(String expectedName, int expectedParameters, String expectedReturnType) {
        return isStatic
                && !isPrivate
                && name.equals(expectedName)
                && parameterCount == expectedParameters
                && returnType.equals(expectedReturnType);
    }
}
