package com.ethnicthv.domain.exception;

/**
 * Input rejected by a domain invariant, optionally tied to the offending property.
 */
public class DomainValidationException extends DomainException {
    private final String propertyName;

    public DomainValidationException(String message) {
        super(message);
        this.propertyName = null;
    }

    public DomainValidationException(String propertyName, String message) {
        super(message);
        this.propertyName = propertyName;
    }

    /**
     * @return the property that failed validation, or {@code null} when the failure is not property specific
     */
    public String getPropertyName() {
        return propertyName;
    }
}
