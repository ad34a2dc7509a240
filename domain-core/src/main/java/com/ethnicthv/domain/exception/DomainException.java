package com.ethnicthv.domain.exception;

/**
 * Unchecked base type for violations of domain rules.
 */
public abstract class DomainException extends RuntimeException {
    protected DomainException(String message) {
        super(message);
    }

    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
