package com.ethnicthv.domain.exception;

/**
 * An operation conflicts with the current state of the domain (duplicate key, stale version, ...).
 */
public class DomainConflictException extends DomainException {
    public DomainConflictException(String message) {
        super(message);
    }
}
