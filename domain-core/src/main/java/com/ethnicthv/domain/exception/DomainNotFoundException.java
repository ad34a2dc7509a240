package com.ethnicthv.domain.exception;

/**
 * A resource looked up by id does not exist.
 */
public class DomainNotFoundException extends DomainException {
    private final String resourceName;
    private final Object id;

    public DomainNotFoundException(String resourceName, Object id) {
        super(resourceName + " with id '" + id + "' was not found.");
        this.resourceName = resourceName;
        this.id = id;
    }

    public String getResourceName() {
        return resourceName;
    }

    public Object getId() {
        return id;
    }
}
