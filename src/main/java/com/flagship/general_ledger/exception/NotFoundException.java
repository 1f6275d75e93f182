package com.flagship.general_ledger.exception;

/**
 * A referenced entry, account, period, document or numbering type does not exist.
 */
public class NotFoundException extends RuntimeException {

    private final String resource;
    private final Object resourceId;

    public NotFoundException(String resource, Object resourceId) {
        super(String.format("%s not found: %s", resource, resourceId));
        this.resource = resource;
        this.resourceId = resourceId;
    }

    public String getResource() {
        return resource;
    }

    public Object getResourceId() {
        return resourceId;
    }
}
