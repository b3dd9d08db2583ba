package com.visaflow.core.exception;

/**
 * Thrown when a referenced entity does not exist.
 */
public class NotFoundException extends VisaflowException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        this(ERROR_CODE, entityType, entityId);
    }

    protected NotFoundException(String errorCode, String entityType, String entityId) {
        super(errorCode, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
