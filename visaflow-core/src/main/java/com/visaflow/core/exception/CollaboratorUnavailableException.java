package com.visaflow.core.exception;

/**
 * Thrown when a store or an external service fails or times out.
 * Aborts the whole transition sequence it occurs in.
 */
public class CollaboratorUnavailableException extends VisaflowException {
    
    public static final String ERROR_CODE = "COLLABORATOR_UNAVAILABLE";

    private final String collaborator;
    
    public CollaboratorUnavailableException(String collaborator, String message) {
        super(ERROR_CODE, String.format("%s unavailable: %s", collaborator, message));
        this.collaborator = collaborator;
    }

    public CollaboratorUnavailableException(String collaborator, String message, Throwable cause) {
        super(ERROR_CODE, String.format("%s unavailable: %s", collaborator, message), cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
