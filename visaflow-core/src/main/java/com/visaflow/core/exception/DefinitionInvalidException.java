package com.visaflow.core.exception;

/**
 * Thrown when a workflow definition cannot be executed: no start node,
 * no statuses, or a cyclic path of non-blocking nodes.
 */
public class DefinitionInvalidException extends VisaflowException {
    
    public static final String ERROR_CODE = "DEFINITION_INVALID";
    
    public DefinitionInvalidException(String message) {
        super(ERROR_CODE, message);
    }
    
    public DefinitionInvalidException(String definitionId, String reason) {
        super(ERROR_CODE, String.format("Invalid workflow definition '%s': %s", definitionId, reason));
    }
}
