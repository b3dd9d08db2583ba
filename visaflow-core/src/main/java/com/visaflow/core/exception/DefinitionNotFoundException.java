package com.visaflow.core.exception;

/**
 * Thrown when the definition an instance refers to no longer exists.
 */
public class DefinitionNotFoundException extends NotFoundException {

    public static final String ERROR_CODE = "DEFINITION_NOT_FOUND";

    public DefinitionNotFoundException(String definitionId) {
        super(ERROR_CODE, "WorkflowDefinition", definitionId);
    }
}
