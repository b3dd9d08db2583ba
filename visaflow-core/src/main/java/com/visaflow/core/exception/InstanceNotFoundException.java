package com.visaflow.core.exception;

/**
 * Thrown when a workflow instance lookup misses.
 */
public class InstanceNotFoundException extends NotFoundException {

    public static final String ERROR_CODE = "INSTANCE_NOT_FOUND";

    public InstanceNotFoundException(String instanceId) {
        super(ERROR_CODE, "WorkflowInstance", instanceId);
    }
}
