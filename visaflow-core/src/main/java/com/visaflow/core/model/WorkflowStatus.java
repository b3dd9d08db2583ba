package com.visaflow.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Status a document can be displayed with while it moves through a workflow.
 */
public record WorkflowStatus(
    String id,
    String name,
    String description,
    String color,
    @JsonProperty("isFinal") boolean finalStatus,
    @JsonProperty("isDefault") boolean defaultStatus,
    int order
) {
    public static WorkflowStatus of(String id, String name, String color) {
        return new WorkflowStatus(id, name, null, color, false, false, 0);
    }

    public static WorkflowStatus defaultOf(String id, String name, String color) {
        return new WorkflowStatus(id, name, null, color, false, true, 0);
    }
}
