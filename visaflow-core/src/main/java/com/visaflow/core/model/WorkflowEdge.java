package com.visaflow.core.model;

/**
 * Directed transition between two nodes.
 */
public record WorkflowEdge(
    String id,
    String source,
    String target,
    String label,
    EdgeCondition condition
) {
    public static WorkflowEdge of(String id, String source, String target) {
        return new WorkflowEdge(id, source, target, null, null);
    }

    public static WorkflowEdge labeled(String id, String source, String target, String label) {
        return new WorkflowEdge(id, source, target, label, null);
    }

    public boolean hasCondition() {
        return condition != null;
    }

    public boolean hasLabel() {
        return label != null && !label.isBlank();
    }
}
