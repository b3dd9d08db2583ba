package com.visaflow.core.model;

/**
 * Node of a workflow graph.
 */
public record WorkflowNode(
    String id,
    NodeType type,
    NodePosition position,
    NodeData data
) {
    public WorkflowNode {
        if (position == null) {
            position = NodePosition.ORIGIN;
        }
        if (data == null) {
            data = NodeData.labeled(null);
        }
    }

    public static WorkflowNode of(String id, NodeType type, NodeData data) {
        return new WorkflowNode(id, type, NodePosition.ORIGIN, data);
    }

    /**
     * Label shown in history entries: the node label, or its type when unlabeled.
     */
    public String displayName() {
        String label = data.label();
        return label != null && !label.isBlank() ? label : type.value();
    }
}
