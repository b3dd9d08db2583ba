package com.visaflow.engine.decision;

/**
 * Edge chosen at a decision node.
 *
 * @param edgeId       the edge to follow
 * @param targetNodeId the node the edge leads to
 * @param label        the edge label, if any
 * @param reason       human readable explanation, recorded in the instance history
 */
public record DecisionResult(
    String edgeId,
    String targetNodeId,
    String label,
    String reason
) {
    /**
     * Label shown in the history entry: the edge label, or "auto".
     */
    public String displayLabel() {
        return label != null && !label.isBlank() ? label : "auto";
    }
}
