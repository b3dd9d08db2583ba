package com.visaflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Type-specific payload of a workflow node.
 * Status nodes use statusId/color, review nodes requiredApprovals/assignees,
 * action nodes autoActions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeData(
    String label,
    String description,
    String statusId,
    String color,
    List<String> assignees,
    Integer requiredApprovals,
    List<AutoAction> autoActions,
    Integer timerDuration,
    String timerUnit
) {
    public NodeData {
        assignees = assignees == null ? List.of() : List.copyOf(assignees);
        autoActions = autoActions == null ? List.of() : List.copyOf(autoActions);
    }

    public static NodeData labeled(String label) {
        return new NodeData(label, null, null, null, null, null, null, null, null);
    }

    public static NodeData status(String label, String statusId, String color) {
        return new NodeData(label, null, statusId, color, null, null, null, null, null);
    }

    public static NodeData review(String label, int requiredApprovals, List<String> assignees) {
        return new NodeData(label, null, null, null, assignees, requiredApprovals, null, null, null);
    }

    public static NodeData action(String label, List<AutoAction> autoActions) {
        return new NodeData(label, null, null, null, null, null, autoActions, null, null);
    }

    /**
     * Required approvals for a review node. Missing or non-positive values count as one.
     */
    public int requiredApprovalsOrDefault() {
        return requiredApprovals == null || requiredApprovals < 1 ? 1 : requiredApprovals;
    }

    public boolean hasStatus() {
        return statusId != null && !statusId.isBlank();
    }
}
