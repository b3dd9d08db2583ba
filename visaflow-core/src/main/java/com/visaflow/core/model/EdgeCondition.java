package com.visaflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Explicit routing rule on an edge leaving a decision node.
 * Compares an aggregate of the completed reviews with a literal value.
 */
public record EdgeCondition(
    String id,
    ConditionField field,
    ConditionOperator operator,
    JsonNode value,
    String label
) {
    /**
     * Name used in decision reasons: the label, or the field name.
     */
    public String displayName() {
        return label != null && !label.isBlank() ? label : field.value();
    }
}
