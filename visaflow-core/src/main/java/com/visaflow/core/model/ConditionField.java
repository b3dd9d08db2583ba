package com.visaflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aggregates of completed reviews an edge condition can read.
 */
public enum ConditionField {
    APPROVAL_COUNT("approvalCount"),
    REJECTION_COUNT("rejectionCount"),
    REVIEW_COUNT("reviewCount"),
    LAST_DECISION("lastDecision"),
    HAS_OBSERVATIONS("hasObservations");

    private final String value;

    ConditionField(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConditionField fromValue(String value) {
        for (ConditionField field : values()) {
            if (field.value.equals(value)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown condition field: " + value);
    }
}
