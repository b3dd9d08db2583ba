package com.visaflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Decision recorded by a reviewer (a "visa").
 * Each decision maps to a fixed document status id.
 */
public enum ReviewDecision {
    PENDING("pending", null),
    APPROVED("approved", "approved"),
    VSO("vso", "vso"),
    VAO("vao", "vao"),
    APPROVED_WITH_COMMENTS("approved_with_comments", "commented"),
    VAO_BLOCKING("vao_blocking", "vao_blocking"),
    REJECTED("rejected", "rejected"),
    REFUSED("refused", "refused");

    private final String value;
    private final String statusId;

    ReviewDecision(String value, String statusId) {
        this.value = value;
        this.statusId = statusId;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Status id the document takes when this decision is submitted.
     * Empty for {@link #PENDING}.
     */
    public Optional<String> mappedStatusId() {
        return Optional.ofNullable(statusId);
    }

    /**
     * Approval without reservation: approved or VSO.
     */
    public boolean isApproval() {
        return this == APPROVED || this == VSO;
    }

    /**
     * Approval with comments or observations.
     */
    public boolean isComment() {
        return this == APPROVED_WITH_COMMENTS || this == VAO;
    }

    /**
     * Rejection, refusal or blocking observations.
     */
    public boolean isRejection() {
        return this == REJECTED || this == REFUSED || this == VAO_BLOCKING;
    }

    @JsonCreator
    public static ReviewDecision fromValue(String value) {
        for (ReviewDecision decision : values()) {
            if (decision.value.equalsIgnoreCase(value)) {
                return decision;
            }
        }
        throw new IllegalArgumentException("Unknown review decision: " + value);
    }
}
