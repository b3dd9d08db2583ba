package com.visaflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of nodes in a workflow graph.
 */
public enum NodeType {
    /**
     * Entry point. Exactly one per definition.
     */
    START("start"),

    /**
     * Sets the document's displayed status. Never blocks.
     */
    STATUS("status"),

    /**
     * Waits for the required number of completed reviews.
     */
    REVIEW("review"),

    /**
     * Branch point resolved by the decision evaluator.
     */
    DECISION("decision"),

    /**
     * Runs the configured automated actions, then continues.
     */
    ACTION("action"),

    /**
     * Terminal node.
     */
    END("end"),

    /**
     * Reserved for delayed transitions. Treated as a pass-through.
     */
    TIMER("timer"),

    /**
     * Reserved for parallel review. Treated as a pass-through.
     */
    PARALLEL("parallel");

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Check if the engine stops and waits for external input on this node.
     */
    public boolean isBlocking() {
        return this == REVIEW;
    }

    /**
     * Check if this node ends the workflow.
     */
    public boolean isTerminal() {
        return this == END;
    }

    /**
     * Check if entering this node produces an audit entry in the instance history.
     */
    public boolean isAudited() {
        return this == STATUS || this == REVIEW;
    }

    @JsonCreator
    public static NodeType fromValue(String value) {
        for (NodeType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + value);
    }
}
