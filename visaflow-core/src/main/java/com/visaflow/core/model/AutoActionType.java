package com.visaflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of automated actions an action node can run.
 */
public enum AutoActionType {
    MOVE_FILE("move_file"),
    COPY_FILE("copy_file"),
    NOTIFY_USER("notify_user"),
    SEND_COMMENT("send_comment"),
    UPDATE_METADATA("update_metadata"),
    WEBHOOK("webhook");

    private final String value;

    AutoActionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AutoActionType fromValue(String value) {
        for (AutoActionType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown action type: " + value);
    }
}
