package com.visaflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Optional;

/**
 * Automated side-effecting operation attached to an action node.
 * The shape of {@code config} depends on the action type.
 */
public record AutoAction(
    String id,
    AutoActionType type,
    JsonNode config,
    String label
) {
    public AutoAction {
        if (config == null || config.isNull()) {
            config = JsonNodeFactory.instance.objectNode();
        }
    }

    /**
     * Read a non-blank text value from the config.
     */
    public Optional<String> configText(String key) {
        JsonNode value = config.get(key);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    /**
     * Read a raw config value.
     */
    public Optional<JsonNode> configValue(String key) {
        JsonNode value = config.get(key);
        return value == null || value.isNull() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Human readable name: the label, or the type when unlabeled.
     */
    public String displayName() {
        if (label != null && !label.isBlank()) {
            return label;
        }
        return type != null ? type.value() : "action";
    }
}
