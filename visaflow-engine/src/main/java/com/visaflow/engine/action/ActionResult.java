package com.visaflow.engine.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.visaflow.core.model.AutoAction;

/**
 * Outcome of one automated action.
 *
 * @param actionId the action
 * @param success  whether the action did what it was configured to do
 * @param message  human readable outcome
 * @param data     action specific output (moved file, echoed metadata), may be null
 * @param error    error code or exception message of a failure, null on success
 * @param retryable whether running the action again could succeed; false on success
 */
public record ActionResult(
    String actionId,
    boolean success,
    String message,
    JsonNode data,
    String error,
    boolean retryable
) {
    public static ActionResult success(AutoAction action, String message) {
        return new ActionResult(action.id(), true, message, null, null, false);
    }

    public static ActionResult success(AutoAction action, String message, JsonNode data) {
        return new ActionResult(action.id(), true, message, data, null, false);
    }

    public static ActionResult failure(AutoAction action, String message, String error, boolean retryable) {
        return new ActionResult(action.id(), false, message, null, error, retryable);
    }
}
