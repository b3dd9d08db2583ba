package com.visaflow.engine.action;

import com.visaflow.core.model.AutoAction;
import com.visaflow.core.model.ValidationDocument;
import com.visaflow.core.model.WorkflowInstance;

/**
 * Implementation of one automated action type.
 * Register custom handlers with {@link ActionExecutor#register}.
 */
@FunctionalInterface
public interface AutoActionHandler {
    
    /**
     * Execute the action.
     * 
     * @param action   The configured action
     * @param instance The instance whose action node is being processed
     * @param document The document under validation
     * @param context  Project, folders and notification sink
     * @return The successful result
     * @throws ActionException if the action fails or is misconfigured
     */
    ActionResult execute(AutoAction action, WorkflowInstance instance, ValidationDocument document,
                         ActionContext context) throws ActionException;
}
