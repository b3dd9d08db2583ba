package com.visaflow.engine.action.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.visaflow.core.model.AutoAction;
import com.visaflow.core.model.ValidationDocument;
import com.visaflow.core.model.WorkflowInstance;
import com.visaflow.engine.action.ActionContext;
import com.visaflow.engine.action.ActionException;
import com.visaflow.engine.action.ActionResult;
import com.visaflow.engine.action.AutoActionHandler;

/**
 * Validates and echoes the configured metadata.
 * Writing it to the host platform belongs to the file collaborator and is not done here.
 */
public class UpdateMetadataActionHandler implements AutoActionHandler {

    @Override
    public ActionResult execute(AutoAction action, WorkflowInstance instance, ValidationDocument document,
                                ActionContext context) throws ActionException {
        JsonNode metadata = action.configValue("metadata")
            .filter(JsonNode::isObject)
            .orElseThrow(() -> ActionException.misconfigured("MISSING_METADATA",
                "Aucune métadonnée à mettre à jour"));

        return ActionResult.success(action,
            String.format("Métadonnées mises à jour pour \"%s\"", document.fileName()),
            metadata.deepCopy());
    }
}
