package com.visaflow.engine.action.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.visaflow.core.collaborator.FileService;
import com.visaflow.core.model.AutoAction;
import com.visaflow.core.model.Notification;
import com.visaflow.core.model.NotificationLevel;
import com.visaflow.core.model.ValidationDocument;
import com.visaflow.core.model.WorkflowInstance;
import com.visaflow.engine.action.ActionContext;
import com.visaflow.engine.action.ActionResult;
import com.visaflow.engine.action.AutoActionHandler;

import java.time.Clock;

/**
 * Tells a user that the document changed status, by raising a project task.
 * Targets {@code config.userId}, else the document's uploader.
 */
public class NotifyUserActionHandler implements AutoActionHandler {

    private final FileService fileService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public NotifyUserActionHandler(FileService fileService, ObjectMapper objectMapper, Clock clock) {
        this.fileService = fileService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ActionResult execute(AutoAction action, WorkflowInstance instance, ValidationDocument document,
                                ActionContext context) {
        String userId = action.configText("userId").orElse(document.uploadedBy());
        String message = action.configText("messageTemplate")
            .orElse(defaultMessage(document.fileName(), instance.currentStatusId()));

        String taskId = fileService.createTask("[Validation] " + document.fileName(), message, context.projectId());

        context.notify(Notification.of(
            NotificationLevel.INFO,
            "Notification envoyée",
            String.format("L'utilisateur a été notifié du changement de statut de \"%s\".", document.fileName()),
            clock.instant(),
            document.id(),
            instance.id()));

        ObjectNode data = objectMapper.createObjectNode();
        data.put("userId", userId);
        data.put("taskId", taskId);
        data.put("message", message);
        return ActionResult.success(action,
            String.format("Notification envoyée pour \"%s\"", document.fileName()), data);
    }

    static String defaultMessage(String fileName, String statusId) {
        return String.format("Le document \"%s\" a reçu le statut \"%s\".", fileName, statusId);
    }
}
