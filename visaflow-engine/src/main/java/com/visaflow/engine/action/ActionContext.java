package com.visaflow.engine.action;

import com.visaflow.core.model.Notification;
import com.visaflow.core.model.WorkflowDefinition;
import com.visaflow.core.model.WorkflowSettings;

import java.util.function.Consumer;

/**
 * Environment an action runs in: the project, the workflow's folders and the
 * sink for the notifications the action raises.
 *
 * @param projectId        owning project
 * @param sourceFolderId   folder watched by the workflow, may be null
 * @param targetFolderId   default destination of move/copy actions, may be null
 * @param rejectedFolderId destination for rejected documents, may be null
 * @param nodeId           the action node being processed, may be null outside the engine
 * @param notifications    receives user-facing notifications raised by actions
 */
public record ActionContext(
    String projectId,
    String sourceFolderId,
    String targetFolderId,
    String rejectedFolderId,
    String nodeId,
    Consumer<Notification> notifications
) {
    public ActionContext {
        if (notifications == null) {
            notifications = n -> { };
        }
    }

    /**
     * Build the context for an action node of a definition.
     */
    public static ActionContext of(WorkflowDefinition definition, String projectId, String nodeId,
                                   Consumer<Notification> notifications) {
        WorkflowSettings settings = definition.settings();
        return new ActionContext(
            projectId != null ? projectId : definition.projectId(),
            settings.sourceFolderId(),
            settings.targetFolderId(),
            settings.rejectedFolderId(),
            nodeId,
            notifications
        );
    }

    public void notify(Notification notification) {
        notifications.accept(notification);
    }
}
