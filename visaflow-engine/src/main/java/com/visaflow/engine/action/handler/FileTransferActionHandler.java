package com.visaflow.engine.action.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visaflow.core.collaborator.FileService;
import com.visaflow.core.model.AutoAction;
import com.visaflow.core.model.FolderItem;
import com.visaflow.core.model.Notification;
import com.visaflow.core.model.NotificationLevel;
import com.visaflow.core.model.ValidationDocument;
import com.visaflow.core.model.WorkflowInstance;
import com.visaflow.engine.action.ActionContext;
import com.visaflow.engine.action.ActionException;
import com.visaflow.engine.action.ActionResult;
import com.visaflow.engine.action.AutoActionHandler;

import java.time.Clock;

/**
 * Moves or copies the document's file to a target folder.
 * The folder comes from the action's {@code targetFolderId}, else from the workflow settings.
 */
public class FileTransferActionHandler implements AutoActionHandler {

    public static final String TARGET_FOLDER_KEY = "targetFolderId";

    private final FileService fileService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean copy;

    private FileTransferActionHandler(FileService fileService, ObjectMapper objectMapper, Clock clock, boolean copy) {
        this.fileService = fileService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.copy = copy;
    }

    public static FileTransferActionHandler move(FileService fileService, ObjectMapper objectMapper, Clock clock) {
        return new FileTransferActionHandler(fileService, objectMapper, clock, false);
    }

    public static FileTransferActionHandler copy(FileService fileService, ObjectMapper objectMapper, Clock clock) {
        return new FileTransferActionHandler(fileService, objectMapper, clock, true);
    }

    @Override
    public ActionResult execute(AutoAction action, WorkflowInstance instance, ValidationDocument document,
                                ActionContext context) throws ActionException {
        String targetFolderId = action.configText(TARGET_FOLDER_KEY)
            .orElse(blankToNull(context.targetFolderId()));
        if (targetFolderId == null) {
            throw ActionException.misconfigured("MISSING_TARGET_FOLDER", copy
                ? "Aucun dossier cible configuré pour la copie"
                : "Aucun dossier cible configuré pour le déplacement");
        }

        if (copy) {
            FolderItem copied = fileService.copyFile(document.fileId(), targetFolderId);
            return ActionResult.success(action,
                String.format("Fichier \"%s\" copié vers le dossier cible", document.fileName()),
                objectMapper.valueToTree(copied));
        }

        FolderItem moved = fileService.moveFile(document.fileId(), targetFolderId);
        context.notify(Notification.of(
            NotificationLevel.SUCCESS,
            "Document déplacé",
            String.format("\"%s\" a été déplacé vers le dossier de validation.", document.fileName()),
            clock.instant(),
            document.id(),
            instance.id()));
        return ActionResult.success(action,
            String.format("Fichier \"%s\" déplacé vers le dossier cible", document.fileName()),
            objectMapper.valueToTree(moved));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
