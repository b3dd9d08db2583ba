package com.visaflow.engine.action.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.visaflow.core.collaborator.FileService;
import com.visaflow.core.model.AutoAction;
import com.visaflow.core.model.ValidationDocument;
import com.visaflow.core.model.WorkflowInstance;
import com.visaflow.core.model.WorkflowReview;
import com.visaflow.engine.action.ActionContext;
import com.visaflow.engine.action.ActionResult;
import com.visaflow.engine.action.AutoActionHandler;

import java.util.stream.Collectors;

/**
 * Posts a comment on the document, followed by every completed review comment.
 */
public class SendCommentActionHandler implements AutoActionHandler {

    static final String REVIEWER_COMMENTS_HEADER = "Commentaires des réviseurs:";

    private final FileService fileService;
    private final ObjectMapper objectMapper;

    public SendCommentActionHandler(FileService fileService, ObjectMapper objectMapper) {
        this.fileService = fileService;
        this.objectMapper = objectMapper;
    }

    @Override
    public ActionResult execute(AutoAction action, WorkflowInstance instance, ValidationDocument document,
                                ActionContext context) {
        String comment = buildComment(action, instance, document);

        String taskId = fileService.createTask("[Commentaire] " + document.fileName(), comment, context.projectId());

        ObjectNode data = objectMapper.createObjectNode();
        data.put("taskId", taskId);
        data.put("comment", comment);
        return ActionResult.success(action,
            String.format("Commentaire envoyé pour \"%s\"", document.fileName()), data);
    }

    String buildComment(AutoAction action, WorkflowInstance instance, ValidationDocument document) {
        String header = action.configText("commentTemplate")
            .orElse(String.format("Statut automatique: le document \"%s\" est maintenant \"%s\".",
                document.fileName(), instance.currentStatusId()));

        String reviewComments = instance.completedReviews().stream()
            .filter(WorkflowReview::hasComment)
            .map(r -> r.reviewerName() + ": " + r.comment())
            .collect(Collectors.joining("\n"));

        return reviewComments.isEmpty()
            ? header
            : header + "\n\n" + REVIEWER_COMMENTS_HEADER + "\n" + reviewComments;
    }
}
