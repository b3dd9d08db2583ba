package com.visaflow.api.rest;

import com.visaflow.core.exception.DefinitionNotFoundException;
import com.visaflow.core.exception.NotFoundException;
import com.visaflow.core.model.FolderItem;
import com.visaflow.core.model.ReviewDecision;
import com.visaflow.core.model.ValidationDocument;
import com.visaflow.core.model.WorkflowDefinition;
import com.visaflow.core.model.WorkflowHistoryEntry;
import com.visaflow.core.model.WorkflowInstance;
import com.visaflow.core.model.WorkflowReview;
import com.visaflow.core.repository.DocumentRepository;
import com.visaflow.core.repository.WorkflowDefinitionRepository;
import com.visaflow.engine.service.WorkflowEngine;
import com.visaflow.engine.service.WorkflowEngine.ReviewSubmission;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * REST API for workflow instances and reviews.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private final WorkflowEngine workflowEngine;
    private final WorkflowDefinitionRepository definitionRepository;
    private final DocumentRepository documentRepository;
    private final Clock clock;

    public WorkflowController(
            WorkflowEngine workflowEngine,
            WorkflowDefinitionRepository definitionRepository,
            DocumentRepository documentRepository,
            Clock clock) {
        this.workflowEngine = workflowEngine;
        this.definitionRepository = definitionRepository;
        this.documentRepository = documentRepository;
        this.clock = clock;
    }

    /**
     * Start a workflow for a stored document, or for a file described in the request.
     */
    @PostMapping("/start")
    public ResponseEntity<WorkflowInstanceResponse> startWorkflow(@RequestBody StartWorkflowRequest request) {
        if (request.definitionId() == null) {
            throw new IllegalArgumentException("definitionId is required");
        }
        WorkflowDefinition definition = definitionRepository.findById(request.definitionId())
            .orElseThrow(() -> new DefinitionNotFoundException(request.definitionId()));

        ValidationDocument document;
        if (request.documentId() != null) {
            document = documentRepository.findById(request.documentId())
                .orElseThrow(() -> new NotFoundException("ValidationDocument", request.documentId()));
        } else if (request.file() != null) {
            document = ValidationDocument.fromFolderItem(request.file().toFolderItem(), definition.projectId(), clock.instant());
        } else {
            throw new IllegalArgumentException("documentId or file is required");
        }

        WorkflowInstance instance = workflowEngine.startWorkflow(definition, document);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(WorkflowInstanceResponse.from(instance));
    }

    /**
     * Get workflow instance by ID.
     */
    @GetMapping("/{instanceId}")
    public ResponseEntity<WorkflowInstanceResponse> getWorkflow(@PathVariable String instanceId) {
        return ResponseEntity.ok(WorkflowInstanceResponse.from(workflowEngine.getInstance(instanceId)));
    }

    /**
     * List the instances started for a document, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<WorkflowInstanceResponse>> findByDocument(@RequestParam String documentId) {
        List<WorkflowInstanceResponse> responses = workflowEngine.findInstancesForDocument(documentId).stream()
            .map(WorkflowInstanceResponse::from)
            .toList();
        return ResponseEntity.ok(responses);
    }

    /**
     * Record a reviewer's decision.
     */
    @PostMapping("/{instanceId}/reviews")
    public ResponseEntity<WorkflowInstanceResponse> submitReview(
            @PathVariable String instanceId,
            @RequestBody ReviewRequest request) {

        WorkflowInstance instance = workflowEngine.submitReview(instanceId, new ReviewSubmission(
            request.reviewerId(),
            request.reviewerName(),
            request.reviewerEmail(),
            request.decision(),
            request.comment(),
            request.observations()
        ));
        return ResponseEntity.ok(WorkflowInstanceResponse.from(instance));
    }

    // ========== DTOs ==========

    public record StartWorkflowRequest(
        String definitionId,
        String documentId,
        FileRef file
    ) {}

    public record FileRef(
        String id,
        String name,
        String extension,
        Long size,
        String path,
        String uploadedBy
    ) {
        FolderItem toFolderItem() {
            if (id == null || name == null) {
                throw new IllegalArgumentException("file id and name are required");
            }
            return new FolderItem(id, name, extension != null ? extension : "", size, path, uploadedBy, null, null);
        }
    }

    public record ReviewRequest(
        String reviewerId,
        String reviewerName,
        String reviewerEmail,
        ReviewDecision decision,
        String comment,
        List<String> observations
    ) {}

    public record WorkflowInstanceResponse(
        String instanceId,
        String workflowDefinitionId,
        String projectId,
        String documentId,
        String documentName,
        String currentNodeId,
        String currentStatusId,
        boolean completed,
        String startedBy,
        Instant startedAt,
        Instant updatedAt,
        Instant completedAt,
        List<WorkflowHistoryEntry> history,
        List<WorkflowReview> reviews,
        long sequenceNumber
    ) {
        public static WorkflowInstanceResponse from(WorkflowInstance instance) {
            return new WorkflowInstanceResponse(
                instance.id(),
                instance.workflowDefinitionId(),
                instance.projectId(),
                instance.documentId(),
                instance.documentName(),
                instance.currentNodeId(),
                instance.currentStatusId(),
                instance.isCompleted(),
                instance.startedBy(),
                instance.startedAt(),
                instance.updatedAt(),
                instance.completedAt(),
                instance.history(),
                instance.reviews(),
                instance.sequenceNumber()
            );
        }
    }
}
