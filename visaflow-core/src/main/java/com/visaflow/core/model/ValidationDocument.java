package com.visaflow.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Document under validation. Owned by the document store;
 * workflow instances reference it by id.
 */
public record ValidationDocument(
    String id,
    String fileId,
    String fileName,
    String fileExtension,
    long fileSize,
    String filePath,
    String uploadedBy,
    String uploadedByName,
    Instant uploadedAt,
    String projectId,
    String workflowInstanceId,
    DocumentStatus currentStatus,
    Map<String, String> metadata
) {
    public ValidationDocument {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Build a pending document for a file detected in a watched folder.
     */
    public static ValidationDocument fromFolderItem(FolderItem file, String projectId, Instant now) {
        String uploader = file.uploadedBy() != null ? file.uploadedBy() : "";
        return new ValidationDocument(
            UUID.randomUUID().toString(),
            file.id(),
            file.name(),
            file.extension() != null ? file.extension() : "",
            file.size() != null ? file.size() : 0L,
            file.path() != null ? file.path() : "",
            uploader,
            uploader.isEmpty() ? "Utilisateur" : uploader,
            file.uploadedAt() != null ? file.uploadedAt() : now,
            projectId,
            null,
            DocumentStatus.pending(now),
            Map.of()
        );
    }

    public ValidationDocument withStatus(DocumentStatus status) {
        return new ValidationDocument(id, fileId, fileName, fileExtension, fileSize, filePath,
            uploadedBy, uploadedByName, uploadedAt, projectId, workflowInstanceId, status, metadata);
    }

    public ValidationDocument withWorkflowInstanceId(String instanceId) {
        return new ValidationDocument(id, fileId, fileName, fileExtension, fileSize, filePath,
            uploadedBy, uploadedByName, uploadedAt, projectId, instanceId, currentStatus, metadata);
    }

    public ValidationDocument withMetadata(Map<String, String> metadata) {
        return new ValidationDocument(id, fileId, fileName, fileExtension, fileSize, filePath,
            uploadedBy, uploadedByName, uploadedAt, projectId, workflowInstanceId, currentStatus, metadata);
    }
}
