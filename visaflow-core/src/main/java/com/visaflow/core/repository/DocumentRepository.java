package com.visaflow.core.repository;

import com.visaflow.core.exception.NotFoundException;
import com.visaflow.core.model.DocumentStatus;
import com.visaflow.core.model.ValidationDocument;
import java.util.Optional;

/**
 * Store of documents under validation.
 */
public interface DocumentRepository {

    /**
     * Register a new document.
     * 
     * @param document The document to create
     */
    void save(ValidationDocument document);

    /**
     * Replace a stored document. Writing an unchanged document is a no-op.
     * 
     * @param document The new document state
     */
    void update(ValidationDocument document);

    /**
     * Find a document by ID.
     * 
     * @param documentId The document ID
     * @return The document if found
     */
    Optional<ValidationDocument> findById(String documentId);

    /**
     * Change the status displayed for a document.
     * 
     * @param documentId The document ID
     * @param status The new status
     * @return The updated document
     */
    default ValidationDocument updateStatus(String documentId, DocumentStatus status) {
        ValidationDocument updated = findById(documentId)
            .orElseThrow(() -> new NotFoundException("ValidationDocument", documentId))
            .withStatus(status);
        update(updated);
        return updated;
    }
}
