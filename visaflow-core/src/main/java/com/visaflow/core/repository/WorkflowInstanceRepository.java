package com.visaflow.core.repository;

import com.visaflow.core.model.WorkflowInstance;
import java.util.List;
import java.util.Optional;

/**
 * Repository for WorkflowInstance persistence.
 * Supports optimistic locking via sequence numbers.
 * Every write is safe to retry after a transient failure.
 */
public interface WorkflowInstanceRepository {

    /**
     * Save a new workflow instance.
     * Saving an instance whose id is already stored with identical content is a no-op.
     * 
     * @param instance The workflow instance to save
     */
    void save(WorkflowInstance instance);

    /**
     * Update an existing workflow instance with optimistic locking.
     * The stored sequence number must be exactly one below the given one;
     * re-sending an update that was already applied is a no-op.
     * 
     * @param instance The workflow instance to update
     * @throws com.visaflow.core.exception.OptimisticLockException if sequence number doesn't match
     * @throws com.visaflow.core.exception.InstanceNotFoundException if the instance was never saved
     */
    void update(WorkflowInstance instance);

    /**
     * Find a workflow instance by ID.
     * 
     * @param instanceId The instance ID
     * @return The workflow instance if found
     */
    Optional<WorkflowInstance> findById(String instanceId);

    /**
     * Find the workflow instances of a document, oldest first.
     * 
     * @param documentId The document ID
     * @return All instances started for the document
     */
    List<WorkflowInstance> findByDocumentId(String documentId);

    /**
     * Find the workflow instances of a definition.
     * 
     * @param definitionId The definition ID
     * @return All instances of the definition
     */
    List<WorkflowInstance> findByDefinitionId(String definitionId);
}
