package com.visaflow.core.repository;

import com.visaflow.core.model.WorkflowDefinition;
import java.util.List;
import java.util.Optional;

/**
 * Repository for WorkflowDefinition persistence.
 * Read-only to the engine; definitions change through the editing layer.
 */
public interface WorkflowDefinitionRepository {

    /**
     * Store a definition, replacing any previous version with the same id.
     * 
     * @param definition The workflow definition to store
     */
    void save(WorkflowDefinition definition);

    /**
     * Find a workflow definition by ID.
     * 
     * @param definitionId The definition ID
     * @return The workflow definition if found
     */
    Optional<WorkflowDefinition> findById(String definitionId);

    /**
     * List all active definitions.
     * 
     * @return Active workflow definitions
     */
    List<WorkflowDefinition> findActive();

    /**
     * List all definitions owned by a project.
     * 
     * @param projectId The project ID
     * @return The project's workflow definitions
     */
    List<WorkflowDefinition> findByProject(String projectId);
}
