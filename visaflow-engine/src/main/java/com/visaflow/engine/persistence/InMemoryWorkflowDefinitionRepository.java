package com.visaflow.engine.persistence;

import com.visaflow.core.model.WorkflowDefinition;
import com.visaflow.core.repository.WorkflowDefinitionRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowDefinitionRepository.
 * A definition saved with an existing id replaces the previous version.
 */
public class InMemoryWorkflowDefinitionRepository implements WorkflowDefinitionRepository {
    
    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();
    
    @Override
    public void save(WorkflowDefinition definition) {
        definitions.put(definition.id(), definition);
    }
    
    @Override
    public Optional<WorkflowDefinition> findById(String definitionId) {
        return Optional.ofNullable(definitions.get(definitionId));
    }
    
    @Override
    public List<WorkflowDefinition> findActive() {
        return definitions.values().stream()
            .filter(WorkflowDefinition::active)
            .sorted(Comparator.comparing(WorkflowDefinition::id))
            .collect(Collectors.toList());
    }
    
    @Override
    public List<WorkflowDefinition> findByProject(String projectId) {
        return definitions.values().stream()
            .filter(d -> Objects.equals(d.projectId(), projectId))
            .sorted(Comparator.comparing(WorkflowDefinition::id))
            .collect(Collectors.toList());
    }
}
