package com.visaflow.engine.persistence;

import com.visaflow.core.exception.InstanceNotFoundException;
import com.visaflow.core.exception.OptimisticLockException;
import com.visaflow.core.model.WorkflowInstance;
import com.visaflow.core.repository.WorkflowInstanceRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowInstanceRepository.
 * Enforces the sequence-number contract so tests see the same conflicts a real store raises.
 */
public class InMemoryWorkflowInstanceRepository implements WorkflowInstanceRepository {
    
    private final Map<String, WorkflowInstance> instances = new ConcurrentHashMap<>();
    
    @Override
    public void save(WorkflowInstance instance) {
        WorkflowInstance existing = instances.putIfAbsent(instance.id(), instance);
        if (existing != null && !existing.equals(instance)) {
            throw new OptimisticLockException("WorkflowInstance", instance.id(), 0L, existing.sequenceNumber());
        }
    }
    
    @Override
    public void update(WorkflowInstance instance) {
        instances.compute(instance.id(), (id, stored) -> {
            if (stored == null) {
                throw new InstanceNotFoundException(id);
            }
            if (stored.equals(instance)) {
                // Replayed write
                return stored;
            }
            long expected = instance.sequenceNumber() - 1;
            if (stored.sequenceNumber() != expected) {
                throw new OptimisticLockException("WorkflowInstance", id, expected, stored.sequenceNumber());
            }
            return instance;
        });
    }
    
    @Override
    public Optional<WorkflowInstance> findById(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }
    
    @Override
    public List<WorkflowInstance> findByDocumentId(String documentId) {
        return instances.values().stream()
            .filter(i -> documentId.equals(i.documentId()))
            .sorted(Comparator.comparing(WorkflowInstance::startedAt))
            .collect(Collectors.toList());
    }
    
    @Override
    public List<WorkflowInstance> findByDefinitionId(String definitionId) {
        return instances.values().stream()
            .filter(i -> definitionId.equals(i.workflowDefinitionId()))
            .sorted(Comparator.comparing(WorkflowInstance::startedAt))
            .collect(Collectors.toList());
    }

    public int size() {
        return instances.size();
    }
}
