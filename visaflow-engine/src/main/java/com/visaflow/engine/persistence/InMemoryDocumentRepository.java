package com.visaflow.engine.persistence;

import com.visaflow.core.exception.NotFoundException;
import com.visaflow.core.model.ValidationDocument;
import com.visaflow.core.repository.DocumentRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of DocumentRepository.
 */
public class InMemoryDocumentRepository implements DocumentRepository {

    private final Map<String, ValidationDocument> documents = new ConcurrentHashMap<>();

    @Override
    public void save(ValidationDocument document) {
        documents.put(document.id(), document);
    }

    @Override
    public void update(ValidationDocument document) {
        if (documents.replace(document.id(), document) == null) {
            throw new NotFoundException("ValidationDocument", document.id());
        }
    }

    @Override
    public Optional<ValidationDocument> findById(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    public List<ValidationDocument> findAll() {
        return List.copyOf(documents.values());
    }
}
