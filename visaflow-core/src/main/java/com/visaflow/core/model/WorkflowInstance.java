package com.visaflow.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One document's live progress through a workflow definition.
 * Primary source of truth for workflow state.
 * 
 * Primary Key: id
 * 
 * Invariants:
 * - currentNodeId references a node of the definition
 * - history is append-only and strictly increasing by timestamp
 * - completedAt is set exactly once, when currentNodeId is an end node
 * - sequenceNumber is monotonically increasing (optimistic locking)
 */
public record WorkflowInstance(
    // Primary key
    String id,
    
    // References
    String workflowDefinitionId,
    String projectId,
    String documentId,
    String documentName,
    
    // State
    String currentNodeId,
    String currentStatusId,
    
    // Timing
    String startedBy,
    Instant startedAt,
    Instant updatedAt,
    Instant completedAt,
    
    // Audit
    List<WorkflowHistoryEntry> history,
    List<WorkflowReview> reviews,
    
    // Versioning (optimistic locking)
    long sequenceNumber
) {
    public WorkflowInstance {
        history = history == null ? List.of() : List.copyOf(history);
        reviews = reviews == null ? List.of() : List.copyOf(reviews);
    }

    /**
     * Create a new instance placed on the start node, with its "started" history entry.
     */
    public static WorkflowInstance create(
            WorkflowDefinition definition,
            ValidationDocument document,
            String startNodeId,
            String statusId,
            Instant now) {
        return new WorkflowInstance(
            UUID.randomUUID().toString(),
            definition.id(),
            document.projectId(),
            document.id(),
            document.fileName(),
            startNodeId,
            statusId,
            document.uploadedBy(),
            now,
            now,
            null,
            List.of(WorkflowHistoryEntry.started(
                now, startNodeId, statusId, document.uploadedBy(), document.uploadedByName())),
            List.of(),
            0L
        );
    }

    /**
     * Check if the instance reached an end node.
     */
    public boolean isCompleted() {
        return completedAt != null;
    }

    /**
     * Reviews that count towards approval quotas and decisions, in submission order.
     */
    public List<WorkflowReview> completedReviews() {
        return reviews.stream()
            .filter(WorkflowReview::completed)
            .toList();
    }

    /**
     * Timestamp of the most recent history entry, or null for an empty history.
     */
    public Instant lastHistoryTimestamp() {
        return history.isEmpty() ? null : history.get(history.size() - 1).timestamp();
    }

    /**
     * Create a copy with one more history entry.
     */
    public WorkflowInstance withHistoryEntry(WorkflowHistoryEntry entry) {
        List<WorkflowHistoryEntry> newHistory = new ArrayList<>(history);
        newHistory.add(entry);
        return toBuilder().history(newHistory).build();
    }

    /**
     * Create a copy with one more review.
     */
    public WorkflowInstance withReview(WorkflowReview review, Instant now) {
        List<WorkflowReview> newReviews = new ArrayList<>(reviews);
        newReviews.add(review);
        return toBuilder().reviews(newReviews).updatedAt(now).build();
    }

    /**
     * Create a copy positioned on another node with the given status.
     */
    public WorkflowInstance movedTo(String nodeId, String statusId, Instant now) {
        return toBuilder()
            .currentNodeId(nodeId)
            .currentStatusId(statusId)
            .updatedAt(now)
            .build();
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private String id;
        private String workflowDefinitionId;
        private String projectId;
        private String documentId;
        private String documentName;
        private String currentNodeId;
        private String currentStatusId;
        private String startedBy;
        private Instant startedAt;
        private Instant updatedAt;
        private Instant completedAt;
        private List<WorkflowHistoryEntry> history;
        private List<WorkflowReview> reviews;
        private long sequenceNumber;

        public Builder(WorkflowInstance instance) {
            this.id = instance.id();
            this.workflowDefinitionId = instance.workflowDefinitionId();
            this.projectId = instance.projectId();
            this.documentId = instance.documentId();
            this.documentName = instance.documentName();
            this.currentNodeId = instance.currentNodeId();
            this.currentStatusId = instance.currentStatusId();
            this.startedBy = instance.startedBy();
            this.startedAt = instance.startedAt();
            this.updatedAt = instance.updatedAt();
            this.completedAt = instance.completedAt();
            this.history = instance.history();
            this.reviews = instance.reviews();
            this.sequenceNumber = instance.sequenceNumber();
        }

        public Builder currentNodeId(String currentNodeId) {
            this.currentNodeId = currentNodeId;
            return this;
        }

        public Builder currentStatusId(String currentStatusId) {
            this.currentStatusId = currentStatusId;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder history(List<WorkflowHistoryEntry> history) {
            this.history = history;
            return this;
        }

        public Builder reviews(List<WorkflowReview> reviews) {
            this.reviews = reviews;
            return this;
        }

        public Builder sequenceNumber(long sequenceNumber) {
            this.sequenceNumber = sequenceNumber;
            return this;
        }

        public Builder incrementSequence() {
            this.sequenceNumber++;
            return this;
        }

        public WorkflowInstance build() {
            return new WorkflowInstance(
                id, workflowDefinitionId, projectId, documentId, documentName,
                currentNodeId, currentStatusId, startedBy, startedAt, updatedAt,
                completedAt, history, reviews, sequenceNumber
            );
        }
    }
}
