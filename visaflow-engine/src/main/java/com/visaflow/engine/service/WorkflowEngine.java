package com.visaflow.engine.service;

import com.visaflow.core.event.EventBus;
import com.visaflow.core.model.ReviewDecision;
import com.visaflow.core.model.ValidationDocument;
import com.visaflow.core.model.WorkflowDefinition;
import com.visaflow.core.model.WorkflowInstance;
import com.visaflow.engine.event.EngineEvent;

import java.util.List;
import java.util.function.Consumer;

/**
 * Executes workflow definitions against documents.
 * Every call is one transition sequence: it either commits completely or leaves
 * no trace in the stores.
 */
public interface WorkflowEngine {

    /**
     * Start a workflow for a document.
     * Places the instance on the start node and advances until a review node
     * or an end node is reached.
     * 
     * @param definition The workflow definition
     * @param document The document to validate
     * @return The committed instance
     * @throws com.visaflow.core.exception.DefinitionInvalidException if the definition has no start node,
     *         no status, or a cycle of non-blocking nodes
     * @throws com.visaflow.core.exception.CollaboratorUnavailableException if the stores cannot be written
     */
    WorkflowInstance startWorkflow(WorkflowDefinition definition, ValidationDocument document);

    /**
     * Record a reviewer's decision and advance the instance if its review node's quota is met.
     * 
     * @param instanceId The instance ID
     * @param review The decision
     * @return The committed instance
     * @throws com.visaflow.core.exception.InstanceNotFoundException if the instance does not exist
     * @throws com.visaflow.core.exception.DefinitionNotFoundException if its definition does not exist
     */
    WorkflowInstance submitReview(String instanceId, ReviewSubmission review);

    /**
     * Get workflow instance by ID.
     * 
     * @throws com.visaflow.core.exception.InstanceNotFoundException if the instance does not exist
     */
    WorkflowInstance getInstance(String instanceId);

    /**
     * Get every instance started for a document, oldest first.
     */
    List<WorkflowInstance> findInstancesForDocument(String documentId);

    /**
     * Subscribe to engine events. Listeners run off the engine's thread.
     */
    EventBus.Subscription onEvent(Consumer<? super EngineEvent> listener);

    /**
     * A reviewer's decision as submitted by a caller.
     */
    record ReviewSubmission(
        String reviewerId,
        String reviewerName,
        String reviewerEmail,
        ReviewDecision decision,
        String comment,
        List<String> observations
    ) {
        public ReviewSubmission {
            if (decision == null) {
                throw new IllegalArgumentException("decision is required");
            }
            observations = observations == null ? List.of() : List.copyOf(observations);
        }

        public static ReviewSubmission of(String reviewerId, String reviewerName, ReviewDecision decision) {
            return new ReviewSubmission(reviewerId, reviewerName, null, decision, null, null);
        }

        public ReviewSubmission withComment(String comment) {
            return new ReviewSubmission(reviewerId, reviewerName, reviewerEmail, decision, comment, observations);
        }

        public ReviewSubmission withObservations(List<String> observations) {
            return new ReviewSubmission(reviewerId, reviewerName, reviewerEmail, decision, comment, observations);
        }
    }
}
