package com.visaflow.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * One reviewer's decision on a document (a "visa").
 * Reviews are append-only; a reviewer may submit several times and all are kept.
 */
public record WorkflowReview(
    String id,
    String instanceId,
    String reviewerId,
    String reviewerName,
    String reviewerEmail,
    ReviewDecision decision,
    String comment,
    List<String> observations,
    Instant requestedAt,
    Instant reviewedAt,
    @JsonProperty("isCompleted") boolean completed
) {
    public WorkflowReview {
        observations = observations == null ? List.of() : List.copyOf(observations);
    }

    public boolean hasObservations() {
        return !observations.isEmpty();
    }

    public boolean hasComment() {
        return comment != null && !comment.isBlank();
    }
}
