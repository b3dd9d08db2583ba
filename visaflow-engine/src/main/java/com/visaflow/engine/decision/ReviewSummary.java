package com.visaflow.engine.decision;

import com.visaflow.core.model.ReviewDecision;
import com.visaflow.core.model.WorkflowReview;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Aggregates of a set of completed reviews, as read by decision conditions.
 */
final class ReviewSummary {

    private final List<WorkflowReview> reviews;

    ReviewSummary(List<WorkflowReview> reviews) {
        this.reviews = List.copyOf(reviews);
    }

    boolean isEmpty() {
        return reviews.isEmpty();
    }

    int reviewCount() {
        return reviews.size();
    }

    int approvalCount() {
        return count(ReviewDecision::isApproval);
    }

    int rejectionCount() {
        return count(ReviewDecision::isRejection);
    }

    boolean hasRejection() {
        return rejectionCount() > 0;
    }

    boolean hasComment() {
        return count(ReviewDecision::isComment) > 0;
    }

    /**
     * Every review approves without reservation. False for an empty set.
     */
    boolean allApproved() {
        return !reviews.isEmpty() && reviews.stream().allMatch(r -> r.decision().isApproval());
    }

    boolean hasObservations() {
        return reviews.stream().anyMatch(WorkflowReview::hasObservations);
    }

    /**
     * Wire value of the most recent decision, or null without reviews.
     */
    String lastDecision() {
        return reviews.isEmpty() ? null : reviews.get(reviews.size() - 1).decision().value();
    }

    /**
     * Comma separated wire values of the decisions matching a category, in submission order.
     */
    String decisionsMatching(Predicate<ReviewDecision> category) {
        return reviews.stream()
            .map(WorkflowReview::decision)
            .filter(category)
            .map(ReviewDecision::value)
            .collect(Collectors.joining(", "));
    }

    private int count(Predicate<ReviewDecision> category) {
        return (int) reviews.stream().map(WorkflowReview::decision).filter(category).count();
    }
}
