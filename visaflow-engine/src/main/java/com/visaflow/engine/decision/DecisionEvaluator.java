package com.visaflow.engine.decision;

import com.fasterxml.jackson.databind.JsonNode;
import com.visaflow.core.model.EdgeCondition;
import com.visaflow.core.model.ReviewDecision;
import com.visaflow.core.model.WorkflowEdge;
import com.visaflow.core.model.WorkflowInstance;
import com.visaflow.core.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Chooses the edge to follow at a decision node. Pure: reads the instance's
 * completed reviews and the graph, changes nothing.
 * <p>
 * Explicit edge conditions are the primary mechanism. When no outgoing edge carries
 * a condition, the evaluator classifies the reviews (rejection, approval, comment)
 * and looks for a matching edge by label, by target status or by target node name.
 * The label heuristics match French workflow vocabulary and are kept as a fallback only.
 */
public class DecisionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DecisionEvaluator.class);

    /**
     * Routing intent derived from the review aggregate.
     */
    enum Intent {
        APPROVED(Pattern.compile("approu|valid|accept|vso|visa\\s*sans", Pattern.CASE_INSENSITIVE),
            Set.of("approved", "vso")),
        COMMENTED(Pattern.compile("comment|observ|vao(?!\\s*bloq)|revoir", Pattern.CASE_INSENSITIVE),
            Set.of("commented", "vao")),
        REJECTED(Pattern.compile("rejet|refus|bloq|denied", Pattern.CASE_INSENSITIVE),
            Set.of("rejected", "refused", "vao_blocking"));

        private final Pattern labelPattern;
        private final Set<String> statusIds;

        Intent(Pattern labelPattern, Set<String> statusIds) {
            this.labelPattern = labelPattern;
            this.statusIds = statusIds;
        }

        boolean matchesText(String text) {
            return text != null && labelPattern.matcher(text).find();
        }

        boolean matchesStatus(String statusId) {
            return statusId != null && statusIds.contains(statusId);
        }
    }

    /**
     * Evaluate a decision node.
     *
     * @param decisionNode  the decision node
     * @param outgoingEdges its outgoing edges, in definition order
     * @param instance      the instance being routed
     * @param allNodes      every node of the definition
     * @return the edge to follow; empty when there is no edge, or when label matching
     *         would have to guess before any review exists
     */
    public Optional<DecisionResult> evaluate(
            WorkflowNode decisionNode,
            List<WorkflowEdge> outgoingEdges,
            WorkflowInstance instance,
            List<WorkflowNode> allNodes) {
        if (outgoingEdges.isEmpty()) {
            return Optional.empty();
        }

        ReviewSummary reviews = new ReviewSummary(instance.completedReviews());

        boolean explicit = outgoingEdges.stream().anyMatch(WorkflowEdge::hasCondition);
        Optional<DecisionResult> result = explicit
            ? evaluateConditions(outgoingEdges, reviews)
            : evaluateByIntent(outgoingEdges, reviews, allNodes);

        result.ifPresentOrElse(
            r -> log.debug("Decision node {} -> edge {} ({})", decisionNode.id(), r.edgeId(), r.reason()),
            () -> log.debug("Decision node {} has no applicable edge yet", decisionNode.id()));
        return result;
    }

    // ========== Explicit conditions ==========

    private Optional<DecisionResult> evaluateConditions(List<WorkflowEdge> edges, ReviewSummary reviews) {
        for (WorkflowEdge edge : edges) {
            if (edge.hasCondition() && test(edge.condition(), reviews)) {
                return Optional.of(new DecisionResult(edge.id(), edge.target(), edge.label(),
                    String.format("Condition \"%s\" satisfaite", edge.condition().displayName())));
            }
        }

        return edges.stream()
            .filter(e -> !e.hasCondition())
            .findFirst()
            .map(e -> new DecisionResult(e.id(), e.target(), e.label(), "Aucune condition satisfaite, fallback"));
    }

    /**
     * Test one condition against the review aggregate.
     * Type mismatches (a number compared with a string) never match.
     */
    boolean test(EdgeCondition condition, ReviewSummary reviews) {
        Object fieldValue = switch (condition.field()) {
            case APPROVAL_COUNT -> reviews.approvalCount();
            case REJECTION_COUNT -> reviews.rejectionCount();
            case REVIEW_COUNT -> reviews.reviewCount();
            case LAST_DECISION -> reviews.lastDecision();
            case HAS_OBSERVATIONS -> reviews.hasObservations();
        };
        JsonNode value = condition.value();

        return switch (condition.operator()) {
            case EQUALS -> sameValue(fieldValue, value);
            case NOT_EQUALS -> !sameValue(fieldValue, value);
            case GREATER_THAN -> fieldValue instanceof Integer && isNumber(value)
                && (Integer) fieldValue > value.asDouble();
            case LESS_THAN -> fieldValue instanceof Integer && isNumber(value)
                && (Integer) fieldValue < value.asDouble();
            case CONTAINS -> fieldValue instanceof String && value != null && value.isTextual()
                && ((String) fieldValue).contains(value.asText());
            case IN -> value != null && value.isArray() && containsValue(value, fieldValue);
        };
    }

    private static boolean sameValue(Object fieldValue, JsonNode value) {
        if (fieldValue == null || value == null || value.isNull()) {
            return false;
        }
        if (fieldValue instanceof Integer) {
            return value.isNumber() && value.asDouble() == (Integer) fieldValue;
        }
        if (fieldValue instanceof Boolean) {
            return value.isBoolean() && value.asBoolean() == (Boolean) fieldValue;
        }
        return value.isTextual() && value.asText().equals(fieldValue);
    }

    private static boolean containsValue(JsonNode array, Object fieldValue) {
        for (JsonNode element : array) {
            if (sameValue(fieldValue, element)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNumber(JsonNode value) {
        return value != null && value.isNumber();
    }

    // ========== Label matching fallback ==========

    private Optional<DecisionResult> evaluateByIntent(
            List<WorkflowEdge> edges, ReviewSummary reviews, List<WorkflowNode> allNodes) {
        if (reviews.isEmpty()) {
            return Optional.empty();
        }

        Optional<WorkflowEdge> edge;
        String reason;
        if (reviews.hasRejection()) {
            edge = findEdgeByIntent(edges, allNodes, Intent.REJECTED);
            reason = "Rejeté: " + reviews.decisionsMatching(ReviewDecision::isRejection);
        } else if (reviews.allApproved()) {
            edge = findEdgeByIntent(edges, allNodes, Intent.APPROVED);
            reason = "Toutes les reviews sont approuvées";
        } else if (reviews.hasComment()) {
            edge = findEdgeByIntent(edges, allNodes, Intent.COMMENTED);
            reason = "Commenté: " + reviews.decisionsMatching(ReviewDecision::isComment);
        } else {
            edge = Optional.of(edges.get(0));
            reason = "Résultat par défaut";
        }

        if (edge.isEmpty()) {
            edge = Optional.of(edges.get(0));
            reason = "Aucune transition correspondante trouvée, fallback";
        }

        WorkflowEdge chosen = edge.get();
        return Optional.of(new DecisionResult(chosen.id(), chosen.target(), chosen.label(), reason));
    }

    /**
     * Find the edge matching an intent by edge label, then target status id, then target node label.
     */
    Optional<WorkflowEdge> findEdgeByIntent(List<WorkflowEdge> edges, List<WorkflowNode> allNodes, Intent intent) {
        Optional<WorkflowEdge> byLabel = edges.stream()
            .filter(e -> intent.matchesText(e.label()))
            .findFirst();
        if (byLabel.isPresent()) {
            return byLabel;
        }

        Optional<WorkflowEdge> byStatus = edges.stream()
            .filter(e -> target(e, allNodes).map(n -> intent.matchesStatus(n.data().statusId())).orElse(false))
            .findFirst();
        if (byStatus.isPresent()) {
            return byStatus;
        }

        return edges.stream()
            .filter(e -> target(e, allNodes).map(n -> intent.matchesText(n.data().label())).orElse(false))
            .findFirst();
    }

    private static Optional<WorkflowNode> target(WorkflowEdge edge, List<WorkflowNode> allNodes) {
        return allNodes.stream().filter(n -> n.id().equals(edge.target())).findFirst();
    }
}
