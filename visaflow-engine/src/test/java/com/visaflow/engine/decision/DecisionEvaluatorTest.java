package com.visaflow.engine.decision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.visaflow.core.model.*;
import com.visaflow.engine.test.WorkflowFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

class DecisionEvaluatorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");
    private static final WorkflowNode DECISION = WorkflowNode.of("decision", NodeType.DECISION, NodeData.labeled("Tri"));

    private final DecisionEvaluator evaluator = new DecisionEvaluator();
    private WorkflowInstance baseInstance;

    @BeforeEach
    void setUp() {
        WorkflowDefinition definition = WorkflowFixtures.visaWorkflow();
        baseInstance = WorkflowInstance.create(definition,
            WorkflowFixtures.document("file-1", "plan.pdf", NOW), "decision", "pending", NOW);
    }

    private WorkflowInstance reviewed(ReviewDecision... decisions) {
        WorkflowInstance instance = baseInstance;
        for (ReviewDecision decision : decisions) {
            instance = instance.withReview(new WorkflowReview(UUID.randomUUID().toString(), instance.id(),
                "r", "Reviewer", null, decision, null, List.of(), NOW, NOW, true), NOW);
        }
        return instance;
    }

    private static WorkflowNode status(String id, String label, String statusId) {
        return WorkflowNode.of(id, NodeType.STATUS, NodeData.status(label, statusId, null));
    }

    private static final List<WorkflowNode> LABELED_TARGETS = List.of(
        DECISION, status("ok", "OK", "approved"), status("ko", "KO", "rejected"), status("obs", "Obs", "commented"));

    private static final List<WorkflowEdge> LABELED_EDGES = List.of(
        WorkflowEdge.labeled("to-ok", "decision", "ok", "Approuvé"),
        WorkflowEdge.labeled("to-ko", "decision", "ko", "Refusé"),
        WorkflowEdge.labeled("to-obs", "decision", "obs", "Avec observations"));

    private Optional<DecisionResult> evaluate(List<WorkflowEdge> edges, List<WorkflowNode> nodes,
                                              WorkflowInstance instance) {
        return evaluator.evaluate(DECISION, edges, instance, nodes);
    }

    // ========== Implicit label matching ==========

    @ParameterizedTest
    @EnumSource(value = ReviewDecision.class, names = {"REJECTED", "REFUSED", "VAO_BLOCKING"})
    @DisplayName("Any rejection wins over approvals and comments")
    void testRejectionPriority(ReviewDecision rejection) {
        DecisionResult result = evaluate(LABELED_EDGES, LABELED_TARGETS,
            reviewed(ReviewDecision.APPROVED, ReviewDecision.VAO, rejection)).orElseThrow();

        assertEquals("to-ko", result.edgeId());
        assertEquals("ko", result.targetNodeId());
        assertEquals("Rejeté: " + rejection.value(), result.reason());
    }

    @Test
    @DisplayName("Approved and VSO reviews select the approval branch")
    void testAllApproved() {
        DecisionResult result = evaluate(LABELED_EDGES, LABELED_TARGETS,
            reviewed(ReviewDecision.APPROVED, ReviewDecision.VSO)).orElseThrow();

        assertEquals("to-ok", result.edgeId());
        assertEquals("Toutes les reviews sont approuvées", result.reason());
        assertEquals("Approuvé", result.displayLabel());
    }

    @Test
    @DisplayName("A reservation without rejection selects the comment branch")
    void testCommented() {
        DecisionResult result = evaluate(LABELED_EDGES, LABELED_TARGETS,
            reviewed(ReviewDecision.APPROVED, ReviewDecision.APPROVED_WITH_COMMENTS)).orElseThrow();

        assertEquals("to-obs", result.edgeId());
        assertEquals("Commenté: approved_with_comments", result.reason());
    }

    @Test
    @DisplayName("Unlabeled edges are matched on the target status, then on the target label")
    void testMatchByTargetStatusThenLabel() {
        List<WorkflowNode> nodes = List.of(DECISION,
            WorkflowNode.of("first", NodeType.ACTION, NodeData.labeled("Archivage")),
            status("refusal", "Retour entreprise", "refused"),
            WorkflowNode.of("validated", NodeType.END, NodeData.labeled("Validé")));
        List<WorkflowEdge> edges = List.of(
            WorkflowEdge.of("e-first", "decision", "first"),
            WorkflowEdge.of("e-refusal", "decision", "refusal"),
            WorkflowEdge.of("e-validated", "decision", "validated"));

        assertEquals("e-refusal", evaluate(edges, nodes, reviewed(ReviewDecision.REFUSED)).orElseThrow().edgeId());
        assertEquals("e-validated", evaluate(edges, nodes, reviewed(ReviewDecision.APPROVED)).orElseThrow().edgeId());
    }

    @Test
    @DisplayName("Without a matching edge the first edge is used")
    void testFallbackToFirstEdge() {
        List<WorkflowEdge> edges = List.of(
            WorkflowEdge.labeled("a", "decision", "ok", "Suite"),
            WorkflowEdge.labeled("b", "decision", "obs", "Autre"));
        List<WorkflowNode> nodes = List.of(DECISION,
            WorkflowNode.of("ok", NodeType.END, NodeData.labeled("Fin")),
            WorkflowNode.of("obs", NodeType.END, NodeData.labeled("Fin bis")));

        DecisionResult result = evaluate(edges, nodes, reviewed(ReviewDecision.REJECTED)).orElseThrow();

        assertEquals("a", result.edgeId());
        assertEquals("Aucune transition correspondante trouvée, fallback", result.reason());
    }

    @Test
    @DisplayName("Pending-only reviews take the default branch")
    void testDefaultBranch() {
        DecisionResult result = evaluate(LABELED_EDGES, LABELED_TARGETS, reviewed(ReviewDecision.PENDING)).orElseThrow();

        assertEquals("to-ok", result.edgeId());
        assertEquals("Résultat par défaut", result.reason());
    }

    @Test
    @DisplayName("Label matching never guesses before the first review")
    void testNoReviewsNoDecision() {
        assertThat(evaluate(LABELED_EDGES, LABELED_TARGETS, baseInstance)).isEmpty();
    }

    @Test
    @DisplayName("A decision node without edges yields nothing")
    void testNoEdges() {
        assertThat(evaluate(List.of(), LABELED_TARGETS, reviewed(ReviewDecision.APPROVED))).isEmpty();
    }

    // ========== Explicit conditions ==========

    private static WorkflowEdge conditional(String id, String target, ConditionField field,
                                            ConditionOperator operator, JsonNode value) {
        return new WorkflowEdge(id, "decision", target, null,
            new EdgeCondition("c-" + id, field, operator, value, null));
    }

    @Test
    @DisplayName("The first satisfied condition wins, in edge order")
    void testFirstSatisfiedConditionWins() {
        List<WorkflowEdge> edges = List.of(
            conditional("many", "ok", ConditionField.APPROVAL_COUNT, ConditionOperator.GREATER_THAN, IntNode.valueOf(2)),
            conditional("some", "obs", ConditionField.REVIEW_COUNT, ConditionOperator.EQUALS, IntNode.valueOf(2)),
            conditional("also", "ko", ConditionField.REVIEW_COUNT, ConditionOperator.LESS_THAN, IntNode.valueOf(5)));

        DecisionResult result = evaluate(edges, LABELED_TARGETS,
            reviewed(ReviewDecision.APPROVED, ReviewDecision.VSO)).orElseThrow();

        assertEquals("some", result.edgeId());
        assertEquals("Condition \"reviewCount\" satisfaite", result.reason());
        assertEquals("auto", result.displayLabel());
    }

    @Test
    @DisplayName("Unsatisfied conditions fall back to the first unconditioned edge, or to nothing")
    void testConditionFallback() {
        WorkflowEdge never = conditional("never", "ko", ConditionField.REJECTION_COUNT,
            ConditionOperator.GREATER_THAN, IntNode.valueOf(0));
        List<WorkflowEdge> withDefault = List.of(never, WorkflowEdge.of("default", "decision", "ok"));

        assertEquals("default", evaluate(withDefault, LABELED_TARGETS, reviewed(ReviewDecision.APPROVED))
            .orElseThrow().edgeId());
        assertThat(evaluate(List.of(never), LABELED_TARGETS, reviewed(ReviewDecision.APPROVED))).isEmpty();
    }

    @Test
    void conditionOperators() {
        ReviewSummary summary = new ReviewSummary(reviewed(ReviewDecision.APPROVED, ReviewDecision.VAO_BLOCKING)
            .completedReviews());
        List<JsonNode> blockingValues = new ArrayList<>();
        blockingValues.add(TextNode.valueOf("refused"));
        blockingValues.add(TextNode.valueOf("vao_blocking"));

        assertTrue(evaluator.test(condition(ConditionField.LAST_DECISION, ConditionOperator.EQUALS,
            TextNode.valueOf("vao_blocking")), summary));
        assertTrue(evaluator.test(condition(ConditionField.LAST_DECISION, ConditionOperator.NOT_EQUALS,
            TextNode.valueOf("approved")), summary));
        assertTrue(evaluator.test(condition(ConditionField.LAST_DECISION, ConditionOperator.CONTAINS,
            TextNode.valueOf("blocking")), summary));
        assertTrue(evaluator.test(condition(ConditionField.LAST_DECISION, ConditionOperator.IN,
            JsonNodeFactory.instance.arrayNode().addAll(blockingValues)), summary));
        assertTrue(evaluator.test(condition(ConditionField.REJECTION_COUNT, ConditionOperator.EQUALS,
            IntNode.valueOf(1)), summary));
        assertFalse(evaluator.test(condition(ConditionField.HAS_OBSERVATIONS, ConditionOperator.EQUALS,
            BooleanNode.TRUE), summary));
    }

    @Test
    void conditionTypeMismatchNeverMatches() {
        ReviewSummary summary = new ReviewSummary(reviewed(ReviewDecision.APPROVED).completedReviews());

        assertFalse(evaluator.test(condition(ConditionField.APPROVAL_COUNT, ConditionOperator.EQUALS,
            TextNode.valueOf("1")), summary));
        assertFalse(evaluator.test(condition(ConditionField.APPROVAL_COUNT, ConditionOperator.CONTAINS,
            TextNode.valueOf("1")), summary));
        assertFalse(evaluator.test(condition(ConditionField.LAST_DECISION, ConditionOperator.GREATER_THAN,
            IntNode.valueOf(0)), summary));
    }

    private static EdgeCondition condition(ConditionField field, ConditionOperator operator, JsonNode value) {
        return new EdgeCondition("c", field, operator, value, null);
    }
}
