package com.visaflow.engine.coordinator;

import com.fasterxml.jackson.databind.node.IntNode;
import com.visaflow.core.exception.DefinitionInvalidException;
import com.visaflow.core.exception.DefinitionNotFoundException;
import com.visaflow.core.model.*;
import com.visaflow.engine.action.ActionExecutor;
import com.visaflow.engine.decision.DecisionEvaluator;
import com.visaflow.engine.event.EngineEventType;
import com.visaflow.engine.service.WorkflowEngine.ReviewSubmission;
import com.visaflow.engine.test.EngineHarness;
import com.visaflow.engine.test.WorkflowFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

class WorkflowCoordinatorTest {

    private EngineHarness harness;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness();
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private ValidationDocument document() {
        return WorkflowFixtures.document("file-1", "plan.pdf", harness.clock.now());
    }

    private static WorkflowNode start() {
        return WorkflowNode.of("start", NodeType.START, NodeData.labeled("Début"));
    }

    private static WorkflowNode status(String id, String statusId) {
        return WorkflowNode.of(id, NodeType.STATUS, NodeData.status(id, statusId, null));
    }

    private static WorkflowNode end() {
        return WorkflowNode.of("end", NodeType.END, NodeData.labeled("Fin"));
    }

    // ========== Traversal guards ==========

    @Test
    @DisplayName("A loop of non-blocking nodes is rejected and nothing is committed")
    void testCycleDetection() {
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .id("def-loop")
            .statuses(WorkflowFixtures.standardStatuses())
            .nodes(List.of(start(), status("a", "pending"), status("b", "approved")))
            .edges(List.of(
                WorkflowEdge.of("e1", "start", "a"),
                WorkflowEdge.of("e2", "a", "b"),
                WorkflowEdge.of("e3", "b", "a")))
            .build();

        DefinitionInvalidException error = assertThrows(DefinitionInvalidException.class,
            () -> harness.engine.startWorkflow(definition, document()));

        assertThat(error.getMessage()).contains("cyclic path").contains("'a'");
        assertEquals(0, harness.storedInstances.size());
        assertThat(harness.documents.findAll()).isEmpty();
        assertThat(harness.notifications).isEmpty();
    }

    @Test
    @DisplayName("A chain longer than the traversal depth is rejected")
    void testTraversalDepthCap() {
        harness.close();
        harness = new EngineHarness(null, EngineHarness.testSettings().withMaxTraversalDepth(3));
        WorkflowDefinition definition = WorkflowFixtures.chain("def-long",
            start(), status("s1", "pending"), status("s2", "pending"), status("s3", "pending"),
            status("s4", "pending"), end());

        assertThatThrownBy(() -> harness.engine.startWorkflow(definition, document()))
            .isInstanceOf(DefinitionInvalidException.class)
            .hasMessageContaining("exceeded 3 hops");
        assertEquals(0, harness.storedInstances.size());
    }

    @Test
    @DisplayName("A node without outgoing edge stops the traversal silently")
    void testDeadEnd() {
        WorkflowDefinition definition = WorkflowFixtures.chain("def-dead-end", start(), status("a", "pending"));

        WorkflowInstance instance = harness.engine.startWorkflow(definition, document());

        assertEquals("a", instance.currentNodeId());
        assertFalse(instance.isCompleted());
        assertThat(instance.history()).hasSize(2);
    }

    @Test
    @DisplayName("Timer and parallel nodes are passed through")
    void testUnsupportedNodesPassThrough() {
        WorkflowDefinition definition = WorkflowFixtures.chain("def-timer",
            start(),
            WorkflowNode.of("timer", NodeType.TIMER, NodeData.labeled("Délai")),
            WorkflowNode.of("parallel", NodeType.PARALLEL, NodeData.labeled("Parallèle")),
            end());

        WorkflowInstance instance = harness.engine.startWorkflow(definition, document());

        assertEquals("end", instance.currentNodeId());
        assertTrue(instance.isCompleted());
        assertThat(instance.history()).hasSize(1);
    }

    // ========== Decisions ==========

    @Test
    @DisplayName("A decision node reached before any review keeps the instance on it")
    void testDecisionWithoutReviewsWaits() {
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .id("def-early-decision")
            .statuses(WorkflowFixtures.standardStatuses())
            .nodes(List.of(start(), WorkflowNode.of("decision", NodeType.DECISION, NodeData.labeled("Tri")),
                status("ok", "approved"), status("ko", "rejected")))
            .edges(List.of(
                WorkflowEdge.of("e1", "start", "decision"),
                WorkflowEdge.labeled("e2", "decision", "ok", "Validé"),
                WorkflowEdge.labeled("e3", "decision", "ko", "Refusé")))
            .build();

        WorkflowInstance instance = harness.engine.startWorkflow(definition, document());

        assertEquals("decision", instance.currentNodeId());
        assertThat(instance.history()).hasSize(1);
    }

    @Test
    @DisplayName("Explicit conditions route on the review aggregate")
    void testExplicitConditionRouting() {
        EdgeCondition twoApprovals = new EdgeCondition("c1", ConditionField.APPROVAL_COUNT,
            ConditionOperator.GREATER_THAN, IntNode.valueOf(1), "Deux visas");
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .id("def-conditions")
            .statuses(WorkflowFixtures.standardStatuses())
            .nodes(List.of(start(),
                WorkflowNode.of("review", NodeType.REVIEW, NodeData.review("Visa", 1, List.of())),
                WorkflowNode.of("decision", NodeType.DECISION, NodeData.labeled("Tri")),
                WorkflowNode.of("end-ok", NodeType.END, NodeData.labeled("Validé")),
                WorkflowNode.of("end-more", NodeType.END, NodeData.labeled("Second visa"))))
            .edges(List.of(
                WorkflowEdge.of("e1", "start", "review"),
                WorkflowEdge.of("e2", "review", "decision"),
                new WorkflowEdge("e3", "decision", "end-ok", null, twoApprovals),
                WorkflowEdge.of("e4", "decision", "end-more")))
            .build();
        harness.definitions.save(definition);
        WorkflowInstance started = harness.engine.startWorkflow(definition, document());

        WorkflowInstance result = harness.engine.submitReview(started.id(),
            ReviewSubmission.of("r1", "Alice", ReviewDecision.APPROVED));

        assertEquals("end-more", result.currentNodeId());
        assertThat(result.history()).extracting(WorkflowHistoryEntry::action)
            .contains("Décision: auto — Aucune condition satisfaite, fallback");
    }

    @Test
    @DisplayName("A commented review can send the document back to the same review node")
    void testResubmissionLoop() {
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .id("def-resubmit")
            .statuses(WorkflowFixtures.standardStatuses())
            .nodes(List.of(start(),
                WorkflowNode.of("review", NodeType.REVIEW, NodeData.review("Visa", 1, List.of())),
                WorkflowNode.of("decision", NodeType.DECISION, NodeData.labeled("Tri")),
                end()))
            .edges(List.of(
                WorkflowEdge.of("e1", "start", "review"),
                WorkflowEdge.of("e2", "review", "decision"),
                WorkflowEdge.labeled("e3", "decision", "end", "Approuvé"),
                WorkflowEdge.labeled("e4", "decision", "review", "À revoir")))
            .build();
        harness.definitions.save(definition);
        WorkflowInstance started = harness.engine.startWorkflow(definition, document());

        WorkflowInstance result = harness.engine.submitReview(started.id(),
            ReviewSubmission.of("r1", "Alice", ReviewDecision.APPROVED_WITH_COMMENTS).withComment("Cartouche incomplet"));

        assertEquals("review", result.currentNodeId());
        assertEquals("commented", result.currentStatusId());
        assertFalse(result.isCompleted());
    }

    // ========== Actions ==========

    @Test
    @DisplayName("A failing action is reported and the traversal continues")
    void testFailingActionDoesNotHalt() {
        AutoAction metadata = new AutoAction("act-meta", AutoActionType.UPDATE_METADATA, null, null);
        AutoAction copy = new AutoAction("act-copy", AutoActionType.COPY_FILE, null, null);
        WorkflowDefinition definition = WorkflowFixtures.chain("def-actions",
                start(),
                WorkflowNode.of("actions", NodeType.ACTION, NodeData.action("Automatismes", List.of(metadata, copy))),
                end())
            .toBuilder()
            .settings(WorkflowSettings.defaults().withFolders(null, "folder-archive", null))
            .build();

        WorkflowInstance instance = harness.engine.startWorkflow(definition, document());

        assertTrue(instance.isCompleted());
        assertThat(harness.eventsOfType(EngineEventType.ACTION_EXECUTED))
            .extracting(e -> e.data().get("actionId"), e -> e.data().get("success"))
            .containsExactly(tuple("act-meta", false), tuple("act-copy", true));
        assertThat(harness.files.transfers()).singleElement()
            .satisfies(t -> {
                assertEquals("folder-archive", t.targetFolderId());
                assertTrue(t.copy());
            });
    }

    // ========== Collaborators ==========

    @Test
    @DisplayName("Notification failures are logged and do not fail the trigger")
    void testNotificationFailureIgnored() {
        WorkflowDefinition definition = WorkflowFixtures.visaWorkflow();
        WorkflowCoordinator engine = new WorkflowCoordinator(
            harness.definitions, harness.storedInstances, harness.documents,
            n -> {
                throw new IllegalStateException("mail relay down");
            },
            new DecisionEvaluator(),
            new ActionExecutor(),
            harness.eventBus, harness.invoker, harness.metrics, EngineHarness.testSettings(), harness.clock);

        WorkflowInstance instance = engine.startWorkflow(definition, document());

        assertEquals("review", instance.currentNodeId());
        assertThat(harness.storedInstances.findById(instance.id())).isPresent();
    }

    @Test
    @DisplayName("Review on an instance whose definition was removed fails")
    void testReviewWithoutDefinition() {
        WorkflowInstance started = harness.engine.startWorkflow(WorkflowFixtures.visaWorkflow(), document());

        assertThrows(DefinitionNotFoundException.class, () -> harness.engine.submitReview(started.id(),
            ReviewSubmission.of("r1", "Alice", ReviewDecision.APPROVED)));
        assertThat(harness.storedInstances.findById(started.id()).orElseThrow().reviews()).isEmpty();
    }

    @Test
    @DisplayName("Instances can be looked up by document")
    void testFindInstancesForDocument() {
        ValidationDocument document = document();
        WorkflowInstance first = harness.engine.startWorkflow(WorkflowFixtures.visaWorkflow(), document);
        harness.clock.advanceSeconds(1);
        WorkflowInstance second = harness.engine.startWorkflow(WorkflowFixtures.visaWorkflow(), document);

        assertThat(harness.engine.findInstancesForDocument(document.id()))
            .extracting(WorkflowInstance::id)
            .containsExactly(first.id(), second.id());
        assertEquals(second, harness.engine.getInstance(second.id()));
    }
}
