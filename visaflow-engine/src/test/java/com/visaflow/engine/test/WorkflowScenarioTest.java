package com.visaflow.engine.test;

import com.visaflow.core.exception.CollaboratorUnavailableException;
import com.visaflow.core.exception.DefinitionInvalidException;
import com.visaflow.core.exception.InstanceNotFoundException;
import com.visaflow.core.model.*;
import com.visaflow.engine.event.EngineEvent;
import com.visaflow.engine.event.EngineEventType;
import com.visaflow.engine.metrics.WorkflowMetrics;
import com.visaflow.engine.service.WorkflowEngine.ReviewSubmission;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end workflow scenarios over the in-memory stores.
 */
class WorkflowScenarioTest {

    private EngineHarness harness;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness();
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private WorkflowInstance start(WorkflowDefinition definition, String fileName) {
        harness.definitions.save(definition);
        ValidationDocument document = WorkflowFixtures.document("file-" + fileName, fileName, harness.clock.now());
        return harness.engine.startWorkflow(definition, document);
    }

    private static ReviewSubmission review(String reviewerId, ReviewDecision decision) {
        return ReviewSubmission.of(reviewerId, "Reviewer " + reviewerId, decision);
    }

    // ========== Start ==========

    @Test
    @DisplayName("Start should stop on the first review node with one started entry")
    void testStartStopsOnReview() {
        WorkflowInstance instance = start(WorkflowFixtures.visaWorkflow(), "plan-A.pdf");

        assertThat(instance.currentNodeId()).isEqualTo("review");
        assertThat(instance.currentStatusId()).isEqualTo("pending");
        assertThat(instance.isCompleted()).isFalse();
        assertThat(instance.history()).extracting(WorkflowHistoryEntry::action)
            .containsExactly(
                WorkflowHistoryEntry.ACTION_STARTED,
                "Transition: Début → En attente",
                "Transition: En attente → Visa");

        ValidationDocument stored = harness.documents.findById(instance.documentId()).orElseThrow();
        assertThat(stored.workflowInstanceId()).isEqualTo(instance.id());
        assertThat(stored.currentStatus().id()).isEqualTo("pending");

        assertThat(harness.storedInstances.findById(instance.id())).contains(instance);
        assertThat(harness.eventsOfType(EngineEventType.STARTED)).hasSize(1);
        assertThat(harness.notifications).extracting(Notification::title).containsExactly("Changement de statut");
    }

    @Test
    @DisplayName("Each start creates exactly one instance and leaves other instances untouched")
    void testStartIsolation() {
        WorkflowDefinition definition = WorkflowFixtures.visaWorkflow();
        WorkflowInstance first = start(definition, "plan-A.pdf");
        WorkflowInstance second = start(definition, "plan-B.pdf");

        assertThat(harness.storedInstances.size()).isEqualTo(2);
        assertThat(second.id()).isNotEqualTo(first.id());
        assertThat(harness.storedInstances.findById(first.id())).contains(first);
        for (WorkflowInstance instance : List.of(first, second)) {
            assertThat(instance.history())
                .filteredOn(e -> WorkflowHistoryEntry.ACTION_STARTED.equals(e.action()))
                .hasSize(1);
        }
    }

    @Test
    @DisplayName("Start should fail without a start node and store nothing")
    void testStartWithoutStartNode() {
        WorkflowDefinition definition = WorkflowFixtures.chain("def-no-start",
            WorkflowNode.of("st", NodeType.STATUS, NodeData.status("En attente", "pending", null)),
            WorkflowNode.of("end", NodeType.END, NodeData.labeled("Fin")));
        ValidationDocument document = WorkflowFixtures.document("file-1", "plan.pdf", harness.clock.now());

        assertThatThrownBy(() -> harness.engine.startWorkflow(definition, document))
            .isInstanceOf(DefinitionInvalidException.class)
            .hasMessageContaining("no start node");
        assertThat(harness.storedInstances.size()).isZero();
        assertThat(harness.documents.findAll()).isEmpty();
        assertThat(harness.events).extracting(EngineEvent::type).containsExactly(EngineEventType.ERROR);
    }

    @Test
    @DisplayName("Start should fail when the definition has no status")
    void testStartWithoutStatuses() {
        WorkflowDefinition definition = WorkflowFixtures.chain("def-no-status",
                WorkflowNode.of("start", NodeType.START, NodeData.labeled("Début")),
                WorkflowNode.of("end", NodeType.END, NodeData.labeled("Fin")))
            .toBuilder().statuses(List.of()).build();
        ValidationDocument document = WorkflowFixtures.document("file-1", "plan.pdf", harness.clock.now());

        assertThatThrownBy(() -> harness.engine.startWorkflow(definition, document))
            .isInstanceOf(DefinitionInvalidException.class)
            .hasMessageContaining("no status");
        assertThat(harness.storedInstances.size()).isZero();
    }

    // ========== Reviews ==========

    @Test
    @DisplayName("Rejected review should end on the rejected branch with two new history entries")
    void testRejectedScenario() {
        WorkflowInstance started = start(WorkflowFixtures.visaWorkflow(), "plan-A.pdf");
        int entriesBefore = started.history().size();

        WorkflowInstance result = harness.engine.submitReview(started.id(), review("r1", ReviewDecision.REJECTED));

        assertThat(result.currentNodeId()).isEqualTo("end-rejected");
        assertThat(result.currentStatusId()).isEqualTo("rejected");
        assertThat(result.completedAt()).isNotNull();
        assertThat(result.history()).hasSize(entriesBefore + 2);
        assertThat(result.history().subList(entriesBefore, entriesBefore + 2))
            .extracting(WorkflowHistoryEntry::action)
            .containsExactly(
                "Décision: Rejeté — Rejeté: rejected",
                "Transition: Résultat → Rejeté");
        assertThat(harness.files.transfers()).isEmpty();
        assertThat(harness.documents.findById(result.documentId()).orElseThrow().currentStatus().id())
            .isEqualTo("rejected");
    }

    @Test
    @DisplayName("Approved review should run the move action and complete on the approved status")
    void testApprovedRoundTrip() {
        WorkflowInstance started = start(WorkflowFixtures.visaWorkflow(), "plan-A.pdf");
        harness.clock.advanceMinutes(5);

        WorkflowInstance result = harness.engine.submitReview(started.id(), review("r1", ReviewDecision.APPROVED));

        assertThat(result.currentNodeId()).isEqualTo("end-approved");
        assertThat(result.currentStatusId()).isEqualTo(ReviewDecision.APPROVED.mappedStatusId().orElseThrow());
        assertThat(result.completedAt()).isNotNull();
        assertThat(result.reviews()).singleElement()
            .satisfies(r -> {
                assertThat(r.completed()).isTrue();
                assertThat(r.reviewedAt()).isEqualTo(harness.clock.now());
            });
        assertThat(harness.files.transfers()).containsExactly(
            new RecordingFileService.Transfer("file-plan-A.pdf", WorkflowFixtures.VALIDATED_FOLDER, false));

        List<EngineEvent> actions = harness.eventsOfType(EngineEventType.ACTION_EXECUTED);
        assertThat(actions).singleElement()
            .satisfies(e -> assertThat(e.data()).containsEntry("success", true).containsEntry("actionType", "move_file"));
        assertThat(harness.eventsOfType(EngineEventType.COMPLETED)).singleElement()
            .satisfies(e -> assertThat(e.data()).containsEntry("finalStatus", "approved"));
        assertThat(harness.notifications).extracting(Notification::title)
            .contains("Document déplacé", "Workflow terminé");
        assertThat(harness.metrics.getRegistry().counter(WorkflowMetrics.WORKFLOW_COMPLETED,
            "definition", "def-visa").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Review node should wait until the required number of reviews is reached")
    void testReviewQuota() {
        WorkflowInstance started = start(WorkflowFixtures.visaWorkflow(3), "plan-A.pdf");

        WorkflowInstance afterFirst = harness.engine.submitReview(started.id(), review("r1", ReviewDecision.APPROVED));
        WorkflowInstance afterSecond = harness.engine.submitReview(started.id(), review("r2", ReviewDecision.VSO));

        assertThat(afterFirst.currentNodeId()).isEqualTo("review");
        assertThat(afterSecond.currentNodeId()).isEqualTo("review");
        assertThat(afterSecond.reviews()).hasSize(2);

        WorkflowInstance afterThird = harness.engine.submitReview(started.id(), review("r3", ReviewDecision.APPROVED));

        assertThat(afterThird.currentNodeId()).isEqualTo("end-approved");
        assertThat(afterThird.isCompleted()).isTrue();
        assertThat(afterThird.sequenceNumber()).isEqualTo(3L);
    }

    @Test
    @DisplayName("A rejection wins over approvals at the decision node")
    void testRejectionPriority() {
        WorkflowInstance started = start(WorkflowFixtures.visaWorkflow(2), "plan-A.pdf");

        harness.engine.submitReview(started.id(), review("r1", ReviewDecision.APPROVED));
        WorkflowInstance result = harness.engine.submitReview(started.id(), review("r2", ReviewDecision.VAO_BLOCKING));

        assertThat(result.currentNodeId()).isEqualTo("end-rejected");
        assertThat(result.currentStatusId()).isEqualTo("rejected");
    }

    @Test
    @DisplayName("Review on an unknown instance should fail and record nothing")
    void testReviewOnUnknownInstance() {
        start(WorkflowFixtures.visaWorkflow(), "plan-A.pdf");
        harness.events.clear();

        assertThatThrownBy(() -> harness.engine.submitReview("nonexistent-id", review("r1", ReviewDecision.APPROVED)))
            .isInstanceOf(InstanceNotFoundException.class);

        assertThat(harness.storedInstances.size()).isEqualTo(1);
        assertThat(harness.storedInstances.findByDefinitionId("def-visa"))
            .allSatisfy(i -> assertThat(i.reviews()).isEmpty());
        assertThat(harness.events).singleElement()
            .satisfies(e -> {
                assertThat(e.type()).isEqualTo(EngineEventType.ERROR);
                assertThat(e.data()).containsEntry("errorCode", InstanceNotFoundException.ERROR_CODE);
            });
    }

    @Test
    @DisplayName("Pending review is recorded without changing the status")
    void testPendingReviewKeepsStatus() {
        WorkflowInstance started = start(WorkflowFixtures.visaWorkflow(2), "plan-A.pdf");

        WorkflowInstance result = harness.engine.submitReview(started.id(), review("r1", ReviewDecision.PENDING));

        assertThat(result.currentStatusId()).isEqualTo("pending");
        assertThat(result.reviews()).hasSize(1);
    }

    @Test
    @DisplayName("A hung file service should fail the move action within the collaborator deadline")
    void testHungFileServiceDoesNotBlockReview() {
        try (EngineHarness shortDeadline = new EngineHarness(null, EngineHarness.testSettings(), Duration.ofMillis(200))) {
            WorkflowDefinition definition = WorkflowFixtures.visaWorkflow();
            shortDeadline.definitions.save(definition);
            WorkflowInstance started = shortDeadline.engine.startWorkflow(definition,
                WorkflowFixtures.document("file-plan-B.pdf", "plan-B.pdf", shortDeadline.clock.now()));
            shortDeadline.files.delayTransfers(Duration.ofSeconds(3));

            long before = System.nanoTime();
            WorkflowInstance result = shortDeadline.engine.submitReview(started.id(), review("r1", ReviewDecision.APPROVED));
            long elapsedMillis = Duration.ofNanos(System.nanoTime() - before).toMillis();

            assertThat(elapsedMillis).isLessThan(2000);
            assertThat(result.currentNodeId()).isEqualTo("end-approved");
            assertThat(shortDeadline.eventsOfType(EngineEventType.ACTION_EXECUTED)).singleElement()
                .satisfies(e -> assertThat(e.data())
                    .containsEntry("success", false)
                    .containsEntry("error", CollaboratorUnavailableException.ERROR_CODE)
                    .containsEntry("retryable", true));
            assertThat(shortDeadline.notifications).extracting(Notification::title)
                .doesNotContain("Document déplacé");
        }
    }

    // ========== Ordering ==========

    @Test
    @DisplayName("History timestamps stay strictly increasing under a frozen clock")
    void testHistoryTimestampsStrictlyIncreasing() {
        WorkflowInstance started = start(WorkflowFixtures.visaWorkflow(), "plan-A.pdf");
        WorkflowInstance result = harness.engine.submitReview(started.id(), review("r1", ReviewDecision.APPROVED));

        List<Instant> timestamps = result.history().stream().map(WorkflowHistoryEntry::timestamp).toList();
        for (int i = 1; i < timestamps.size(); i++) {
            assertThat(timestamps.get(i)).isAfter(timestamps.get(i - 1));
        }
    }

    @Test
    @DisplayName("Events of a trigger are published in traversal order")
    void testEventOrder() {
        start(WorkflowFixtures.visaWorkflow(), "plan-A.pdf");

        assertThat(harness.events).extracting(EngineEvent::type).containsExactly(
            EngineEventType.STARTED,
            EngineEventType.ADVANCED,
            EngineEventType.ADVANCED);
        assertThat(harness.events.get(2).data()).containsEntry("toNodeType", "review");
    }
}
