package com.visaflow.engine.coordinator;

import com.visaflow.core.collaborator.NotificationService;
import com.visaflow.core.event.EventBus;
import com.visaflow.core.exception.*;
import com.visaflow.core.model.*;
import com.visaflow.core.repository.DocumentRepository;
import com.visaflow.core.repository.WorkflowDefinitionRepository;
import com.visaflow.core.repository.WorkflowInstanceRepository;
import com.visaflow.engine.action.ActionContext;
import com.visaflow.engine.action.ActionExecutor;
import com.visaflow.engine.action.ActionResult;
import com.visaflow.engine.config.EngineSettings;
import com.visaflow.engine.decision.DecisionEvaluator;
import com.visaflow.engine.decision.DecisionResult;
import com.visaflow.engine.event.EngineEvent;
import com.visaflow.engine.event.EngineEventType;
import com.visaflow.engine.invoke.CollaboratorInvoker;
import com.visaflow.engine.logging.LoggingContext;
import com.visaflow.engine.metrics.WorkflowMetrics;
import com.visaflow.engine.service.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Core workflow coordinator: interprets a definition's graph against an instance.
 * 
 * Each external trigger ({@link #startWorkflow}, {@link #submitReview}) runs as one
 * transition sequence over an in-memory snapshot, then commits in this order:
 * 1. the document (status, instance link)
 * 2. the instance (history, reviews, position) in a single write
 * If step 2 fails, step 1 is reverted and the trigger fails. Events and notifications
 * of the sequence are released only after the commit.
 * 
 * Node handling:
 * - start, status, action: follow the first outgoing edge
 * - review: wait for submitReview to meet the required approvals
 * - decision: follow the edge chosen by the DecisionEvaluator
 * - end: complete the instance
 * - timer, parallel: not supported yet, passed through with a warning
 */
public class WorkflowCoordinator implements WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    private static final String INSTANCE_STORE = "instance store";
    private static final String DEFINITION_STORE = "definition store";
    private static final String DOCUMENT_STORE = "document store";
    private static final int LOCK_STRIPES = 64;

    private final WorkflowDefinitionRepository definitionRepository;
    private final WorkflowInstanceRepository instanceRepository;
    private final DocumentRepository documentRepository;
    private final NotificationService notificationService;
    private final DecisionEvaluator decisionEvaluator;
    private final ActionExecutor actionExecutor;
    private final EventBus<EngineEvent> eventBus;
    private final CollaboratorInvoker invoker;
    private final WorkflowMetrics metrics;
    private final EngineSettings settings;
    private final Clock clock;
    private final ReentrantLock[] instanceLocks = new ReentrantLock[LOCK_STRIPES];

    public WorkflowCoordinator(
            WorkflowDefinitionRepository definitionRepository,
            WorkflowInstanceRepository instanceRepository,
            DocumentRepository documentRepository,
            NotificationService notificationService,
            DecisionEvaluator decisionEvaluator,
            ActionExecutor actionExecutor,
            EventBus<EngineEvent> eventBus,
            CollaboratorInvoker invoker,
            WorkflowMetrics metrics,
            EngineSettings settings,
            Clock clock) {
        this.definitionRepository = definitionRepository;
        this.instanceRepository = instanceRepository;
        this.documentRepository = documentRepository;
        this.notificationService = notificationService;
        this.decisionEvaluator = decisionEvaluator;
        this.actionExecutor = actionExecutor;
        this.eventBus = eventBus;
        this.invoker = invoker;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            instanceLocks[i] = new ReentrantLock();
        }
    }

    @Override
    public WorkflowInstance startWorkflow(WorkflowDefinition definition, ValidationDocument document) {
        try (var ctx = LoggingContext.forInstance(null, document.id(), definition.id())) {
            log.info("Starting workflow '{}' for document '{}'", definition.name(), document.fileName());
            try {
                return doStartWorkflow(definition, document);
            } catch (RuntimeException e) {
                publishError(LoggingContext.getInstanceId(), "startWorkflow", e);
                throw e;
            }
        }
    }

    @Override
    public WorkflowInstance submitReview(String instanceId, ReviewSubmission review) {
        try (var ctx = LoggingContext.forInstance(instanceId, null, null)) {
            ReentrantLock lock = lockFor(instanceId);
            lock.lock();
            try {
                return doSubmitReview(instanceId, review);
            } catch (RuntimeException e) {
                publishError(instanceId, "submitReview", e);
                throw e;
            } finally {
                lock.unlock();
            }
        }
    }

    @Override
    public WorkflowInstance getInstance(String instanceId) {
        return invoker.call(INSTANCE_STORE, () -> instanceRepository.findById(instanceId))
            .orElseThrow(() -> new InstanceNotFoundException(instanceId));
    }

    @Override
    public List<WorkflowInstance> findInstancesForDocument(String documentId) {
        return invoker.call(INSTANCE_STORE, () -> instanceRepository.findByDocumentId(documentId));
    }

    @Override
    public EventBus.Subscription onEvent(Consumer<? super EngineEvent> listener) {
        return eventBus.subscribe(listener);
    }

    // ========== Triggers ==========

    private WorkflowInstance doStartWorkflow(WorkflowDefinition definition, ValidationDocument document) {
        WorkflowNode startNode = definition.findStartNode()
            .orElseThrow(() -> new DefinitionInvalidException(definition.id(), "no start node"));
        WorkflowStatus initialStatus = definition.initialStatus()
            .orElseThrow(() -> new DefinitionInvalidException(definition.id(), "no status defined"));

        Instant now = clock.instant();
        WorkflowInstance instance = WorkflowInstance.create(
            definition, document, startNode.id(), initialStatus.id(), now);
        LoggingContext.setInstanceId(instance.id());

        ValidationDocument stored = invoker.call(DOCUMENT_STORE, () -> documentRepository.findById(document.id()))
            .orElse(null);
        TransitionSequence sequence = new TransitionSequence(
            definition, instance, stored, document, clock, settings.maxTraversalDepth());
        sequence.replaceDocument(document
            .withWorkflowInstanceId(instance.id())
            .withStatus(DocumentStatus.of(initialStatus, now, WorkflowHistoryEntry.SYSTEM_USER_NAME)));
        sequence.emit(EngineEventType.STARTED,
            "documentName", document.fileName(),
            "workflowName", definition.name(),
            "definitionId", definition.id());

        advanceFrom(sequence, startNode);

        WorkflowInstance committed = commit(sequence, true);
        log.info("Started workflow instance {} on node {}", committed.id(), committed.currentNodeId());
        release(sequence);
        return committed;
    }

    private WorkflowInstance doSubmitReview(String instanceId, ReviewSubmission submission) {
        WorkflowInstance instance = getInstance(instanceId);
        WorkflowDefinition definition = invoker.call(DEFINITION_STORE,
                () -> definitionRepository.findById(instance.workflowDefinitionId()))
            .orElseThrow(() -> new DefinitionNotFoundException(instance.workflowDefinitionId()));
        ValidationDocument document = invoker.call(DOCUMENT_STORE,
                () -> documentRepository.findById(instance.documentId()))
            .orElse(null);
        if (document == null) {
            log.warn("Document {} of instance {} not found, its status will not be updated",
                instance.documentId(), instanceId);
        }

        Instant now = clock.instant();
        WorkflowReview review = new WorkflowReview(
            UUID.randomUUID().toString(),
            instanceId,
            submission.reviewerId(),
            submission.reviewerName(),
            submission.reviewerEmail(),
            submission.decision(),
            submission.comment(),
            submission.observations(),
            instance.startedAt(),
            now,
            true
        );

        TransitionSequence sequence = new TransitionSequence(
            definition, instance, document, document, clock, settings.maxTraversalDepth());
        sequence.updateInstance(instance.withReview(review, now));

        submission.decision().mappedStatusId()
            .flatMap(definition::findStatus)
            .ifPresent(status -> {
                sequence.updateInstance(sequence.instance().toBuilder().currentStatusId(status.id()).build());
                sequence.updateDocumentStatus(DocumentStatus.of(status, now, submission.reviewerName()));
            });

        sequence.emit(EngineEventType.REVIEW_SUBMITTED,
            "reviewer", submission.reviewerName(),
            "decision", submission.decision().value(),
            "documentName", instance.documentName());

        definition.findNode(instance.currentNodeId())
            .filter(node -> node.type() == NodeType.REVIEW)
            .ifPresent(node -> tryAdvanceAfterReview(sequence, node));

        WorkflowInstance committed = commit(sequence, false);
        log.info("Review {} by {} recorded, instance now on node {}",
            submission.decision().value(), submission.reviewerName(), committed.currentNodeId());
        release(sequence);
        return committed;
    }

    // ========== Traversal ==========

    private void tryAdvanceAfterReview(TransitionSequence sequence, WorkflowNode reviewNode) {
        int completed = sequence.instance().completedReviews().size();
        int required = reviewNode.data().requiredApprovalsOrDefault();
        if (completed < required) {
            log.debug("Review node {} has {}/{} reviews, waiting", reviewNode.id(), completed, required);
            return;
        }
        advanceFrom(sequence, reviewNode);
    }

    /**
     * Follow the first outgoing edge of a non-decision node.
     */
    private void advanceFrom(TransitionSequence sequence, WorkflowNode node) {
        List<WorkflowEdge> edges = sequence.definition().outgoingEdges(node.id());
        if (edges.isEmpty()) {
            log.warn("Dead end: node {} ({}) has no outgoing edge, instance stays there",
                node.id(), node.type().value());
            return;
        }

        WorkflowEdge edge = edges.get(0);
        Optional<WorkflowNode> target = sequence.definition().findNode(edge.target());
        if (target.isEmpty()) {
            log.warn("Edge {} points to unknown node {}, instance stays on {}", edge.id(), edge.target(), node.id());
            return;
        }
        moveToNode(sequence, node, target.get());
    }

    private void moveToNode(TransitionSequence sequence, WorkflowNode from, WorkflowNode to) {
        sequence.enter(to);

        WorkflowInstance instance = sequence.instance();
        String fromStatusId = instance.currentStatusId();
        String toStatusId = to.type() == NodeType.STATUS && to.data().hasStatus()
            ? to.data().statusId()
            : fromStatusId;
        Instant now = sequence.nextTimestamp();

        if (to.type().isAudited()) {
            sequence.appendHistory(WorkflowHistoryEntry.system(now, from.id(), to.id(), fromStatusId, toStatusId,
                "Transition: " + from.displayName() + " → " + to.displayName()));
        }
        sequence.updateInstance(sequence.instance().movedTo(to.id(), toStatusId, now));

        if (to.type() == NodeType.STATUS && to.data().hasStatus()) {
            Optional<WorkflowStatus> status = sequence.definition().findStatus(toStatusId);
            if (status.isPresent()) {
                sequence.updateDocumentStatus(
                    DocumentStatus.of(status.get(), now, WorkflowHistoryEntry.SYSTEM_USER_NAME));
            } else {
                log.warn("Status node {} references unknown status {}", to.id(), toStatusId);
            }
        }

        log.debug("Moved {} -> {} ({})", from.id(), to.id(), to.type().value());
        sequence.emit(EngineEventType.ADVANCED,
            "fromNode", from.data().label(),
            "toNode", to.data().label(),
            "toNodeId", to.id(),
            "toNodeType", to.type().value(),
            "newStatus", toStatusId);

        processNode(sequence, to);
    }

    private void processNode(TransitionSequence sequence, WorkflowNode node) {
        switch (node.type()) {
            case START -> advanceFrom(sequence, node);
            case STATUS -> {
                if (sequence.definition().settings().notifyOnStatusChange()) {
                    WorkflowInstance instance = sequence.instance();
                    sequence.notify(Notification.of(
                        NotificationLevel.INFO,
                        "Changement de statut",
                        String.format("\"%s\" est maintenant \"%s\"", instance.documentName(), node.displayName()),
                        clock.instant(),
                        instance.documentId(),
                        instance.id()));
                }
                advanceFrom(sequence, node);
            }
            case REVIEW -> log.debug("Waiting for {} review(s) on node {}",
                node.data().requiredApprovalsOrDefault(), node.id());
            case DECISION -> processDecisionNode(sequence, node);
            case ACTION -> processActionNode(sequence, node);
            case END -> completeWorkflow(sequence, node);
            case TIMER, PARALLEL -> {
                log.warn("{} node {} is not supported yet, passing through", node.type().value(), node.id());
                advanceFrom(sequence, node);
            }
        }
    }

    private void processDecisionNode(TransitionSequence sequence, WorkflowNode node) {
        WorkflowDefinition definition = sequence.definition();
        Optional<DecisionResult> decision = decisionEvaluator.evaluate(
            node, definition.outgoingEdges(node.id()), sequence.instance(), definition.nodes());
        if (decision.isEmpty()) {
            log.warn("No transition found for decision node {}, instance stays there", node.id());
            return;
        }

        DecisionResult result = decision.get();
        Optional<WorkflowNode> target = definition.findNode(result.targetNodeId());
        if (target.isEmpty() || definition.findEdge(result.edgeId()).isEmpty()) {
            log.warn("Decision node {} chose edge {} to unknown node {}", node.id(), result.edgeId(),
                result.targetNodeId());
            return;
        }

        String statusId = sequence.instance().currentStatusId();
        sequence.appendHistory(WorkflowHistoryEntry.system(
            sequence.nextTimestamp(), node.id(), target.get().id(), statusId, statusId,
            "Décision: " + result.displayLabel() + " — " + result.reason()));

        moveToNode(sequence, node, target.get());
    }

    private void processActionNode(TransitionSequence sequence, WorkflowNode node) {
        ValidationDocument document = sequence.document();
        if (document == null) {
            log.warn("Document {} not found, actions of node {} skipped and instance stays there",
                sequence.instance().documentId(), node.id());
            return;
        }

        ActionContext context = ActionContext.of(
            sequence.definition(), sequence.instance().projectId(), node.id(), sequence::notify);
        for (AutoAction action : node.data().autoActions()) {
            ActionResult result = actionExecutor.execute(action, sequence.instance(), sequence.document(), context);
            sequence.emit(EngineEventType.ACTION_EXECUTED,
                "nodeId", node.id(),
                "actionId", action.id(),
                "actionType", action.type() != null ? action.type().value() : null,
                "success", result.success(),
                "message", result.message(),
                "error", result.error(),
                "retryable", result.retryable());
        }

        advanceFrom(sequence, node);
    }

    private void completeWorkflow(TransitionSequence sequence, WorkflowNode endNode) {
        WorkflowInstance instance = sequence.instance();
        if (instance.isCompleted()) {
            return;
        }
        Instant now = sequence.nextTimestamp();
        sequence.updateInstance(instance.toBuilder()
            .currentNodeId(endNode.id())
            .completedAt(now)
            .updatedAt(now)
            .build());

        String endLabel = endNode.data().label() != null ? endNode.data().label() : "Fin";
        sequence.notify(Notification.of(
            NotificationLevel.SUCCESS,
            "Workflow terminé",
            String.format("Le workflow pour \"%s\" est terminé (%s).", instance.documentName(), endLabel),
            clock.instant(),
            instance.documentId(),
            instance.id()));
        sequence.emit(EngineEventType.COMPLETED,
            "documentName", instance.documentName(),
            "finalStatus", instance.currentStatusId(),
            "endNode", endNode.data().label());
    }

    // ========== Commit ==========

    /**
     * Write the sequence to the stores: document first, then the instance.
     * A failed instance write reverts the document. Writes have no deadline, so a
     * reported failure means the write did not land.
     */
    private WorkflowInstance commit(TransitionSequence sequence, boolean newInstance) {
        long started = System.nanoTime();
        WorkflowInstance toWrite = newInstance ? sequence.instance() : sequence.instanceToCommit();

        boolean documentWritten = false;
        if (sequence.documentChanged()) {
            ValidationDocument document = sequence.document();
            boolean exists = sequence.storedDocument() != null;
            invoker.runToCompletion(DOCUMENT_STORE, settings.commitRetryPolicy(), () -> {
                if (exists) {
                    documentRepository.update(document);
                } else {
                    documentRepository.save(document);
                }
            });
            documentWritten = true;
        }

        try {
            invoker.runToCompletion(INSTANCE_STORE, settings.commitRetryPolicy(), () -> {
                if (newInstance) {
                    instanceRepository.save(toWrite);
                } else {
                    instanceRepository.update(toWrite);
                }
            });
        } catch (RuntimeException e) {
            metrics.commitFailed(e instanceof CollaboratorUnavailableException
                ? ((CollaboratorUnavailableException) e).getCollaborator()
                : e.getClass().getSimpleName());
            if (documentWritten) {
                revertDocument(sequence);
            }
            if (!sequence.events().isEmpty()) {
                log.warn("Rolled back transition sequence of instance {}; side effects of executed actions "
                    + "are not reverted", toWrite.id());
            }
            throw e;
        }

        metrics.commitSucceeded(Duration.ofNanos(System.nanoTime() - started));
        return toWrite;
    }

    private void revertDocument(TransitionSequence sequence) {
        ValidationDocument previous = sequence.storedDocument();
        if (previous == null) {
            log.error("Instance write failed; document {} was created by this sequence and is left in place",
                sequence.document().id());
            return;
        }
        try {
            invoker.runToCompletion(DOCUMENT_STORE, settings.commitRetryPolicy(),
                () -> documentRepository.update(previous));
            log.info("Restored document {} after failed instance write", previous.id());
        } catch (RuntimeException e) {
            log.error("Could not restore document {} after failed instance write", previous.id(), e);
        }
    }

    // ========== Publication ==========

    private void release(TransitionSequence sequence) {
        for (EngineEvent event : sequence.events()) {
            recordMetrics(sequence, event);
            eventBus.publish(event);
        }
        for (Notification notification : sequence.notifications()) {
            try {
                notificationService.notify(notification);
            } catch (RuntimeException e) {
                log.warn("Notification '{}' could not be delivered: {}", notification.title(), e.getMessage());
            }
        }
    }

    private void recordMetrics(TransitionSequence sequence, EngineEvent event) {
        Map<String, Object> data = event.data();
        switch (event.type()) {
            case STARTED -> metrics.workflowStarted(sequence.definition().id());
            case ADVANCED -> metrics.transitionRecorded(String.valueOf(data.get("toNodeType")));
            case REVIEW_SUBMITTED -> metrics.reviewSubmitted(String.valueOf(data.get("decision")));
            case ACTION_EXECUTED -> metrics.actionExecuted(
                String.valueOf(data.get("actionType")), Boolean.TRUE.equals(data.get("success")));
            case COMPLETED -> metrics.workflowCompleted(sequence.definition().id(),
                Duration.between(sequence.instance().startedAt(), sequence.instance().completedAt()));
            case ERROR -> { }
        }
    }

    private void publishError(String instanceId, String operation, RuntimeException e) {
        if (e instanceof NotFoundException) {
            log.warn("{} failed: {}", operation, e.getMessage());
        } else {
            log.error("{} failed: {}", operation, e.getMessage());
        }
        String errorCode = e instanceof VisaflowException ? ((VisaflowException) e).getErrorCode() : "INTERNAL_ERROR";
        eventBus.publish(EngineEvent.of(EngineEventType.ERROR, instanceId, clock.instant(),
            "operation", operation,
            "errorCode", errorCode,
            "message", e.getMessage()));
    }

    private ReentrantLock lockFor(String instanceId) {
        return instanceLocks[Math.floorMod(Objects.hashCode(instanceId), LOCK_STRIPES)];
    }
}
