package com.visaflow.engine.coordinator;

import com.visaflow.core.exception.DefinitionInvalidException;
import com.visaflow.core.model.DocumentStatus;
import com.visaflow.core.model.Notification;
import com.visaflow.core.model.ValidationDocument;
import com.visaflow.core.model.WorkflowDefinition;
import com.visaflow.core.model.WorkflowHistoryEntry;
import com.visaflow.core.model.WorkflowInstance;
import com.visaflow.core.model.WorkflowNode;
import com.visaflow.engine.event.EngineEvent;
import com.visaflow.engine.event.EngineEventType;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Working state of one engine trigger.
 * <p>
 * The graph is traversed against this in-memory snapshot. Nothing reaches the stores,
 * the event bus or the notification service until the coordinator commits the sequence;
 * a failed sequence is simply dropped.
 */
final class TransitionSequence {

    private final WorkflowDefinition definition;
    private final Clock clock;
    private final int maxHops;
    private final long baseSequenceNumber;
    private final ValidationDocument storedDocument;

    private WorkflowInstance instance;
    private ValidationDocument document;
    private boolean documentChanged;

    private final Set<String> enteredNodes = new HashSet<>();
    private int hops;

    private final List<EngineEvent> events = new ArrayList<>();
    private final List<Notification> notifications = new ArrayList<>();

    TransitionSequence(WorkflowDefinition definition, WorkflowInstance instance,
                       ValidationDocument storedDocument, ValidationDocument document,
                       Clock clock, int maxHops) {
        this.definition = definition;
        this.instance = instance;
        this.baseSequenceNumber = instance.sequenceNumber();
        this.storedDocument = storedDocument;
        this.document = document;
        this.clock = clock;
        this.maxHops = maxHops;
    }

    WorkflowDefinition definition() {
        return definition;
    }

    WorkflowInstance instance() {
        return instance;
    }

    ValidationDocument document() {
        return document;
    }

    /**
     * Document as it was in the store before the sequence, or null if it was not stored.
     */
    ValidationDocument storedDocument() {
        return storedDocument;
    }

    boolean documentChanged() {
        return documentChanged;
    }

    List<EngineEvent> events() {
        return events;
    }

    List<Notification> notifications() {
        return notifications;
    }

    void updateInstance(WorkflowInstance updated) {
        this.instance = updated;
    }

    void replaceDocument(ValidationDocument updated) {
        this.document = updated;
        this.documentChanged = true;
    }

    void updateDocumentStatus(DocumentStatus status) {
        if (document != null) {
            replaceDocument(document.withStatus(status));
        }
    }

    /**
     * Instance to write: one sequence number above the stored one.
     */
    WorkflowInstance instanceToCommit() {
        return instance.toBuilder().sequenceNumber(baseSequenceNumber + 1).build();
    }

    // ========== Traversal guards ==========

    /**
     * Register entry into a node.
     *
     * @throws DefinitionInvalidException when the node was already entered during this trigger
     *         or the hop budget is exhausted
     */
    void enter(WorkflowNode node) {
        hops++;
        if (hops > maxHops) {
            throw new DefinitionInvalidException(definition.id(), String.format(
                "traversal exceeded %d hops without reaching a review or end node", maxHops));
        }
        if (!enteredNodes.add(node.id())) {
            throw new DefinitionInvalidException(definition.id(), String.format(
                "cyclic path of non-blocking nodes through '%s'", node.id()));
        }
    }

    // ========== History and time ==========

    /**
     * Timestamp for the next history entry: the clock, or one millisecond past
     * the latest entry when the clock has not moved past it.
     */
    Instant nextTimestamp() {
        Instant now = clock.instant();
        Instant last = instance.lastHistoryTimestamp();
        return last != null && !now.isAfter(last) ? last.plusMillis(1) : now;
    }

    void appendHistory(WorkflowHistoryEntry entry) {
        instance = instance.withHistoryEntry(entry);
    }

    // ========== Deferred side effects ==========

    void emit(EngineEventType type, Object... keyValues) {
        events.add(EngineEvent.of(type, instance.id(), clock.instant(), keyValues));
    }

    void notify(Notification notification) {
        notifications.add(notification);
    }
}
