package com.visaflow.engine.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.visaflow.core.event.AsyncEventBus;
import com.visaflow.core.model.Notification;
import com.visaflow.core.model.RetryPolicy;
import com.visaflow.core.repository.WorkflowInstanceRepository;
import com.visaflow.core.test.TimeController;
import com.visaflow.engine.action.ActionExecutor;
import com.visaflow.engine.config.EngineSettings;
import com.visaflow.engine.coordinator.WorkflowCoordinator;
import com.visaflow.engine.decision.DecisionEvaluator;
import com.visaflow.engine.event.EngineEvent;
import com.visaflow.engine.event.EngineEventType;
import com.visaflow.engine.invoke.CollaboratorInvoker;
import com.visaflow.engine.metrics.WorkflowMetrics;
import com.visaflow.engine.persistence.InMemoryDocumentRepository;
import com.visaflow.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.visaflow.engine.persistence.InMemoryWorkflowInstanceRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fully wired coordinator over in-memory stores, a frozen clock and a same-thread event bus.
 */
public class EngineHarness implements AutoCloseable {

    public static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    public final TimeController clock = TimeController.frozenAt(T0);
    public final InMemoryWorkflowDefinitionRepository definitions = new InMemoryWorkflowDefinitionRepository();
    public final InMemoryWorkflowInstanceRepository storedInstances = new InMemoryWorkflowInstanceRepository();
    public final InMemoryDocumentRepository documents = new InMemoryDocumentRepository();
    public final RecordingFileService files = new RecordingFileService();
    public final List<Notification> notifications = new CopyOnWriteArrayList<>();
    public final List<EngineEvent> events = new CopyOnWriteArrayList<>();
    public final AsyncEventBus<EngineEvent> eventBus = AsyncEventBus.direct("engine-events");
    public final WorkflowMetrics metrics = new WorkflowMetrics();
    public final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    public final CollaboratorInvoker invoker;
    public final WorkflowCoordinator engine;

    public EngineHarness() {
        this(null, testSettings());
    }

    public EngineHarness(WorkflowInstanceRepository instances) {
        this(instances, testSettings());
    }

    /**
     * @param instances instance store to use instead of the in-memory one, or null
     * @param settings  engine settings
     */
    public EngineHarness(WorkflowInstanceRepository instances, EngineSettings settings) {
        this(instances, settings, Duration.ofSeconds(5));
    }

    /**
     * @param instances           instance store to use instead of the in-memory one, or null
     * @param settings            engine settings
     * @param collaboratorTimeout deadline of each collaborator call
     */
    public EngineHarness(WorkflowInstanceRepository instances, EngineSettings settings, Duration collaboratorTimeout) {
        this.invoker = new CollaboratorInvoker(collaboratorTimeout);
        this.engine = new WorkflowCoordinator(
            definitions,
            instances != null ? instances : storedInstances,
            documents,
            notifications::add,
            new DecisionEvaluator(),
            new ActionExecutor(files, invoker, objectMapper, clock, Duration.ofSeconds(2)),
            eventBus,
            invoker,
            metrics,
            settings,
            clock);
        eventBus.subscribe(events::add);
    }

    /**
     * Defaults with a fast two-attempt commit policy.
     */
    public static EngineSettings testSettings() {
        return EngineSettings.defaults()
            .withCommitRetryPolicy(RetryPolicy.builder()
                .maxAttempts(2)
                .initialBackoff(Duration.ofMillis(1))
                .maxBackoff(Duration.ofMillis(1))
                .jitterFactor(0.0)
                .build());
    }

    public List<EngineEvent> eventsOfType(EngineEventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    @Override
    public void close() {
        invoker.close();
    }
}
