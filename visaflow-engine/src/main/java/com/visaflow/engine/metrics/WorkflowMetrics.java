package com.visaflow.engine.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the workflow engine and the folder watchers.
 * 
 * Metrics exposed:
 * - Workflows started and completed
 * - Node transitions and submitted reviews by decision
 * - Automated actions by type and outcome
 * - Watcher polls, detected files and active watcher count
 * - Commit duration of transition sequences
 * 
 * Until {@link #bindTo(MeterRegistry)} is called, meters are recorded in a private
 * {@link SimpleMeterRegistry} so the engine can run without a monitoring backend.
 */
public class WorkflowMetrics implements MeterBinder {

    // Metric names
    public static final String WORKFLOW_STARTED = "visaflow.workflows.started";
    public static final String WORKFLOW_COMPLETED = "visaflow.workflows.completed";
    public static final String TRANSITIONS = "visaflow.transitions";
    public static final String REVIEWS_SUBMITTED = "visaflow.reviews.submitted";
    public static final String ACTIONS_EXECUTED = "visaflow.actions.executed";
    public static final String COMMIT_DURATION = "visaflow.commit.duration";
    public static final String COMMIT_FAILURES = "visaflow.commit.failures";

    public static final String WATCHER_POLLS = "visaflow.watcher.polls";
    public static final String WATCHER_FILES_DETECTED = "visaflow.watcher.files.detected";
    public static final String WATCHERS_ACTIVE = "visaflow.watchers.active";

    private volatile MeterRegistry registry = new SimpleMeterRegistry();
    private final AtomicInteger activeWatchers = new AtomicInteger(0);

    public WorkflowMetrics() {
        registerGauges(registry);
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        registerGauges(registry);
    }

    private void registerGauges(MeterRegistry target) {
        Gauge.builder(WATCHERS_ACTIVE, activeWatchers, AtomicInteger::get)
            .description("Number of running folder watchers")
            .register(target);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    // ========== Workflow Metrics ==========

    public void workflowStarted(String definitionId) {
        Counter.builder(WORKFLOW_STARTED)
            .tag("definition", definitionId)
            .description("Total workflow instances started")
            .register(registry)
            .increment();
    }

    public void workflowCompleted(String definitionId, Duration elapsed) {
        Counter.builder(WORKFLOW_COMPLETED)
            .tag("definition", definitionId)
            .description("Total workflow instances that reached an end node")
            .register(registry)
            .increment();

        Timer.builder("visaflow.workflow.duration")
            .tag("definition", definitionId)
            .description("Time from start to end node")
            .register(registry)
            .record(elapsed);
    }

    public void transitionRecorded(String toNodeType) {
        Counter.builder(TRANSITIONS)
            .tag("node_type", toNodeType)
            .description("Total node transitions committed")
            .register(registry)
            .increment();
    }

    public void reviewSubmitted(String decision) {
        Counter.builder(REVIEWS_SUBMITTED)
            .tag("decision", decision)
            .description("Total reviews submitted")
            .register(registry)
            .increment();
    }

    public void actionExecuted(String actionType, boolean success) {
        Counter.builder(ACTIONS_EXECUTED)
            .tag("type", actionType)
            .tag("outcome", success ? "success" : "failure")
            .description("Total automated actions executed")
            .register(registry)
            .increment();
    }

    public void commitSucceeded(Duration duration) {
        Timer.builder(COMMIT_DURATION)
            .tag("outcome", "success")
            .description("Duration of transition sequence commits")
            .register(registry)
            .record(duration);
    }

    public void commitFailed(String collaborator) {
        Counter.builder(COMMIT_FAILURES)
            .tag("collaborator", sanitize(collaborator))
            .description("Transition sequences rolled back")
            .register(registry)
            .increment();
    }

    // ========== Watcher Metrics ==========

    public void watcherPolled(boolean success) {
        Counter.builder(WATCHER_POLLS)
            .tag("outcome", success ? "success" : "failure")
            .description("Total folder polls")
            .register(registry)
            .increment();
    }

    public void filesDetected(int count) {
        Counter.builder(WATCHER_FILES_DETECTED)
            .description("Total new files detected in watched folders")
            .register(registry)
            .increment(count);
    }

    public void watcherStarted() {
        activeWatchers.incrementAndGet();
    }

    public void watcherStopped() {
        activeWatchers.updateAndGet(v -> Math.max(0, v - 1));
    }

    // ========== Helper Methods ==========

    /**
     * Sanitize a free-form string for use as a metric tag.
     */
    private String sanitize(String value) {
        if (value == null || value.isBlank()) {
            return "unspecified";
        }
        String sanitized = value.toLowerCase()
            .replaceAll("[^a-z0-9_]", "_")
            .replaceAll("_+", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
