package com.visaflow.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visaflow.api.collaborator.LocalFolderFileService;
import com.visaflow.api.collaborator.LoggingNotificationService;
import com.visaflow.core.collaborator.FileService;
import com.visaflow.core.collaborator.NotificationService;
import com.visaflow.core.event.AsyncEventBus;
import com.visaflow.core.repository.DocumentRepository;
import com.visaflow.core.repository.WorkflowDefinitionRepository;
import com.visaflow.core.repository.WorkflowInstanceRepository;
import com.visaflow.engine.action.ActionExecutor;
import com.visaflow.engine.coordinator.WorkflowCoordinator;
import com.visaflow.engine.decision.DecisionEvaluator;
import com.visaflow.engine.event.EngineEvent;
import com.visaflow.engine.invoke.CollaboratorInvoker;
import com.visaflow.engine.metrics.WorkflowMetrics;
import com.visaflow.engine.persistence.InMemoryDocumentRepository;
import com.visaflow.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.visaflow.engine.persistence.InMemoryWorkflowInstanceRepository;
import com.visaflow.watcher.FolderWatcher;
import com.visaflow.watcher.WatcherEvent;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine, the folder watcher and their collaborators.
 * Stores and collaborators are in-memory or local defaults; declare a bean of the
 * same type to replace one.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "visaflow");
    }

    @Bean
    public WorkflowMetrics workflowMetrics() {
        return new WorkflowMetrics();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ========== Stores and Collaborators ==========

    @Bean
    @ConditionalOnMissingBean
    public WorkflowDefinitionRepository workflowDefinitionRepository() {
        return new InMemoryWorkflowDefinitionRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowInstanceRepository workflowInstanceRepository() {
        return new InMemoryWorkflowInstanceRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentRepository documentRepository() {
        return new InMemoryDocumentRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public FileService fileService(VisaflowProperties properties) {
        return new LocalFolderFileService(properties.storage().root());
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationService notificationService() {
        return new LoggingNotificationService();
    }

    @Bean(destroyMethod = "close")
    public CollaboratorInvoker collaboratorInvoker(VisaflowProperties properties) {
        return new CollaboratorInvoker(properties.engine().collaboratorTimeout());
    }

    // ========== Events ==========

    @Bean(destroyMethod = "shutdown")
    public ExecutorService eventExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(2, r -> {
            Thread thread = new Thread(r, "visaflow-events-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public AsyncEventBus<EngineEvent> engineEventBus(ExecutorService eventExecutor) {
        return new AsyncEventBus<>("engine", eventExecutor);
    }

    @Bean
    public AsyncEventBus<WatcherEvent> watcherEventBus(ExecutorService eventExecutor) {
        return new AsyncEventBus<>("watcher", eventExecutor);
    }

    // ========== Engine and Watcher ==========

    @Bean
    public ActionExecutor actionExecutor(
            FileService fileService, CollaboratorInvoker collaboratorInvoker, ObjectMapper objectMapper,
            Clock clock, VisaflowProperties properties) {
        return new ActionExecutor(fileService, collaboratorInvoker, objectMapper, clock, properties.webhook().timeout());
    }

    @Bean
    public WorkflowCoordinator workflowEngine(
            WorkflowDefinitionRepository definitionRepository,
            WorkflowInstanceRepository instanceRepository,
            DocumentRepository documentRepository,
            NotificationService notificationService,
            ActionExecutor actionExecutor,
            AsyncEventBus<EngineEvent> engineEventBus,
            CollaboratorInvoker collaboratorInvoker,
            WorkflowMetrics workflowMetrics,
            VisaflowProperties properties,
            Clock clock) {
        return new WorkflowCoordinator(
            definitionRepository,
            instanceRepository,
            documentRepository,
            notificationService,
            new DecisionEvaluator(),
            actionExecutor,
            engineEventBus,
            collaboratorInvoker,
            workflowMetrics,
            properties.engine().toSettings(),
            clock);
    }

    @Bean(destroyMethod = "close")
    public FolderWatcher folderWatcher(
            FileService fileService,
            WorkflowDefinitionRepository definitionRepository,
            DocumentRepository documentRepository,
            WorkflowCoordinator workflowEngine,
            NotificationService notificationService,
            AsyncEventBus<WatcherEvent> watcherEventBus,
            CollaboratorInvoker collaboratorInvoker,
            WorkflowMetrics workflowMetrics,
            VisaflowProperties properties,
            Clock clock) {
        return new FolderWatcher(
            fileService,
            definitionRepository,
            documentRepository,
            workflowEngine,
            notificationService,
            watcherEventBus,
            collaboratorInvoker,
            workflowMetrics,
            properties.watcher().toSettings(),
            clock);
    }
}
