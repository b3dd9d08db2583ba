package com.visaflow.watcher;

import com.visaflow.core.collaborator.FileService;
import com.visaflow.core.collaborator.NotificationService;
import com.visaflow.core.event.EventBus;
import com.visaflow.core.exception.DefinitionNotFoundException;
import com.visaflow.core.exception.NotFoundException;
import com.visaflow.core.model.FolderItem;
import com.visaflow.core.model.Notification;
import com.visaflow.core.model.NotificationLevel;
import com.visaflow.core.model.RetryPolicy;
import com.visaflow.core.model.ValidationDocument;
import com.visaflow.core.model.WorkflowDefinition;
import com.visaflow.core.model.WorkflowInstance;
import com.visaflow.core.repository.DocumentRepository;
import com.visaflow.core.repository.WorkflowDefinitionRepository;
import com.visaflow.engine.invoke.CollaboratorInvoker;
import com.visaflow.engine.logging.LoggingContext;
import com.visaflow.engine.metrics.WorkflowMetrics;
import com.visaflow.engine.service.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Polls source folders and starts a workflow for every file that appears in them.
 *
 * Responsibilities:
 * - Record the files present when a watcher starts, without starting workflows for them
 * - Poll each folder on its own interval and detect new files
 * - Register a pending document per new file and start the configured workflow
 * - Stop a watcher by itself after too many consecutive failed polls
 *
 * A single scheduler thread emits ticks; poll cycles run on a separate pool so slow
 * folders never delay other watchers. A tick is skipped while the previous cycle
 * of the same watcher is still running.
 */
public class FolderWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FolderWatcher.class);

    private static final String FILE_SERVICE = "file service";
    private static final String DEFINITION_STORE = "definition store";
    private static final String DOCUMENT_STORE = "document store";

    static final String REASON_REQUESTED = "requested";
    static final String REASON_SHUTDOWN = "shutdown";
    static final String REASON_TOO_MANY_ERRORS = "too many errors";

    private final FileService fileService;
    private final WorkflowDefinitionRepository definitionRepository;
    private final DocumentRepository documentRepository;
    private final WorkflowEngine engine;
    private final NotificationService notificationService;
    private final EventBus<WatcherEvent> eventBus;
    private final CollaboratorInvoker invoker;
    private final WorkflowMetrics metrics;
    private final WatcherSettings settings;
    private final Clock clock;

    private final Map<String, WatcherState> watchers = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final ExecutorService pollExecutor;

    public FolderWatcher(
            FileService fileService,
            WorkflowDefinitionRepository definitionRepository,
            DocumentRepository documentRepository,
            WorkflowEngine engine,
            NotificationService notificationService,
            EventBus<WatcherEvent> eventBus,
            CollaboratorInvoker invoker,
            WorkflowMetrics metrics,
            WatcherSettings settings,
            Clock clock) {
        this.fileService = fileService;
        this.definitionRepository = definitionRepository;
        this.documentRepository = documentRepository;
        this.engine = engine;
        this.notificationService = notificationService;
        this.eventBus = eventBus;
        this.invoker = invoker;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;

        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "visaflow-watcher-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        AtomicInteger counter = new AtomicInteger();
        this.pollExecutor = Executors.newFixedThreadPool(settings.pollThreads(), r -> {
            Thread thread = new Thread(r, "visaflow-watcher-poll-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    // ========== Lifecycle ==========

    /**
     * Start watching a folder.
     * Files already present are recorded as known and never trigger a workflow.
     *
     * @param config What to watch and which workflow to start
     * @return The watcher ID
     */
    public String start(WatcherConfig config) {
        String watcherId = UUID.randomUUID().toString();
        WatcherState state = new WatcherState(watcherId, config, clock.instant());
        watchers.put(watcherId, state);
        metrics.watcherStarted();

        try (LoggingContext ctx = LoggingContext.forWatcher(watcherId, config.workflowDefinitionId())) {
            initialScan(state);
            if (state.stopped) {
                return watcherId;
            }

            long intervalMillis = config.pollIntervalOr(settings.defaultPollInterval()).toMillis();
            state.future = scheduler.scheduleWithFixedDelay(
                () -> tick(state), intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);

            log.info("Started watcher {} on folder {} (every {}ms)", watcherId, config.folderId(), intervalMillis);
        }
        return watcherId;
    }

    /**
     * Stop a watcher and discard its state.
     *
     * @param watcherId The watcher ID
     * @return true if the watcher was running
     */
    public boolean stop(String watcherId) {
        return stop(watcherId, REASON_REQUESTED);
    }

    /**
     * Stop every watcher. Called on process shutdown.
     */
    public void stopAll() {
        List<String> ids = new ArrayList<>(watchers.keySet());
        for (String id : ids) {
            stop(id, REASON_SHUTDOWN);
        }
        if (!ids.isEmpty()) {
            log.info("Stopped {} watcher(s)", ids.size());
        }
    }

    /**
     * Start a watcher for every active definition that auto-starts on upload and has
     * a source folder. Definitions already watched on that folder are skipped.
     *
     * @return IDs of the watchers started
     */
    public List<String> startForActiveWorkflows() {
        List<WorkflowDefinition> definitions = invoker.call(DEFINITION_STORE, definitionRepository::findActive);

        List<String> started = new ArrayList<>();
        for (WorkflowDefinition definition : definitions) {
            if (!definition.settings().autoStartOnUpload() || !definition.settings().hasSourceFolder()) {
                continue;
            }
            String folderId = definition.settings().sourceFolderId();
            if (isWatching(folderId, definition.id())) {
                log.debug("Definition {} already watched on folder {}", definition.id(), folderId);
                continue;
            }
            started.add(start(WatcherConfig.of(folderId, definition.id())));
        }

        if (!started.isEmpty()) {
            log.info("Started {} watcher(s) for active workflows", started.size());
        }
        return started;
    }

    /**
     * List the running watchers, oldest first.
     */
    public List<WatcherInfo> getActiveWatchers() {
        return watchers.values().stream()
            .sorted(Comparator.comparing((WatcherState s) -> s.startedAt).thenComparing(s -> s.id))
            .map(WatcherState::toInfo)
            .toList();
    }

    /**
     * Subscribe to watcher events.
     */
    public EventBus.Subscription onEvent(Consumer<? super WatcherEvent> listener) {
        return eventBus.subscribe(listener);
    }

    /**
     * Run one poll cycle of a watcher on the calling thread.
     *
     * @param watcherId The watcher ID
     * @return false if a cycle of this watcher was already running and nothing was done
     * @throws NotFoundException if no such watcher is running
     */
    public boolean pollOnce(String watcherId) {
        WatcherState state = watchers.get(watcherId);
        if (state == null) {
            throw new NotFoundException("FolderWatcher", watcherId);
        }
        if (!state.inFlight.compareAndSet(false, true)) {
            return false;
        }
        try {
            poll(state);
        } finally {
            state.inFlight.set(false);
        }
        return true;
    }

    @Override
    public void close() {
        stopAll();
        shutdown(scheduler);
        shutdown(pollExecutor);
    }

    // ========== Polling ==========

    private void tick(WatcherState state) {
        if (state.stopped) {
            return;
        }
        if (!state.inFlight.compareAndSet(false, true)) {
            log.debug("Previous poll of watcher {} still running, skipping tick", state.id);
            return;
        }
        try {
            pollExecutor.execute(() -> {
                try {
                    poll(state);
                } finally {
                    state.inFlight.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            state.inFlight.set(false);
            log.warn("Poll of watcher {} rejected: {}", state.id, e.getMessage());
        }
    }

    private void initialScan(WatcherState state) {
        try {
            List<FolderItem> items = listFiles(state);
            for (FolderItem item : items) {
                state.knownFileIds.add(item.id());
            }
            state.baselined = true;
            log.info("Initial scan: {} file(s) found in folder {}", items.size(), state.config.folderId());
        } catch (RuntimeException e) {
            log.warn("Initial scan of folder {} failed: {}", state.config.folderId(), e.getMessage());
            recordFailure(state, e);
        }
    }

    private void poll(WatcherState state) {
        if (state.stopped) {
            return;
        }
        try (LoggingContext ctx = LoggingContext.forWatcher(state.id, state.config.workflowDefinitionId())) {
            List<FolderItem> files;
            List<FolderItem> newFiles;
            WorkflowDefinition definition = null;
            try {
                files = listFiles(state);
                if (!state.baselined) {
                    // The initial scan failed: this listing becomes the baseline
                    files.forEach(f -> state.knownFileIds.add(f.id()));
                    state.baselined = true;
                    log.info("Baseline re-established: {} file(s) in folder {}", files.size(), state.config.folderId());
                    newFiles = List.of();
                } else {
                    newFiles = files.stream()
                        .filter(state.config::accepts)
                        .filter(f -> !state.knownFileIds.contains(f.id()))
                        .toList();
                }
                if (!newFiles.isEmpty()) {
                    definition = loadDefinition(state.config.workflowDefinitionId());
                }
            } catch (RuntimeException e) {
                log.warn("Poll of folder {} failed: {}", state.config.folderId(), e.getMessage());
                recordFailure(state, e);
                return;
            }

            state.lastPollAt = clock.instant();
            state.errorCount.set(0);
            metrics.watcherPolled(true);

            publish(state, WatcherEvent.of(WatcherEventType.POLL, state.id, state.lastPollAt,
                "folderId", state.config.folderId(),
                "totalFiles", files.size(),
                "newFiles", newFiles.size()));

            if (newFiles.isEmpty()) {
                return;
            }
            log.info("{} new file(s) in folder {}", newFiles.size(), state.config.folderId());
            metrics.filesDetected(newFiles.size());

            for (FolderItem file : newFiles) {
                if (state.stopped) {
                    return;
                }
                state.knownFileIds.add(file.id());
                handleNewFile(state, definition, file);
            }
        }
    }

    private List<FolderItem> listFiles(WatcherState state) {
        List<FolderItem> items = invoker.call(FILE_SERVICE,
            () -> fileService.listFolderItems(state.config.folderId()));
        return items.stream().filter(FolderItem::isFile).toList();
    }

    private WorkflowDefinition loadDefinition(String definitionId) {
        return invoker.call(DEFINITION_STORE, () -> definitionRepository.findById(definitionId))
            .orElseThrow(() -> new DefinitionNotFoundException(definitionId));
    }

    /**
     * Register a pending document for a new file and start its workflow.
     * A failure here is reported for the file and does not count against the watcher.
     */
    private void handleNewFile(WatcherState state, WorkflowDefinition definition, FolderItem file) {
        Instant now = clock.instant();
        publish(state, WatcherEvent.of(WatcherEventType.NEW_FILE, state.id, now,
            "fileId", file.id(),
            "fileName", file.name(),
            "folderId", state.config.folderId()));

        ValidationDocument document = ValidationDocument.fromFolderItem(file, definition.projectId(), now);
        try {
            invoker.run(DOCUMENT_STORE, RetryPolicy.noRetry(), () -> documentRepository.save(document));
            notifyNewDocument(file, document, now);

            WorkflowInstance instance = engine.startWorkflow(definition, document);

            log.info("Started workflow {} for new file '{}'", instance.id(), file.name());
            publish(state, WatcherEvent.of(WatcherEventType.WORKFLOW_STARTED, state.id, clock.instant(),
                "fileId", file.id(),
                "fileName", file.name(),
                "documentId", document.id(),
                "instanceId", instance.id(),
                "workflowName", definition.name()));
        } catch (RuntimeException e) {
            log.error("Failed to start workflow for '{}': {}", file.name(), e.getMessage(), e);
            publish(state, WatcherEvent.of(WatcherEventType.ERROR, state.id, clock.instant(),
                "fileId", file.id(),
                "message", String.valueOf(e.getMessage()),
                "errorCount", state.errorCount.get()));
        }
    }

    private void notifyNewDocument(FolderItem file, ValidationDocument document, Instant now) {
        try {
            notificationService.notify(Notification.of(
                NotificationLevel.INFO,
                "Nouveau document",
                "\"" + file.name() + "\" a été détecté et ajouté à la validation.",
                now,
                document.id(),
                null));
        } catch (RuntimeException e) {
            log.warn("Notification for new file '{}' could not be delivered: {}", file.name(), e.getMessage());
        }
    }

    private void recordFailure(WatcherState state, RuntimeException e) {
        int errors = state.errorCount.incrementAndGet();
        metrics.watcherPolled(false);

        publish(state, WatcherEvent.of(WatcherEventType.ERROR, state.id, clock.instant(),
            "message", String.valueOf(e.getMessage()),
            "errorCount", errors));

        if (errors >= settings.maxConsecutiveErrors()) {
            log.error("Too many errors ({} in a row), stopping watcher {}", errors, state.id);
            stop(state.id, REASON_TOO_MANY_ERRORS);
        }
    }

    // ========== Helper Methods ==========

    private boolean stop(String watcherId, String reason) {
        WatcherState state = watchers.remove(watcherId);
        if (state == null) {
            return false;
        }
        state.stopped = true;
        if (state.future != null) {
            state.future.cancel(false);
        }
        metrics.watcherStopped();
        log.info("Stopped watcher {} ({})", watcherId, reason);

        eventBus.publish(WatcherEvent.of(WatcherEventType.STOPPED, watcherId, clock.instant(),
            "reason", reason,
            "folderId", state.config.folderId()));
        return true;
    }

    private boolean isWatching(String folderId, String definitionId) {
        return watchers.values().stream().anyMatch(s ->
            s.config.folderId().equals(folderId) && s.config.workflowDefinitionId().equals(definitionId));
    }

    /**
     * Events of a stopped watcher are dropped, so listeners see nothing after STOPPED.
     */
    private void publish(WatcherState state, WatcherEvent event) {
        if (!state.stopped) {
            eventBus.publish(event);
        }
    }

    private void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Mutable state of one watcher.
     */
    private static final class WatcherState {
        private final String id;
        private final WatcherConfig config;
        private final Instant startedAt;
        private final Set<String> knownFileIds = ConcurrentHashMap.newKeySet();
        private final AtomicInteger errorCount = new AtomicInteger(0);
        private final AtomicBoolean inFlight = new AtomicBoolean(false);
        private volatile Instant lastPollAt;
        private volatile boolean baselined = false;
        private volatile boolean stopped = false;
        private volatile ScheduledFuture<?> future;

        private WatcherState(String id, WatcherConfig config, Instant startedAt) {
            this.id = id;
            this.config = config;
            this.startedAt = startedAt;
        }

        private WatcherInfo toInfo() {
            return new WatcherInfo(id, config.folderId(), config.workflowDefinitionId(),
                startedAt, lastPollAt, errorCount.get(), knownFileIds.size());
        }
    }
}
