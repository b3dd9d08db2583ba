package com.visaflow.engine.logging;

import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Puts the ids of the instance, document, node or watcher being processed
 * into every log line written inside the block.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forInstance(instanceId, documentId, definitionId)) {
 *     log.info("Review submitted"); // Automatically includes instanceId, documentId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-03-01 10:30:45.123 [http-nio-8080-exec-1] INFO  c.v.e.c.WorkflowCoordinator - Review submitted
 *   instanceId=4f1c.. documentId=9a2e.. definitionId=visa-plans traceId=1b2c3d4e
 */
public final class LoggingContext implements AutoCloseable {

    public static final String INSTANCE_ID = "instanceId";
    public static final String DOCUMENT_ID = "documentId";
    public static final String DEFINITION_ID = "definitionId";
    public static final String NODE_ID = "nodeId";
    public static final String ACTION_ID = "actionId";
    public static final String WATCHER_ID = "watcherId";
    public static final String TRACE_ID = "traceId";

    private final Map<String, String> previous = new HashMap<>();
    private final String[] keys;
    private final boolean ownsTraceId;

    private LoggingContext(String... keys) {
        this.keys = keys;
        for (String key : keys) {
            previous.put(key, MDC.get(key));
        }
        this.ownsTraceId = ensureTraceId();
    }

    /**
     * Context for one engine trigger on an instance.
     * The instance id may still be unknown when a workflow is being started.
     */
    public static LoggingContext forInstance(String instanceId, String documentId, String definitionId) {
        LoggingContext context = new LoggingContext(INSTANCE_ID, DOCUMENT_ID, DEFINITION_ID);
        MDC.remove(INSTANCE_ID);
        putIfPresent(INSTANCE_ID, instanceId);
        putIfPresent(DOCUMENT_ID, documentId);
        putIfPresent(DEFINITION_ID, definitionId);
        return context;
    }

    /**
     * Context for one automated action. Nested inside an instance context.
     */
    public static LoggingContext forAction(String nodeId, String actionId) {
        LoggingContext context = new LoggingContext(NODE_ID, ACTION_ID);
        putIfPresent(NODE_ID, nodeId);
        putIfPresent(ACTION_ID, actionId);
        return context;
    }

    /**
     * Context for one poll cycle of a folder watcher.
     */
    public static LoggingContext forWatcher(String watcherId, String definitionId) {
        LoggingContext context = new LoggingContext(WATCHER_ID, DEFINITION_ID);
        putIfPresent(WATCHER_ID, watcherId);
        putIfPresent(DEFINITION_ID, definitionId);
        return context;
    }

    /**
     * Add the instance id once it is known.
     */
    public static void setInstanceId(String instanceId) {
        putIfPresent(INSTANCE_ID, instanceId);
    }

    public static String getInstanceId() {
        return MDC.get(INSTANCE_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    /**
     * Ensure a trace ID exists in the context.
     *
     * @return true if this call created it
     */
    private static boolean ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
            return true;
        }
        return false;
    }

    /**
     * Restore the values the keys had when the context was opened.
     */
    @Override
    public void close() {
        for (String key : keys) {
            String value = previous.get(key);
            if (value != null) {
                MDC.put(key, value);
            } else {
                MDC.remove(key);
            }
        }
        if (ownsTraceId) {
            MDC.remove(TRACE_ID);
        }
    }
}
