package com.visaflow.engine.action;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visaflow.core.collaborator.FileService;
import com.visaflow.core.exception.CollaboratorUnavailableException;
import com.visaflow.core.model.AutoAction;
import com.visaflow.core.model.AutoActionType;
import com.visaflow.core.model.ValidationDocument;
import com.visaflow.core.model.WorkflowInstance;
import com.visaflow.engine.action.handler.FileTransferActionHandler;
import com.visaflow.engine.action.handler.NotifyUserActionHandler;
import com.visaflow.engine.action.handler.SendCommentActionHandler;
import com.visaflow.engine.action.handler.UpdateMetadataActionHandler;
import com.visaflow.engine.action.handler.WebhookActionHandler;
import com.visaflow.engine.invoke.CollaboratorInvoker;
import com.visaflow.engine.invoke.InvokingFileService;
import com.visaflow.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Runs automated actions through the handler registered for their type.
 * 
 * Never throws: handler exceptions, collaborator failures and unknown types all come
 * back as a failed {@link ActionResult}, so one misconfigured action cannot stop
 * an action node or the workflow.
 * 
 * Usage:
 * <pre>
 * ActionExecutor executor = new ActionExecutor(fileService, invoker, objectMapper, clock, Duration.ofSeconds(10));
 * executor.register(AutoActionType.WEBHOOK, customWebhookHandler);
 * ActionResult result = executor.execute(action, instance, document, context);
 * </pre>
 */
public class ActionExecutor {
    
    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);
    
    private final Map<AutoActionType, AutoActionHandler> handlers = new EnumMap<>(AutoActionType.class);

    /**
     * Create an executor with no handlers. Every action fails until handlers are registered.
     */
    public ActionExecutor() {
    }

    /**
     * Create an executor with the built-in handler of every action type.
     * File service calls run through the invoker and carry its deadline.
     */
    public ActionExecutor(FileService fileService, CollaboratorInvoker invoker, ObjectMapper objectMapper,
                          Clock clock, Duration webhookTimeout) {
        this(fileService, invoker, objectMapper, clock, webhookTimeout,
            HttpClient.newBuilder().connectTimeout(webhookTimeout).build());
    }

    public ActionExecutor(FileService fileService, CollaboratorInvoker invoker, ObjectMapper objectMapper,
                          Clock clock, Duration webhookTimeout, HttpClient httpClient) {
        FileService files = new InvokingFileService(fileService, invoker);
        register(AutoActionType.MOVE_FILE, FileTransferActionHandler.move(files, objectMapper, clock));
        register(AutoActionType.COPY_FILE, FileTransferActionHandler.copy(files, objectMapper, clock));
        register(AutoActionType.NOTIFY_USER, new NotifyUserActionHandler(files, objectMapper, clock));
        register(AutoActionType.SEND_COMMENT, new SendCommentActionHandler(files, objectMapper));
        register(AutoActionType.UPDATE_METADATA, new UpdateMetadataActionHandler());
        register(AutoActionType.WEBHOOK, new WebhookActionHandler(httpClient, objectMapper, clock, webhookTimeout));
    }
    
    /**
     * Register (or replace) the handler of an action type.
     */
    public void register(AutoActionType type, AutoActionHandler handler) {
        handlers.put(type, handler);
        log.debug("Registered action handler: {}", type.value());
    }

    /**
     * Execute one action.
     *
     * @return the outcome; never null, never thrown
     */
    public ActionResult execute(AutoAction action, WorkflowInstance instance, ValidationDocument document,
                                ActionContext context) {
        try (var ctx = LoggingContext.forAction(context.nodeId(), action.id())) {
            AutoActionHandler handler = action.type() != null ? handlers.get(action.type()) : null;
            if (handler == null) {
                log.warn("No handler for action type {}", action.type());
                return ActionResult.failure(action,
                    "Type d'action inconnu: " + (action.type() != null ? action.type().value() : null),
                    "UNKNOWN_ACTION_TYPE", false);
            }

            try {
                ActionResult result = handler.execute(action, instance, document, context);
                log.info("Action {} ({}) succeeded: {}", action.displayName(), action.type().value(), result.message());
                return result;
            } catch (ActionException e) {
                log.warn("Action {} ({}) failed: {} - {}",
                    action.displayName(), action.type().value(), e.getErrorCode(), e.getMessage());
                return ActionResult.failure(action, e.getMessage(), e.getErrorCode(), e.isRetryable());
            } catch (CollaboratorUnavailableException e) {
                log.warn("Action {} ({}) failed: {}", action.displayName(), action.type().value(), e.getMessage());
                return ActionResult.failure(action,
                    String.format("Service indisponible pour l'action \"%s\"", action.displayName()),
                    e.getErrorCode(), true);
            } catch (RuntimeException e) {
                log.warn("Action {} ({}) failed with unexpected error",
                    action.displayName(), action.type().value(), e);
                return ActionResult.failure(action,
                    String.format("Erreur lors de l'exécution de l'action \"%s\"", action.displayName()),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), false);
            }
        }
    }
}
