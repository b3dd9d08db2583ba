package com.visaflow.engine.action.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.visaflow.core.model.AutoAction;
import com.visaflow.core.model.ValidationDocument;
import com.visaflow.core.model.WorkflowInstance;
import com.visaflow.engine.action.ActionContext;
import com.visaflow.engine.action.ActionException;
import com.visaflow.engine.action.ActionResult;
import com.visaflow.engine.action.AutoActionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;

/**
 * POSTs a JSON description of the instance and document to {@code config.url}.
 * Any 2xx response is a success. No retry: the caller decides.
 */
public class WebhookActionHandler implements AutoActionHandler {

    private static final Logger log = LoggerFactory.getLogger(WebhookActionHandler.class);

    public static final String EVENT_NAME = "workflow.action";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration requestTimeout;

    public WebhookActionHandler(HttpClient httpClient, ObjectMapper objectMapper, Clock clock, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public ActionResult execute(AutoAction action, WorkflowInstance instance, ValidationDocument document,
                                ActionContext context) throws ActionException {
        String url = action.configText("url")
            .orElseThrow(() -> ActionException.misconfigured("MISSING_URL", "Aucune URL de webhook configurée"));

        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw ActionException.misconfigured("INVALID_URL", "URL de webhook invalide: " + url);
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(buildPayload(instance, document, context));
        } catch (JsonProcessingException e) {
            throw new ActionException("SERIALIZATION_ERROR", "Impossible de sérialiser le webhook", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ActionException("WEBHOOK_UNREACHABLE", "Webhook injoignable: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionException("WEBHOOK_INTERRUPTED", "Appel webhook interrompu", e);
        }

        int status = response.statusCode();
        log.debug("Webhook {} answered {}", url, status);
        if (status < 200 || status >= 300) {
            throw new ActionException("WEBHOOK_HTTP_" + status, "Erreur webhook: " + status, status >= 500);
        }
        return ActionResult.success(action, String.format("Webhook appelé avec succès (%d)", status));
    }

    /**
     * Envelope sent to webhook targets.
     */
    ObjectNode buildPayload(WorkflowInstance instance, ValidationDocument document, ActionContext context) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("event", EVENT_NAME);
        payload.put("timestamp", clock.instant().toString());

        ObjectNode workflow = payload.putObject("workflow");
        workflow.put("instanceId", instance.id());
        workflow.put("definitionId", instance.workflowDefinitionId());
        workflow.put("currentStatus", instance.currentStatusId());

        ObjectNode doc = payload.putObject("document");
        doc.put("id", document.id());
        doc.put("fileId", document.fileId());
        doc.put("fileName", document.fileName());
        doc.put("status", document.currentStatus() != null ? document.currentStatus().name() : null);

        payload.putObject("project").put("id", context.projectId());
        return payload;
    }
}
