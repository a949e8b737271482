package com.intentguard.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intentguard.AppLogger;
import com.intentguard.SecurityProxy;
import com.intentguard.models.ActionRequest;
import com.intentguard.models.ExtractedParams;
import com.intentguard.models.ValidationRequest;
import com.intentguard.models.ValidationResult;
import com.intentguard.tools.ActionCall;
import com.intentguard.tools.ActionCallParseResult;
import com.intentguard.tools.ActionCallParser;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controller exposing intent extraction and action/response validation to agent dispatchers.
 */
public class ValidationController implements Controller {

    private final SecurityProxy securityProxy;
    private final ActionCallParser actionCallParser;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public ValidationController(SecurityProxy securityProxy, ObjectMapper objectMapper) {
        this.securityProxy = securityProxy;
        this.objectMapper = objectMapper;
        this.actionCallParser = new ActionCallParser(objectMapper);
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/intent", this::extractIntent);
        app.post("/api/validate", this::validate);
        app.post("/api/validate/action", this::validateAction);
        app.post("/api/validate/response", this::validateResponse);
        app.post("/api/validate/tool-call", this::validateToolCall);
    }

    private void extractIntent(Context ctx) {
        try {
            ValidationRequest body = readBody(ctx);
            if (body == null) return;
            if (isMissing(body.getUserPrompt())) {
                ctx.status(400).json(Map.of("error", "userPrompt is required"));
                return;
            }
            ctx.json(securityProxy.getActionValidator().getExtractor().extractIntent(body.getUserPrompt()));
        } catch (Exception e) {
            logger.error("Error extracting intent: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void validateAction(Context ctx) {
        try {
            ValidationRequest body = readBody(ctx);
            if (body == null) return;
            if (!requireActionFields(ctx, body)) return;
            ctx.json(securityProxy.getActionValidator().validateAction(
                body.getUserPrompt(), body.getProposedAction(), ExtractedParams.fromRaw(body.getActionParams())));
        } catch (Exception e) {
            logger.error("Error validating action: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void validateResponse(Context ctx) {
        try {
            ValidationRequest body = readBody(ctx);
            if (body == null) return;
            if (body.getEmailContent() == null || body.getProposedResponse() == null) {
                ctx.status(400).json(Map.of("error", "emailContent and proposedResponse are required"));
                return;
            }
            ctx.json(securityProxy.getResponseValidator().validateResponseContent(
                body.getEmailContent(), body.getProposedResponse()));
        } catch (Exception e) {
            logger.error("Error validating response: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void validate(Context ctx) {
        try {
            ValidationRequest body = readBody(ctx);
            if (body == null) return;
            if (!requireActionFields(ctx, body)) return;
            ValidationResult result = securityProxy.processRequest(body.toActionRequest(), body.getProposedResponse());
            ctx.json(result);
        } catch (Exception e) {
            logger.error("Error processing validation request: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void validateToolCall(Context ctx) {
        try {
            ValidationRequest body = readBody(ctx);
            if (body == null) return;
            if (isMissing(body.getUserPrompt()) || isMissing(body.getToolCall())) {
                ctx.status(400).json(Map.of("error", "userPrompt and toolCall are required"));
                return;
            }
            ActionCallParseResult parsed = actionCallParser.parseStrict(body.getToolCall());
            if (!parsed.isActionCall()) {
                Map<String, Object> error = new LinkedHashMap<>();
                error.put("error", parsed.getErrorCode() != null ? "Invalid action call" : "No action call found");
                error.put("errorCode", parsed.getErrorCode());
                error.put("detail", parsed.getErrorDetail());
                logger.warn("Rejected tool call: " + parsed.getErrorCode() + " " + parsed.getErrorDetail());
                ctx.status(400).json(error);
                return;
            }
            ActionCall call = parsed.getCall();
            logger.info("Validating action call: " + call.getRaw());
            ActionRequest request = new ActionRequest(
                body.getUserPrompt(), call.getAction(), call.toExtractedParams(), body.getEmailContent());
            ctx.json(securityProxy.processRequest(request, body.getProposedResponse()));
        } catch (Exception e) {
            logger.error("Error validating tool call: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private ValidationRequest readBody(Context ctx) {
        String raw = ctx.body();
        if (raw == null || raw.isBlank()) {
            ctx.status(400).json(Map.of("error", "Request body required"));
            return null;
        }
        try {
            return objectMapper.readValue(raw, ValidationRequest.class);
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Invalid JSON body: " + e.getOriginalMessage()));
            return null;
        }
    }

    private boolean requireActionFields(Context ctx, ValidationRequest body) {
        if (isMissing(body.getUserPrompt()) || isMissing(body.getProposedAction())) {
            ctx.status(400).json(Map.of("error", "userPrompt and proposedAction are required"));
            return false;
        }
        return true;
    }

    private static boolean isMissing(String value) {
        return value == null || value.isBlank();
    }
}
