package com.popupkit.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.popupkit.AppLogger;
import com.popupkit.PopupService;
import com.popupkit.json.ErgonomicNormalizer;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.PopupResult;
import com.popupkit.models.PopupState;
import com.popupkit.parse.PopupParseException;
import com.popupkit.parse.PopupParseResult;
import com.popupkit.parse.PopupValidator;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * Controller for parsing popups and collapsing their results.
 */
public class PopupController implements Controller {

    private final PopupService popupService;
    private final ObjectMapper objectMapper;
    private final ErgonomicNormalizer normalizer;
    private final AppLogger logger;

    public PopupController(PopupService popupService, ObjectMapper objectMapper) {
        this.popupService = popupService;
        this.objectMapper = objectMapper;
        this.normalizer = new ErgonomicNormalizer(objectMapper);
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/popup/parse", this::parse);
        app.post("/api/popup/state", this::state);
        app.post("/api/popup/result", this::result);
        app.post("/api/popup/dsl", this::dsl);
    }

    private void parse(Context ctx) {
        try {
            PopupParseResult result = popupService.prepare(ctx.body(), injectOther(ctx));
            ObjectNode body = objectMapper.createObjectNode();
            body.put("format", result.getDialect());
            body.set("definition", popupService.getCodec().writeDefinition(result.getDefinition()));
            ctx.json(body);
        } catch (PopupParseException e) {
            ctx.status(400).json(rejected(ctx.path(), e));
        } catch (Exception e) {
            logError("Failed to parse popup", e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void state(Context ctx) {
        try {
            PopupDefinition definition = popupService.prepare(ctx.body(), injectOther(ctx)).getDefinition();
            ObjectNode body = objectMapper.createObjectNode();
            body.set("definition", popupService.getCodec().writeDefinition(definition));
            body.set("state", popupService.getCodec().writeState(popupService.deriveState(definition)));
            ctx.json(body);
        } catch (PopupParseException e) {
            ctx.status(400).json(rejected(ctx.path(), e));
        } catch (Exception e) {
            logError("Failed to derive popup state", e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void result(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            if (json == null || !json.has("definition") || !json.has("state")) {
                ctx.status(400).json(rejected(ctx.path(), "Both 'definition' and 'state' are required"));
                return;
            }
            PopupDefinition definition = readDefinition(json.get("definition"));
            PopupState state = popupService.readState(json.get("state"), definition);
            boolean visibleOnly = json.path("visibleOnly").asBoolean(false);
            PopupResult result = visibleOnly
                ? popupService.collapseVisible(state, definition)
                : popupService.collapse(state, definition);
            ctx.json(result);
        } catch (PopupParseException e) {
            ctx.status(400).json(rejected(ctx.path(), e));
        } catch (JsonProcessingException e) {
            ctx.status(400).json(rejected(ctx.path(), "Invalid JSON body: " + e.getOriginalMessage()));
        } catch (Exception e) {
            logError("Failed to collapse popup result", e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void dsl(Context ctx) {
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            PopupDefinition definition = readDefinition(json);
            ctx.contentType("text/plain; charset=utf-8").result(popupService.toDsl(definition));
        } catch (PopupParseException e) {
            ctx.status(400).json(rejected(ctx.path(), e));
        } catch (JsonProcessingException e) {
            ctx.status(400).json(rejected(ctx.path(), "Invalid JSON body: " + e.getOriginalMessage()));
        } catch (Exception e) {
            logError("Failed to write popup DSL", e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private PopupDefinition readDefinition(JsonNode node) {
        return PopupValidator.validate(popupService.getCodec().readDefinition(normalizer.normalize(node)));
    }

    private boolean injectOther(Context ctx) {
        String flag = ctx.queryParam("injectOther");
        if (flag == null) {
            return popupService.isInjectOther();
        }
        return "true".equalsIgnoreCase(flag) || "1".equals(flag);
    }

    Map<String, Object> rejected(String path, PopupParseException e) {
        if (logger != null) {
            logger.warn(path + " rejected [" + e.getKind().getCode() + "]: " + e.getReason());
        }
        return Controller.parseErrorBody(e);
    }

    Map<String, Object> rejected(String path, String message) {
        if (logger != null) {
            logger.warn(path + " rejected: " + message);
        }
        return Map.of("error", message);
    }

    private void logError(String message, Exception e) {
        if (logger != null) {
            logger.error(message + ": " + e.getMessage(), e);
        }
    }
}
