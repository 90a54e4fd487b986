package com.popupkit.controllers;

import com.popupkit.parse.PopupParseException;
import io.javalin.Javalin;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Interface for API controllers.
 * Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    /**
     * Register this controller's routes with the Javalin app.
     */
    void registerRoutes(Javalin app);

    /**
     * Error body that never carries a null message.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        return Map.of("error", m);
    }

    /**
     * Error body for parse failures: the stable code plus the position when one is known.
     */
    static Map<String, Object> parseErrorBody(PopupParseException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("code", e.getKind().getCode());
        if (e.hasPosition()) {
            body.put("line", e.getLine());
            body.put("column", e.getColumn());
        }
        return body;
    }
}
