package com.finopti.controllers;

import com.finopti.dispatch.ErrorKind;
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
     * Error body for unexpected failures. Falls back to the exception type
     * when the message is null.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        return Map.of("error", m);
    }

    /**
     * Structured failure body: {@code {"error": true, "kind", "message"}}.
     */
    static Map<String, Object> failureBody(ErrorKind kind, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", true);
        body.put("kind", kind.name());
        body.put("message", message != null ? message : kind.name());
        return body;
    }
}
