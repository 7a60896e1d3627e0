package com.finopti.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finopti.AppLogger;
import com.finopti.dispatch.DispatchResult;
import com.finopti.dispatch.DispatchRouter;
import com.finopti.dispatch.ErrorKind;
import com.finopti.dispatch.TaskRequest;
import com.finopti.models.RequestContext;
import io.javalin.Javalin;
import io.javalin.http.Context;

/**
 * Single-agent task entry point.
 *
 * Endpoints:
 *   POST /ask   Route a free-text task to one specialist agent
 */
public class TaskController implements Controller {

    private final DispatchRouter router;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public TaskController(DispatchRouter router, ObjectMapper objectMapper) {
        this.router = router;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/ask", this::ask);
    }

    /**
     * POST /ask
     * Body: { "prompt": "...", "target_agent"?: "...", "project_id"?: "...",
     *         "session_id"?: "...", "user_email"?: "..." }
     */
    private void ask(Context ctx) {
        JsonNode body;
        try {
            body = ctx.body().isBlank() ? null : objectMapper.readTree(ctx.body());
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Controller.failureBody(ErrorKind.INVALID_INPUT, "Request body is not valid JSON"));
            return;
        }
        if (body == null || !body.isObject()) {
            ctx.status(400).json(Controller.failureBody(ErrorKind.INVALID_INPUT, "Request body must be a JSON object"));
            return;
        }

        RequestContext context = RequestContexts.from(ctx, body);
        logger.info("POST /ask " + context);
        DispatchResult result = router.routeTask(TaskRequest.fromJson(body), context);
        if (!result.isOk()) {
            ctx.status(result.getErrorKind().getHttpStatus())
                .json(Controller.failureBody(result.getErrorKind(), result.getMessage()));
            return;
        }

        ObjectNode response = objectMapper.createObjectNode();
        response.put("success", true);
        response.put("target_agent", result.getAgentId());
        response.put("session_id", context.getSessionId());
        response.put("latency_ms", result.getLatencyMs());
        if (result.getData() != null) {
            response.set("data", result.getData());
        }
        ctx.json(response);
    }
}
