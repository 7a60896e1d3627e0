package com.finopti.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finopti.AppLogger;
import com.finopti.dispatch.ErrorKind;
import com.finopti.models.RequestContext;
import com.finopti.remediation.CancellationToken;
import com.finopti.remediation.RemediationRequest;
import com.finopti.remediation.RemediationResult;
import com.finopti.remediation.RemediationRunTracker;
import com.finopti.remediation.RemediationStateMachine;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;

/**
 * REST controller for remediation runs.
 *
 * Endpoints:
 *   POST /remediate                Run a remediation to completion
 *   GET  /remediate/active         Run ids currently in flight
 *   POST /remediate/{runId}/cancel Cancel an in-flight run
 */
public class RemediationController implements Controller {

    static final String INVALID_INPUT_REASON = "invalid input";

    private final RemediationStateMachine stateMachine;
    private final RemediationRunTracker runTracker;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public RemediationController(RemediationStateMachine stateMachine, RemediationRunTracker runTracker,
                                 ObjectMapper objectMapper) {
        this.stateMachine = stateMachine;
        this.runTracker = runTracker;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/remediate", this::remediate);
        app.get("/remediate/active", this::activeRuns);
        app.post("/remediate/{runId}/cancel", this::cancel);
    }

    /**
     * POST /remediate
     * Body: { "rca_document": "...", "resolution_plan": "...", "run_id"?: "...",
     *         "session_id"?: "...", "user_email"?: "..." }
     */
    private void remediate(Context ctx) {
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
        RemediationRequest request = RemediationRequest.fromJson(body);
        String runId = request.getRunId() != null ? request.getRunId() : runTracker.generateRunId();

        CancellationToken token;
        try {
            token = runTracker.register(runId, context.getCallerIdentity());
        } catch (IllegalStateException e) {
            ctx.status(409).json(Controller.errorBody(e));
            return;
        }

        logger.info("Remediation " + runId + " started for " + context);
        RemediationResult result;
        try {
            result = stateMachine.run(runId, request, context, token);
        } finally {
            runTracker.complete(runId);
        }

        if (INVALID_INPUT_REASON.equals(result.getAbortReason())) {
            ctx.status(400);
        }
        ctx.json(result);
    }

    private void activeRuns(Context ctx) {
        ctx.json(Map.of("runs", runTracker.activeRuns()));
    }

    /**
     * POST /remediate/{runId}/cancel
     * Only the caller that started the run (X-User-Email or body user_email) may cancel it.
     */
    private void cancel(Context ctx) {
        String runId = ctx.pathParam("runId");
        JsonNode body;
        try {
            body = ctx.body().isBlank() ? null : objectMapper.readTree(ctx.body());
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Controller.failureBody(ErrorKind.INVALID_INPUT, "Request body is not valid JSON"));
            return;
        }
        RequestContext context = RequestContexts.from(ctx, body);

        switch (runTracker.cancel(runId, context.getCallerIdentity())) {
            case NOT_FOUND:
                ctx.status(404).json(Map.of("error", "No active run: " + runId));
                return;
            case NOT_OWNER:
                logger.warn("Cancellation of " + runId + " refused for " + context);
                ctx.status(403).json(Controller.failureBody(ErrorKind.AUTHORIZATION_DENIED,
                    "Only the caller that started " + runId + " may cancel it"));
                return;
            default:
                logger.info("Cancellation requested for remediation " + runId);
                ctx.status(202).json(Map.of("run_id", runId, "cancelled", true));
        }
    }
}
