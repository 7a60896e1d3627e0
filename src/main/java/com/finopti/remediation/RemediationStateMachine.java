package com.finopti.remediation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finopti.AppLogger;
import com.finopti.dispatch.DispatchResult;
import com.finopti.dispatch.DispatchRouter;
import com.finopti.dispatch.ErrorKind;
import com.finopti.models.RequestContext;
import com.finopti.observability.ObservabilityEvent;
import com.finopti.observability.ObservabilitySink;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Drives one remediation run through INFRA_FIX, VALIDATE, the optional
 * BROWSER_TEST and REPORT. Every delegation goes through the
 * {@link DispatchRouter}; phases run strictly one after another.
 *
 * <p>Fatality: an INFRA_FIX failure aborts the run. VALIDATE and BROWSER_TEST
 * failures are recorded and lower the final status. REPORT is best-effort and
 * never changes the status.
 */
public class RemediationStateMachine {

    static final String COMPONENT = "remediation";
    static final String REASON_INVALID_INPUT = "invalid input";
    static final String REASON_CANCELLED = "cancelled";
    static final long DEFAULT_POLL_INTERVAL_MS = 100L;
    static final Duration STEP_GRACE = Duration.ofSeconds(30);

    private static final Pattern HTTPS_URL = Pattern.compile("(https://[^\\s)\"'>\\]]+)");
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final DispatchRouter router;
    private final PlanParser planParser;
    private final RemediationAgents agents;
    private final ObservabilitySink sink;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final int maxValidationAttempts;
    private final long pollIntervalMs;
    private final ExecutorService executor;
    private final AppLogger logger = AppLogger.get();

    public RemediationStateMachine(DispatchRouter router, RemediationAgents agents, ObservabilitySink sink,
                                   ObjectMapper mapper, int maxValidationAttempts, Clock clock,
                                   long pollIntervalMs) {
        if (router == null || mapper == null) {
            throw new IllegalArgumentException("router and mapper are required");
        }
        this.router = router;
        this.planParser = new PlanParser(mapper);
        this.agents = agents != null ? agents : RemediationAgents.defaults();
        this.sink = sink != null ? sink : ObservabilitySink.NOOP;
        this.mapper = mapper;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.maxValidationAttempts = Math.max(1, maxValidationAttempts);
        this.pollIntervalMs = pollIntervalMs > 0 ? pollIntervalMs : DEFAULT_POLL_INTERVAL_MS;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "remediation-step-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public RemediationStateMachine(DispatchRouter router, RemediationAgents agents, ObservabilitySink sink,
                                   ObjectMapper mapper, int maxValidationAttempts) {
        this(router, agents, sink, mapper, maxValidationAttempts, Clock.systemUTC(), DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * Run a remediation to a terminal phase. Blocks the calling thread.
     */
    public RemediationResult run(String runId, RemediationRequest request, RequestContext context,
                                 CancellationToken token) {
        CancellationToken cancel = token != null ? token : new CancellationToken();
        RemediationState state = new RemediationState(runId, request.getRcaDocument(),
            request.getResolutionPlan(), context);

        progress(state, "start", "Starting remediation workflow");
        while (!state.isTerminal()) {
            advance(state, cancel);
        }

        RemediationResult result = RemediationResult.fromState(state);
        sinkPublish(ObservabilityEvent.builder(COMPONENT, "remediation.complete")
            .sessionId(sessionOf(state))
            .outcome(result.getStatus().wireValue())
            .message(result.getExplanation())
            .build());
        logger.info("Remediation " + runId + " finished: " + result.getStatus().wireValue()
            + " (" + result.getSteps().size() + " steps)");
        return result;
    }

    /**
     * Execute the current phase and move the state to the next one.
     *
     * @throws IllegalStateException the state is already terminal
     */
    public void advance(RemediationState state, CancellationToken token) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run " + state.getRunId() + " is already " + state.getPhase());
        }
        if (token != null && token.isCancelled()) {
            abort(state, REASON_CANCELLED);
            return;
        }

        switch (state.getPhase()) {
            case START:
                start(state);
                break;
            case INFRA_FIX:
                infraFix(state, token);
                break;
            case VALIDATE:
                validate(state, token);
                break;
            case BROWSER_TEST:
                browserTest(state, token);
                break;
            case REPORT:
                report(state, token);
                break;
            default:
                throw new IllegalStateException("Unexpected phase " + state.getPhase());
        }
    }

    private void start(RemediationState state) {
        if (state.getContext() == null) {
            abort(state, REASON_INVALID_INPUT);
            return;
        }
        RemediationPlan plan;
        try {
            plan = planParser.parse(state.getRcaDocument(), state.getResolutionPlan());
        } catch (InvalidPlanException e) {
            logger.warn("Remediation " + state.getRunId() + " rejected: " + e.getMessage());
            abort(state, REASON_INVALID_INPUT);
            return;
        }
        state.setPlan(plan);
        state.moveTo(plan.isInfraChange() ? RemediationPhase.INFRA_FIX : RemediationPhase.VALIDATE, false);
    }

    private void infraFix(RemediationState state, CancellationToken token) {
        progress(state, "infra_fix", "Phase 1: applying infrastructure fix");
        ObjectNode payload = mapper.createObjectNode();
        payload.put("prompt", state.getPlan().getInfraInstruction());

        DelegationStep step = delegate(state, RemediationPhase.INFRA_FIX, payload, 1, token);
        if (step == null) {
            return;
        }
        if (!step.isSuccess()) {
            abort(state, "infrastructure fix failed: " + step.getError());
            return;
        }
        state.moveTo(RemediationPhase.VALIDATE, false);
    }

    private void validate(RemediationState state, CancellationToken token) {
        int attempt = state.incrementValidationAttempts();
        progress(state, "validate", attempt == 1
            ? "Phase 2: validating with monitoring"
            : "Phase 2: validating with monitoring (attempt " + attempt + ")");

        ObjectNode payload = mapper.createObjectNode();
        payload.put("prompt", "Run this monitoring query and analyze the last 5m: "
            + state.getPlan().getValidationQuery());

        DelegationStep step = delegate(state, RemediationPhase.VALIDATE, payload, attempt, token);
        if (step == null) {
            return;
        }
        if (!step.isSuccess() && attempt < maxValidationAttempts) {
            state.moveTo(RemediationPhase.VALIDATE, true);
            return;
        }
        state.moveTo(state.getPlan().isBrowserTestRequested()
            ? RemediationPhase.BROWSER_TEST : RemediationPhase.REPORT, false);
    }

    private void browserTest(RemediationState state, CancellationToken token) {
        progress(state, "browser_test", "Phase 3: end-to-end verification in the browser");
        RemediationPlan plan = state.getPlan();
        String url = plan.getBrowserTargetUrl() != null ? plan.getBrowserTargetUrl() : "the application";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("prompt", "Navigate to " + url + " and verify the following scenario: "
            + plan.getBrowserScenario() + ". Return a JSON with 'status' (SUCCESS/FAILURE) and "
            + "'screenshot_url' if applicable.");
        if (plan.getBrowserTargetUrl() != null) {
            payload.put("url", plan.getBrowserTargetUrl());
        }

        DelegationStep step = delegate(state, RemediationPhase.BROWSER_TEST, payload, 1, token);
        if (step == null) {
            return;
        }
        state.moveTo(RemediationPhase.REPORT, false);
    }

    private void report(RemediationState state, CancellationToken token) {
        progress(state, "report", "Phase 4: recording the remediation report");
        RemediationStatus outcome = StatusAggregator.aggregate(state.getSteps(), false);

        ObjectNode record = buildRecord(state, outcome);
        String filename = "remediation_" + (sessionOf(state) != null ? sessionOf(state) : state.getRunId()) + ".md";
        ObjectNode payload = mapper.createObjectNode();
        payload.put("prompt", "Upload the following content to storage as file '" + filename
            + "'. Return the public URL.\n\nCONTENT:\n" + renderMarkdown(state, outcome));
        payload.set("record", record);

        DelegationStep step = delegate(state, RemediationPhase.REPORT, payload, 1, token);
        if (step == null) {
            return;
        }
        if (step.isSuccess()) {
            state.setReportUrl(extractReportUrl(step.getResponse()));
        } else {
            logger.warn("Remediation report for " + state.getRunId() + " was not stored: " + step.getError());
        }
        state.finish(outcome);
    }

    /**
     * Runs one delegation on a worker and waits for it while watching the
     * cancellation token.
     *
     * @return the recorded step, or null when the run was cancelled and aborted
     */
    private DelegationStep delegate(RemediationState state, RemediationPhase phase, ObjectNode payload,
                                    int attempt, CancellationToken token) {
        String agentId = agents.agentFor(phase);
        RequestContext context = state.getContext();
        Future<DispatchResult> future = executor.submit(() -> router.route(agentId, payload, context));

        DispatchResult result = await(future, token, agentId);
        if (result == null) {
            DelegationStep cancelled = new DelegationStep(phase, agentId, payload, false, null,
                ErrorKind.DELEGATION_FAILURE, REASON_CANCELLED, attempt, state.nextTimestamp(clock.millis()));
            state.appendStep(cancelled);
            abort(state, REASON_CANCELLED);
            return null;
        }

        DelegationStep step = DelegationStep.fromResult(phase, agentId, payload, result, attempt,
            state.nextTimestamp(clock.millis()));
        state.appendStep(step);
        return step;
    }

    private DispatchResult await(Future<DispatchResult> future, CancellationToken token, String agentId) {
        long deadline = System.nanoTime() + router.getAgentTimeout().plus(STEP_GRACE).toNanos();
        while (true) {
            if (token != null && token.isCancelled()) {
                future.cancel(true);
                return null;
            }
            try {
                return future.get(pollIntervalMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (System.nanoTime() - deadline > 0) {
                    future.cancel(true);
                    return DispatchResult.error(ErrorKind.DELEGATION_FAILURE,
                        "Timeout waiting for " + agentId, agentId);
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.error("Delegation to " + agentId + " failed unexpectedly", cause);
                return DispatchResult.error(ErrorKind.DELEGATION_FAILURE,
                    "Delegation to " + agentId + " failed: " + cause.getClass().getSimpleName(), agentId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                return null;
            }
        }
    }

    private void abort(RemediationState state, String reason) {
        progress(state, "aborted", "Remediation aborted: " + reason);
        state.abort(reason);
    }

    ObjectNode buildRecord(RemediationState state, RemediationStatus outcome) {
        ObjectNode record = mapper.createObjectNode();
        record.put("run_id", state.getRunId());
        record.put("session_id", sessionOf(state));
        record.put("rca_document", state.getRcaDocument());
        record.put("resolution_plan", state.getResolutionPlan());
        record.put("status", outcome.wireValue());
        ArrayNode steps = record.putArray("steps");
        for (DelegationStep step : state.getSteps()) {
            steps.add(mapper.valueToTree(step));
        }
        return record;
    }

    private String renderMarkdown(RemediationState state, RemediationStatus outcome) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Remediation Report\n\n");
        sb.append("**Run:** ").append(state.getRunId()).append('\n');
        sb.append("**Session:** ").append(sessionOf(state)).append('\n');
        sb.append("**Status:** ").append(outcome.wireValue()).append("\n\n");
        sb.append("## Root Cause Analysis\n").append(state.getRcaDocument()).append("\n\n");
        sb.append("## Resolution Plan\n").append(state.getResolutionPlan()).append("\n\n");
        for (DelegationStep step : state.getSteps()) {
            sb.append("## ").append(step.getPhase());
            if (step.getAttempt() > 1) {
                sb.append(" (attempt ").append(step.getAttempt()).append(')');
            }
            sb.append("\nAgent: ").append(step.getTargetAgentId());
            sb.append("\nOutcome: ").append(step.getOutcome());
            if (step.getError() != null) {
                sb.append("\nError: ").append(step.getError());
            }
            sb.append("\n\n");
        }
        return sb.toString();
    }

    /**
     * Report URL from a storage response: {@code signed_url} when present,
     * else the first https link in the response text.
     */
    static String extractReportUrl(JsonNode response) {
        if (response == null || response.isNull()) {
            return null;
        }
        for (String field : new String[] {"signed_url", "report_url", "url"}) {
            JsonNode node = response.get(field);
            if (node != null && node.isTextual() && !node.asText().isBlank()) {
                return node.asText();
            }
            JsonNode nested = response.path("data").get(field);
            if (nested != null && nested.isTextual() && !nested.asText().isBlank()) {
                return nested.asText();
            }
        }
        JsonNode text = response.get("response");
        String haystack = text != null && text.isTextual() ? text.asText() : response.toString();
        Matcher m = HTTPS_URL.matcher(haystack);
        return m.find() ? m.group(1) : null;
    }

    private void progress(RemediationState state, String event, String message) {
        sinkPublish(ObservabilityEvent.builder(COMPONENT, "progress." + event)
            .sessionId(sessionOf(state))
            .message(message)
            .build());
    }

    private void sinkPublish(ObservabilityEvent event) {
        try {
            sink.publish(event);
        } catch (RuntimeException e) {
            logger.warn("Observability publish failed: " + e.getMessage());
        }
    }

    private static String sessionOf(RemediationState state) {
        return state.getContext() != null ? state.getContext().getSessionId() : null;
    }

    public void shutdown() {
        executor.shutdownNow();
    }
}
