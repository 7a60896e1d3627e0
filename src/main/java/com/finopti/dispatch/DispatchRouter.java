package com.finopti.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finopti.AppLogger;
import com.finopti.auth.AuthorizationGate;
import com.finopti.models.AgentDescriptor;
import com.finopti.models.AuthorizationDecision;
import com.finopti.models.RequestContext;
import com.finopti.observability.ObservabilityEvent;
import com.finopti.observability.ObservabilitySink;
import com.finopti.registry.AgentRegistry;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Routes one call to one specialist agent: registry lookup, authorization,
 * the outbound call with the request context attached, and an observability
 * report before and after. Never retries.
 */
public class DispatchRouter {

    static final String COMPONENT = "dispatch_router";

    private final AgentRegistry registry;
    private final AuthorizationGate gate;
    private final AgentClient agentClient;
    private final ObservabilitySink sink;
    private final IntentResolver intentResolver;
    private final ObjectMapper mapper;
    private final Duration agentTimeout;
    private final AppLogger logger = AppLogger.get();

    public DispatchRouter(AgentRegistry registry, AuthorizationGate gate, AgentClient agentClient,
                          ObservabilitySink sink, IntentResolver intentResolver,
                          ObjectMapper mapper, Duration agentTimeout) {
        if (registry == null || gate == null || agentClient == null || mapper == null) {
            throw new IllegalArgumentException("registry, gate, agentClient and mapper are required");
        }
        this.registry = registry;
        this.gate = gate;
        this.agentClient = agentClient;
        this.sink = sink != null ? sink : ObservabilitySink.NOOP;
        this.intentResolver = intentResolver;
        this.mapper = mapper;
        this.agentTimeout = agentTimeout != null ? agentTimeout : Duration.ofMinutes(10);
    }

    /**
     * Route a payload to a named agent on behalf of the request.
     */
    public DispatchResult route(String targetAgentId, ObjectNode payload, RequestContext context) {
        if (context == null) {
            return reject(ErrorKind.INVALID_INPUT, "request context is required", targetAgentId, null);
        }

        AgentDescriptor agent = registry.resolve(targetAgentId);
        if (agent == null) {
            if (!registry.isAvailable()) {
                return reject(ErrorKind.REGISTRY_UNAVAILABLE,
                    "Agent registry unavailable: " + registry.getLoadError(), targetAgentId, context);
            }
            return reject(ErrorKind.UNKNOWN_AGENT, "Unknown agent: " + targetAgentId, targetAgentId, context);
        }

        AuthorizationDecision decision = gate.authorize(context, agent);
        if (!decision.isAllowed()) {
            return reject(ErrorKind.AUTHORIZATION_DENIED, decision.getReason(), targetAgentId, context);
        }

        ObjectNode outbound = payload != null ? payload.deepCopy() : mapper.createObjectNode();
        outbound.put("session_id", context.getSessionId());
        outbound.put("user_email", context.getCallerIdentity());

        emit(ObservabilityEvent.builder(COMPONENT, "dispatch.start")
            .targetAgent(targetAgentId)
            .sessionId(context.getSessionId())
            .build());

        long start = System.nanoTime();
        DispatchResult result;
        try {
            AgentResponse response = agentClient.execute(agent, outbound, context, agentTimeout);
            long latency = elapsedMs(start);
            if (response != null && response.isSuccess()) {
                result = DispatchResult.ok(targetAgentId, response.getData(), latency);
            } else {
                String error = response != null ? response.getError() : "empty response";
                result = DispatchResult.error(ErrorKind.DELEGATION_FAILURE,
                    agent.getDisplayName() + " failed: " + error, targetAgentId, latency);
            }
        } catch (HttpTimeoutException e) {
            result = DispatchResult.error(ErrorKind.DELEGATION_FAILURE,
                "Timeout waiting for " + agent.getDisplayName() + " after " + agentTimeout.toMillis() + " ms",
                targetAgentId, elapsedMs(start));
        } catch (IOException e) {
            result = DispatchResult.error(ErrorKind.DELEGATION_FAILURE,
                "Delegation to " + agent.getDisplayName() + " failed: " + describe(e), targetAgentId, elapsedMs(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = DispatchResult.error(ErrorKind.DELEGATION_FAILURE,
                "Delegation to " + agent.getDisplayName() + " was interrupted", targetAgentId, elapsedMs(start));
        } catch (RuntimeException e) {
            logger.error("Unexpected error calling " + targetAgentId + ": " + describe(e), e);
            result = DispatchResult.error(ErrorKind.DELEGATION_FAILURE,
                "Delegation to " + agent.getDisplayName() + " failed: " + describe(e), targetAgentId, elapsedMs(start));
        }

        emit(ObservabilityEvent.builder(COMPONENT, "dispatch.complete")
            .targetAgent(targetAgentId)
            .sessionId(context.getSessionId())
            .outcome(result.isOk() ? "success" : "failure")
            .latencyMs(result.getLatencyMs())
            .message(result.isOk() ? null : result.getMessage())
            .build());
        if (!result.isOk()) {
            logger.warn("Dispatch to " + targetAgentId + " failed: " + result.getMessage());
        }
        return result;
    }

    /**
     * Route a free-text task. The target comes from the request when named,
     * otherwise from the intent resolver.
     */
    public DispatchResult routeTask(TaskRequest task, RequestContext context) {
        if (task == null || task.getPrompt() == null) {
            return reject(ErrorKind.INVALID_INPUT, "Missing 'prompt' in request body",
                task != null ? task.getTargetAgent() : null, context);
        }

        String target = task.getTargetAgent();
        if (target == null && intentResolver != null) {
            target = intentResolver.resolve(task.getPrompt());
        }
        if (target == null) {
            if (!registry.isAvailable()) {
                return reject(ErrorKind.REGISTRY_UNAVAILABLE,
                    "Agent registry unavailable: " + registry.getLoadError(), null, context);
            }
            return reject(ErrorKind.UNKNOWN_AGENT, "No agent matches the task", null, context);
        }

        ObjectNode payload = mapper.createObjectNode();
        payload.put("prompt", task.getPrompt());
        if (task.getProjectId() != null) {
            payload.put("project_id", task.getProjectId());
        }
        return route(target, payload, context);
    }

    public Duration getAgentTimeout() {
        return agentTimeout;
    }

    private DispatchResult reject(ErrorKind kind, String message, String targetAgentId, RequestContext context) {
        emit(ObservabilityEvent.builder(COMPONENT, "dispatch.rejected")
            .targetAgent(targetAgentId)
            .sessionId(context != null ? context.getSessionId() : null)
            .outcome("rejected")
            .latencyMs(0L)
            .message(kind + ": " + message)
            .build());
        return DispatchResult.error(kind, message, targetAgentId);
    }

    private void emit(ObservabilityEvent event) {
        try {
            sink.publish(event);
        } catch (RuntimeException e) {
            logger.warn("Observability publish failed: " + describe(e));
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private static String describe(Throwable t) {
        String m = t.getMessage();
        if (m == null || m.isBlank()) {
            m = t.getClass().getSimpleName();
        }
        return m;
    }
}
