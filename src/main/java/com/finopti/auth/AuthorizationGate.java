package com.finopti.auth;

import com.finopti.AppLogger;
import com.finopti.models.AgentDescriptor;
import com.finopti.models.AuthorizationDecision;
import com.finopti.models.RequestContext;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fail-closed authorization: every error reaching the policy service becomes a
 * denial. Decisions are never cached, each call asks the service again.
 */
public class AuthorizationGate {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final PolicyClient policyClient;
    private final Duration timeout;
    private final ExecutorService executor;
    private final AppLogger logger = AppLogger.get();

    public AuthorizationGate(PolicyClient policyClient, Duration timeout) {
        if (policyClient == null) {
            throw new IllegalArgumentException("policyClient is required");
        }
        this.policyClient = policyClient;
        this.timeout = timeout != null && !timeout.isNegative() && !timeout.isZero() ? timeout : DEFAULT_TIMEOUT;
        this.executor = Executors.newCachedThreadPool(gateThreadFactory());
    }

    public AuthorizationGate(PolicyClient policyClient) {
        this(policyClient, DEFAULT_TIMEOUT);
    }

    /**
     * Decide whether the caller may reach the target agent.
     */
    public AuthorizationDecision authorize(String callerIdentity, String targetAgentId) {
        if (callerIdentity == null || callerIdentity.isBlank()) {
            return AuthorizationDecision.deny("caller identity is required");
        }
        if (targetAgentId == null || targetAgentId.isBlank()) {
            return AuthorizationDecision.deny("target agent is required");
        }

        Future<AuthorizationDecision> pending;
        try {
            pending = executor.submit(() -> policyClient.evaluate(callerIdentity, targetAgentId, timeout));
        } catch (RuntimeException e) {
            return serviceError(callerIdentity, targetAgentId, describe(e));
        }

        try {
            AuthorizationDecision decision = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (decision == null) {
                return serviceError(callerIdentity, targetAgentId, "empty decision");
            }
            if (!decision.isAllowed()) {
                logger.warn("Authorization denied: " + callerIdentity + " -> " + targetAgentId
                    + " (" + decision.getReason() + ")");
            }
            return decision;
        } catch (TimeoutException e) {
            pending.cancel(true);
            return serviceError(callerIdentity, targetAgentId, "timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return serviceError(callerIdentity, targetAgentId, describe(cause));
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return serviceError(callerIdentity, targetAgentId, "interrupted");
        }
    }

    /**
     * Authorize a delegation to a resolved agent. Identity-gated agents are
     * denied locally when the request carries no upstream credential.
     */
    public AuthorizationDecision authorize(RequestContext context, AgentDescriptor agent) {
        if (context == null) {
            return AuthorizationDecision.deny("request context is required");
        }
        if (agent == null) {
            return AuthorizationDecision.deny("target agent is required");
        }
        if (agent.isRequiresCredential() && !context.hasCredential()) {
            return AuthorizationDecision.deny("agent " + agent.getAgentId() + " requires an upstream credential");
        }
        return authorize(context.getCallerIdentity(), agent.getAgentId());
    }

    public Duration getTimeout() {
        return timeout;
    }

    public String describePolicyService() {
        return policyClient.describe();
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    private AuthorizationDecision serviceError(String caller, String target, String detail) {
        logger.error("Authorization check failed for " + caller + " -> " + target + ": " + detail);
        return AuthorizationDecision.deny("Authorization service error: " + detail);
    }

    private static String describe(Throwable t) {
        String m = t.getMessage();
        if (m == null || m.isBlank()) {
            m = t.getClass().getSimpleName();
        }
        return m;
    }

    private static ThreadFactory gateThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "authz-gate-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
