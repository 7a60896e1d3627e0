package com.finopti.auth;

import com.finopti.models.AgentDescriptor;
import com.finopti.models.AuthorizationDecision;
import com.finopti.models.RequestContext;
import com.finopti.support.FakePolicyClient;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AuthorizationGateTest {

    private static final String CALLER = "ops@example.com";
    private static final String TARGET = "gcloud_infrastructure_specialist";

    @Test
    void allowIsPassedThrough() {
        AuthorizationGate gate = new AuthorizationGate(FakePolicyClient.allowAll());

        AuthorizationDecision decision = gate.authorize(CALLER, TARGET);

        assertTrue(decision.isAllowed());
    }

    @Test
    void denyCarriesPolicyReason() {
        FakePolicyClient policy = new FakePolicyClient(
            (caller, target) -> AuthorizationDecision.deny("not in allowlist"));
        AuthorizationGate gate = new AuthorizationGate(policy);

        AuthorizationDecision decision = gate.authorize("outsider@example.com", TARGET);

        assertFalse(decision.isAllowed());
        assertEquals("not in allowlist", decision.getReason());
    }

    @Test
    void unreachablePolicyServiceDenies() {
        AuthorizationGate gate = new AuthorizationGate(
            FakePolicyClient.failing(new ConnectException("Connection refused")));

        for (String caller : List.of(CALLER, "admin@example.com", "outsider@example.com")) {
            for (String target : List.of(TARGET, "monitoring_specialist")) {
                AuthorizationDecision decision = gate.authorize(caller, target);
                assertFalse(decision.isAllowed());
                assertTrue(decision.getReason().startsWith("Authorization service error"));
                assertTrue(decision.getReason().contains("Connection refused"));
            }
        }
    }

    @Test
    void malformedResponseDenies() {
        AuthorizationGate gate = new AuthorizationGate(
            FakePolicyClient.failing(new PolicyServiceException("malformed policy response: missing result.allow")));

        AuthorizationDecision decision = gate.authorize(CALLER, TARGET);

        assertFalse(decision.isAllowed());
        assertTrue(decision.getReason().contains("missing result.allow"));
    }

    @Test
    void runtimeFailureDenies() {
        AuthorizationGate gate = new AuthorizationGate(new FakePolicyClient((caller, target) -> {
            throw new IllegalStateException("boom");
        }));

        assertFalse(gate.authorize(CALLER, TARGET).isAllowed());
    }

    @Test
    void nullDecisionDenies() {
        AuthorizationGate gate = new AuthorizationGate(new FakePolicyClient((caller, target) -> null));

        AuthorizationDecision decision = gate.authorize(CALLER, TARGET);

        assertFalse(decision.isAllowed());
        assertTrue(decision.getReason().contains("empty decision"));
    }

    @Test
    void slowPolicyServiceTimesOutAsDeny() {
        AuthorizationGate gate = new AuthorizationGate(new FakePolicyClient((caller, target) -> {
            Thread.sleep(5_000);
            return AuthorizationDecision.allow("too late");
        }), Duration.ofMillis(100));

        long start = System.nanoTime();
        AuthorizationDecision decision = gate.authorize(CALLER, TARGET);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;

        assertFalse(decision.isAllowed());
        assertTrue(decision.getReason().contains("timed out"));
        assertTrue(elapsedMs < 4_000, "gate must not wait for the slow service");
    }

    @Test
    void decisionsAreNeverCached() {
        AtomicInteger calls = new AtomicInteger();
        FakePolicyClient policy = new FakePolicyClient((caller, target) -> calls.incrementAndGet() == 1
            ? AuthorizationDecision.allow("first")
            : AuthorizationDecision.deny("revoked"));
        AuthorizationGate gate = new AuthorizationGate(policy);

        assertTrue(gate.authorize(CALLER, TARGET).isAllowed());
        assertFalse(gate.authorize(CALLER, TARGET).isAllowed());
        assertEquals(2, policy.callCount());
    }

    @Test
    void blankCallerIsDeniedWithoutAskingPolicyService() {
        FakePolicyClient policy = FakePolicyClient.allowAll();
        AuthorizationGate gate = new AuthorizationGate(policy);

        AuthorizationDecision decision = gate.authorize(" ", TARGET);

        assertFalse(decision.isAllowed());
        assertEquals("caller identity is required", decision.getReason());
        assertEquals(0, policy.callCount());
    }

    @Test
    void credentialGatedAgentRequiresCredential() {
        FakePolicyClient policy = FakePolicyClient.allowAll();
        AuthorizationGate gate = new AuthorizationGate(policy);
        AgentDescriptor github = new AgentDescriptor("github_specialist", "GitHub", "http://github/execute",
            List.of("github"), true);

        AuthorizationDecision without = gate.authorize(RequestContext.of("s1", CALLER, null), github);
        assertFalse(without.isAllowed());
        assertTrue(without.getReason().contains("requires an upstream credential"));
        assertEquals(0, policy.callCount());

        AuthorizationDecision with = gate.authorize(RequestContext.of("s1", CALLER, "Bearer abc"), github);
        assertTrue(with.isAllowed());
        assertEquals(1, policy.callCount());
    }

    @Test
    void ioExceptionSubclassIsServiceError() throws Exception {
        AuthorizationGate gate = new AuthorizationGate(FakePolicyClient.failing(new IOException()));

        AuthorizationDecision decision = gate.authorize(CALLER, TARGET);

        assertFalse(decision.isAllowed());
        assertEquals("Authorization service error: IOException", decision.getReason());
    }
}
