package com.finopti.support;

import com.finopti.auth.PolicyClient;
import com.finopti.models.AuthorizationDecision;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Policy client that answers from a lambda and records every evaluation.
 */
public class FakePolicyClient implements PolicyClient {

    @FunctionalInterface
    public interface Policy {
        AuthorizationDecision decide(String caller, String target) throws IOException, InterruptedException;
    }

    private final Policy policy;
    private final List<String> evaluations = new CopyOnWriteArrayList<>();

    public FakePolicyClient(Policy policy) {
        this.policy = policy;
    }

    public static FakePolicyClient allowAll() {
        return new FakePolicyClient((caller, target) -> AuthorizationDecision.allow("allowed"));
    }

    public static FakePolicyClient failing(IOException error) {
        return new FakePolicyClient((caller, target) -> {
            throw error;
        });
    }

    @Override
    public AuthorizationDecision evaluate(String callerIdentity, String targetAgentId, Duration timeout)
        throws IOException, InterruptedException {
        evaluations.add(callerIdentity + "->" + targetAgentId);
        return policy.decide(callerIdentity, targetAgentId);
    }

    @Override
    public String describe() {
        return "fake-policy";
    }

    public List<String> getEvaluations() {
        return evaluations;
    }

    public int callCount() {
        return evaluations.size();
    }
}
