package com.finopti;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finopti.auth.AuthorizationGate;
import com.finopti.auth.HttpPolicyClient;
import com.finopti.auth.PolicyClient;
import com.finopti.dispatch.AgentClient;
import com.finopti.dispatch.DispatchRouter;
import com.finopti.dispatch.HttpAgentClient;
import com.finopti.dispatch.IntentResolver;
import com.finopti.observability.AsyncObservabilitySink;
import com.finopti.observability.LoggingObservabilitySink;
import com.finopti.observability.ObservabilitySink;
import com.finopti.registry.AgentRegistry;
import com.finopti.remediation.RemediationAgents;
import com.finopti.remediation.RemediationRunTracker;
import com.finopti.remediation.RemediationStateMachine;

/**
 * Composition root. Builds the registry, gate, router and remediation
 * machine once and hands them to the controllers.
 */
public class OrchestratorContext implements AutoCloseable {
    private final AppConfig config;
    private final ObjectMapper objectMapper;
    private final ObservabilitySink sink;
    private final AgentRegistry agentRegistry;
    private final AuthorizationGate authorizationGate;
    private final IntentResolver intentResolver;
    private final DispatchRouter dispatchRouter;
    private final RemediationStateMachine remediation;
    private final RemediationRunTracker runTracker;
    private final AppLogger logger = AppLogger.get();

    public OrchestratorContext(AppConfig config, ObjectMapper objectMapper) {
        this(config, objectMapper,
            new HttpPolicyClient(config.getPolicyUrl(), objectMapper),
            new HttpAgentClient(objectMapper),
            new AsyncObservabilitySink(new LoggingObservabilitySink()));
    }

    public OrchestratorContext(AppConfig config, ObjectMapper objectMapper, PolicyClient policyClient,
                               AgentClient agentClient, ObservabilitySink sink) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.sink = sink != null ? sink : ObservabilitySink.NOOP;
        this.agentRegistry = new AgentRegistry(config.getRegistryPath(), objectMapper);
        this.authorizationGate = new AuthorizationGate(policyClient, config.getPolicyTimeout());
        this.intentResolver = new IntentResolver(agentRegistry, config.getDefaultAgentId());
        this.dispatchRouter = new DispatchRouter(agentRegistry, authorizationGate, agentClient, this.sink,
            intentResolver, objectMapper, config.getAgentTimeout());
        this.remediation = new RemediationStateMachine(dispatchRouter, RemediationAgents.fromConfig(config),
            this.sink, objectMapper, config.getValidationAttempts());
        this.runTracker = new RemediationRunTracker();
        logger.info("Orchestrator context ready: " + agentRegistry.size() + " agents, policy service "
            + authorizationGate.describePolicyService());
    }

    public AppConfig config() {
        return config;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public AgentRegistry agents() {
        return agentRegistry;
    }

    public AuthorizationGate authorization() {
        return authorizationGate;
    }

    public IntentResolver intents() {
        return intentResolver;
    }

    public DispatchRouter router() {
        return dispatchRouter;
    }

    public RemediationStateMachine remediation() {
        return remediation;
    }

    public RemediationRunTracker runs() {
        return runTracker;
    }

    public ObservabilitySink observability() {
        return sink;
    }

    @Override
    public void close() {
        remediation.shutdown();
        authorizationGate.shutdown();
        if (sink instanceof AsyncObservabilitySink) {
            ((AsyncObservabilitySink) sink).close();
        }
    }
}
