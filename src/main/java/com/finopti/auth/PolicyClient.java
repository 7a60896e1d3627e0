package com.finopti.auth;

import com.finopti.models.AuthorizationDecision;

import java.io.IOException;
import java.time.Duration;

/**
 * Boundary to the external policy-evaluation service.
 */
public interface PolicyClient {

    /**
     * Ask the policy service whether the caller may reach the target agent.
     *
     * @param callerIdentity caller email or subject
     * @param targetAgentId registry id of the agent being called
     * @param timeout upper bound for the whole exchange
     * @return the service's verdict
     * @throws IOException on transport failure, non-2xx status or a malformed answer
     */
    AuthorizationDecision evaluate(String callerIdentity, String targetAgentId, Duration timeout)
        throws IOException, InterruptedException;

    /**
     * Where the service lives, for health output and error messages.
     */
    String describe();
}
