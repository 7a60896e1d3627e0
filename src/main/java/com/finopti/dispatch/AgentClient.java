package com.finopti.dispatch;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finopti.models.AgentDescriptor;
import com.finopti.models.RequestContext;

import java.io.IOException;
import java.time.Duration;

/**
 * Boundary to the specialist agents' execute operation.
 */
public interface AgentClient {

    /**
     * Call the agent's execute operation.
     *
     * @param agent resolved catalog entry
     * @param payload request body, already carrying session_id and user_email
     * @param context forwarded unchanged; its credential goes out as the Authorization header
     * @param timeout upper bound for the call
     * @return the agent's answer; application failures come back as unsuccessful responses
     * @throws IOException on transport failure or timeout
     */
    AgentResponse execute(AgentDescriptor agent, ObjectNode payload, RequestContext context, Duration timeout)
        throws IOException, InterruptedException;
}
