package com.finopti.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of one routed call: either the agent's data, or an error kind with a
 * caller-facing message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DispatchResult {

    private final boolean ok;
    private final String agentId;
    private final JsonNode data;
    private final ErrorKind errorKind;
    private final String message;
    private final long latencyMs;

    private DispatchResult(boolean ok, String agentId, JsonNode data, ErrorKind errorKind,
                           String message, long latencyMs) {
        this.ok = ok;
        this.agentId = agentId;
        this.data = data;
        this.errorKind = errorKind;
        this.message = message;
        this.latencyMs = latencyMs;
    }

    public static DispatchResult ok(String agentId, JsonNode data, long latencyMs) {
        return new DispatchResult(true, agentId, data, null, null, latencyMs);
    }

    public static DispatchResult error(ErrorKind kind, String message, String agentId) {
        return error(kind, message, agentId, 0L);
    }

    public static DispatchResult error(ErrorKind kind, String message, String agentId, long latencyMs) {
        if (kind == null) {
            throw new IllegalArgumentException("error kind is required");
        }
        String m = message == null || message.isBlank() ? kind.name() : message;
        return new DispatchResult(false, agentId, null, kind, m, latencyMs);
    }

    @JsonProperty("success")
    public boolean isOk() {
        return ok;
    }

    @JsonProperty("target_agent")
    public String getAgentId() {
        return agentId;
    }

    @JsonProperty("data")
    public JsonNode getData() {
        return data;
    }

    @JsonProperty("kind")
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("latency_ms")
    public long getLatencyMs() {
        return latencyMs;
    }

    @Override
    public String toString() {
        return ok
            ? "DispatchResult{ok, agent=" + agentId + "}"
            : "DispatchResult{" + errorKind + ", agent=" + agentId + ", message=" + message + "}";
    }
}
