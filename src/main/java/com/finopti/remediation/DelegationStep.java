package com.finopti.remediation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.finopti.dispatch.DispatchResult;
import com.finopti.dispatch.ErrorKind;

/**
 * One delegation made by a remediation run. Immutable; the run's step list is
 * append-only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DelegationStep {

    static final int ACTION_PREVIEW_CHARS = 200;

    private final RemediationPhase phase;
    private final String targetAgentId;
    private final JsonNode requestPayload;
    private final boolean success;
    private final JsonNode response;
    private final ErrorKind errorKind;
    private final String error;
    private final int attempt;
    private final long timestamp;

    public DelegationStep(RemediationPhase phase, String targetAgentId, JsonNode requestPayload,
                          boolean success, JsonNode response, ErrorKind errorKind, String error,
                          int attempt, long timestamp) {
        if (phase == null || !phase.isDelegating()) {
            throw new IllegalArgumentException("phase must be a delegating phase: " + phase);
        }
        this.phase = phase;
        this.targetAgentId = targetAgentId;
        this.requestPayload = requestPayload;
        this.success = success;
        this.response = response;
        this.errorKind = success ? null : (errorKind != null ? errorKind : ErrorKind.DELEGATION_FAILURE);
        this.error = success ? null : error;
        this.attempt = Math.max(1, attempt);
        this.timestamp = timestamp;
    }

    public static DelegationStep fromResult(RemediationPhase phase, String targetAgentId, JsonNode payload,
                                            DispatchResult result, int attempt, long timestamp) {
        return new DelegationStep(phase, targetAgentId, payload, result.isOk(), result.getData(),
            result.getErrorKind(), result.getMessage(), attempt, timestamp);
    }

    @JsonProperty("phase")
    public RemediationPhase getPhase() {
        return phase;
    }

    @JsonProperty("target_agent")
    public String getTargetAgentId() {
        return targetAgentId;
    }

    @JsonIgnore
    public JsonNode getRequestPayload() {
        return requestPayload;
    }

    /**
     * Short description of what was asked of the agent.
     */
    @JsonProperty("action")
    public String getAction() {
        if (requestPayload == null) {
            return null;
        }
        String prompt = requestPayload.path("prompt").asText("");
        int newline = prompt.indexOf('\n');
        String firstLine = newline >= 0 ? prompt.substring(0, newline) : prompt;
        if (firstLine.length() > ACTION_PREVIEW_CHARS) {
            return firstLine.substring(0, ACTION_PREVIEW_CHARS) + "...";
        }
        return firstLine;
    }

    @JsonProperty("outcome")
    public String getOutcome() {
        return success ? "success" : "failure";
    }

    @JsonIgnore
    public boolean isSuccess() {
        return success;
    }

    @JsonProperty("response")
    public JsonNode getResponse() {
        return response;
    }

    @JsonProperty("error_kind")
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    @JsonProperty("error")
    public String getError() {
        return error;
    }

    @JsonProperty("attempt")
    public int getAttempt() {
        return attempt;
    }

    @JsonProperty("timestamp")
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return phase + " -> " + targetAgentId + ": " + getOutcome() + (error != null ? " (" + error + ")" : "");
    }
}
