package com.finopti.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What a specialist agent answered to an execute call.
 */
public class AgentResponse {
    private final boolean success;
    private final JsonNode data;
    private final String error;
    private final int statusCode;

    public AgentResponse(boolean success, JsonNode data, String error, int statusCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.statusCode = statusCode;
    }

    public static AgentResponse success(JsonNode data) {
        return new AgentResponse(true, data, null, 200);
    }

    public static AgentResponse failure(String error, int statusCode) {
        return new AgentResponse(false, null, error, statusCode);
    }

    public boolean isSuccess() {
        return success;
    }

    public JsonNode getData() {
        return data;
    }

    public String getError() {
        return error;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
