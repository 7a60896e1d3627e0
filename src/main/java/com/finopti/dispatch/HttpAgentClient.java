package com.finopti.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finopti.models.AgentDescriptor;
import com.finopti.models.RequestContext;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * JSON-over-HTTP client for specialist agents. Sends one POST per call and
 * never retries; retry is the caller's decision.
 */
public class HttpAgentClient implements AgentClient {

    static final int ERROR_PREVIEW_CHARS = 200;

    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    public HttpAgentClient(ObjectMapper mapper, HttpClient httpClient) {
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    public HttpAgentClient(ObjectMapper mapper) {
        this(mapper, HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build());
    }

    @Override
    public AgentResponse execute(AgentDescriptor agent, ObjectNode payload, RequestContext context, Duration timeout)
        throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(agent.getNetworkEndpoint()))
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)));

        if (context.hasCredential()) {
            builder.header("Authorization", context.getUpstreamCredential());
        }
        if (context.getSessionId() != null) {
            builder.header("X-Session-ID", context.getSessionId());
        }
        if (context.hasCallerIdentity()) {
            builder.header("X-User-Email", context.getCallerIdentity());
        }

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        String body = response.body() != null ? response.body() : "";

        JsonNode json = tryParse(body);
        if (status < 200 || status >= 300) {
            String message = json != null ? errorMessage(json) : null;
            if (message == null) {
                message = "Agent request failed (" + status + "): " + truncate(body);
            }
            return AgentResponse.failure(message, status);
        }
        if (json == null || json.isMissingNode() || !json.isObject()) {
            // Plain-text replies are the agent's answer as-is
            ObjectNode wrapped = mapper.createObjectNode();
            wrapped.put("response", body);
            return new AgentResponse(true, wrapped, null, status);
        }

        boolean success = json.path("success").asBoolean(!hasError(json));
        if (!success) {
            String message = errorMessage(json);
            return AgentResponse.failure(message != null ? message : "Agent reported failure", status);
        }
        return new AgentResponse(true, json, null, status);
    }

    private JsonNode tryParse(String body) {
        if (body.isBlank()) {
            return null;
        }
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            return null;
        }
    }

    private static boolean hasError(JsonNode json) {
        JsonNode error = json.get("error");
        if (error == null || error.isNull()) {
            return false;
        }
        return !error.isTextual() || !error.asText().isBlank();
    }

    private static String errorMessage(JsonNode json) {
        for (String field : new String[] {"error", "message"}) {
            JsonNode node = json.get(field);
            if (node != null && node.isTextual() && !node.asText().isBlank()) {
                return node.asText();
            }
            if (node != null && node.isObject()) {
                return node.toString();
            }
        }
        return null;
    }

    private static String truncate(String input) {
        if (input.length() <= ERROR_PREVIEW_CHARS) return input;
        return input.substring(0, ERROR_PREVIEW_CHARS) + "...";
    }
}
