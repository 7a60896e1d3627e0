package com.finopti.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finopti.models.AuthorizationDecision;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Policy client for an OPA-style data API:
 * {@code POST {baseUrl}/v1/data/finopti/authz} with
 * {@code {"input": {"user_email", "target_agent"}}}, answered by
 * {@code {"result": {"allow", "reason"}}}.
 */
public class HttpPolicyClient implements PolicyClient {

    static final String DECISION_PATH = "/v1/data/finopti/authz";

    private final String baseUrl;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    public HttpPolicyClient(String baseUrl, ObjectMapper mapper, HttpClient httpClient) {
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    public HttpPolicyClient(String baseUrl, ObjectMapper mapper) {
        this(baseUrl, mapper, HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build());
    }

    @Override
    public AuthorizationDecision evaluate(String callerIdentity, String targetAgentId, Duration timeout)
        throws IOException, InterruptedException {
        ObjectNode payload = mapper.createObjectNode();
        ObjectNode input = payload.putObject("input");
        input.put("user_email", callerIdentity);
        input.put("target_agent", targetAgentId);

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + DECISION_PATH))
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)))
            .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new PolicyServiceException("policy service returned " + status);
        }

        JsonNode body;
        try {
            body = mapper.readTree(response.body());
        } catch (IOException e) {
            throw new PolicyServiceException("malformed policy response", e);
        }
        JsonNode result = body != null ? body.path("result") : null;
        if (result == null || !result.isObject() || !result.path("allow").isBoolean()) {
            throw new PolicyServiceException("malformed policy response: missing result.allow");
        }

        String reason = result.path("reason").asText("");
        return result.path("allow").asBoolean()
            ? AuthorizationDecision.allow(reason)
            : AuthorizationDecision.deny(reason);
    }

    @Override
    public String describe() {
        return baseUrl;
    }

    private static String normalizeBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("policy service URL is required");
        }
        String url = baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }
}
