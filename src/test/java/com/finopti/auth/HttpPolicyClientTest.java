package com.finopti.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finopti.models.AuthorizationDecision;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpPolicyClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<String> responseBody = new AtomicReference<>();
    private final AtomicReference<Integer> responseStatus = new AtomicReference<>(200);
    private final AtomicReference<JsonNode> lastInput = new AtomicReference<>();
    private Javalin opa;
    private HttpPolicyClient client;

    @BeforeEach
    void startFakePolicyService() {
        opa = Javalin.create(cfg -> cfg.showJavalinBanner = false)
            .post("/v1/data/finopti/authz", ctx -> {
                lastInput.set(mapper.readTree(ctx.body()).path("input"));
                ctx.status(responseStatus.get()).contentType("application/json").result(responseBody.get());
            })
            .start(0);
        client = new HttpPolicyClient("http://localhost:" + opa.port() + "/", mapper);
    }

    @AfterEach
    void stop() {
        opa.stop();
    }

    @Test
    void sendsCallerAndTargetAsOpaInput() throws Exception {
        responseBody.set("{\"result\":{\"allow\":true,\"reason\":\"admin group\"}}");

        AuthorizationDecision decision = client.evaluate("ops@example.com", "monitoring_specialist", TIMEOUT);

        assertTrue(decision.isAllowed());
        assertEquals("admin group", decision.getReason());
        assertEquals("ops@example.com", lastInput.get().path("user_email").asText());
        assertEquals("monitoring_specialist", lastInput.get().path("target_agent").asText());
    }

    @Test
    void denyWithoutReasonGetsDefaultReason() throws Exception {
        responseBody.set("{\"result\":{\"allow\":false}}");

        AuthorizationDecision decision = client.evaluate("outsider@example.com", "gcloud_infrastructure_specialist", TIMEOUT);

        assertFalse(decision.isAllowed());
        assertFalse(decision.getReason().isBlank());
    }

    @Test
    void nonSuccessStatusThrows() {
        responseStatus.set(500);
        responseBody.set("{\"error\":\"internal\"}");

        PolicyServiceException e = assertThrows(PolicyServiceException.class,
            () -> client.evaluate("ops@example.com", "monitoring_specialist", TIMEOUT));
        assertTrue(e.getMessage().contains("500"));
    }

    @Test
    void missingAllowThrows() {
        responseBody.set("{\"result\":{}}");

        assertThrows(PolicyServiceException.class,
            () -> client.evaluate("ops@example.com", "monitoring_specialist", TIMEOUT));
    }

    @Test
    void malformedBodyThrows() {
        responseBody.set("<html>proxy error</html>");

        assertThrows(PolicyServiceException.class,
            () -> client.evaluate("ops@example.com", "monitoring_specialist", TIMEOUT));
    }

    @Test
    void gateOverRealClientFailsClosedOnServerError() {
        responseStatus.set(503);
        responseBody.set("");
        AuthorizationGate gate = new AuthorizationGate(client, TIMEOUT);

        AuthorizationDecision decision = gate.authorize("ops@example.com", "monitoring_specialist");

        assertFalse(decision.isAllowed());
        assertTrue(decision.getReason().contains("503"));
    }

    @Test
    void blankBaseUrlIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new HttpPolicyClient(" ", mapper));
    }
}
