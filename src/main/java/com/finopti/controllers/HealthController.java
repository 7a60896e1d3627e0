package com.finopti.controllers;

import com.finopti.auth.AuthorizationGate;
import com.finopti.registry.AgentRegistry;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

public class HealthController implements Controller {

    private final String version;
    private final AgentRegistry registry;
    private final AuthorizationGate gate;

    public HealthController(String version, AgentRegistry registry, AuthorizationGate gate) {
        this.version = version;
        this.registry = registry;
        this.gate = gate;
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/health", this::health);
    }

    private void health(Context ctx) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", registry.isAvailable() ? "ok" : "degraded");
        body.put("version", version);
        body.put("agents", registry.size());
        body.put("registry_available", registry.isAvailable());
        body.put("policy_service", gate.describePolicyService());
        ctx.json(body);
    }
}
