package com.finopti.controllers;

import com.finopti.AppLogger;
import com.finopti.models.AgentDescriptor;
import com.finopti.registry.AgentRegistry;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read access to the agent registry, plus explicit reload.
 */
public class AgentController implements Controller {

    private final AgentRegistry registry;
    private final AppLogger logger;

    public AgentController(AgentRegistry registry) {
        this.registry = registry;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/agents", this::getAgents);
        app.get("/api/agents/{id}", this::getAgent);
        app.post("/api/agents/reload", this::reloadAgents);
    }

    private void getAgents(Context ctx) {
        if (!registry.isAvailable()) {
            ctx.status(503).json(Map.of("error", "Agent registry unavailable: " + registry.getLoadError()));
            return;
        }
        ctx.json(registry.listAgents());
    }

    private void getAgent(Context ctx) {
        String id = ctx.pathParam("id");
        AgentDescriptor agent = registry.resolve(id);
        if (agent == null) {
            ctx.status(404).json(Map.of("error", "Unknown agent: " + id));
            return;
        }
        ctx.json(agent);
    }

    private void reloadAgents(Context ctx) {
        Set<AgentDescriptor> loaded = registry.reload();
        logger.info("Agent registry reloaded: " + loaded.size() + " agents");
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("available", registry.isAvailable());
        body.put("count", loaded.size());
        if (!registry.isAvailable()) {
            body.put("error", registry.getLoadError());
            ctx.status(503);
        }
        ctx.json(body);
    }
}
