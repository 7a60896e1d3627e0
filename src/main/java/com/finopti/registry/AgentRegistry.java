package com.finopti.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finopti.AppLogger;
import com.finopti.models.AgentDescriptor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static catalog of specialist agents, loaded once and cached for the process
 * lifetime. Reads never lock: each load publishes a new immutable map.
 *
 * A failed load leaves the registry empty and unavailable rather than throwing,
 * so every dispatch fails closed.
 */
public class AgentRegistry {

    public static final String BUNDLED_CATALOG = "agents/agent_registry.json";

    private final Path catalogPath;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    private volatile Map<String, AgentDescriptor> agents = Collections.emptyMap();
    private volatile boolean available = false;
    private volatile String loadError = "not loaded";

    /**
     * @param catalogPath catalog file, or null for the bundled classpath catalog
     */
    public AgentRegistry(Path catalogPath, ObjectMapper objectMapper) {
        this.catalogPath = catalogPath;
        this.objectMapper = objectMapper;
        load();
    }

    /**
     * Read the catalog and replace the cached view. Returns the loaded agents,
     * or an empty set when the catalog could not be read.
     */
    public synchronized Set<AgentDescriptor> load() {
        String source = catalogPath != null ? catalogPath.toString() : "classpath:" + BUNDLED_CATALOG;
        try {
            JsonNode root = readCatalog();
            Map<String, AgentDescriptor> loaded = parseCatalog(root);
            agents = Collections.unmodifiableMap(loaded);
            available = true;
            loadError = null;
            logger.info("Loaded agent registry from " + source + ": " + loaded.size() + " agents");
        } catch (IOException | IllegalArgumentException e) {
            agents = Collections.emptyMap();
            available = false;
            loadError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            logger.error("Agent registry unavailable (" + source + "): " + loadError);
        }
        return new LinkedHashSet<>(agents.values());
    }

    /**
     * Explicit invalidation: drop the cached catalog and read it again.
     */
    public Set<AgentDescriptor> reload() {
        return load();
    }

    /**
     * Exact-match lookup by agent id.
     *
     * @return the descriptor, or null when no agent has that id
     */
    public AgentDescriptor resolve(String agentId) {
        if (agentId == null) {
            return null;
        }
        return agents.get(agentId);
    }

    public List<AgentDescriptor> listAgents() {
        return new ArrayList<>(agents.values());
    }

    public int size() {
        return agents.size();
    }

    public boolean isAvailable() {
        return available;
    }

    public String getLoadError() {
        return loadError;
    }

    private JsonNode readCatalog() throws IOException {
        if (catalogPath != null) {
            if (!Files.isRegularFile(catalogPath)) {
                throw new IOException("Catalog not found: " + catalogPath);
            }
            return objectMapper.readTree(catalogPath.toFile());
        }
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(BUNDLED_CATALOG)) {
            if (is == null) {
                throw new IOException("Bundled catalog not found on classpath: " + BUNDLED_CATALOG);
            }
            return objectMapper.readTree(is);
        }
    }

    private Map<String, AgentDescriptor> parseCatalog(JsonNode root) {
        JsonNode records = root;
        if (root != null && root.isObject()) {
            records = root.path("agents");
        }
        if (records == null || !records.isArray()) {
            throw new IllegalArgumentException("Catalog must be a list of agent records");
        }

        Map<String, AgentDescriptor> loaded = new LinkedHashMap<>();
        for (JsonNode record : records) {
            AgentDescriptor descriptor;
            try {
                descriptor = AgentDescriptor.fromJson(record);
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping invalid agent record: " + e.getMessage());
                continue;
            }
            if (loaded.containsKey(descriptor.getAgentId())) {
                logger.warn("Duplicate agent id in catalog, keeping first: " + descriptor.getAgentId());
                continue;
            }
            loaded.put(descriptor.getAgentId(), descriptor);
        }
        return loaded;
    }
}
