package com.finopti.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Catalog entry for one specialist agent. Immutable once loaded.
 */
public final class AgentDescriptor {

    private final String agentId;
    private final String displayName;
    private final String networkEndpoint;
    private final Set<String> capabilities;
    private final boolean requiresCredential;

    public AgentDescriptor(String agentId, String displayName, String networkEndpoint,
                           Collection<String> capabilities, boolean requiresCredential) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent_id is required");
        }
        if (networkEndpoint == null || networkEndpoint.isBlank()) {
            throw new IllegalArgumentException("network_endpoint is required for agent " + agentId);
        }
        this.agentId = agentId.trim();
        this.displayName = displayName == null || displayName.isBlank() ? this.agentId : displayName.trim();
        this.networkEndpoint = networkEndpoint.trim();
        this.capabilities = normalizeCapabilities(capabilities);
        this.requiresCredential = requiresCredential;
    }

    public AgentDescriptor(String agentId, String displayName, String networkEndpoint,
                           Collection<String> capabilities) {
        this(agentId, displayName, networkEndpoint, capabilities, false);
    }

    /**
     * Build a descriptor from one catalog record. Accepts the generated
     * registry shape too: {@code name} for the display name, {@code url} or
     * {@code endpoint} for the location and a comma separated capability string.
     */
    public static AgentDescriptor fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("agent record must be a JSON object");
        }
        String id = text(node, "agent_id", "id");
        String name = text(node, "display_name", "name");
        String endpoint = text(node, "network_endpoint", "endpoint", "url");

        Set<String> caps = new LinkedHashSet<>();
        JsonNode capsNode = node.path("capabilities");
        if (capsNode.isArray()) {
            for (JsonNode cap : capsNode) {
                caps.add(cap.asText());
            }
        } else if (capsNode.isTextual()) {
            for (String part : capsNode.asText().split(",")) {
                caps.add(part);
            }
        }
        boolean gated = node.path("requires_credential").asBoolean(false);
        return new AgentDescriptor(id, name, endpoint, caps, gated);
    }

    private static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private static Set<String> normalizeCapabilities(Collection<String> raw) {
        Set<String> normalized = new LinkedHashSet<>();
        if (raw != null) {
            for (String cap : raw) {
                if (cap != null && !cap.isBlank()) {
                    normalized.add(cap.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return Collections.unmodifiableSet(normalized);
    }

    @JsonProperty("agent_id")
    public String getAgentId() {
        return agentId;
    }

    @JsonProperty("display_name")
    public String getDisplayName() {
        return displayName;
    }

    @JsonProperty("network_endpoint")
    public String getNetworkEndpoint() {
        return networkEndpoint;
    }

    @JsonProperty("capabilities")
    public Set<String> getCapabilities() {
        return capabilities;
    }

    @JsonProperty("requires_credential")
    public boolean isRequiresCredential() {
        return requiresCredential;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AgentDescriptor)) return false;
        AgentDescriptor that = (AgentDescriptor) o;
        return requiresCredential == that.requiresCredential
            && agentId.equals(that.agentId)
            && displayName.equals(that.displayName)
            && networkEndpoint.equals(that.networkEndpoint)
            && capabilities.equals(that.capabilities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(agentId, displayName, networkEndpoint, capabilities, requiresCredential);
    }

    @Override
    public String toString() {
        return "AgentDescriptor{" + agentId + " @ " + networkEndpoint + "}";
    }
}
