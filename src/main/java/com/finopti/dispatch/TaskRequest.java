package com.finopti.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Inbound task: free-text prompt, optionally naming the agent that should
 * handle it.
 */
public class TaskRequest {
    private final String prompt;
    private final String targetAgent;
    private final String projectId;

    public TaskRequest(String prompt, String targetAgent, String projectId) {
        this.prompt = prompt;
        this.targetAgent = targetAgent;
        this.projectId = projectId;
    }

    public static TaskRequest fromJson(JsonNode body) {
        if (body == null || !body.isObject()) {
            return new TaskRequest(null, null, null);
        }
        return new TaskRequest(
            textOrNull(body, "prompt"),
            textOrNull(body, "target_agent"),
            textOrNull(body, "project_id"));
    }

    private static String textOrNull(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }

    public String getPrompt() {
        return prompt;
    }

    public String getTargetAgent() {
        return targetAgent;
    }

    public String getProjectId() {
        return projectId;
    }
}
