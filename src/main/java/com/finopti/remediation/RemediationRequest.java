package com.finopti.remediation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Inbound remediation request body. Both documents may be absent here; the
 * START phase rejects them.
 */
public class RemediationRequest {

    private final String rcaDocument;
    private final String resolutionPlan;
    private final String runId;

    public RemediationRequest(String rcaDocument, String resolutionPlan, String runId) {
        this.rcaDocument = rcaDocument;
        this.resolutionPlan = resolutionPlan;
        this.runId = runId == null || runId.isBlank() ? null : runId.trim();
    }

    public RemediationRequest(String rcaDocument, String resolutionPlan) {
        this(rcaDocument, resolutionPlan, null);
    }

    /**
     * A structured (object) plan is kept as its JSON text.
     */
    public static RemediationRequest fromJson(JsonNode body) {
        if (body == null || !body.isObject()) {
            return new RemediationRequest(null, null, null);
        }
        return new RemediationRequest(
            text(body.get("rca_document")),
            text(body.get("resolution_plan")),
            text(body.get("run_id")));
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isContainerNode()) {
            return node.toString();
        }
        return node.asText();
    }

    public String getRcaDocument() {
        return rcaDocument;
    }

    public String getResolutionPlan() {
        return resolutionPlan;
    }

    public String getRunId() {
        return runId;
    }
}
