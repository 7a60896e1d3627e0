package com.finopti.remediation;

import com.finopti.AppConfig;

/**
 * Which specialist agent handles each delegating phase.
 */
public class RemediationAgents {

    public static final String DEFAULT_INFRA_AGENT = "gcloud_infrastructure_specialist";
    public static final String DEFAULT_MONITORING_AGENT = "monitoring_specialist";
    public static final String DEFAULT_BROWSER_AGENT = "puppeteer_browser_specialist";
    public static final String DEFAULT_STORAGE_AGENT = "storage_specialist";

    private final String infraAgentId;
    private final String monitoringAgentId;
    private final String browserAgentId;
    private final String storageAgentId;

    public RemediationAgents(String infraAgentId, String monitoringAgentId,
                             String browserAgentId, String storageAgentId) {
        this.infraAgentId = orDefault(infraAgentId, DEFAULT_INFRA_AGENT);
        this.monitoringAgentId = orDefault(monitoringAgentId, DEFAULT_MONITORING_AGENT);
        this.browserAgentId = orDefault(browserAgentId, DEFAULT_BROWSER_AGENT);
        this.storageAgentId = orDefault(storageAgentId, DEFAULT_STORAGE_AGENT);
    }

    public static RemediationAgents defaults() {
        return new RemediationAgents(null, null, null, null);
    }

    public static RemediationAgents fromConfig(AppConfig config) {
        return new RemediationAgents(config.getInfraAgentId(), config.getMonitoringAgentId(),
            config.getBrowserAgentId(), config.getStorageAgentId());
    }

    public String agentFor(RemediationPhase phase) {
        switch (phase) {
            case INFRA_FIX:
                return infraAgentId;
            case VALIDATE:
                return monitoringAgentId;
            case BROWSER_TEST:
                return browserAgentId;
            case REPORT:
                return storageAgentId;
            default:
                throw new IllegalArgumentException("No agent for phase " + phase);
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
