package com.finopti.remediation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What a remediation run returns to its caller.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RemediationResult {

    private final String runId;
    private final RemediationStatus status;
    private final List<DelegationStep> steps;
    private final String explanation;
    private final String reportUrl;
    private final String abortReason;

    public RemediationResult(String runId, RemediationStatus status, List<DelegationStep> steps,
                             String explanation, String reportUrl, String abortReason) {
        this.runId = runId;
        this.status = status;
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.explanation = explanation;
        this.reportUrl = reportUrl;
        this.abortReason = abortReason;
    }

    public static RemediationResult fromState(RemediationState state) {
        if (!state.isTerminal()) {
            throw new IllegalStateException("Run " + state.getRunId() + " has not finished (phase "
                + state.getPhase() + ")");
        }
        return new RemediationResult(state.getRunId(), state.getStatus(), state.getSteps(),
            explain(state), state.getReportUrl(), state.getAbortReason());
    }

    static String explain(RemediationState state) {
        if (state.getStatus() == RemediationStatus.ABORTED) {
            return "Remediation aborted: " + state.getAbortReason();
        }
        StringBuilder sb = new StringBuilder();
        switch (state.getStatus()) {
            case SUCCESS:
                sb.append("Remediation succeeded.");
                break;
            case PARTIAL:
                sb.append("Remediation partially succeeded.");
                break;
            default:
                sb.append("Remediation failed.");
                break;
        }
        for (DelegationStep step : state.getSteps()) {
            sb.append(' ').append(step.getPhase()).append(" (").append(step.getTargetAgentId()).append("): ");
            sb.append(step.isSuccess() ? "succeeded" : "failed, " + step.getError());
            sb.append('.');
        }
        return sb.toString();
    }

    @JsonProperty("run_id")
    public String getRunId() {
        return runId;
    }

    @JsonProperty("status")
    public RemediationStatus getStatus() {
        return status;
    }

    @JsonProperty("steps")
    public List<DelegationStep> getSteps() {
        return steps;
    }

    @JsonProperty("explanation")
    public String getExplanation() {
        return explanation;
    }

    @JsonProperty("report_url")
    public String getReportUrl() {
        return reportUrl;
    }

    @JsonProperty("abort_reason")
    public String getAbortReason() {
        return abortReason;
    }
}
