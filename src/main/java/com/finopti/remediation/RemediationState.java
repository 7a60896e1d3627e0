package com.finopti.remediation;

import com.finopti.models.RequestContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State of one remediation run. Read access is public; every mutation is
 * package-private and made by {@link RemediationStateMachine#advance}.
 */
public class RemediationState {

    private final String runId;
    private final String rcaDocument;
    private final String resolutionPlan;
    private final RequestContext context;
    private final List<DelegationStep> steps = new ArrayList<>();

    private RemediationPlan plan;
    private RemediationPhase phase = RemediationPhase.START;
    private RemediationStatus status;
    private String abortReason;
    private String reportUrl;
    private int validationAttempts;
    private long lastTimestamp;

    public RemediationState(String runId, String rcaDocument, String resolutionPlan, RequestContext context) {
        this.runId = runId;
        this.rcaDocument = rcaDocument;
        this.resolutionPlan = resolutionPlan;
        this.context = context;
    }

    void moveTo(RemediationPhase next, boolean retry) {
        PhaseTransition.validate(phase, next, retry);
        phase = next;
    }

    void abort(String reason) {
        moveTo(RemediationPhase.ABORTED, false);
        abortReason = reason;
        status = RemediationStatus.ABORTED;
    }

    void finish(RemediationStatus finalStatus) {
        moveTo(RemediationPhase.DONE, false);
        status = finalStatus;
    }

    void appendStep(DelegationStep step) {
        if (step.getTimestamp() < lastTimestamp) {
            throw new IllegalArgumentException("step timestamp goes backwards: "
                + step.getTimestamp() + " < " + lastTimestamp);
        }
        steps.add(step);
        lastTimestamp = step.getTimestamp();
    }

    /**
     * Clamp a clock reading so step timestamps never decrease within the run.
     */
    long nextTimestamp(long now) {
        return Math.max(now, lastTimestamp);
    }

    void setPlan(RemediationPlan plan) {
        this.plan = plan;
    }

    void setReportUrl(String reportUrl) {
        this.reportUrl = reportUrl;
    }

    int incrementValidationAttempts() {
        return ++validationAttempts;
    }

    public String getRunId() {
        return runId;
    }

    public String getRcaDocument() {
        return rcaDocument;
    }

    public String getResolutionPlan() {
        return resolutionPlan;
    }

    public RequestContext getContext() {
        return context;
    }

    public RemediationPlan getPlan() {
        return plan;
    }

    public RemediationPhase getPhase() {
        return phase;
    }

    public boolean isTerminal() {
        return phase.isTerminal();
    }

    public RemediationStatus getStatus() {
        return status;
    }

    public String getAbortReason() {
        return abortReason;
    }

    public String getReportUrl() {
        return reportUrl;
    }

    public int getValidationAttempts() {
        return validationAttempts;
    }

    public List<DelegationStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }
}
