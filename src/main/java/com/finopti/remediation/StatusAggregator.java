package com.finopti.remediation;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes a run's final status from its step list. A pure function of the
 * steps, so replaying a recorded list gives the same answer as the live run.
 *
 * <p>Only the last attempt of each substantive phase counts; REPORT never
 * counts.
 */
public final class StatusAggregator {

    private StatusAggregator() {
    }

    public static RemediationStatus aggregate(List<DelegationStep> steps, boolean aborted) {
        if (aborted) {
            return RemediationStatus.ABORTED;
        }
        Map<RemediationPhase, Boolean> lastOutcome = new EnumMap<>(RemediationPhase.class);
        if (steps != null) {
            for (DelegationStep step : steps) {
                if (step.getPhase() == RemediationPhase.REPORT) {
                    continue;
                }
                lastOutcome.put(step.getPhase(), step.isSuccess());
            }
        }
        if (lastOutcome.isEmpty()) {
            return RemediationStatus.FAILED;
        }

        int succeeded = 0;
        for (Boolean ok : lastOutcome.values()) {
            if (ok) {
                succeeded++;
            }
        }
        if (succeeded == lastOutcome.size()) {
            return RemediationStatus.SUCCESS;
        }
        return succeeded > 0 ? RemediationStatus.PARTIAL : RemediationStatus.FAILED;
    }
}
