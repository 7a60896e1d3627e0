package com.finopti.remediation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatusAggregatorTest {

    private static DelegationStep step(RemediationPhase phase, boolean ok, int attempt) {
        return new DelegationStep(phase, "agent", null, ok, null, null, ok ? null : "failed", attempt, 1L);
    }

    private static DelegationStep step(RemediationPhase phase, boolean ok) {
        return step(phase, ok, 1);
    }

    @Test
    void allSubstantivePhasesSucceeded() {
        assertEquals(RemediationStatus.SUCCESS, StatusAggregator.aggregate(List.of(
            step(RemediationPhase.INFRA_FIX, true),
            step(RemediationPhase.VALIDATE, true),
            step(RemediationPhase.REPORT, false)), false));
    }

    @Test
    void validationFailureIsPartial() {
        assertEquals(RemediationStatus.PARTIAL, StatusAggregator.aggregate(List.of(
            step(RemediationPhase.INFRA_FIX, true),
            step(RemediationPhase.VALIDATE, false),
            step(RemediationPhase.REPORT, true)), false));
    }

    @Test
    void browserFailureIsPartial() {
        assertEquals(RemediationStatus.PARTIAL, StatusAggregator.aggregate(List.of(
            step(RemediationPhase.VALIDATE, true),
            step(RemediationPhase.BROWSER_TEST, false)), false));
    }

    @Test
    void nothingSucceededIsFailed() {
        assertEquals(RemediationStatus.FAILED, StatusAggregator.aggregate(List.of(
            step(RemediationPhase.VALIDATE, false),
            step(RemediationPhase.REPORT, true)), false));
        assertEquals(RemediationStatus.FAILED, StatusAggregator.aggregate(List.of(), false));
    }

    @Test
    void lastValidationAttemptCounts() {
        assertEquals(RemediationStatus.SUCCESS, StatusAggregator.aggregate(List.of(
            step(RemediationPhase.VALIDATE, false, 1),
            step(RemediationPhase.VALIDATE, true, 2)), false));
    }

    @Test
    void abortedWins() {
        assertEquals(RemediationStatus.ABORTED, StatusAggregator.aggregate(List.of(
            step(RemediationPhase.INFRA_FIX, true)), true));
    }

    @Test
    void wireValuesAreLowercase() {
        assertEquals("partial", RemediationStatus.PARTIAL.wireValue());
    }
}
