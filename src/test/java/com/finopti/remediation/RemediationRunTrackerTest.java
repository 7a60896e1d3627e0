package com.finopti.remediation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RemediationRunTrackerTest {

    @Test
    void generatedRunIdsHaveRunPrefix() {
        String id = new RemediationRunTracker().generateRunId();

        assertTrue(id.matches("run_[0-9a-f]{12}"), id);
    }

    @Test
    void cancelRaisesTheRegisteredToken() {
        RemediationRunTracker tracker = new RemediationRunTracker();
        CancellationToken token = tracker.register("run_a", "sre@example.com");

        assertEquals(RemediationRunTracker.CancelOutcome.CANCELLED, tracker.cancel("run_a", "SRE@example.com"));
        assertTrue(token.isCancelled());
        assertFalse(token.cancel(), "already raised");
    }

    @Test
    void unknownOrCompletedRunsCannotBeCancelled() {
        RemediationRunTracker tracker = new RemediationRunTracker();
        tracker.register("run_b", "sre@example.com");
        tracker.complete("run_b");

        assertEquals(RemediationRunTracker.CancelOutcome.NOT_FOUND, tracker.cancel("run_b", "sre@example.com"));
        assertEquals(RemediationRunTracker.CancelOutcome.NOT_FOUND, tracker.cancel("run_missing", "sre@example.com"));
        assertEquals(RemediationRunTracker.CancelOutcome.NOT_FOUND, tracker.cancel(null, null));
        assertTrue(tracker.activeRuns().isEmpty());
    }

    @Test
    void duplicateRunIdIsRejectedWhileActive() {
        RemediationRunTracker tracker = new RemediationRunTracker();
        tracker.register("run_c", null);

        assertThrows(IllegalStateException.class, () -> tracker.register("run_c", null));
        assertTrue(tracker.isActive("run_c"));
    }

    @Test
    void onlyTheOwnerMayCancel() {
        RemediationRunTracker tracker = new RemediationRunTracker();
        CancellationToken token = tracker.register("run_d", "sre@example.com");

        assertEquals(RemediationRunTracker.CancelOutcome.NOT_OWNER, tracker.cancel("run_d", "intruder@example.com"));
        assertEquals(RemediationRunTracker.CancelOutcome.NOT_OWNER, tracker.cancel("run_d", null));
        assertFalse(token.isCancelled());
        assertTrue(tracker.isActive("run_d"));
    }

    @Test
    void anonymousRunCanBeCancelledByAnyCaller() {
        RemediationRunTracker tracker = new RemediationRunTracker();
        CancellationToken token = tracker.register("run_e", null);

        assertEquals(RemediationRunTracker.CancelOutcome.CANCELLED, tracker.cancel("run_e", null));
        assertTrue(token.isCancelled());
    }
}
