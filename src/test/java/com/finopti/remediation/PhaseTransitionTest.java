package com.finopti.remediation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PhaseTransitionTest {

    @Test
    void forwardPathIsAllowed() {
        RemediationPhase phase = RemediationPhase.START;
        phase = PhaseTransition.transition(phase, RemediationPhase.INFRA_FIX);
        phase = PhaseTransition.transition(phase, RemediationPhase.VALIDATE);
        phase = PhaseTransition.transition(phase, RemediationPhase.BROWSER_TEST);
        phase = PhaseTransition.transition(phase, RemediationPhase.REPORT);
        phase = PhaseTransition.transition(phase, RemediationPhase.DONE);
        assertTrue(phase.isTerminal());
    }

    @Test
    void optionalPhasesMayBeSkipped() {
        assertDoesNotThrow(() -> PhaseTransition.validate(RemediationPhase.START, RemediationPhase.VALIDATE, false));
        assertDoesNotThrow(() -> PhaseTransition.validate(RemediationPhase.VALIDATE, RemediationPhase.REPORT, false));
    }

    @Test
    void abortIsReachableFromEveryNonTerminalPhase() {
        for (RemediationPhase phase : RemediationPhase.values()) {
            if (!phase.isTerminal()) {
                assertEquals(RemediationPhase.ABORTED, PhaseTransition.transition(phase, RemediationPhase.ABORTED));
            }
        }
    }

    @Test
    void terminalPhasesNeverMove() {
        assertThrows(IllegalStateException.class,
            () -> PhaseTransition.transition(RemediationPhase.DONE, RemediationPhase.ABORTED));
        assertThrows(IllegalStateException.class,
            () -> PhaseTransition.transition(RemediationPhase.ABORTED, RemediationPhase.REPORT));
    }

    @Test
    void revisitRequiresExplicitRetry() {
        assertThrows(IllegalStateException.class,
            () -> PhaseTransition.validate(RemediationPhase.VALIDATE, RemediationPhase.VALIDATE, false));
        assertDoesNotThrow(() -> PhaseTransition.validate(RemediationPhase.VALIDATE, RemediationPhase.VALIDATE, true));
        assertThrows(IllegalStateException.class,
            () -> PhaseTransition.validate(RemediationPhase.INFRA_FIX, RemediationPhase.INFRA_FIX, true));
    }

    @Test
    void backwardsAndSkippingReportAreRejected() {
        assertThrows(IllegalStateException.class,
            () -> PhaseTransition.transition(RemediationPhase.VALIDATE, RemediationPhase.INFRA_FIX));
        assertThrows(IllegalStateException.class,
            () -> PhaseTransition.transition(RemediationPhase.VALIDATE, RemediationPhase.DONE));
        assertThrows(IllegalArgumentException.class,
            () -> PhaseTransition.transition(null, RemediationPhase.DONE));
    }
}
