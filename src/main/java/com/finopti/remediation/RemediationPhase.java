package com.finopti.remediation;

/**
 * Phases of a remediation run.
 *
 * <pre>
 * START → INFRA_FIX → VALIDATE → (BROWSER_TEST) → REPORT → DONE
 *   └──────── ABORTED reachable from every non-terminal phase ────────┘
 * </pre>
 */
public enum RemediationPhase {
    START,
    INFRA_FIX,
    VALIDATE,
    BROWSER_TEST,
    REPORT,
    DONE,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }

    /**
     * Phases that delegate to a specialist agent and produce a step.
     */
    public boolean isDelegating() {
        return this == INFRA_FIX || this == VALIDATE || this == BROWSER_TEST || this == REPORT;
    }
}
