package com.finopti.remediation;

/**
 * Transition rules for {@link RemediationPhase}. Terminal phases never move;
 * staying in the same phase is only legal as an explicit retry of VALIDATE.
 */
public final class PhaseTransition {

    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @throws IllegalArgumentException from or to is null
     * @throws IllegalStateException the transition is not allowed
     */
    public static void validate(RemediationPhase from, RemediationPhase to, boolean retry) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to));
        }
        if (from == to) {
            if (!retry || from != RemediationPhase.VALIDATE) {
                throw new IllegalStateException(
                    String.format("Phase %s cannot be revisited without an explicit retry", from));
            }
            return;
        }
        if (to == RemediationPhase.ABORTED) {
            return;
        }

        boolean valid;
        switch (from) {
            case START:
                valid = to == RemediationPhase.INFRA_FIX || to == RemediationPhase.VALIDATE;
                break;
            case INFRA_FIX:
                valid = to == RemediationPhase.VALIDATE;
                break;
            case VALIDATE:
                valid = to == RemediationPhase.BROWSER_TEST || to == RemediationPhase.REPORT;
                break;
            case BROWSER_TEST:
                valid = to == RemediationPhase.REPORT;
                break;
            case REPORT:
                valid = to == RemediationPhase.DONE;
                break;
            default:
                valid = false;
        }
        if (!valid) {
            throw new IllegalStateException(String.format("Invalid phase transition: %s → %s", from, to));
        }
    }

    public static RemediationPhase transition(RemediationPhase current, RemediationPhase next) {
        validate(current, next, false);
        return next;
    }
}
