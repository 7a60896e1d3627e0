package com.finopti.remediation;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the cancellation tokens of in-flight remediation runs by run id,
 * together with the caller that started each run.
 */
public class RemediationRunTracker {

    public enum CancelOutcome {
        CANCELLED,
        NOT_FOUND,
        NOT_OWNER
    }

    private static final class ActiveRun {
        final CancellationToken token;
        final String owner;

        ActiveRun(CancellationToken token, String owner) {
            this.token = token;
            this.owner = owner;
        }
    }

    private final ConcurrentHashMap<String, ActiveRun> runs = new ConcurrentHashMap<>();

    public String generateRunId() {
        return "run_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    /**
     * @param owner caller identity that started the run; may be null
     * @throws IllegalStateException a run with this id is already in flight
     */
    public CancellationToken register(String runId, String owner) {
        ActiveRun run = new ActiveRun(new CancellationToken(), owner);
        ActiveRun existing = runs.putIfAbsent(runId, run);
        if (existing != null) {
            throw new IllegalStateException("Run already in progress: " + runId);
        }
        return run.token;
    }

    /**
     * Request cancellation of a running run. Only the caller that started a
     * run may cancel it; a run started without an identity can be cancelled
     * by anyone.
     */
    public CancelOutcome cancel(String runId, String caller) {
        ActiveRun run = runId != null ? runs.get(runId) : null;
        if (run == null) {
            return CancelOutcome.NOT_FOUND;
        }
        if (run.owner != null && (caller == null || !run.owner.equalsIgnoreCase(caller.trim()))) {
            return CancelOutcome.NOT_OWNER;
        }
        run.token.cancel();
        return CancelOutcome.CANCELLED;
    }

    public void complete(String runId) {
        if (runId != null) {
            runs.remove(runId);
        }
    }

    public boolean isActive(String runId) {
        return runId != null && runs.containsKey(runId);
    }

    public Set<String> activeRuns() {
        return Set.copyOf(runs.keySet());
    }
}
