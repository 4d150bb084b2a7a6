package com.metbull.sync.reconcile.model;

public record ReconciliationSummary(
    String profile,
    RunOutcome outcome,
    StopReason stopReason,
    int pagesFetched,
    int pagesWithData,
    int pagesFailed,
    int indexedNames,
    int namesCleaned,
    int missingBefore,
    int missingAfter,
    int checkpointsWritten
) {
    public int filled() {
        return Math.max(0, missingBefore - missingAfter);
    }

    public static ReconciliationSummary skipped(String profile, RunOutcome outcome, int namesCleaned, int missing) {
        return new ReconciliationSummary(profile, outcome, null, 0, 0, 0, 0, namesCleaned, missing, missing, 0);
    }
}
