package com.metbull.sync.reconcile.model;

public enum RunOutcome {
    COMPLETED,
    NOTHING_TO_DO,
    NO_DATA,
    INPUT_MISSING,
    ABORTED
}
