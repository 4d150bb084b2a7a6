package com.metbull.sync.reconcile.model;

public record HarvestSummary(
    RunOutcome outcome,
    int pagesFetched,
    int rowsHarvested,
    int rowsKept,
    MergeResult merge
) {
}
