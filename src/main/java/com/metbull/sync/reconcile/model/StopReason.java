package com.metbull.sync.reconcile.model;

public enum StopReason {
    EMPTY_PAGE,
    YEAR_FLOOR,
    PAGE_CEILING,
    ABORTED
}
