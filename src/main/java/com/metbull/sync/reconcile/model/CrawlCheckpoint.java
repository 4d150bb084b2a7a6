package com.metbull.sync.reconcile.model;

import java.time.Instant;

public record CrawlCheckpoint(
    String profile,
    int nextPage,
    int lastPage,
    int pagesProcessed,
    int resolvedIds,
    int unresolvedIds,
    int indexedNames,
    Instant writtenAt
) {
}
