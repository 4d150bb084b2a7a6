package com.metbull.sync.reconcile.model;

import java.util.List;
import java.util.SortedMap;

public record MissingIdReport(
    int totalRecords,
    int missingCount,
    List<CatalogRecord> sample,
    SortedMap<Integer, Integer> recentYearDistribution
) {
}
