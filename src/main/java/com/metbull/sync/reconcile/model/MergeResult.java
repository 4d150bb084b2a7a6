package com.metbull.sync.reconcile.model;

public record MergeResult(
    CatalogDataset merged,
    int baseCount,
    int incrementalCount,
    int duplicatesCollapsed,
    int withCoordinates
) {
    public int mergedCount() {
        return merged.size();
    }
}
