package com.metbull.sync.reconcile.service;

import com.metbull.sync.reconcile.index.LookupIndex;
import com.metbull.sync.reconcile.model.ApplyResult;
import com.metbull.sync.reconcile.model.CatalogDataset;
import com.metbull.sync.reconcile.model.CatalogRecord;
import com.metbull.sync.reconcile.model.ExternalId;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Fills unresolved ids from a lookup index. Records that already carry an id are
 * skipped, so applying a growing index repeatedly only ever resolves more records.
 */
@Service
public class ReconciliationApplier {

    public ApplyResult apply(CatalogDataset dataset, LookupIndex index) {
        int examined = 0;
        int filled = 0;
        for (int i = 0; i < dataset.size(); i++) {
            CatalogRecord record = dataset.get(i);
            if (record.isResolved()) {
                continue;
            }
            examined++;
            Optional<ExternalId> match = index.lookup(record.name());
            if (match.isPresent()) {
                dataset.replace(i, record.withExternalId(match.get()));
                filled++;
            }
        }
        return new ApplyResult(examined, filled, examined - filled);
    }
}
