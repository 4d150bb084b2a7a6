package com.metbull.sync.reconcile.service;

import com.metbull.sync.reconcile.index.LookupIndex;
import com.metbull.sync.reconcile.model.ApplyResult;
import com.metbull.sync.reconcile.model.CatalogDataset;
import com.metbull.sync.reconcile.model.CatalogRecord;
import com.metbull.sync.reconcile.model.ExternalId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ReconciliationApplierTest {
    private final ReconciliationApplier applier = new ReconciliationApplier();

    @Test
    void fillsMissingIdFromPage() {
        CatalogDataset dataset = CatalogDataset.of(List.of(CatalogRecord.named("NWA 869")));
        LookupIndex index = new LookupIndex();
        index.put("NWA 869", 1234);

        ApplyResult result = applier.apply(dataset, index);

        assertEquals(1, result.filled());
        assertEquals(0, result.remaining());
        assertThat(dataset.get(0).externalId()).isEqualTo(ExternalId.of(1234));
    }

    @Test
    void neverOverwritesResolvedId() {
        CatalogDataset dataset = CatalogDataset.of(List.of(CatalogRecord.named("Allende").withExternalId(ExternalId.of(7))));
        LookupIndex index = new LookupIndex();
        index.put("Allende", 9);

        ApplyResult result = applier.apply(dataset, index);

        assertEquals(0, result.examined());
        assertThat(dataset.get(0).externalId()).isEqualTo(ExternalId.of(7));
    }

    @Test
    void matchesAcrossCaseAndPadding() {
        CatalogDataset dataset = CatalogDataset.of(List.of(CatalogRecord.named("allende")));
        LookupIndex index = new LookupIndex();
        index.put(" Allende ", 2278);

        applier.apply(dataset, index);

        assertThat(dataset.get(0).externalId()).isEqualTo(ExternalId.of(2278));
    }

    @Test
    void applyingTwiceChangesNothing() {
        CatalogDataset dataset = CatalogDataset.of(List.of(
            CatalogRecord.named("Aachen"),
            CatalogRecord.named("Murchison"),
            CatalogRecord.named("Tissint")
        ));
        LookupIndex index = new LookupIndex();
        index.put("Aachen", 1);
        index.put("Tissint", 54823);

        applier.apply(dataset, index);
        List<CatalogRecord> afterFirst = List.copyOf(dataset.records());
        ApplyResult second = applier.apply(dataset, index);

        assertThat(dataset.records()).isEqualTo(afterFirst);
        assertEquals(0, second.filled());
        assertEquals(1, second.remaining());
    }

    @Test
    void growingIndexOnlyResolvesMore() {
        CatalogDataset dataset = CatalogDataset.of(List.of(
            CatalogRecord.named("Aachen"),
            CatalogRecord.named("Murchison"),
            CatalogRecord.named("Tissint")
        ));
        LookupIndex index = new LookupIndex();
        index.put("Aachen", 1);

        applier.apply(dataset, index);
        int resolvedAfterFirst = dataset.resolvedCount();
        index.put("Murchison", 16875);
        index.put("Aachen", 99);
        applier.apply(dataset, index);

        assertThat(dataset.resolvedCount()).isGreaterThanOrEqualTo(resolvedAfterFirst).isEqualTo(2);
        assertThat(dataset.get(0).externalId()).isEqualTo(ExternalId.of(1));
    }
}
