package com.metbull.sync.reconcile.util;

import com.metbull.sync.reconcile.model.CatalogDataset;
import com.metbull.sync.reconcile.model.CatalogRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class NameNormalizerTest {

    @Test
    void spellingVariantsShareOneCompareKey() {
        String key = NameNormalizer.compareKey("Allende");
        assertEquals(key, NameNormalizer.compareKey("allende"));
        assertEquals(key, NameNormalizer.compareKey(" Allende "));
        assertEquals("", NameNormalizer.compareKey(null));
    }

    @Test
    void unverifiedMarkerIsStripped() {
        assertEquals("Northwest Africa 15000", NameNormalizer.cleanDisplayName("Northwest Africa 15000*"));
        assertEquals("Aba Panu", NameNormalizer.cleanDisplayName(" *Aba Panu "));
    }

    @Test
    void cleanNamesRewritesOnlyChangedRecords() {
        CatalogDataset dataset = CatalogDataset.of(List.of(
            CatalogRecord.named("Kitchener*"),
            CatalogRecord.named("Allende"),
            CatalogRecord.named("*")
        ));

        int changed = NameNormalizer.cleanNames(dataset);

        assertEquals(1, changed);
        assertThat(dataset.records()).extracting(CatalogRecord::name).containsExactly("Kitchener", "Allende", "*");
        assertEquals(0, NameNormalizer.cleanNames(dataset));
    }
}
