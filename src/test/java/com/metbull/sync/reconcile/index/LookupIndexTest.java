package com.metbull.sync.reconcile.index;

import com.metbull.sync.reconcile.model.ExternalId;
import com.metbull.sync.reconcile.model.ExtractedEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LookupIndexTest {

    @Test
    void findsNamesRegardlessOfCaseAndPadding() {
        LookupIndex index = new LookupIndex();
        index.put("Allende", 2278);

        assertThat(index.lookup("Allende")).contains(ExternalId.of(2278));
        assertThat(index.lookup("allende")).contains(ExternalId.of(2278));
        assertThat(index.lookup(" ALLENDE ")).contains(ExternalId.of(2278));
        assertThat(index.lookup("Murchison")).isEmpty();
    }

    @Test
    void exactNameWinsOverCaseFoldedMatch() {
        LookupIndex index = new LookupIndex();
        index.put("Ider", 10);
        index.put("IDER", 20);

        assertThat(index.lookup("Ider")).contains(ExternalId.of(10));
        assertThat(index.lookup("IDER")).contains(ExternalId.of(20));
        assertThat(index.lookup("ider")).contains(ExternalId.of(20));
    }

    @Test
    void laterIdWinsAndCollisionIsCounted() {
        LookupIndex index = new LookupIndex();
        index.addAll(List.of(new ExtractedEntry(7, "Dhofar 100"), new ExtractedEntry(9, "Dhofar 100")));
        index.put("Dhofar 100", 9);

        assertThat(index.lookup("Dhofar 100")).contains(ExternalId.of(9));
        assertThat(index.collisions()).isEqualTo(1);
        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    void ignoresBlankNamesAndNonPositiveIds() {
        LookupIndex index = new LookupIndex();
        index.put("  ", 5);
        index.put("Zag", 0);

        assertThat(index.isEmpty()).isTrue();
    }
}
