package com.metbull.sync.reconcile.service;

import com.metbull.sync.config.SyncProperties;
import com.metbull.sync.reconcile.model.CatalogDataset;
import com.metbull.sync.reconcile.model.CatalogRecord;
import com.metbull.sync.reconcile.model.ExternalId;
import com.metbull.sync.reconcile.model.MissingIdReport;
import com.metbull.sync.reconcile.persistence.CatalogCsvRepository;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MissingIdDiagnosticsServiceTest {
    private final MissingIdDiagnosticsService service =
        new MissingIdDiagnosticsService(new SyncProperties(), new CatalogCsvRepository());

    private static CatalogRecord record(String name, long id, String year) {
        ExternalId externalId = id > 0 ? ExternalId.of(id) : ExternalId.unresolved();
        return new CatalogRecord(name, externalId, null, 1.0, null, year, null, null, null);
    }

    @Test
    void reportsSampleAndMostRecentYears() {
        List<CatalogRecord> records = new ArrayList<>();
        records.add(record("Resolved", 1, "2024"));
        for (int i = 0; i < 30; i++) {
            records.add(record("Missing " + i, 0, Integer.toString(2000 + (i % 15))));
        }
        records.add(record("No year", 0, null));

        MissingIdReport report = service.report(CatalogDataset.of(records));

        assertThat(report.totalRecords()).isEqualTo(32);
        assertThat(report.missingCount()).isEqualTo(31);
        assertThat(report.sample()).hasSize(20);
        assertThat(report.sample().get(0).name()).isEqualTo("Missing 0");
        assertThat(report.recentYearDistribution().keySet()).containsExactly(
            2005, 2006, 2007, 2008, 2009, 2010, 2011, 2012, 2013, 2014
        );
        assertThat(report.recentYearDistribution().get(2014)).isEqualTo(2);
    }

    @Test
    void emptyReportWhenEverythingResolved() {
        MissingIdReport report = service.report(CatalogDataset.of(List.of(record("Aachen", 1, "1880"))));

        assertThat(report.missingCount()).isZero();
        assertThat(report.sample()).isEmpty();
        assertThat(report.recentYearDistribution()).isEmpty();
    }
}
