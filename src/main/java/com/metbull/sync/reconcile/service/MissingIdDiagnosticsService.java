package com.metbull.sync.reconcile.service;

import com.metbull.sync.config.SyncProperties;
import com.metbull.sync.reconcile.model.CatalogDataset;
import com.metbull.sync.reconcile.model.CatalogRecord;
import com.metbull.sync.reconcile.model.MissingIdReport;
import com.metbull.sync.reconcile.persistence.CatalogCsvRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

@Service
public class MissingIdDiagnosticsService {
    private static final Logger log = LoggerFactory.getLogger(MissingIdDiagnosticsService.class);

    static final int SAMPLE_SIZE = 20;
    static final int RECENT_YEARS = 10;

    private final SyncProperties properties;
    private final CatalogCsvRepository repository;

    public MissingIdDiagnosticsService(SyncProperties properties, CatalogCsvRepository repository) {
        this.properties = properties;
        this.repository = repository;
    }

    public MissingIdReport diagnose() {
        CatalogDataset dataset = repository.load(CatalogCsvRepository.resolvePath(properties.getData().getInputCsv()));
        MissingIdReport report = report(dataset);
        log.info("{} of {} records have no catalog id", report.missingCount(), report.totalRecords());
        for (CatalogRecord record : report.sample()) {
            log.info("  missing: name={} year={} mass={}", record.name(), record.year(), record.mass());
        }
        report.recentYearDistribution().forEach((year, count) -> log.info("  year {}: {} missing", year, count));
        return report;
    }

    public MissingIdReport report(CatalogDataset dataset) {
        List<CatalogRecord> unresolved = dataset.unresolved();
        List<CatalogRecord> sample = new ArrayList<>(unresolved.subList(0, Math.min(SAMPLE_SIZE, unresolved.size())));

        TreeMap<Integer, Integer> byYear = new TreeMap<>();
        for (CatalogRecord record : unresolved) {
            Integer year = record.yearAsInt();
            if (year != null) {
                byYear.merge(year, 1, Integer::sum);
            }
        }
        SortedMap<Integer, Integer> recent = new TreeMap<>();
        for (Integer year : byYear.descendingKeySet()) {
            if (recent.size() == RECENT_YEARS) {
                break;
            }
            recent.put(year, byYear.get(year));
        }
        return new MissingIdReport(
            dataset.size(),
            unresolved.size(),
            Collections.unmodifiableList(sample),
            Collections.unmodifiableSortedMap(recent)
        );
    }
}
