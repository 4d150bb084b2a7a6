package com.metbull.sync.reconcile.service;

import com.metbull.sync.config.SyncProperties;
import com.metbull.sync.reconcile.extract.CatalogTableExtractor;
import com.metbull.sync.reconcile.extract.RawFieldParser;
import com.metbull.sync.reconcile.http.CatalogPageFetcher;
import com.metbull.sync.reconcile.model.CatalogDataset;
import com.metbull.sync.reconcile.model.CatalogRecord;
import com.metbull.sync.reconcile.model.HarvestSummary;
import com.metbull.sync.reconcile.model.MergeResult;
import com.metbull.sync.reconcile.model.PageFetchResult;
import com.metbull.sync.reconcile.model.RunOutcome;
import com.metbull.sync.reconcile.persistence.CatalogCsvRepository;
import com.metbull.sync.reconcile.persistence.LocalFileMissingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pulls whole records for recently added catalog entries from the table rendering
 * and folds them into the base dataset.
 */
@Service
public class CatalogHarvestService {
    private static final Logger log = LoggerFactory.getLogger(CatalogHarvestService.class);

    private final SyncProperties properties;
    private final CatalogPageFetcher fetcher;
    private final CatalogTableExtractor tableExtractor;
    private final CatalogCsvRepository repository;
    private final DatasetMerger merger;

    public CatalogHarvestService(
        SyncProperties properties,
        CatalogPageFetcher fetcher,
        CatalogTableExtractor tableExtractor,
        CatalogCsvRepository repository,
        DatasetMerger merger
    ) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.tableExtractor = tableExtractor;
        this.repository = repository;
        this.merger = merger;
    }

    public HarvestSummary harvest(SyncProperties.Profile profile) {
        Integer floor = profile.getYearFloor();
        List<CatalogRecord> kept = new ArrayList<>();
        int pagesFetched = 0;
        int rowsHarvested = 0;

        for (int page = profile.getStartPage(); page <= profile.getEndPage(); page++) {
            PageFetchResult fetched = fetcher.fetchPage(page, CatalogPageFetcher.TABLE_RENDERING);
            if (!fetched.isSuccessful()) {
                log.warn("Harvest page {} failed ({}): {}", page, fetched.failure(), fetched.errorMessage());
            } else {
                pagesFetched++;
                CatalogTableExtractor.TablePage table = tableExtractor.extract(fetched.body());
                if (!table.tableFound() || table.rows().isEmpty()) {
                    log.info("Harvest page {} has no result table rows, stopping", page);
                    break;
                }
                rowsHarvested += table.rows().size();
                for (CatalogRecord row : table.rows()) {
                    if (keep(row, floor)) {
                        kept.add(withDerivedColumns(row));
                    }
                }
                log.info(
                    "Harvest page {}: {} rows, newest year {}",
                    page,
                    table.rows().size(),
                    table.maxYear().isPresent() ? table.maxYear().getAsInt() : "n/a"
                );
                if (floor != null && table.maxYear().isPresent() && table.maxYear().getAsInt() < floor) {
                    log.info("Harvest page {} is entirely older than {}, stopping", page, floor);
                    break;
                }
            }
            if (page < profile.getEndPage() && !pause(profile.getPageDelayMs())) {
                log.warn("Harvest interrupted after page {}", page);
                break;
            }
        }

        if (kept.isEmpty()) {
            log.error("Harvest found no usable rows in {} fetched pages", pagesFetched);
            return new HarvestSummary(RunOutcome.NO_DATA, pagesFetched, rowsHarvested, 0, null);
        }

        CatalogDataset base;
        Path basePath = CatalogCsvRepository.resolvePath(properties.getData().getBaseCsv());
        try {
            base = repository.load(basePath);
        } catch (LocalFileMissingException e) {
            log.warn("Base dataset {} not found, the merged file will hold harvested rows only", e.path());
            base = CatalogDataset.of(List.of());
        }
        CatalogDataset harvested = new CatalogDataset(CatalogDataset.DERIVED_COLUMNS, CatalogDataset.DEFAULT_ID_COLUMN, kept);
        MergeResult merge = merger.merge(base, harvested);
        Path mergedPath = CatalogCsvRepository.resolvePath(properties.getData().getMergedCsv());
        repository.save(merge.merged(), mergedPath);
        log.info("Harvest kept {} of {} rows; wrote {} records to {}", kept.size(), rowsHarvested, merge.mergedCount(), mergedPath);
        return new HarvestSummary(RunOutcome.COMPLETED, pagesFetched, rowsHarvested, kept.size(), merge);
    }

    /** Merges the configured base and incremental snapshots without crawling. */
    public MergeResult mergeFiles() {
        String incremental = properties.getData().getIncrementalCsv();
        if (incremental == null || incremental.isBlank()) {
            throw new IllegalArgumentException("sync.data.incremental-csv must be set for merge mode");
        }
        CatalogDataset base = repository.load(CatalogCsvRepository.resolvePath(properties.getData().getBaseCsv()));
        CatalogDataset update = repository.load(CatalogCsvRepository.resolvePath(incremental));
        MergeResult merge = merger.merge(base, update);
        repository.save(merge.merged(), CatalogCsvRepository.resolvePath(properties.getData().getMergedCsv()));
        return merge;
    }

    /** Only called for kept rows, so mass is positive and the year parses. */
    static CatalogRecord withDerivedColumns(CatalogRecord row) {
        Map<String, String> extras = new LinkedHashMap<>(row.extras());
        Integer year = row.yearAsInt();
        extras.put(CatalogDataset.YEAR_INT_COLUMN, year == null ? "0" : Integer.toString(year));
        extras.put(CatalogDataset.MASS_LOG_COLUMN, BigDecimal.valueOf(Math.log10(row.mass())).toPlainString());
        extras.put(CatalogDataset.CATEGORY_COLUMN, RawFieldParser.categoryOf(row.recclass()));
        return row.withExtras(extras);
    }

    static boolean keep(CatalogRecord row, Integer floor) {
        if (row.mass() == null || row.mass() <= 0) {
            return false;
        }
        if (floor == null) {
            return true;
        }
        Integer year = row.yearAsInt();
        return year != null && year > floor;
    }

    private boolean pause(int delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
