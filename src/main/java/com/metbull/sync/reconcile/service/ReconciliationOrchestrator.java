package com.metbull.sync.reconcile.service;

import com.metbull.sync.config.SyncProperties;
import com.metbull.sync.reconcile.extract.RecordExtractor;
import com.metbull.sync.reconcile.http.CatalogPageFetcher;
import com.metbull.sync.reconcile.model.CatalogDataset;
import com.metbull.sync.reconcile.model.CatalogRecord;
import com.metbull.sync.reconcile.model.CrawlCheckpoint;
import com.metbull.sync.reconcile.model.ExternalId;
import com.metbull.sync.reconcile.model.PageExtraction;
import com.metbull.sync.reconcile.model.PageFetchResult;
import com.metbull.sync.reconcile.model.ReconciliationSummary;
import com.metbull.sync.reconcile.model.RunOutcome;
import com.metbull.sync.reconcile.model.StopDecision;
import com.metbull.sync.reconcile.model.StopReason;
import com.metbull.sync.reconcile.persistence.CatalogCsvRepository;
import com.metbull.sync.reconcile.persistence.CheckpointStore;
import com.metbull.sync.reconcile.persistence.LocalFileMissingException;
import com.metbull.sync.reconcile.util.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one backfill session: pages are fetched one at a time, folded into the
 * session's lookup index and periodically applied to the dataset on disk.
 */
@Service
public class ReconciliationOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationOrchestrator.class);

    private final SyncProperties properties;
    private final CatalogCsvRepository repository;
    private final CheckpointStore checkpointStore;
    private final CatalogPageFetcher fetcher;
    private final RecordExtractor extractor;
    private final StopConditionEvaluator stopConditionEvaluator;
    private final Checkpointer checkpointer;

    public ReconciliationOrchestrator(
        SyncProperties properties,
        CatalogCsvRepository repository,
        CheckpointStore checkpointStore,
        CatalogPageFetcher fetcher,
        RecordExtractor extractor,
        StopConditionEvaluator stopConditionEvaluator,
        Checkpointer checkpointer
    ) {
        this.properties = properties;
        this.repository = repository;
        this.checkpointStore = checkpointStore;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.stopConditionEvaluator = stopConditionEvaluator;
        this.checkpointer = checkpointer;
    }

    public ReconciliationSummary run(SyncProperties.Profile profile, boolean resume) {
        Path inputPath = CatalogCsvRepository.resolvePath(properties.getData().getInputCsv());
        Path outputPath = CatalogCsvRepository.resolvePath(properties.getData().getOutputCsv());
        Path checkpointPath = CatalogCsvRepository.resolvePath(properties.getData().getCheckpointJson());
        String profileName = profile.getName() == null ? "adhoc" : profile.getName();

        CatalogDataset dataset;
        try {
            dataset = repository.load(inputPath);
        } catch (LocalFileMissingException e) {
            log.error("Input dataset {} not found. Run the cleaning step first or fix sync.data.input-csv.", e.path());
            return ReconciliationSummary.skipped(profileName, RunOutcome.INPUT_MISSING, 0, 0);
        }

        int namesCleaned = NameNormalizer.cleanNames(dataset);
        int carried = carryOverResolvedIds(dataset, inputPath, outputPath);
        if (carried > 0) {
            log.info("Restored {} ids written to {} by an earlier session", carried, outputPath);
        }
        if (namesCleaned > 0) {
            log.info("Removed the unverified-name marker from {} names", namesCleaned);
        }
        if (namesCleaned > 0 || carried > 0) {
            repository.save(dataset, outputPath);
        }

        int missingBefore = dataset.unresolvedCount();
        log.info("Profile {}: {} of {} records are missing a catalog id", profileName, missingBefore, dataset.size());
        if (missingBefore == 0) {
            log.info("No missing ids, nothing to crawl");
            if (!outputPath.equals(inputPath) && namesCleaned == 0 && carried == 0) {
                repository.save(dataset, outputPath);
            }
            return ReconciliationSummary.skipped(profileName, RunOutcome.NOTHING_TO_DO, namesCleaned, 0);
        }

        ReconciliationRun run = new ReconciliationRun(profile, startPage(profile, profileName, resume, checkpointPath));
        log.info(
            "Scanning pages {}-{} (year floor {}, stop on empty page {})",
            run.startPage(),
            profile.getEndPage(),
            profile.getYearFloor() == null ? "off" : profile.getYearFloor(),
            profile.isStopOnEmptyPage()
        );

        try {
            crawl(run, dataset, outputPath, checkpointPath);
        } catch (RuntimeException e) {
            run.stop(StopReason.ABORTED);
            log.error("Session aborted after page {}; last checkpoint left in place", run.lastPage(), e);
            return summary(run, RunOutcome.ABORTED, namesCleaned, missingBefore, dataset.unresolvedCount());
        }

        if (run.index().collisions() > 0) {
            log.warn("{} names were seen with more than one id this session; the later id was kept", run.index().collisions());
        }
        CrawlCheckpoint last = checkpointer.checkpoint(run, dataset, outputPath, checkpointPath);
        RunOutcome outcome = RunOutcome.COMPLETED;
        if (run.pagesWithData() == 0) {
            outcome = RunOutcome.NO_DATA;
            log.error(
                "No page yielded any records ({} fetched, {} failed). The catalog may be unreachable or its markup changed.",
                run.pagesFetched(),
                run.pagesFailed()
            );
        }
        log.info(
            "Session {} finished: stop={} pages={} indexed={} filled={} still missing={}",
            profileName,
            run.stopReason(),
            run.pagesProcessed(),
            run.index().size(),
            missingBefore - last.unresolvedIds(),
            last.unresolvedIds()
        );
        return summary(run, outcome, namesCleaned, missingBefore, last.unresolvedIds());
    }

    private void crawl(ReconciliationRun run, CatalogDataset dataset, Path outputPath, Path checkpointPath) {
        SyncProperties.Profile profile = run.profile();
        for (int page = run.startPage(); page <= profile.getEndPage(); page++) {
            PageFetchResult fetched = fetcher.fetchPage(page);
            if (!fetched.isSuccessful()) {
                run.recordFailure(page);
                log.warn("Page {} failed ({}): {}", page, fetched.failure(), fetched.errorMessage());
            } else {
                PageExtraction extraction = extractor.extract(fetched.body());
                int added = run.recordExtraction(page, extraction);
                log.info(
                    "Page {}: indexed {} names (oldest year {})",
                    page,
                    added,
                    extraction.minYear().isPresent() ? extraction.minYear().getAsInt() : "n/a"
                );
                StopDecision decision = stopConditionEvaluator.evaluate(run, extraction);
                if (decision.stop()) {
                    run.stop(decision.reason());
                    log.info("Stopping at page {}: {}", page, decision.detail());
                    return;
                }
            }
            if (checkpointer.isDue(run)) {
                checkpointer.checkpoint(run, dataset, outputPath, checkpointPath);
            }
            if (page < profile.getEndPage() && !pause(profile.getPageDelayMs())) {
                throw new IllegalStateException("interrupted while waiting between pages");
            }
        }
        run.stop(StopReason.PAGE_CEILING);
    }

    /**
     * When the output is a separate file, ids already resolved there are copied onto
     * the freshly loaded input by exact name. Ids present in the input are kept.
     */
    private int carryOverResolvedIds(CatalogDataset dataset, Path inputPath, Path outputPath) {
        if (outputPath.equals(inputPath) || !Files.isRegularFile(outputPath)) {
            return 0;
        }
        Map<String, ExternalId> previous = new HashMap<>();
        for (CatalogRecord record : repository.load(outputPath).records()) {
            if (record.isResolved()) {
                previous.put(NameNormalizer.exactKey(NameNormalizer.cleanDisplayName(record.name())), record.externalId());
            }
        }
        int carried = 0;
        for (int i = 0; i < dataset.size(); i++) {
            CatalogRecord record = dataset.get(i);
            if (record.isResolved()) {
                continue;
            }
            ExternalId id = previous.get(NameNormalizer.exactKey(record.name()));
            if (id != null) {
                dataset.replace(i, record.withExternalId(id));
                carried++;
            }
        }
        return carried;
    }

    private int startPage(SyncProperties.Profile profile, String profileName, boolean resume, Path checkpointPath) {
        if (!resume) {
            return profile.getStartPage();
        }
        Optional<CrawlCheckpoint> checkpoint = checkpointStore.read(checkpointPath);
        if (checkpoint.isPresent()
            && profileName.equals(checkpoint.get().profile())
            && checkpoint.get().nextPage() > profile.getStartPage()
            && checkpoint.get().nextPage() <= profile.getEndPage()) {
            log.info("Resuming profile {} from page {}", profileName, checkpoint.get().nextPage());
            return checkpoint.get().nextPage();
        }
        return profile.getStartPage();
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

    private ReconciliationSummary summary(
        ReconciliationRun run,
        RunOutcome outcome,
        int namesCleaned,
        int missingBefore,
        int missingAfter
    ) {
        return new ReconciliationSummary(
            run.profileName(),
            outcome,
            run.stopReason(),
            run.pagesFetched(),
            run.pagesWithData(),
            run.pagesFailed(),
            run.index().size(),
            namesCleaned,
            missingBefore,
            missingAfter,
            run.checkpointsWritten()
        );
    }
}
