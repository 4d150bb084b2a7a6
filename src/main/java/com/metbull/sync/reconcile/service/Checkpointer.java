package com.metbull.sync.reconcile.service;

import com.metbull.sync.config.SyncProperties;
import com.metbull.sync.reconcile.model.ApplyResult;
import com.metbull.sync.reconcile.model.CatalogDataset;
import com.metbull.sync.reconcile.model.CrawlCheckpoint;
import com.metbull.sync.reconcile.persistence.CatalogCsvRepository;
import com.metbull.sync.reconcile.persistence.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

@Service
public class Checkpointer {
    private static final Logger log = LoggerFactory.getLogger(Checkpointer.class);

    private final SyncProperties properties;
    private final ReconciliationApplier applier;
    private final CatalogCsvRepository repository;
    private final CheckpointStore checkpointStore;
    private final Clock clock;

    public Checkpointer(
        SyncProperties properties,
        ReconciliationApplier applier,
        CatalogCsvRepository repository,
        CheckpointStore checkpointStore,
        Clock clock
    ) {
        this.properties = properties;
        this.applier = applier;
        this.repository = repository;
        this.checkpointStore = checkpointStore;
        this.clock = clock;
    }

    public boolean isDue(ReconciliationRun run) {
        return run.pagesSinceCheckpoint() >= properties.getCheckpointEveryPages();
    }

    /**
     * Applies the partial index to the full dataset and overwrites the target file,
     * then records the page cursor. Both writes are plain overwrites.
     */
    public CrawlCheckpoint checkpoint(ReconciliationRun run, CatalogDataset dataset, Path datasetPath, Path checkpointPath) {
        ApplyResult applied = applier.apply(dataset, run.index());
        repository.save(dataset, datasetPath);
        CrawlCheckpoint checkpoint = new CrawlCheckpoint(
            run.profileName(),
            run.nextPage(),
            run.lastPage(),
            run.pagesProcessed(),
            dataset.resolvedCount(),
            dataset.unresolvedCount(),
            run.index().size(),
            Instant.now(clock)
        );
        checkpointStore.write(checkpoint, checkpointPath);
        run.markCheckpoint();
        log.info(
            "Checkpoint after page {}: filled={} missing={} indexed={} -> {}",
            run.lastPage(),
            applied.filled(),
            checkpoint.unresolvedIds(),
            checkpoint.indexedNames(),
            datasetPath
        );
        return checkpoint;
    }
}
