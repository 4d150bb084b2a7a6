package com.metbull.sync.reconcile.service;

import com.metbull.sync.config.SyncProperties;
import com.metbull.sync.reconcile.model.HarvestSummary;
import com.metbull.sync.reconcile.model.MergeResult;
import com.metbull.sync.reconcile.model.ReconciliationSummary;
import com.metbull.sync.reconcile.persistence.LocalFileMissingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class SyncCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SyncCliRunner.class);

    private final SyncProperties properties;
    private final ReconciliationOrchestrator orchestrator;
    private final CatalogHarvestService harvestService;
    private final MissingIdDiagnosticsService diagnosticsService;
    private final ConfigurableApplicationContext applicationContext;

    public SyncCliRunner(
        SyncProperties properties,
        ReconciliationOrchestrator orchestrator,
        CatalogHarvestService harvestService,
        MissingIdDiagnosticsService diagnosticsService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestrator = orchestrator;
        this.harvestService = harvestService;
        this.diagnosticsService = diagnosticsService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        try {
            dispatch(properties.getCli().getMode());
        } catch (LocalFileMissingException e) {
            log.error("Required file {} does not exist; check the sync.data.* paths", e.path());
        } catch (IllegalArgumentException e) {
            log.error("Invalid run configuration: {}", e.getMessage());
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    void dispatch(String rawMode) {
        String mode = rawMode == null ? "backfill" : rawMode.trim().toLowerCase(Locale.ROOT);
        switch (mode) {
            case "backfill" -> {
                SyncProperties.Profile profile = properties.requireProfile(properties.getCli().getProfile());
                ReconciliationSummary summary = orchestrator.run(profile, properties.getCli().isResume());
                log.info(
                    "Backfill {} ended {}: stop={}, pages={} (data {}, failed {}), filled={}, still missing={}, checkpoints={}",
                    summary.profile(),
                    summary.outcome(),
                    summary.stopReason(),
                    summary.pagesFetched(),
                    summary.pagesWithData(),
                    summary.pagesFailed(),
                    summary.filled(),
                    summary.missingAfter(),
                    summary.checkpointsWritten()
                );
            }
            case "harvest" -> {
                SyncProperties.Profile profile = properties.requireProfile(properties.getCli().getProfile());
                HarvestSummary summary = harvestService.harvest(profile);
                log.info(
                    "Harvest ended {}: pages={}, rows={}, kept={}",
                    summary.outcome(),
                    summary.pagesFetched(),
                    summary.rowsHarvested(),
                    summary.rowsKept()
                );
            }
            case "merge" -> {
                MergeResult result = harvestService.mergeFiles();
                log.info(
                    "Merge: base={}, incremental={}, merged={}, duplicates={}, with coordinates={}",
                    result.baseCount(),
                    result.incrementalCount(),
                    result.mergedCount(),
                    result.duplicatesCollapsed(),
                    result.withCoordinates()
                );
            }
            case "diagnose" -> diagnosticsService.diagnose();
            default -> throw new IllegalArgumentException(
                "unknown mode '" + rawMode + "', expected backfill, harvest, merge or diagnose"
            );
        }
    }
}
