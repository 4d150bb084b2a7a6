package com.metbull.sync.reconcile.service;

import com.metbull.sync.config.SyncProperties;
import com.metbull.sync.reconcile.model.CatalogDataset;
import com.metbull.sync.reconcile.model.MergeResult;
import com.metbull.sync.reconcile.model.ReconciliationSummary;
import com.metbull.sync.reconcile.model.RunOutcome;
import com.metbull.sync.reconcile.persistence.LocalFileMissingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SyncCliRunnerTest {
    private SyncProperties properties;
    private ReconciliationOrchestrator orchestrator;
    private CatalogHarvestService harvestService;
    private MissingIdDiagnosticsService diagnosticsService;
    private SyncCliRunner runner;

    @BeforeEach
    void setUp() {
        properties = new SyncProperties();
        properties.getCli().setExitAfterRun(false);
        SyncProperties.Profile deep = new SyncProperties.Profile("deep", 0, 100);
        properties.getProfiles().put("deep", deep);
        orchestrator = Mockito.mock(ReconciliationOrchestrator.class);
        harvestService = Mockito.mock(CatalogHarvestService.class);
        diagnosticsService = Mockito.mock(MissingIdDiagnosticsService.class);
        runner = new SyncCliRunner(
            properties,
            orchestrator,
            harvestService,
            diagnosticsService,
            Mockito.mock(ConfigurableApplicationContext.class)
        );
    }

    @Test
    void doesNothingUnlessEnabled() {
        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(orchestrator, harvestService, diagnosticsService);
    }

    @Test
    void backfillRunsSelectedProfile() {
        properties.getCli().setRun(true);
        properties.getCli().setProfile("deep");
        properties.getCli().setResume(true);
        when(orchestrator.run(any(), eq(true)))
            .thenReturn(ReconciliationSummary.skipped("deep", RunOutcome.NOTHING_TO_DO, 0, 0));

        runner.run(new DefaultApplicationArguments());

        verify(orchestrator).run(properties.getProfiles().get("deep"), true);
    }

    @Test
    void unknownProfileIsReportedNotThrown() {
        properties.getCli().setRun(true);
        properties.getCli().setProfile("weekly");

        assertThatCode(() -> runner.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
        verify(orchestrator, never()).run(any(), eq(false));
    }

    @Test
    void missingMergeInputIsReportedNotThrown() {
        properties.getCli().setRun(true);
        properties.getCli().setMode("merge");
        when(harvestService.mergeFiles()).thenThrow(new LocalFileMissingException(Path.of("absent.csv")));

        assertThatCode(() -> runner.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
    }

    @Test
    void dispatchRoutesModes() {
        when(harvestService.mergeFiles()).thenReturn(new MergeResult(CatalogDataset.of(List.of()), 0, 0, 0, 0));

        runner.dispatch("DIAGNOSE");
        runner.dispatch("merge");

        verify(diagnosticsService).diagnose();
        verify(harvestService).mergeFiles();
        assertThatThrownBy(() -> runner.dispatch("export")).isInstanceOf(IllegalArgumentException.class);
    }
}
