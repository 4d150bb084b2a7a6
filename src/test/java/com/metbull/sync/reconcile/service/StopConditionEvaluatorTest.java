package com.metbull.sync.reconcile.service;

import com.metbull.sync.config.SyncProperties;
import com.metbull.sync.reconcile.model.ExtractedEntry;
import com.metbull.sync.reconcile.model.PageExtraction;
import com.metbull.sync.reconcile.model.StopDecision;
import com.metbull.sync.reconcile.model.StopReason;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class StopConditionEvaluatorTest {
    private final StopConditionEvaluator evaluator = new StopConditionEvaluator();

    private static PageExtraction page(Integer... years) {
        return new PageExtraction(List.of(new ExtractedEntry(1, "Allende")), Set.of(years));
    }

    @Test
    void emptyPageStopsWhenHeuristicActive() {
        ReconciliationRun run = new ReconciliationRun(new SyncProperties.Profile("recent", 0, 24), 0);
        run.recordExtraction(0, PageExtraction.empty());

        StopDecision decision = evaluator.evaluate(run, PageExtraction.empty());

        assertThat(decision.stop()).isTrue();
        assertThat(decision.reason()).isEqualTo(StopReason.EMPTY_PAGE);
    }

    @Test
    void emptyPageThresholdRequiresConsecutiveEmpties() {
        SyncProperties.Profile profile = new SyncProperties.Profile("tolerant", 0, 24);
        profile.setEmptyPagesBeforeStop(3);
        ReconciliationRun run = new ReconciliationRun(profile, 0);

        run.recordExtraction(0, PageExtraction.empty());
        run.recordExtraction(1, PageExtraction.empty());
        assertThat(evaluator.evaluate(run, PageExtraction.empty()).stop()).isFalse();

        run.recordExtraction(2, page(2020));
        run.recordExtraction(3, PageExtraction.empty());
        assertThat(evaluator.evaluate(run, PageExtraction.empty()).stop()).isFalse();

        run.recordExtraction(4, PageExtraction.empty());
        run.recordExtraction(5, PageExtraction.empty());
        assertThat(evaluator.evaluate(run, PageExtraction.empty()).reason()).isEqualTo(StopReason.EMPTY_PAGE);
    }

    @Test
    void emptyPageIsIgnoredWhenHeuristicDisabled() {
        SyncProperties.Profile profile = new SyncProperties.Profile("rescan", 0, 60);
        profile.setStopOnEmptyPage(false);
        ReconciliationRun run = new ReconciliationRun(profile, 0);
        run.recordExtraction(0, PageExtraction.empty());

        assertThat(evaluator.evaluate(run, PageExtraction.empty()).stop()).isFalse();
    }

    @Test
    void stopsOnceOldestYearFallsBelowFloor() {
        SyncProperties.Profile profile = new SyncProperties.Profile("deep", 0, 100);
        profile.setYearFloor(2012);
        ReconciliationRun run = new ReconciliationRun(profile, 0);

        assertThat(evaluator.evaluate(run, page(2015, 2012)).stop()).isFalse();
        StopDecision decision = evaluator.evaluate(run, page(2013, 2011));
        assertThat(decision.stop()).isTrue();
        assertThat(decision.reason()).isEqualTo(StopReason.YEAR_FLOOR);
        assertThat(evaluator.evaluate(run, page()).stop()).isFalse();
    }

    @Test
    void yearFloorAppliesToPagesWithoutRecords() {
        SyncProperties.Profile profile = new SyncProperties.Profile("deep", 0, 100);
        profile.setYearFloor(2012);
        profile.setEmptyPagesBeforeStop(3);
        ReconciliationRun run = new ReconciliationRun(profile, 0);
        PageExtraction yearsOnly = new PageExtraction(List.of(), Set.of(2011, 2009));
        run.recordExtraction(0, yearsOnly);

        StopDecision decision = evaluator.evaluate(run, yearsOnly);

        assertThat(decision.stop()).isTrue();
        assertThat(decision.reason()).isEqualTo(StopReason.YEAR_FLOOR);
    }

    @Test
    void noFloorMeansYearsAreIgnored() {
        ReconciliationRun run = new ReconciliationRun(new SyncProperties.Profile("history", 100, 180), 100);
        assertThat(evaluator.evaluate(run, page(1850)).stop()).isFalse();
    }
}
