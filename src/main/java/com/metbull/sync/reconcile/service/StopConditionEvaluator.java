package com.metbull.sync.reconcile.service;

import com.metbull.sync.config.SyncProperties;
import com.metbull.sync.reconcile.model.PageExtraction;
import com.metbull.sync.reconcile.model.StopDecision;
import com.metbull.sync.reconcile.model.StopReason;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

/**
 * Heuristics for ending a crawl. The catalog has no last-page marker, so an empty
 * page or a page older than the profile's year floor is taken as the end. The year
 * floor relies on the listing being sorted newest first. The two checks are
 * independent; a page without records can still end the scan on its years.
 */
@Component
public class StopConditionEvaluator {

    public StopDecision evaluate(ReconciliationRun run, PageExtraction extraction) {
        SyncProperties.Profile profile = run.profile();
        Integer floor = profile.getYearFloor();
        OptionalInt minYear = extraction.minYear();
        if (floor != null && minYear.isPresent() && minYear.getAsInt() < floor) {
            return StopDecision.stop(
                StopReason.YEAR_FLOOR,
                "oldest year on page " + minYear.getAsInt() + " is below " + floor
            );
        }
        if (extraction.isEmpty()
            && profile.isStopOnEmptyPage()
            && run.consecutiveEmptyPages() >= profile.getEmptyPagesBeforeStop()) {
            return StopDecision.stop(
                StopReason.EMPTY_PAGE,
                run.consecutiveEmptyPages() + " consecutive page(s) without records"
            );
        }
        return StopDecision.proceed();
    }
}
