package com.metbull.sync.reconcile.service;

import com.metbull.sync.config.SyncProperties;
import com.metbull.sync.reconcile.index.LookupIndex;
import com.metbull.sync.reconcile.model.PageExtraction;
import com.metbull.sync.reconcile.model.StopReason;

/**
 * State of one crawl session, handed from stage to stage. Created fresh per run;
 * nothing in here outlives the process except what the checkpointer writes.
 */
public class ReconciliationRun {
    private final SyncProperties.Profile profile;
    private final LookupIndex index = new LookupIndex();
    private final int startPage;
    private int nextPage;
    private int lastPage = -1;
    private int pagesFetched;
    private int pagesWithData;
    private int pagesFailed;
    private int consecutiveEmptyPages;
    private int pagesSinceCheckpoint;
    private int checkpointsWritten;
    private StopReason stopReason;

    public ReconciliationRun(SyncProperties.Profile profile, int startPage) {
        this.profile = profile;
        this.startPage = startPage;
        this.nextPage = startPage;
    }

    public void recordFailure(int page) {
        pagesFailed++;
        advance(page);
    }

    public int recordExtraction(int page, PageExtraction extraction) {
        pagesFetched++;
        int added = 0;
        if (extraction.isEmpty()) {
            consecutiveEmptyPages++;
        } else {
            consecutiveEmptyPages = 0;
            pagesWithData++;
            added = index.addAll(extraction.entries());
        }
        advance(page);
        return added;
    }

    public void markCheckpoint() {
        pagesSinceCheckpoint = 0;
        checkpointsWritten++;
    }

    public void stop(StopReason reason) {
        this.stopReason = reason;
    }

    private void advance(int page) {
        lastPage = page;
        nextPage = page + 1;
        pagesSinceCheckpoint++;
    }

    public SyncProperties.Profile profile() {
        return profile;
    }

    public String profileName() {
        return profile.getName() == null ? "adhoc" : profile.getName();
    }

    public LookupIndex index() {
        return index;
    }

    public int startPage() {
        return startPage;
    }

    public int nextPage() {
        return nextPage;
    }

    public int lastPage() {
        return lastPage;
    }

    public int pagesFetched() {
        return pagesFetched;
    }

    public int pagesWithData() {
        return pagesWithData;
    }

    public int pagesFailed() {
        return pagesFailed;
    }

    public int pagesProcessed() {
        return pagesFetched + pagesFailed;
    }

    public int consecutiveEmptyPages() {
        return consecutiveEmptyPages;
    }

    public int pagesSinceCheckpoint() {
        return pagesSinceCheckpoint;
    }

    public int checkpointsWritten() {
        return checkpointsWritten;
    }

    public StopReason stopReason() {
        return stopReason;
    }
}
