package com.metbull.sync.reconcile.index;

import com.metbull.sync.reconcile.model.ExtractedEntry;
import com.metbull.sync.reconcile.model.ExternalId;
import com.metbull.sync.reconcile.util.NameNormalizer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Name to catalog id lookup built during one crawl session. Never persisted.
 * A name seen twice keeps the later id; {@link #collisions()} counts how often
 * that replaced a different id.
 */
public class LookupIndex {
    private final Map<String, Long> byExactName = new HashMap<>();
    private final Map<String, Long> byCompareKey = new HashMap<>();
    private int collisions;

    public void put(String rawName, long externalId) {
        if (externalId <= 0) {
            return;
        }
        String exact = NameNormalizer.exactKey(rawName);
        if (exact.isEmpty()) {
            return;
        }
        Long previous = byExactName.put(exact, externalId);
        if (previous != null && previous != externalId) {
            collisions++;
        }
        Long previousByKey = byCompareKey.put(NameNormalizer.compareKey(exact), externalId);
        if (previous == null && previousByKey != null && previousByKey != externalId) {
            collisions++;
        }
    }

    public int addAll(List<ExtractedEntry> entries) {
        int added = 0;
        for (ExtractedEntry entry : entries) {
            if (entry == null) {
                continue;
            }
            put(entry.rawName(), entry.externalId());
            added++;
        }
        return added;
    }

    /** Exact trimmed name first, then the case-insensitive key. */
    public Optional<ExternalId> lookup(String name) {
        Long exact = byExactName.get(NameNormalizer.exactKey(name));
        if (exact != null) {
            return Optional.of(ExternalId.of(exact));
        }
        Long folded = byCompareKey.get(NameNormalizer.compareKey(name));
        return folded == null ? Optional.empty() : Optional.of(ExternalId.of(folded));
    }

    public int size() {
        return byExactName.size();
    }

    public boolean isEmpty() {
        return byExactName.isEmpty();
    }

    public int collisions() {
        return collisions;
    }
}
