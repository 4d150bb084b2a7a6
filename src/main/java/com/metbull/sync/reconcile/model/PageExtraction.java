package com.metbull.sync.reconcile.model;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Result of parsing one catalog page. Year tokens are page-level only; they are not
 * bound to individual entries.
 */
public record PageExtraction(List<ExtractedEntry> entries, Set<Integer> yearTokens) {
    public PageExtraction {
        entries = entries == null ? List.of() : List.copyOf(entries);
        yearTokens = yearTokens == null ? Set.of() : Set.copyOf(yearTokens);
    }

    public static PageExtraction empty() {
        return new PageExtraction(List.of(), Set.of());
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public OptionalInt minYear() {
        return yearTokens.stream().mapToInt(Integer::intValue).min();
    }

    public OptionalInt maxYear() {
        return yearTokens.stream().mapToInt(Integer::intValue).max();
    }
}
