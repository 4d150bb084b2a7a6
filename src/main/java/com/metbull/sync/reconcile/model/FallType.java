package com.metbull.sync.reconcile.model;

import java.util.Locale;
import java.util.Set;

public enum FallType {
    FELL("Fell"),
    FOUND("Found");

    private static final Set<String> FELL_FLAGS = Set.of("y", "yc", "yp", "yes", "fell");

    private final String label;

    FallType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static FallType fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return FELL_FLAGS.contains(normalized) ? FELL : FOUND;
    }
}
