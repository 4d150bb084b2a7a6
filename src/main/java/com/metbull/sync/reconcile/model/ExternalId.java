package com.metbull.sync.reconcile.model;

import java.util.OptionalLong;

/**
 * Catalog identifier of a record. Either unresolved or a positive catalog code;
 * the CSV sentinel {@code 0} only exists at the file boundary.
 */
public final class ExternalId {
    private static final ExternalId UNRESOLVED = new ExternalId(0L);

    private final long value;

    private ExternalId(long value) {
        this.value = value;
    }

    public static ExternalId unresolved() {
        return UNRESOLVED;
    }

    public static ExternalId of(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("catalog id must be positive, got " + value);
        }
        return new ExternalId(value);
    }

    /**
     * Reads the CSV representation. Blank, {@code 0}, {@code NaN} and unparsable
     * values all mean unresolved; pandas-style {@code 1234.0} is accepted.
     */
    public static ExternalId parse(String raw) {
        if (raw == null) {
            return UNRESOLVED;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty() || trimmed.equalsIgnoreCase("nan") || trimmed.equalsIgnoreCase("null")) {
            return UNRESOLVED;
        }
        try {
            double numeric = Double.parseDouble(trimmed);
            if (Double.isNaN(numeric) || numeric < 1 || numeric != Math.rint(numeric)) {
                return UNRESOLVED;
            }
            return of((long) numeric);
        } catch (NumberFormatException e) {
            return UNRESOLVED;
        }
    }

    public boolean isResolved() {
        return value > 0;
    }

    public OptionalLong value() {
        return isResolved() ? OptionalLong.of(value) : OptionalLong.empty();
    }

    public String toCsv() {
        return Long.toString(value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ExternalId that && value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return isResolved() ? Long.toString(value) : "unresolved";
    }
}
