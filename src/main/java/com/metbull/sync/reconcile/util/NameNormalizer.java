package com.metbull.sync.reconcile.util;

import com.metbull.sync.reconcile.model.CatalogDataset;
import com.metbull.sync.reconcile.model.CatalogRecord;

import java.util.Locale;

public final class NameNormalizer {
    /** Flag the catalog prints next to names that are not yet approved. */
    public static final char UNVERIFIED_MARKER = '*';

    private NameNormalizer() {}

    public static String compareKey(String name) {
        if (name == null) {
            return "";
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public static String exactKey(String name) {
        return name == null ? "" : name.trim();
    }

    public static String cleanDisplayName(String name) {
        if (name == null) {
            return null;
        }
        return name.replace(String.valueOf(UNVERIFIED_MARKER), "").trim();
    }

    /**
     * Rewrites the persisted names of the dataset in place. Records whose cleaned name
     * would be blank are left untouched.
     *
     * @return number of records whose name changed
     */
    public static int cleanNames(CatalogDataset dataset) {
        int changed = 0;
        for (int i = 0; i < dataset.size(); i++) {
            CatalogRecord record = dataset.get(i);
            String cleaned = cleanDisplayName(record.name());
            if (cleaned == null || cleaned.isEmpty() || cleaned.equals(record.name())) {
                continue;
            }
            dataset.replace(i, record.withName(cleaned));
            changed++;
        }
        return changed;
    }
}
