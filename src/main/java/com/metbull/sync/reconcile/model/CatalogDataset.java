package com.metbull.sync.reconcile.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * In-memory table of catalog records plus the column layout they were read with,
 * so a rewrite keeps the schema of the file it came from.
 */
public class CatalogDataset {
    public static final String NAME_COLUMN = "name";
    public static final String DEFAULT_ID_COLUMN = "id";
    public static final String RECCLASS_COLUMN = "recclass";
    public static final String MASS_COLUMN = "mass (g)";
    public static final String FALL_COLUMN = "fall";
    public static final String YEAR_COLUMN = "year";
    public static final String LAT_COLUMN = "reclat";
    public static final String LON_COLUMN = "reclong";
    public static final String YEAR_INT_COLUMN = "year_int";
    public static final String MASS_LOG_COLUMN = "mass_log";
    public static final String CATEGORY_COLUMN = "category_broad";

    public static final List<String> STANDARD_COLUMNS = List.of(
        NAME_COLUMN,
        DEFAULT_ID_COLUMN,
        RECCLASS_COLUMN,
        MASS_COLUMN,
        FALL_COLUMN,
        YEAR_COLUMN,
        LAT_COLUMN,
        LON_COLUMN
    );

    /** Standard columns plus the derived ones the dashboard reads. */
    public static final List<String> DERIVED_COLUMNS = List.of(
        NAME_COLUMN,
        DEFAULT_ID_COLUMN,
        RECCLASS_COLUMN,
        MASS_COLUMN,
        FALL_COLUMN,
        YEAR_COLUMN,
        LAT_COLUMN,
        LON_COLUMN,
        YEAR_INT_COLUMN,
        MASS_LOG_COLUMN,
        CATEGORY_COLUMN
    );

    private final List<String> columns;
    private final String idColumn;
    private final List<CatalogRecord> records;

    public CatalogDataset(List<String> columns, String idColumn, List<CatalogRecord> records) {
        this.idColumn = idColumn == null || idColumn.isBlank() ? DEFAULT_ID_COLUMN : idColumn;
        LinkedHashSet<String> layout = new LinkedHashSet<>(columns == null || columns.isEmpty() ? STANDARD_COLUMNS : columns);
        layout.add(NAME_COLUMN);
        layout.add(this.idColumn);
        this.columns = List.copyOf(layout);
        this.records = new ArrayList<>(records == null ? List.of() : records);
    }

    public static CatalogDataset of(List<CatalogRecord> records) {
        return new CatalogDataset(STANDARD_COLUMNS, DEFAULT_ID_COLUMN, records);
    }

    public List<String> columns() {
        return columns;
    }

    public String idColumn() {
        return idColumn;
    }

    public List<CatalogRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public CatalogRecord get(int index) {
        return records.get(index);
    }

    public void replace(int index, CatalogRecord record) {
        records.set(index, record);
    }

    public int size() {
        return records.size();
    }

    public int resolvedCount() {
        int count = 0;
        for (CatalogRecord record : records) {
            if (record.isResolved()) {
                count++;
            }
        }
        return count;
    }

    public int unresolvedCount() {
        return records.size() - resolvedCount();
    }

    public List<CatalogRecord> unresolved() {
        List<CatalogRecord> out = new ArrayList<>();
        for (CatalogRecord record : records) {
            if (!record.isResolved()) {
                out.add(record);
            }
        }
        return out;
    }

    public CatalogDataset copy() {
        return new CatalogDataset(columns, idColumn, records);
    }
}
