package com.metbull.sync.reconcile.service;

import com.metbull.sync.reconcile.model.CatalogDataset;
import com.metbull.sync.reconcile.model.CatalogRecord;
import com.metbull.sync.reconcile.model.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Survivorship merge of two snapshots: one whole record is kept per name and the
 * other is dropped, fields are never combined. A located record beats an unlocated
 * one; remaining ties fall through a fixed order so the result does not depend on
 * which snapshot lists a name first.
 */
@Service
public class DatasetMerger {
    private static final Logger log = LoggerFactory.getLogger(DatasetMerger.class);

    private static final Comparator<Candidate> SURVIVOR_ORDER = Comparator
        .comparingInt((Candidate c) -> c.record().hasValidCoordinates() ? 0 : 1)
        .thenComparingInt(c -> c.record().lat() != null ? 0 : 1)
        .thenComparingDouble(c -> c.record().hasValidCoordinates() ? c.record().lat() : 0.0)
        .thenComparingDouble(c -> c.record().hasValidCoordinates() ? c.record().lon() : 0.0)
        .thenComparingInt(c -> c.record().isResolved() ? 0 : 1)
        .thenComparingInt(Candidate::source)
        .thenComparingInt(Candidate::position);

    public MergeResult merge(CatalogDataset base, CatalogDataset incremental) {
        Map<String, Candidate> survivors = new HashMap<>();
        int collapsed = 0;
        collapsed += offer(survivors, base, 0);
        collapsed += offer(survivors, incremental, 1);

        TreeMap<String, CatalogRecord> byName = new TreeMap<>();
        for (Map.Entry<String, Candidate> entry : survivors.entrySet()) {
            byName.put(entry.getKey(), entry.getValue().record());
        }
        List<CatalogRecord> records = new ArrayList<>(byName.values());
        int withCoordinates = 0;
        for (CatalogRecord record : records) {
            if (record.hasValidCoordinates()) {
                withCoordinates++;
            }
        }

        LinkedHashSet<String> columns = new LinkedHashSet<>(base.columns());
        for (String column : incremental.columns()) {
            if (!column.equals(incremental.idColumn())) {
                columns.add(column);
            }
        }
        CatalogDataset merged = new CatalogDataset(new ArrayList<>(columns), base.idColumn(), records);
        log.info(
            "Merged base={} incremental={} into {} records ({} duplicates collapsed, {} with coordinates)",
            base.size(),
            incremental.size(),
            merged.size(),
            collapsed,
            withCoordinates
        );
        return new MergeResult(merged, base.size(), incremental.size(), collapsed, withCoordinates);
    }

    private int offer(Map<String, Candidate> survivors, CatalogDataset dataset, int source) {
        int collapsed = 0;
        List<CatalogRecord> records = dataset.records();
        for (int i = 0; i < records.size(); i++) {
            Candidate candidate = new Candidate(records.get(i), source, i);
            Candidate current = survivors.get(candidate.record().name());
            if (current == null) {
                survivors.put(candidate.record().name(), candidate);
                continue;
            }
            collapsed++;
            if (SURVIVOR_ORDER.compare(candidate, current) < 0) {
                survivors.put(candidate.record().name(), candidate);
            }
        }
        return collapsed;
    }

    private record Candidate(CatalogRecord record, int source, int position) {
    }
}
