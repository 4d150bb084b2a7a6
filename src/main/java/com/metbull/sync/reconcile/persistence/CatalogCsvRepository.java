package com.metbull.sync.reconcile.persistence;

import com.metbull.sync.reconcile.model.CatalogDataset;
import com.metbull.sync.reconcile.model.CatalogRecord;
import com.metbull.sync.reconcile.model.ExternalId;
import com.metbull.sync.reconcile.model.FallType;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Repository
public class CatalogCsvRepository {
    private static final Logger log = LoggerFactory.getLogger(CatalogCsvRepository.class);
    private static final Set<String> ID_HEADERS = Set.of("id", "externalid", "external_id");

    public CatalogDataset load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new LocalFileMissingException(path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            List<String> headers = new ArrayList<>(parser.getHeaderNames());
            String idColumn = findIdColumn(headers);
            if (idColumn == null) {
                idColumn = CatalogDataset.DEFAULT_ID_COLUMN;
                log.info("{} has no id column, adding '{}' with every record unresolved", path, idColumn);
            }
            List<CatalogRecord> records = new ArrayList<>();
            int skipped = 0;
            for (CSVRecord row : parser) {
                CatalogRecord record = toRecord(row, headers, idColumn);
                if (record == null) {
                    skipped++;
                    continue;
                }
                records.add(record);
            }
            if (skipped > 0) {
                log.warn("Skipped {} rows without a name while reading {}", skipped, path);
            }
            log.info("Loaded {} records from {}", records.size(), path);
            return new CatalogDataset(headers, idColumn, records);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read dataset " + path, e);
        }
    }

    /** Overwrites the target in place; a crash mid-write can leave a truncated file. */
    public void save(CatalogDataset dataset, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(dataset.columns().toArray(String[]::new))
                .setRecordSeparator("\n")
                .build();
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {
                for (CatalogRecord record : dataset.records()) {
                    printer.printRecord(toRow(record, dataset));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write dataset " + path, e);
        }
        log.debug("Wrote {} records to {}", dataset.size(), path);
    }

    public static Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }

    private CatalogRecord toRecord(CSVRecord row, List<String> headers, String idColumn) {
        String name = column(row, CatalogDataset.NAME_COLUMN);
        if (name == null) {
            return null;
        }
        Map<String, String> extras = new LinkedHashMap<>();
        for (String header : headers) {
            if (header.equals(idColumn) || CatalogDataset.STANDARD_COLUMNS.contains(header)) {
                continue;
            }
            extras.put(header, row.isSet(header) ? row.get(header) : "");
        }
        return new CatalogRecord(
            name,
            ExternalId.parse(column(row, idColumn)),
            column(row, CatalogDataset.RECCLASS_COLUMN),
            parseDouble(column(row, CatalogDataset.MASS_COLUMN)),
            FallType.fromRaw(column(row, CatalogDataset.FALL_COLUMN)),
            column(row, CatalogDataset.YEAR_COLUMN),
            parseDouble(column(row, CatalogDataset.LAT_COLUMN)),
            parseDouble(column(row, CatalogDataset.LON_COLUMN)),
            extras
        );
    }

    private List<String> toRow(CatalogRecord record, CatalogDataset dataset) {
        List<String> values = new ArrayList<>(dataset.columns().size());
        for (String column : dataset.columns()) {
            if (column.equals(dataset.idColumn())) {
                values.add(record.externalId().toCsv());
                continue;
            }
            switch (column) {
                case CatalogDataset.NAME_COLUMN -> values.add(record.name());
                case CatalogDataset.RECCLASS_COLUMN -> values.add(nullToEmpty(record.recclass()));
                case CatalogDataset.MASS_COLUMN -> values.add(formatNumber(record.mass()));
                case CatalogDataset.FALL_COLUMN -> values.add(record.fall() == null ? "" : record.fall().label());
                case CatalogDataset.YEAR_COLUMN -> values.add(nullToEmpty(record.year()));
                case CatalogDataset.LAT_COLUMN -> values.add(formatNumber(record.lat()));
                case CatalogDataset.LON_COLUMN -> values.add(formatNumber(record.lon()));
                default -> values.add(nullToEmpty(record.extras().get(column)));
            }
        }
        return values;
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setAllowMissingColumnNames(true)
            .build();
        return format.parse(reader);
    }

    private String findIdColumn(List<String> headers) {
        for (String header : headers) {
            if (header != null && ID_HEADERS.contains(header.trim().toLowerCase(Locale.ROOT))) {
                return header;
            }
        }
        return null;
    }

    private String column(CSVRecord row, String name) {
        if (!row.isMapped(name) || !row.isSet(name)) {
            return null;
        }
        String value = row.get(name).trim();
        return value.isEmpty() ? null : value;
    }

    static Double parseDouble(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isNaN(value) ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String formatNumber(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return "";
        }
        return BigDecimal.valueOf(value).toPlainString();
    }

    private String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
