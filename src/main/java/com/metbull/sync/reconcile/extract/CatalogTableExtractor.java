package com.metbull.sync.reconcile.extract;

import com.metbull.sync.reconcile.model.CatalogRecord;
import com.metbull.sync.reconcile.model.ExternalId;
import com.metbull.sync.reconcile.model.FallType;
import com.metbull.sync.reconcile.util.NameNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads whole rows from the "Normal table" rendering of a result page. Columns are
 * found by header keywords because the catalog renames them between layouts.
 */
@Component
public class CatalogTableExtractor {
    private static final Pattern CODE_PATTERN = Pattern.compile("code=(\\d+)", Pattern.CASE_INSENSITIVE);

    enum Field {
        NAME,
        RECCLASS,
        MASS,
        YEAR,
        FALL,
        LOCATION
    }

    public record TablePage(boolean tableFound, List<CatalogRecord> rows, OptionalInt maxYear) {
        static TablePage missing() {
            return new TablePage(false, List.of(), OptionalInt.empty());
        }
    }

    public TablePage extract(String html) {
        if (html == null || html.isBlank()) {
            return TablePage.missing();
        }
        Document document = Jsoup.parse(html);
        Element table = findResultsTable(document);
        if (table == null) {
            return TablePage.missing();
        }
        Map<Field, Integer> columns = mapColumns(table);
        Integer nameIndex = columns.get(Field.NAME);
        if (nameIndex == null) {
            return TablePage.missing();
        }

        List<CatalogRecord> rows = new ArrayList<>();
        int maxYear = Integer.MIN_VALUE;
        for (Element row : table.select("tr")) {
            Elements cells = row.select("td");
            if (cells.isEmpty() || nameIndex >= cells.size()) {
                continue;
            }
            Element nameCell = cells.get(nameIndex);
            String name = NameNormalizer.cleanDisplayName(normalizeText(nameCell.text()));
            if (name == null || name.isEmpty()) {
                continue;
            }
            Integer year = RawFieldParser.parseYear(readCell(cells, columns.get(Field.YEAR)));
            if (year != null) {
                maxYear = Math.max(maxYear, year);
            }
            RawFieldParser.Coordinates coordinates = RawFieldParser.parseCoordinates(readCell(cells, columns.get(Field.LOCATION)));
            rows.add(new CatalogRecord(
                name,
                codeOf(nameCell),
                readCell(cells, columns.get(Field.RECCLASS)),
                RawFieldParser.parseMassGrams(readCell(cells, columns.get(Field.MASS))),
                FallType.fromRaw(readCell(cells, columns.get(Field.FALL))),
                year == null ? null : Integer.toString(year),
                coordinates.lat(),
                coordinates.lon(),
                Map.of()
            ));
        }
        return new TablePage(true, rows, maxYear == Integer.MIN_VALUE ? OptionalInt.empty() : OptionalInt.of(maxYear));
    }

    private Element findResultsTable(Document document) {
        for (Element table : document.select("table")) {
            Element headerRow = headerRow(table);
            if (headerRow != null && normalizeHeader(headerRow.text()).contains("mass")) {
                return table;
            }
        }
        return null;
    }

    private Element headerRow(Element table) {
        Element withHeaders = table.selectFirst("tr:has(th)");
        return withHeaders != null ? withHeaders : table.selectFirst("tr");
    }

    Map<Field, Integer> mapColumns(Element table) {
        Map<Field, Integer> columns = new EnumMap<>(Field.class);
        Element headerRow = headerRow(table);
        if (headerRow == null) {
            return columns;
        }
        Elements headerCells = headerRow.select("th");
        if (headerCells.isEmpty()) {
            headerCells = headerRow.select("td");
        }
        for (int i = 0; i < headerCells.size(); i++) {
            Field field = classify(normalizeHeader(headerCells.get(i).text()));
            if (field != null) {
                columns.putIfAbsent(field, i);
            }
        }
        return columns;
    }

    private Field classify(String header) {
        if (header.contains("name") && !header.contains("type")) {
            return Field.NAME;
        }
        if (header.contains("class") || header.contains("type")) {
            return Field.RECCLASS;
        }
        if (header.contains("mass")) {
            return Field.MASS;
        }
        if (header.contains("year") || header.contains("date")) {
            return Field.YEAR;
        }
        if (header.contains("fall")) {
            return Field.FALL;
        }
        if (header.contains("co-ord") || header.contains("loc")) {
            return Field.LOCATION;
        }
        return null;
    }

    private ExternalId codeOf(Element nameCell) {
        Element link = nameCell.selectFirst("a[href]");
        if (link == null) {
            return ExternalId.unresolved();
        }
        Matcher matcher = CODE_PATTERN.matcher(link.attr("href"));
        return matcher.find() ? ExternalId.parse(matcher.group(1)) : ExternalId.unresolved();
    }

    private String readCell(Elements cells, Integer index) {
        if (index == null || index < 0 || index >= cells.size()) {
            return null;
        }
        return normalizeText(cells.get(index).text());
    }

    private String normalizeHeader(String value) {
        if (value == null) {
            return "";
        }
        return value
            .replace('\u00A0', ' ')
            .trim()
            .replaceAll("\\s+", " ")
            .toLowerCase(Locale.ROOT);
    }

    private String normalizeText(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = value.replace('\u00A0', ' ').trim();
        return cleaned.isEmpty() ? null : cleaned;
    }
}
