package com.metbull.sync.reconcile.extract;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Lenient parsing of the free-text cells of the catalog's table rendering. */
public final class RawFieldParser {
    private static final Pattern NUMBER_PATTERN = Pattern.compile("(\\d*\\.?\\d+)");
    private static final Pattern YEAR_PATTERN = Pattern.compile("(\\d{3,4})");
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    private RawFieldParser() {}

    public record Coordinates(Double lat, Double lon) {
        static final Coordinates NONE = new Coordinates(null, null);
    }

    /** Broad grouping used for map colouring, keyed on words in the class name. */
    public static String categoryOf(String recclass) {
        if (recclass == null || recclass.isBlank()) {
            return "Other / Unknown";
        }
        String value = recclass.toLowerCase(Locale.ROOT);
        if (value.contains("iron") || value.contains("mesosiderite") || value.contains("pallasite")) {
            return "Iron / Stony-Iron";
        }
        if (value.contains("chondrite")) {
            return "Stony (Chondrite)";
        }
        if (value.contains("achondrite") || value.contains("martian") || value.contains("lunar")) {
            return "Stony (Achondrite)";
        }
        return "Other / Unknown";
    }

    /** Mass in grams; understands kg, mg and ton suffixes. Null when no number is present. */
    public static Double parseMassGrams(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.toLowerCase(Locale.ROOT).replace(",", "").trim();
        Matcher matcher = NUMBER_PATTERN.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        double number = Double.parseDouble(matcher.group(1));
        if (value.contains("kg")) {
            return number * 1000;
        }
        if (value.contains("mg")) {
            return number / 1000;
        }
        if (value.contains("ton")) {
            return number * 1_000_000;
        }
        return number;
    }

    public static Integer parseYear(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Matcher matcher = YEAR_PATTERN.matcher(raw);
        return matcher.find() ? Integer.parseInt(matcher.group(1)) : null;
    }

    /**
     * Parses "19.58S 17.92E" style text. South and west become negative; a
     * missing second token means no coordinates.
     */
    public static Coordinates parseCoordinates(String raw) {
        if (raw == null || raw.isBlank()) {
            return Coordinates.NONE;
        }
        String[] parts = WHITESPACE_PATTERN.split(raw.trim());
        if (parts.length < 2) {
            return Coordinates.NONE;
        }
        Double lat = signedDegrees(parts[0], 'S');
        Double lon = signedDegrees(parts[1], 'W');
        if (lat == null || lon == null) {
            return Coordinates.NONE;
        }
        return new Coordinates(lat, lon);
    }

    private static Double signedDegrees(String token, char negativeHemisphere) {
        Matcher matcher = NUMBER_PATTERN.matcher(token);
        if (!matcher.find()) {
            return null;
        }
        double value = Double.parseDouble(matcher.group(1));
        char direction = Character.toUpperCase(token.charAt(token.length() - 1));
        return direction == negativeHemisphere ? -value : value;
    }
}
