package com.metbull.sync.reconcile.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record CatalogRecord(
    String name,
    ExternalId externalId,
    String recclass,
    Double mass,
    FallType fall,
    String year,
    Double lat,
    Double lon,
    Map<String, String> extras
) {
    private static final Pattern YEAR_PATTERN = Pattern.compile("(\\d{4})");

    public CatalogRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("record name must not be blank");
        }
        externalId = externalId == null ? ExternalId.unresolved() : externalId;
        extras = extras == null || extras.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public static CatalogRecord named(String name) {
        return new CatalogRecord(name, ExternalId.unresolved(), null, null, null, null, null, null, Map.of());
    }

    public CatalogRecord withName(String newName) {
        return new CatalogRecord(newName, externalId, recclass, mass, fall, year, lat, lon, extras);
    }

    public CatalogRecord withExternalId(ExternalId newId) {
        return new CatalogRecord(name, newId, recclass, mass, fall, year, lat, lon, extras);
    }

    public CatalogRecord withExtras(Map<String, String> newExtras) {
        return new CatalogRecord(name, externalId, recclass, mass, fall, year, lat, lon, newExtras);
    }

    public CatalogRecord withCoordinates(Double newLat, Double newLon) {
        return new CatalogRecord(name, externalId, recclass, mass, fall, year, newLat, newLon, extras);
    }

    public boolean isResolved() {
        return externalId.isResolved();
    }

    /**
     * True when both coordinates are present, finite, in range and not the
     * (0, 0) placeholder used by the upstream dataset for unknown locations.
     */
    public boolean hasValidCoordinates() {
        if (lat == null || lon == null) {
            return false;
        }
        if (!Double.isFinite(lat) || !Double.isFinite(lon)) {
            return false;
        }
        if (Math.abs(lat) > 90.0 || Math.abs(lon) > 180.0) {
            return false;
        }
        return lat != 0.0 || lon != 0.0;
    }

    public Integer yearAsInt() {
        if (year == null || year.isBlank()) {
            return null;
        }
        String trimmed = year.trim();
        try {
            return (int) Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            // NASA export style "01/01/1880 12:00:00 AM"
            Matcher matcher = YEAR_PATTERN.matcher(trimmed);
            return matcher.find() ? Integer.parseInt(matcher.group(1)) : null;
        }
    }
}
