package io.github.jakubt4.meteorites.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Meteorite row exactly as received from the remote source, before normalization.
 * Values may be strings, numbers, nested objects or {@code null}.
 *
 * @param fields field name to untyped value
 */
public record RawRecord(Map<String, Object> fields) {

    public static final String NAME = "name";
    public static final String RECCLASS = "recclass";
    public static final String MASS = "mass";
    public static final String YEAR = "year";
    public static final String RECLAT = "reclat";
    public static final String RECLONG = "reclong";
    public static final String FALL = "fall";
    public static final String NAMETYPE = "nametype";

    // Header used by the CSV export of the same dataset
    private static final String MASS_CSV_ALIAS = "mass (g)";

    public RawRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static RawRecord of(final Map<String, ?> fields) {
        return new RawRecord(new LinkedHashMap<>(fields));
    }

    /**
     * Returns the trimmed textual value of a field, or {@code null} when the field is
     * absent, {@code null} or blank.
     */
    public String text(final String field) {
        var value = fields.get(field);
        if (value == null && MASS.equals(field)) {
            value = fields.get(MASS_CSV_ALIAS);
        }
        if (value == null) {
            return null;
        }
        final var text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    public boolean hasField(final String field) {
        return fields.containsKey(field) || (MASS.equals(field) && fields.containsKey(MASS_CSV_ALIAS));
    }
}
