package io.github.jakubt4.meteorites.service;

import io.github.jakubt4.meteorites.dto.RawRecord;
import io.github.jakubt4.meteorites.exception.SchemaMismatchException;
import io.github.jakubt4.meteorites.model.MassBand;
import io.github.jakubt4.meteorites.model.Meteorite;
import io.github.jakubt4.meteorites.service.NormalizationResult.Rejection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns raw upstream rows into typed {@link Meteorite} records.
 *
 * <p>Each field is parsed independently; a bad optional field becomes {@code null}
 * while a bad required field rejects the row. Mass is always required. Latitude and
 * longitude are required unless {@code explorer.normalizer.require-coordinates} is
 * switched off; year is optional unless {@code explorer.normalizer.require-year} is on.
 */
@Slf4j
@Service
public class MeteoriteNormalizer {

    private static final Pattern YEAR_ONLY = Pattern.compile("^-?\\d{1,4}$");
    private static final Pattern ISO_DATE = Pattern.compile("^(-?\\d{1,4})-\\d{2}-\\d{2}");
    private static final Pattern US_DATE = Pattern.compile("^\\d{1,2}/\\d{1,2}/(\\d{4})");

    private final MeteoriteClassifier classifier;
    private final boolean requireCoordinates;
    private final boolean requireYear;

    public MeteoriteNormalizer(final MeteoriteClassifier classifier,
                               @Value("${explorer.normalizer.require-coordinates:true}") final boolean requireCoordinates,
                               @Value("${explorer.normalizer.require-year:false}") final boolean requireYear) {
        this.classifier = classifier;
        this.requireCoordinates = requireCoordinates;
        this.requireYear = requireYear;
    }

    /**
     * Normalizes a single row. Never throws for malformed content.
     */
    public NormalizationResult normalize(final RawRecord raw) {
        final var name = raw.text(RawRecord.NAME);
        if (name == null) {
            return NormalizationResult.rejected(Rejection.MISSING_NAME);
        }

        final var mass = parseMass(raw.text(RawRecord.MASS));
        if (mass == null) {
            return NormalizationResult.rejected(Rejection.INVALID_MASS);
        }

        final var latitude = parseCoordinate(raw.text(RawRecord.RECLAT), 90.0);
        final var longitude = parseCoordinate(raw.text(RawRecord.RECLONG), 180.0);
        if (requireCoordinates && latitude == null) {
            return NormalizationResult.rejected(Rejection.INVALID_LATITUDE);
        }
        if (requireCoordinates && longitude == null) {
            return NormalizationResult.rejected(Rejection.INVALID_LONGITUDE);
        }

        final var year = parseYear(raw.text(RawRecord.YEAR));
        if (requireYear && year == null) {
            return NormalizationResult.rejected(Rejection.MISSING_YEAR);
        }

        final var classificationRaw = raw.text(RawRecord.RECCLASS);
        return NormalizationResult.accepted(new Meteorite(
                name,
                classificationRaw,
                classifier.classify(classificationRaw),
                mass,
                year,
                latitude,
                longitude,
                raw.text(RawRecord.FALL),
                raw.text(RawRecord.NAMETYPE),
                MassBand.of(mass)
        ));
    }

    /**
     * Normalizes a whole fetch in source order. Rejected rows are dropped and only
     * reported as a per-reason tally in the log.
     */
    public List<Meteorite> normalizeAll(final List<RawRecord> rawRecords) {
        final var accepted = new ArrayList<Meteorite>(rawRecords.size());
        final var rejections = new EnumMap<Rejection, Integer>(Rejection.class);

        for (final RawRecord raw : rawRecords) {
            final var result = normalize(raw);
            if (result.isAccepted()) {
                accepted.add(result.meteorite());
            } else {
                rejections.merge(result.rejection(), 1, Integer::sum);
            }
        }

        if (rejections.isEmpty()) {
            log.info("Normalized {} rows, none rejected", accepted.size());
        } else {
            log.info("Normalized {} of {} rows, rejected: {}", accepted.size(), rawRecords.size(), rejections);
        }
        return accepted;
    }

    /**
     * Checks that a fetched response carries the fields normalization depends on.
     * Rows may omit individual fields (the JSON feed drops null keys), so the check
     * runs against the union of all field names.
     *
     * @throws SchemaMismatchException when the response is empty or a required field never appears
     */
    public void validateSchema(final List<RawRecord> rawRecords) {
        final var required = requiredSchemaFields();
        if (rawRecords.isEmpty()) {
            throw new SchemaMismatchException("Upstream response contained no rows", required);
        }

        final var missing = new HashSet<>(required);
        for (final RawRecord raw : rawRecords) {
            missing.removeIf(raw::hasField);
            if (missing.isEmpty()) {
                return;
            }
        }
        throw new SchemaMismatchException("Upstream response is missing required fields " + missing, missing);
    }

    Set<String> requiredSchemaFields() {
        final var fields = new LinkedHashSet<>(List.of(RawRecord.NAME, RawRecord.RECCLASS, RawRecord.MASS));
        if (requireCoordinates) {
            fields.add(RawRecord.RECLAT);
            fields.add(RawRecord.RECLONG);
        }
        if (requireYear) {
            fields.add(RawRecord.YEAR);
        }
        return fields;
    }

    static Double parseMass(final String text) {
        final var value = parseDouble(text);
        if (value == null || value < 0) {
            return null;
        }
        return value;
    }

    static Double parseCoordinate(final String text, final double bound) {
        final var value = parseDouble(text);
        if (value == null || value < -bound || value > bound) {
            return null;
        }
        return value;
    }

    /**
     * Extracts the calendar year from values such as {@code 1880-01-01T00:00:00.000},
     * {@code 1880-01-01}, {@code 01/01/1880 12:00:00 AM} or a bare {@code 1880}.
     */
    static Integer parseYear(final String text) {
        if (text == null) {
            return null;
        }
        if (YEAR_ONLY.matcher(text).matches()) {
            return Integer.valueOf(text);
        }
        final var isoDate = ISO_DATE.matcher(text);
        if (isoDate.find()) {
            return Integer.valueOf(isoDate.group(1));
        }
        final var usDate = US_DATE.matcher(text);
        if (usDate.find()) {
            return Integer.valueOf(usDate.group(1));
        }
        return null;
    }

    private static Double parseDouble(final String text) {
        if (text == null) {
            return null;
        }
        try {
            final var value = Double.parseDouble(text.replace(",", ""));
            return Double.isFinite(value) ? value : null;
        } catch (final NumberFormatException e) {
            return null;
        }
    }
}
