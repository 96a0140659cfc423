package io.github.jakubt4.meteorites.model;

import java.util.Objects;

/**
 * One normalized, classified meteorite landing. Never mutated after normalization.
 *
 * @param name                official meteorite name
 * @param classificationRaw   scientific classification as published (e.g. "L6", "Iron, IAB")
 * @param classificationGroup coarse group derived from {@code classificationRaw}
 * @param massGrams           mass in grams, non-negative
 * @param year                calendar year of fall or find, {@code null} when unknown
 * @param latitude            degrees in [-90, 90], {@code null} when unknown
 * @param longitude           degrees in [-180, 180], {@code null} when unknown
 * @param fallOrFind          "Fell" or "Found", {@code null} when not reported
 * @param nameType            "Valid" or "Relict", {@code null} when not reported
 * @param massBand            fixed mass bucket derived from {@code massGrams}
 */
public record Meteorite(String name,
                        String classificationRaw,
                        ClassificationGroup classificationGroup,
                        double massGrams,
                        Integer year,
                        Double latitude,
                        Double longitude,
                        String fallOrFind,
                        String nameType,
                        MassBand massBand) {

    public Meteorite {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(classificationGroup, "classificationGroup");
        Objects.requireNonNull(massBand, "massBand");
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
