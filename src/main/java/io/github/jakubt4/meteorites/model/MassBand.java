package io.github.jakubt4.meteorites.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed mass-magnitude buckets in grams.
 *
 * <p>Each band is closed on the left and open on the right, so a mass of exactly
 * 1000 g is {@link #LARGE} and 999.99 g is {@link #MEDIUM}. Aggregate counts
 * depend on this edge convention.
 */
public enum MassBand {

    MICROSCOPIC("Microscopic", 0.0, 10.0),
    SMALL("Small", 10.0, 100.0),
    MEDIUM("Medium", 100.0, 1_000.0),
    LARGE("Large", 1_000.0, 10_000.0),
    VERY_LARGE("Very Large", 10_000.0, 1_000_000.0),
    MASSIVE("Massive", 1_000_000.0, Double.POSITIVE_INFINITY);

    private final String label;
    private final double lowerInclusive;
    private final double upperExclusive;

    MassBand(final String label, final double lowerInclusive, final double upperExclusive) {
        this.label = label;
        this.lowerInclusive = lowerInclusive;
        this.upperExclusive = upperExclusive;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public double lowerInclusive() {
        return lowerInclusive;
    }

    public double upperExclusive() {
        return upperExclusive;
    }

    public boolean contains(final double grams) {
        return grams >= lowerInclusive && grams < upperExclusive;
    }

    /**
     * Buckets a mass into its band.
     *
     * @param grams non-negative, finite mass
     * @throws IllegalArgumentException for negative or NaN input
     */
    public static MassBand of(final double grams) {
        if (Double.isNaN(grams) || grams < 0) {
            throw new IllegalArgumentException("Mass must be a non-negative number, got " + grams);
        }
        for (final MassBand band : values()) {
            if (band.contains(grams)) {
                return band;
            }
        }
        return MASSIVE;
    }

    @Override
    public String toString() {
        return label;
    }
}
