package io.github.jakubt4.meteorites.service;

import io.github.jakubt4.meteorites.model.Meteorite;

import java.util.Optional;

/**
 * Outcome of normalizing one raw row: either an accepted {@link Meteorite} or the
 * reason the row was rejected.
 */
public record NormalizationResult(Meteorite meteorite, Rejection rejection) {

    public static NormalizationResult accepted(final Meteorite meteorite) {
        return new NormalizationResult(meteorite, null);
    }

    public static NormalizationResult rejected(final Rejection rejection) {
        return new NormalizationResult(null, rejection);
    }

    public boolean isAccepted() {
        return meteorite != null;
    }

    public Optional<Meteorite> asOptional() {
        return Optional.ofNullable(meteorite);
    }

    public enum Rejection {
        MISSING_NAME,
        INVALID_MASS,
        INVALID_LATITUDE,
        INVALID_LONGITUDE,
        MISSING_YEAR
    }
}
