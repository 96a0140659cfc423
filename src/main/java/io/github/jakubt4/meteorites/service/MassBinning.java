package io.github.jakubt4.meteorites.service;

/**
 * How {@link MeteoriteAggregator#countsByGroupAndMassBand} buckets masses.
 */
public enum MassBinning {
    /** Fixed gram boundaries of {@link io.github.jakubt4.meteorites.model.MassBand}. */
    FIXED,
    /** Equal-population bins computed from the snapshot, labelled {@code Q1..Qn}. */
    QUANTILE
}
