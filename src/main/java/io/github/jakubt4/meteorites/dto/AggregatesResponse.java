package io.github.jakubt4.meteorites.dto;

import io.github.jakubt4.meteorites.model.AggregateViews;
import io.github.jakubt4.meteorites.model.AggregateViews.GeoCellCount;
import io.github.jakubt4.meteorites.model.ClassificationGroup;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Count tables keyed by display labels ("L-type", "Very Large", ...).
 */
public record AggregatesResponse(Map<String, Map<String, Long>> byGroupAndMassBand,
                                 Map<Integer, Long> byYear,
                                 Map<String, Map<Integer, Long>> byGroupOverTime,
                                 List<GeoCellCount> byGeoCell) {

    public static AggregatesResponse from(final AggregateViews views) {
        return new AggregatesResponse(
                byLabel(views.byGroupAndMassBand()),
                views.byYear(),
                byLabel(views.byGroupOverTime()),
                views.byGeoCell());
    }

    private static <V> Map<String, V> byLabel(final Map<ClassificationGroup, ? extends V> byGroup) {
        final var labelled = new LinkedHashMap<String, V>();
        byGroup.forEach((group, value) -> labelled.put(group.label(), value));
        return labelled;
    }
}
