package io.github.jakubt4.meteorites.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Derived count tables computed once per {@link DatasetSnapshot}.
 * Groupings with a zero count are absent from the maps.
 *
 * @param byGroupAndMassBand classification group, then mass band label, to count
 * @param byYear             year to count, ascending
 * @param byGroupOverTime    classification group, then year, to count
 * @param byGeoCell          counts per latitude/longitude grid cell
 * @param summary            headline statistics
 */
public record AggregateViews(Map<ClassificationGroup, Map<String, Long>> byGroupAndMassBand,
                             SortedMap<Integer, Long> byYear,
                             Map<ClassificationGroup, SortedMap<Integer, Long>> byGroupOverTime,
                             List<GeoCellCount> byGeoCell,
                             SummaryStatistics summary) {

    public AggregateViews {
        byGroupAndMassBand = Collections.unmodifiableMap(byGroupAndMassBand);
        byYear = Collections.unmodifiableSortedMap(byYear);
        byGroupOverTime = Collections.unmodifiableMap(byGroupOverTime);
        byGeoCell = List.copyOf(byGeoCell);
    }

    /**
     * @param latitude   centre latitude of the cell
     * @param longitude  centre longitude of the cell
     * @param count      meteorites inside the cell
     * @param totalMassGrams summed mass of those meteorites
     */
    public record GeoCellCount(double latitude, double longitude, long count, double totalMassGrams) {
    }
}
