package io.github.jakubt4.meteorites.model;

import java.util.List;

/**
 * Headline figures for the dataset.
 *
 * @param totalCount       number of records
 * @param averageMassGrams mean mass, {@code 0} for an empty dataset
 * @param earliestYear     earliest known year, {@code null} when no record has a year
 * @param latestYear       latest known year, {@code null} when no record has a year
 * @param topClasses       most frequent raw classifications, most frequent first
 */
public record SummaryStatistics(long totalCount,
                                double averageMassGrams,
                                Integer earliestYear,
                                Integer latestYear,
                                List<ClassCount> topClasses) {

    public SummaryStatistics {
        topClasses = List.copyOf(topClasses);
    }

    public record ClassCount(String classification, long count) {
    }
}
