package io.github.jakubt4.meteorites.dto;

import io.github.jakubt4.meteorites.model.Meteorite;
import io.github.jakubt4.meteorites.model.SummaryStatistics;

import java.util.List;

/**
 * Dataset listing for page rendering: a capped slice of records plus every aggregate table.
 *
 * @param totalCount records in the dataset
 * @param records    first records in source order, at most the requested limit
 * @param aggregates derived count tables over the whole dataset
 * @param summary    headline statistics over the whole dataset
 */
public record ListingResponse(int totalCount,
                              List<Meteorite> records,
                              AggregatesResponse aggregates,
                              SummaryStatistics summary) {
}
