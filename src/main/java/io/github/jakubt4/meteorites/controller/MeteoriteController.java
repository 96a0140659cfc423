package io.github.jakubt4.meteorites.controller;

import io.github.jakubt4.meteorites.dto.AggregatesResponse;
import io.github.jakubt4.meteorites.dto.ListingResponse;
import io.github.jakubt4.meteorites.model.SummaryStatistics;
import io.github.jakubt4.meteorites.service.MeteoriteQueryService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Listing and aggregate views consumed by the page renderer.
 */
@RestController
@RequestMapping("/api/meteorites")
public class MeteoriteController {

    private final MeteoriteQueryService queryService;
    private final int maxListingRows;

    public MeteoriteController(final MeteoriteQueryService queryService,
                               @Value("${explorer.listing.max-rows:1000}") final int maxListingRows) {
        this.queryService = queryService;
        this.maxListingRows = maxListingRows;
    }

    /**
     * @param limit rows to include, capped at {@code explorer.listing.max-rows}
     */
    @GetMapping
    public ListingResponse listing(@RequestParam(required = false) final Integer limit) {
        final var effectiveLimit = limit == null ? maxListingRows : Math.min(limit, maxListingRows);
        final var result = queryService.listing(effectiveLimit);
        final var aggregates = queryService.aggregates();
        return new ListingResponse(
                result.totalCount(),
                result.rows(),
                AggregatesResponse.from(aggregates),
                aggregates.summary());
    }

    @GetMapping("/aggregates")
    public AggregatesResponse aggregates() {
        return AggregatesResponse.from(queryService.aggregates());
    }

    @GetMapping("/summary")
    public SummaryStatistics summary() {
        return queryService.aggregates().summary();
    }
}
