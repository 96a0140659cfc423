package io.github.jakubt4.meteorites.controller;

import io.github.jakubt4.meteorites.TestMeteorites;
import io.github.jakubt4.meteorites.exception.DatasetUnavailableException;
import io.github.jakubt4.meteorites.model.ClassificationGroup;
import io.github.jakubt4.meteorites.model.Meteorite;
import io.github.jakubt4.meteorites.service.MassBinning;
import io.github.jakubt4.meteorites.service.MeteoriteAggregator;
import io.github.jakubt4.meteorites.service.MeteoriteQueryService;
import io.github.jakubt4.meteorites.service.QueryResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static io.github.jakubt4.meteorites.TestMeteorites.meteorite;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MeteoriteController.class)
@TestPropertySource(properties = "explorer.listing.max-rows=100")
class MeteoriteControllerTest {

    private final MeteoriteAggregator aggregator = new MeteoriteAggregator(MassBinning.FIXED, 5, 10.0);

    private final List<Meteorite> fixture = List.of(
            meteorite("Tiny", ClassificationGroup.H_TYPE, 5.0, 1990),
            meteorite("Medium", ClassificationGroup.H_TYPE, 1500.0, 1990),
            meteorite("Huge", ClassificationGroup.IRON, 2_000_000.0, 1920));

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MeteoriteQueryService queryService;

    @Test
    void listingCombinesRecordsAndAggregates() throws Exception {
        when(queryService.listing(2)).thenReturn(new QueryResult(fixture.subList(0, 2), 3, 3));
        when(queryService.aggregates()).thenReturn(aggregator.aggregate(fixture));

        mockMvc.perform(get("/api/meteorites").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(3))
                .andExpect(jsonPath("$.records.length()").value(2))
                .andExpect(jsonPath("$.records[0].classificationGroup").value("H-type"))
                .andExpect(jsonPath("$.records[0].massBand").value("Microscopic"))
                .andExpect(jsonPath("$.aggregates.byGroupAndMassBand['H-type'].Large").value(1))
                .andExpect(jsonPath("$.summary.totalCount").value(3));
    }

    @Test
    void listingLimitIsCapped() throws Exception {
        when(queryService.listing(100)).thenReturn(new QueryResult(TestMeteorites.numbered(100), 500, 500));
        when(queryService.aggregates()).thenReturn(aggregator.aggregate(fixture));

        mockMvc.perform(get("/api/meteorites").param("limit", "5000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records.length()").value(100));

        verify(queryService).listing(100);
    }

    @Test
    void aggregatesAreKeyedByLabels() throws Exception {
        when(queryService.aggregates()).thenReturn(aggregator.aggregate(fixture));

        mockMvc.perform(get("/api/meteorites/aggregates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.byGroupAndMassBand.Iron.Massive").value(1))
                .andExpect(jsonPath("$.byYear['1990']").value(2))
                .andExpect(jsonPath("$.byGroupOverTime['H-type']['1990']").value(2))
                .andExpect(jsonPath("$.byGeoCell[0].count").value(3));
    }

    @Test
    void summaryReportsHeadlineFigures() throws Exception {
        when(queryService.aggregates()).thenReturn(aggregator.aggregate(fixture));

        mockMvc.perform(get("/api/meteorites/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(3))
                .andExpect(jsonPath("$.earliestYear").value(1920))
                .andExpect(jsonPath("$.latestYear").value(1990))
                .andExpect(jsonPath("$.topClasses[0].classification").value("H-type"));
    }

    @Test
    void aggregatesAreUnavailableBeforeFirstLoad() throws Exception {
        when(queryService.aggregates()).thenThrow(new DatasetUnavailableException());

        mockMvc.perform(get("/api/meteorites/aggregates"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("UNAVAILABLE"));
    }
}
