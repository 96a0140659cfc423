package io.github.jakubt4.meteorites.controller;

import io.github.jakubt4.meteorites.exception.DatasetUnavailableException;
import io.github.jakubt4.meteorites.model.ClassificationGroup;
import io.github.jakubt4.meteorites.service.MeteoriteQueryService;
import io.github.jakubt4.meteorites.service.PageRequest;
import io.github.jakubt4.meteorites.service.QueryFilter;
import io.github.jakubt4.meteorites.service.QueryFilter.SortField;
import io.github.jakubt4.meteorites.service.QueryResult;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static io.github.jakubt4.meteorites.TestMeteorites.meteorite;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DataTableController.class)
class DataTableControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MeteoriteQueryService queryService;

    @Test
    void dataReturnsDataTablesEnvelope() throws Exception {
        when(queryService.query(any(), any())).thenReturn(new QueryResult(
                List.of(meteorite("Tagish Lake", ClassificationGroup.CARBONACEOUS, 10_000.0, 2000)), 45716, 1));

        mockMvc.perform(get("/data")
                        .param("draw", "3")
                        .param("start", "0")
                        .param("length", "10")
                        .param("search[value]", "tagish"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.draw").value(3))
                .andExpect(jsonPath("$.recordsTotal").value(45716))
                .andExpect(jsonPath("$.recordsFiltered").value(1))
                .andExpect(jsonPath("$.data[0].name").value("Tagish Lake"))
                .andExpect(jsonPath("$.data[0].recclass_clean").value("Carbonaceous"))
                .andExpect(jsonPath("$.data[0].mass_formatted").value("10,000.00 g"))
                .andExpect(jsonPath("$.data[0].year_formatted").value("2000"))
                .andExpect(jsonPath("$.data[0].mass_band").value("Very Large"));
    }

    @Test
    void dataTranslatesPagingSearchAndOrder() throws Exception {
        when(queryService.query(any(), any())).thenReturn(new QueryResult(List.of(), 0, 0));

        mockMvc.perform(get("/data")
                        .param("start", "20")
                        .param("length", "10")
                        .param("search[value]", "Allende")
                        .param("order[0][column]", "3")
                        .param("order[0][dir]", "desc"))
                .andExpect(status().isOk());

        final var filterCaptor = ArgumentCaptor.forClass(QueryFilter.class);
        final var pageCaptor = ArgumentCaptor.forClass(PageRequest.class);
        verify(queryService).query(filterCaptor.capture(), pageCaptor.capture());
        assertThat(filterCaptor.getValue().nameContains()).isEqualTo("Allende");
        assertThat(filterCaptor.getValue().sort()).isEqualTo(new QueryFilter.Sort(SortField.MASS, true));
        assertThat(pageCaptor.getValue()).isEqualTo(PageRequest.of(20, 10));
    }

    @Test
    void lengthMinusOneRequestsAllRows() throws Exception {
        when(queryService.query(any(), any())).thenReturn(new QueryResult(List.of(), 0, 0));

        mockMvc.perform(get("/data").param("length", "-1"))
                .andExpect(status().isOk());

        final var pageCaptor = ArgumentCaptor.forClass(PageRequest.class);
        verify(queryService).query(any(), pageCaptor.capture());
        assertThat(pageCaptor.getValue().limit()).isEqualTo(Integer.MAX_VALUE);
        assertThat(pageCaptor.getValue().offset()).isZero();
    }

    @Test
    void unknownOrderColumnKeepsSourceOrder() throws Exception {
        when(queryService.query(any(), any())).thenReturn(new QueryResult(List.of(), 0, 0));

        mockMvc.perform(get("/data").param("order[0][column]", "42"))
                .andExpect(status().isOk());

        final var filterCaptor = ArgumentCaptor.forClass(QueryFilter.class);
        verify(queryService).query(filterCaptor.capture(), any());
        assertThat(filterCaptor.getValue().sort()).isNull();
    }

    @Test
    void negativeStartIsRejected() throws Exception {
        mockMvc.perform(get("/data").param("start", "-5"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("REJECTED"));
    }

    @Test
    void dataIsUnavailableBeforeFirstLoad() throws Exception {
        when(queryService.query(any(), any())).thenThrow(new DatasetUnavailableException());

        mockMvc.perform(get("/data"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("UNAVAILABLE"))
                .andExpect(jsonPath("$.message").value("Meteorite dataset is not available yet"));
    }
}
