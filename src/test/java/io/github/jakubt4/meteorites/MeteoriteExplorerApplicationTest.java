package io.github.jakubt4.meteorites;

import io.github.jakubt4.meteorites.client.NasaMeteoriteClient;
import io.github.jakubt4.meteorites.model.RefreshState;
import io.github.jakubt4.meteorites.service.DatasetRefreshService;
import io.github.jakubt4.meteorites.service.RefreshOutcome.Status;
import io.github.jakubt4.meteorites.store.CsvCacheStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Files;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class MeteoriteExplorerApplicationTest {

    @MockBean
    private NasaMeteoriteClient source;

    @Autowired
    private DatasetRefreshService refreshService;

    @Autowired
    private CsvCacheStore cacheStore;

    @Autowired
    private MockMvc mockMvc;

    @AfterEach
    void removeCache() throws IOException {
        Files.deleteIfExists(cacheStore.location());
        Files.deleteIfExists(cacheStore.location().resolveSibling(cacheStore.location().getFileName() + ".meta.json"));
    }

    @Test
    void contextStartsColdAndRejectsReads() throws Exception {
        assertThat(refreshService.state()).isEqualTo(RefreshState.COLD);

        mockMvc.perform(get("/data"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void refreshFeedsTheQueryEndpoints() throws Exception {
        when(source.fetch(any())).thenReturn(TestMeteorites.upstreamRows());

        final var outcome = refreshService.forceRefresh();

        assertThat(outcome.status()).isEqualTo(Status.REFRESHED);
        assertThat(cacheStore.load()).hasValueSatisfying(cached -> assertThat(cached.records()).hasSize(3));

        mockMvc.perform(get("/data").param("search[value]", "AAR"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recordsTotal").value(3))
                .andExpect(jsonPath("$.recordsFiltered").value(1))
                .andExpect(jsonPath("$.data[0].name").value("Aarhus"))
                .andExpect(jsonPath("$.data[0].recclass_clean").value("H-type"));

        mockMvc.perform(get("/api/dataset/status"))
                .andExpect(jsonPath("$.state").value("WARM"))
                .andExpect(jsonPath("$.origin").value("REMOTE"))
                .andExpect(jsonPath("$.sourceRowCount").value(5));
    }
}
