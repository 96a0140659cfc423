package io.github.jakubt4.meteorites.controller;

import io.github.jakubt4.meteorites.dto.DatasetStatusResponse;
import io.github.jakubt4.meteorites.model.DatasetSnapshot;
import io.github.jakubt4.meteorites.service.DatasetRefreshService;
import io.github.jakubt4.meteorites.service.DatasetSnapshotHolder;
import io.github.jakubt4.meteorites.service.RefreshOutcome;
import io.github.jakubt4.meteorites.store.CsvCacheStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational view of the dataset lifecycle: current state and on-demand refresh.
 */
@Slf4j
@RestController
@RequestMapping("/api/dataset")
@RequiredArgsConstructor
public class DatasetController {

    private final DatasetRefreshService refreshService;
    private final DatasetSnapshotHolder snapshotHolder;
    private final CsvCacheStore cacheStore;

    @GetMapping("/status")
    public DatasetStatusResponse status() {
        final var snapshot = snapshotHolder.current();
        return new DatasetStatusResponse(
                refreshService.state(),
                snapshot.map(DatasetSnapshot::size).orElse(null),
                snapshot.map(DatasetSnapshot::sourceRowCount).orElse(null),
                snapshot.map(DatasetSnapshot::builtAt).orElse(null),
                snapshot.map(s -> s.origin().name()).orElse(null),
                cacheStore.metadata().orElse(null));
    }

    /**
     * Runs a staleness check, or an unconditional refetch when {@code force} is set.
     *
     * @return {@code 200 OK} with the outcome, {@code 502 Bad Gateway} when the upstream
     *         could not supply a replacement dataset
     */
    @PostMapping("/refresh")
    public ResponseEntity<RefreshOutcome> refresh(@RequestParam(defaultValue = "false") final boolean force) {
        final var outcome = force ? refreshService.forceRefresh() : refreshService.checkStaleness();
        log.info("Manual {} — {} ({} rows)", force ? "refresh" : "staleness check", outcome.status(), outcome.rowCount());
        if (outcome.failed()) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(outcome);
        }
        return ResponseEntity.ok(outcome);
    }
}
