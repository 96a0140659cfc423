package io.github.jakubt4.meteorites.service;

import io.github.jakubt4.meteorites.client.NasaMeteoriteClient;
import io.github.jakubt4.meteorites.dto.RawRecord;
import io.github.jakubt4.meteorites.exception.SchemaMismatchException;
import io.github.jakubt4.meteorites.exception.SourceUnavailableException;
import io.github.jakubt4.meteorites.exception.StoreWriteException;
import io.github.jakubt4.meteorites.model.DatasetSnapshot;
import io.github.jakubt4.meteorites.model.Meteorite;
import io.github.jakubt4.meteorites.model.RefreshState;
import io.github.jakubt4.meteorites.service.RefreshOutcome.Status;
import io.github.jakubt4.meteorites.store.CsvCacheStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Keeps the in-memory dataset current; the only writer of {@link DatasetSnapshotHolder}.
 *
 * <p>State machine:
 * <pre>
 *   COLD  --fetch ok-->               WARM
 *   WARM  --remote count differs-->   STALE --fetch ok--> WARM
 *   WARM/STALE --fetch fails-->       unchanged, existing snapshot kept
 * </pre>
 *
 * <p>At most one fetch-normalize-save-publish sequence runs at a time. A caller arriving
 * while one is in flight waits for it and receives the same {@link RefreshOutcome}
 * instead of issuing a second fetch. Replacement snapshots are built completely before
 * being swapped in, so readers are never blocked.
 */
@Slf4j
@Service
public class DatasetRefreshService {

    private final NasaMeteoriteClient source;
    private final CsvCacheStore cacheStore;
    private final MeteoriteNormalizer normalizer;
    private final MeteoriteAggregator aggregator;
    private final DatasetSnapshotHolder snapshotHolder;
    private final Duration fetchTimeout;
    private final Duration countTimeout;
    private final boolean refreshOnStartup;

    private final AtomicReference<RefreshState> state = new AtomicReference<>(RefreshState.COLD);
    private final AtomicReference<CompletableFuture<RefreshOutcome>> inFlight = new AtomicReference<>();

    public DatasetRefreshService(final NasaMeteoriteClient source,
                                 final CsvCacheStore cacheStore,
                                 final MeteoriteNormalizer normalizer,
                                 final MeteoriteAggregator aggregator,
                                 final DatasetSnapshotHolder snapshotHolder,
                                 @Value("${explorer.source.fetch-timeout:60s}") final Duration fetchTimeout,
                                 @Value("${explorer.source.count-timeout:10s}") final Duration countTimeout,
                                 @Value("${explorer.refresh.on-startup:true}") final boolean refreshOnStartup) {
        this.source = source;
        this.cacheStore = cacheStore;
        this.normalizer = normalizer;
        this.aggregator = aggregator;
        this.snapshotHolder = snapshotHolder;
        this.fetchTimeout = fetchTimeout;
        this.countTimeout = countTimeout;
        this.refreshOnStartup = refreshOnStartup;
    }

    @PostConstruct
    void init() {
        if (!refreshOnStartup) {
            log.info("Startup refresh disabled — dataset stays COLD until a refresh is requested");
            return;
        }
        initialize();
    }

    /**
     * Startup path: publishes the cached dataset if there is one, then checks it against
     * the upstream. Without a cache the dataset is fetched; if that fails too the service
     * stays {@link RefreshState#COLD} and every read is rejected.
     */
    public RefreshOutcome initialize() {
        final var cached = cacheStore.load();
        if (cached.isPresent() && !cached.get().records().isEmpty()) {
            final var dataset = cached.get();
            snapshotHolder.publish(buildSnapshot(
                    dataset.records(), dataset.metadata().sourceRowCount(), DatasetSnapshot.Origin.CACHE));
            state.set(RefreshState.WARM);
            log.info("Warm start — {} cached records from {}", dataset.records().size(), dataset.metadata().lastModified());
        } else {
            log.info("Cold start — no cached dataset at {}", cacheStore.location());
        }

        final var outcome = checkStaleness();
        if (outcome.failed() && outcome.state() == RefreshState.COLD) {
            log.error("No meteorite dataset available, reads will be rejected: {}", outcome.message());
        }
        return outcome;
    }

    /**
     * Compares the local dataset with the upstream and refetches only when they differ.
     * Safe to call repeatedly and concurrently.
     */
    public RefreshOutcome checkStaleness() {
        return singleFlight(this::runStalenessCheck);
    }

    /**
     * Refetches unconditionally, subject to the same single-flight gate.
     */
    public RefreshOutcome forceRefresh() {
        return singleFlight(() -> refresh("forced refresh"));
    }

    @Scheduled(fixedDelayString = "${explorer.refresh.check-interval:21600000}",
               initialDelayString = "${explorer.refresh.check-interval:21600000}")
    public void scheduledCheck() {
        final var outcome = checkStaleness();
        log.info("Scheduled staleness check — {} ({})", outcome.status(), outcome.message());
    }

    public RefreshState state() {
        return state.get();
    }

    private RefreshOutcome singleFlight(final Supplier<RefreshOutcome> action) {
        final var mine = new CompletableFuture<RefreshOutcome>();
        final var running = inFlight.compareAndExchange(null, mine);
        if (running != null) {
            log.debug("Refresh already in flight, awaiting its outcome");
            return running.join();
        }
        try {
            final var outcome = action.get();
            mine.complete(outcome);
            return outcome;
        } catch (final RuntimeException | Error e) {
            // waiters parked in join() must be released whatever the leader died of
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.set(null);
        }
    }

    private RefreshOutcome runStalenessCheck() {
        final var current = snapshotHolder.current();
        if (current.isEmpty()) {
            return refresh("no local dataset");
        }

        final var snapshot = current.get();
        final var remoteCount = remoteCount();
        if (remoteCount.isEmpty()) {
            state.set(RefreshState.WARM);
            return new RefreshOutcome(RefreshState.WARM, Status.UNCHANGED, snapshot.size(),
                    "Remote count unavailable, keeping local dataset");
        }
        if (remoteCount.getAsLong() == snapshot.sourceRowCount()) {
            state.set(RefreshState.WARM);
            return new RefreshOutcome(RefreshState.WARM, Status.UNCHANGED, snapshot.size(),
                    "Local dataset matches remote row count " + remoteCount.getAsLong());
        }

        state.set(RefreshState.STALE);
        log.info("Local dataset is STALE — {} source rows cached, {} upstream",
                snapshot.sourceRowCount(), remoteCount.getAsLong());
        return refresh("remote row count changed");
    }

    private OptionalLong remoteCount() {
        try {
            return source.remoteCount(countTimeout);
        } catch (final SourceUnavailableException e) {
            log.warn("Remote row count unavailable: {}", e.getMessage());
            return OptionalLong.empty();
        }
    }

    private RefreshOutcome refresh(final String reason) {
        log.info("Refreshing dataset — {}", reason);
        final List<RawRecord> rawRecords;
        final List<Meteorite> records;
        try {
            rawRecords = source.fetch(fetchTimeout);
            normalizer.validateSchema(rawRecords);
            records = normalizer.normalizeAll(rawRecords);
            if (records.isEmpty()) {
                throw new SchemaMismatchException(
                        "None of the " + rawRecords.size() + " fetched rows passed validation", Set.of());
            }
        } catch (final SourceUnavailableException | SchemaMismatchException e) {
            return failed(e);
        }

        final var snapshot = buildSnapshot(records, rawRecords.size(), DatasetSnapshot.Origin.REMOTE);
        var status = Status.REFRESHED;
        var message = "Fetched " + rawRecords.size() + " rows, " + records.size() + " retained";
        try {
            cacheStore.save(records, rawRecords.size());
        } catch (final StoreWriteException e) {
            log.error("Dataset refreshed but the local cache is now out of date: {}", e.getMessage());
            status = Status.REFRESHED_NOT_CACHED;
            message = message + "; cache write failed: " + e.getMessage();
        }

        snapshotHolder.publish(snapshot);
        state.set(RefreshState.WARM);
        return new RefreshOutcome(RefreshState.WARM, status, snapshot.size(), message);
    }

    private RefreshOutcome failed(final RuntimeException e) {
        final var current = snapshotHolder.current();
        if (current.isPresent()) {
            log.warn("Refresh failed, keeping existing dataset of {} records: {}", current.get().size(), e.getMessage());
        } else {
            log.error("Refresh failed with no dataset to fall back on: {}", e.getMessage());
        }
        return new RefreshOutcome(state.get(), Status.FAILED, current.map(DatasetSnapshot::size).orElse(0), e.getMessage());
    }

    private DatasetSnapshot buildSnapshot(final List<Meteorite> records,
                                          final long sourceRowCount,
                                          final DatasetSnapshot.Origin origin) {
        return new DatasetSnapshot(records, aggregator.aggregate(records), sourceRowCount, Instant.now(), origin);
    }
}
