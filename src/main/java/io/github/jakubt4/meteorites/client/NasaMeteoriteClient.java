package io.github.jakubt4.meteorites.client;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import io.github.jakubt4.meteorites.dto.RawRecord;
import io.github.jakubt4.meteorites.exception.SourceUnavailableException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Reads the NASA Meteorite Landings dataset from its Socrata endpoint.
 *
 * <p>The dataset is read in pages of {@code explorer.source.page-size} rows
 * ({@code $limit}/{@code $offset}, ordered by row id) until a short page signals the
 * end, so the result always holds every upstream row.
 *
 * <p>Every call carries a caller-supplied deadline covering all pages. The HTTP exchange runs on a worker
 * thread; when the deadline passes the worker is interrupted, which aborts the JDK
 * HTTP exchange, and the caller gets a {@link SourceUnavailableException}. Partial
 * results are never returned.
 */
@Slf4j
@Service
public class NasaMeteoriteClient {

    private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS_TYPE =
            new ParameterizedTypeReference<>() {
            };
    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");
    private static final String COUNT_FIELD = "count";

    private final RestClient restClient;
    private final String dataPath;
    private final String countPath;
    private final SourceFormat format;
    private final int pageSize;

    private final AtomicInteger workerCounter = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(task -> {
        final var thread = new Thread(task, "meteorite-source-" + workerCounter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    public NasaMeteoriteClient(final RestClient.Builder restClientBuilder,
                               @Value("${explorer.source.base-url}") final String baseUrl,
                               @Value("${explorer.source.data-path:/resource/gh4g-9sfh.json}") final String dataPath,
                               @Value("${explorer.source.count-path:/resource/gh4g-9sfh.json}") final String countPath,
                               @Value("${explorer.source.format:JSON}") final SourceFormat format,
                               @Value("${explorer.source.page-size:50000}") final int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("page-size must be positive, got " + pageSize);
        }
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .build();
        this.dataPath = dataPath;
        this.countPath = countPath;
        this.format = format;
        this.pageSize = pageSize;
    }

    /**
     * Downloads the full dataset.
     *
     * @param timeout deadline for the whole exchange, including body parsing
     * @return every row the upstream returned, in upstream order
     * @throws SourceUnavailableException on timeout, transport failure, non-2xx status or unreadable body
     */
    public List<RawRecord> fetch(final Duration timeout) {
        final var rows = withDeadline("fetch", timeout, this::requestAllPages);
        log.info("Fetched {} raw rows from {} ({})", rows.size(), dataPath, format);
        return rows;
    }

    /**
     * Asks the upstream how many rows the dataset currently has. Best-effort: a failed
     * attempt is retried once and then recovered to an empty result.
     *
     * @return the remote row count, or empty when no count endpoint is configured
     * @throws SourceUnavailableException when called without the retry proxy and the count query fails
     */
    @Retryable(retryFor = SourceUnavailableException.class, maxAttempts = 2,
               backoff = @Backoff(delay = 500, maxDelay = 2000))
    public OptionalLong remoteCount(final Duration timeout) {
        if (countPath == null || countPath.isBlank()) {
            return OptionalLong.empty();
        }
        final long count = withDeadline("count", timeout, this::requestCount);
        log.debug("Remote source reports {} rows", count);
        return OptionalLong.of(count);
    }

    @Recover
    public OptionalLong recoverRemoteCount(final SourceUnavailableException e, final Duration timeout) {
        log.warn("Remote row count unavailable after retries: {}", e.getMessage());
        return OptionalLong.empty();
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private List<RawRecord> requestAllPages() {
        final var rows = new ArrayList<RawRecord>();
        var offset = 0L;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new SourceUnavailableException("Fetch interrupted after " + rows.size() + " rows");
            }
            final var page = format == SourceFormat.CSV ? requestCsv(offset) : requestJson(offset);
            rows.addAll(page);
            if (page.size() < pageSize) {
                return rows;
            }
            offset += page.size();
            log.debug("Full page of {} rows, requesting offset {}", page.size(), offset);
        }
    }

    private List<RawRecord> requestJson(final long offset) {
        final var body = restClient.get()
                .uri(uriBuilder -> pageUri(uriBuilder, offset))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(ROWS_TYPE);
        if (body == null) {
            throw new SourceUnavailableException("Remote source returned an empty body");
        }
        return body.stream().map(RawRecord::of).toList();
    }

    private List<RawRecord> requestCsv(final long offset) {
        final var body = restClient.get()
                .uri(uriBuilder -> pageUri(uriBuilder, offset))
                .accept(TEXT_CSV)
                .retrieve()
                .body(String.class);
        if (body == null) {
            throw new SourceUnavailableException("Remote source returned an empty body");
        }
        return parseCsv(body);
    }

    private URI pageUri(final UriBuilder uriBuilder, final long offset) {
        return uriBuilder.path(dataPath)
                .queryParam("$order", ":id")
                .queryParam("$limit", pageSize)
                .queryParam("$offset", offset)
                .build();
    }

    static List<RawRecord> parseCsv(final String body) {
        final var rows = new ArrayList<RawRecord>();
        try (var reader = new CSVReader(new StringReader(body))) {
            final var header = reader.readNext();
            if (header == null) {
                return rows;
            }
            String[] line;
            while ((line = reader.readNext()) != null) {
                final var fields = new LinkedHashMap<String, Object>();
                for (var i = 0; i < header.length && i < line.length; i++) {
                    fields.put(header[i].trim(), line[i]);
                }
                rows.add(new RawRecord(fields));
            }
        } catch (final IOException | CsvValidationException e) {
            throw new SourceUnavailableException("Unreadable CSV from remote source: " + e.getMessage(), e);
        }
        return rows;
    }

    private long requestCount() {
        final var body = restClient.get()
                .uri(uriBuilder -> uriBuilder.path(countPath).queryParam("$select", "count(*)").build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(ROWS_TYPE);
        if (body == null || body.isEmpty()) {
            throw new SourceUnavailableException("Count query returned no rows");
        }
        final var row = body.get(0);
        final var value = row.containsKey(COUNT_FIELD)
                ? row.get(COUNT_FIELD)
                : row.values().stream().findFirst().orElse(null);
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (final NumberFormatException e) {
            throw new SourceUnavailableException("Count query returned a non-numeric value: " + value, e);
        }
    }

    private <T> T withDeadline(final String operation, final Duration timeout, final Supplier<T> call) {
        final Future<T> future = executor.submit(call::get);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            future.cancel(true);
            throw new SourceUnavailableException("Remote " + operation + " timed out after " + timeout.toMillis() + " ms");
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Interrupted while waiting for remote " + operation, e);
        } catch (final ExecutionException e) {
            final var cause = e.getCause();
            if (cause instanceof SourceUnavailableException unavailable) {
                throw unavailable;
            }
            if (cause instanceof RestClientException) {
                throw new SourceUnavailableException("Remote " + operation + " failed: " + cause.getMessage(), cause);
            }
            throw new SourceUnavailableException("Unexpected error during remote " + operation + ": " + cause, cause);
        }
    }
}
