package io.github.jakubt4.meteorites.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import io.github.jakubt4.meteorites.exception.StoreWriteException;
import io.github.jakubt4.meteorites.model.ClassificationGroup;
import io.github.jakubt4.meteorites.model.MassBand;
import io.github.jakubt4.meteorites.model.Meteorite;
import io.github.jakubt4.meteorites.service.MeteoriteClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Single-slot local cache of the last successfully fetched dataset.
 *
 * <p>Records are kept in a CSV file (header row plus one line per meteorite). A small
 * JSON sidecar next to it remembers how many raw rows the upstream returned, which is
 * what staleness checks compare against. Both files are written to a temporary file
 * first and then moved into place atomically, so a concurrent {@link #load()} sees
 * either the old or the new version, never a partial one.
 */
@Slf4j
@Component
public class CsvCacheStore {

    static final String[] HEADER = {
            "name", "recclass", "recclass_clean", "mass", "year", "reclat", "reclong", "fall", "nametype", "mass_band"
    };

    private static final String SIDECAR_SUFFIX = ".meta.json";

    private final Path cacheFile;
    private final Path sidecarFile;
    private final MeteoriteClassifier classifier;
    private final ObjectMapper objectMapper;

    public CsvCacheStore(@Value("${explorer.cache.path:data/meteorites.csv}") final String cacheFile,
                         final MeteoriteClassifier classifier,
                         final ObjectMapper objectMapper) {
        this.cacheFile = Path.of(cacheFile).toAbsolutePath();
        this.sidecarFile = this.cacheFile.resolveSibling(this.cacheFile.getFileName() + SIDECAR_SUFFIX);
        this.classifier = classifier;
        this.objectMapper = objectMapper;
    }

    /**
     * Reads the whole cache. An unreadable cache is reported and treated as absent.
     */
    public Optional<CachedDataset> load() {
        if (!Files.isRegularFile(cacheFile)) {
            return Optional.empty();
        }
        try {
            final var records = readRecords();
            final var metadata = metadataFor(records.size());
            log.info("Loaded {} cached records from {}", records.size(), cacheFile);
            return Optional.of(new CachedDataset(records, metadata));
        } catch (final IOException | CsvValidationException e) {
            log.warn("Cache file {} is unreadable, ignoring it: {}", cacheFile, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Atomically replaces the cached dataset.
     *
     * @param records        normalized records to persist
     * @param sourceRowCount raw rows the upstream returned for this fetch
     * @throws StoreWriteException if either file cannot be written
     */
    public void save(final List<Meteorite> records, final long sourceRowCount) {
        try {
            Files.createDirectories(cacheFile.getParent());
            writeAtomically(cacheFile, temp -> writeRecords(temp, records));
            final var sidecar = new Sidecar(records.size(), sourceRowCount, Instant.now().toEpochMilli());
            writeAtomically(sidecarFile, temp -> objectMapper.writeValue(temp.toFile(), sidecar));
            log.info("Cached {} records ({} source rows) to {}", records.size(), sourceRowCount, cacheFile);
        } catch (final IOException e) {
            throw new StoreWriteException("Failed to write cache " + cacheFile + ": " + e.getMessage(), e);
        }
    }

    public Optional<CacheMetadata> metadata() {
        if (!Files.isRegularFile(cacheFile)) {
            return Optional.empty();
        }
        try {
            final var sidecar = readSidecar();
            if (sidecar.isPresent()) {
                return Optional.of(new CacheMetadata(
                        sidecar.get().rowCount(), sidecar.get().sourceRowCount(), lastModified()));
            }
            return Optional.of(metadataFor(readRecords().size()));
        } catch (final IOException | CsvValidationException e) {
            log.warn("Cannot read cache metadata for {}: {}", cacheFile, e.getMessage());
            return Optional.empty();
        }
    }

    public Path location() {
        return cacheFile;
    }

    private CacheMetadata metadataFor(final int rowCount) throws IOException {
        final var sourceRowCount = readSidecar().map(Sidecar::sourceRowCount).orElse((long) rowCount);
        return new CacheMetadata(rowCount, sourceRowCount, lastModified());
    }

    private Instant lastModified() throws IOException {
        return Files.getLastModifiedTime(cacheFile).toInstant();
    }

    private Optional<Sidecar> readSidecar() {
        if (!Files.isRegularFile(sidecarFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(sidecarFile.toFile(), Sidecar.class));
        } catch (final IOException e) {
            log.warn("Ignoring unreadable cache sidecar {}: {}", sidecarFile, e.getMessage());
            return Optional.empty();
        }
    }

    private List<Meteorite> readRecords() throws IOException, CsvValidationException {
        final var records = new ArrayList<Meteorite>();
        try (var reader = new CSVReader(Files.newBufferedReader(cacheFile, StandardCharsets.UTF_8))) {
            final var header = reader.readNext();
            if (header == null) {
                return records;
            }
            String[] row;
            var line = 1;
            while ((row = reader.readNext()) != null) {
                line++;
                final var meteorite = parseRow(row);
                if (meteorite.isPresent()) {
                    records.add(meteorite.get());
                } else {
                    log.warn("Skipping malformed cache row at line {}", line);
                }
            }
        }
        return records;
    }

    private void writeRecords(final Path target, final List<Meteorite> records) throws IOException {
        try (var writer = new CSVWriter(Files.newBufferedWriter(target, StandardCharsets.UTF_8))) {
            writer.writeNext(HEADER);
            for (final Meteorite meteorite : records) {
                writer.writeNext(toRow(meteorite));
            }
        }
    }

    static String[] toRow(final Meteorite meteorite) {
        return new String[]{
                meteorite.name(),
                nullToEmpty(meteorite.classificationRaw()),
                meteorite.classificationGroup().label(),
                BigDecimal.valueOf(meteorite.massGrams()).toPlainString(),
                meteorite.year() == null ? "" : meteorite.year().toString(),
                meteorite.latitude() == null ? "" : meteorite.latitude().toString(),
                meteorite.longitude() == null ? "" : meteorite.longitude().toString(),
                nullToEmpty(meteorite.fallOrFind()),
                nullToEmpty(meteorite.nameType()),
                meteorite.massBand().label()
        };
    }

    Optional<Meteorite> parseRow(final String[] row) {
        if (row.length < HEADER.length || row[0].isBlank()) {
            return Optional.empty();
        }
        try {
            final var mass = Double.parseDouble(row[3]);
            if (!Double.isFinite(mass) || mass < 0) {
                return Optional.empty();
            }
            final var classificationRaw = emptyToNull(row[1]);
            final var group = ClassificationGroup.fromLabel(row[2])
                    .orElseGet(() -> classifier.classify(classificationRaw));
            return Optional.of(new Meteorite(
                    row[0],
                    classificationRaw,
                    group,
                    mass,
                    row[4].isEmpty() ? null : Integer.valueOf(row[4]),
                    row[5].isEmpty() ? null : Double.valueOf(row[5]),
                    row[6].isEmpty() ? null : Double.valueOf(row[6]),
                    emptyToNull(row[7]),
                    emptyToNull(row[8]),
                    MassBand.of(mass)));
        } catch (final NumberFormatException e) {
            return Optional.empty();
        }
    }

    private void writeAtomically(final Path target, final FileWriteAction action) throws IOException {
        final var temp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            action.write(temp);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (final IOException cleanupEx) {
                log.warn("Failed to clean up temp file after write failure: {}", temp, cleanupEx);
            }
            throw e;
        }
    }

    private static String nullToEmpty(final String value) {
        return value == null ? "" : value;
    }

    private static String emptyToNull(final String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    @FunctionalInterface
    private interface FileWriteAction {
        void write(Path target) throws IOException;
    }

    public record Sidecar(int rowCount, long sourceRowCount, long savedAtEpochMillis) {
    }
}
