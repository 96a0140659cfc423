package io.github.jakubt4.meteorites.service;

import io.github.jakubt4.meteorites.exception.DatasetUnavailableException;
import io.github.jakubt4.meteorites.model.DatasetSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the currently published {@link DatasetSnapshot}.
 *
 * <p>{@link DatasetRefreshService} is the only writer. Readers grab the reference once
 * per request and keep working against it even if a newer snapshot is published
 * meanwhile.
 */
@Slf4j
@Component
public class DatasetSnapshotHolder {

    private final AtomicReference<DatasetSnapshot> current = new AtomicReference<>();

    public Optional<DatasetSnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * @throws DatasetUnavailableException when nothing has been published yet
     */
    public DatasetSnapshot require() {
        return current().orElseThrow(DatasetUnavailableException::new);
    }

    void publish(final DatasetSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        final var previous = current.getAndSet(snapshot);
        log.info("Published snapshot — {} records from {} (previous: {})",
                snapshot.size(), snapshot.origin(), previous == null ? "none" : previous.size() + " records");
    }
}
