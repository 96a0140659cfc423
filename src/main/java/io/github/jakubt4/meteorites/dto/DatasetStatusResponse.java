package io.github.jakubt4.meteorites.dto;

import io.github.jakubt4.meteorites.model.RefreshState;
import io.github.jakubt4.meteorites.store.CacheMetadata;

import java.time.Instant;

/**
 * @param state          refresh state machine position
 * @param rowCount       records in the published snapshot, {@code null} when COLD
 * @param sourceRowCount upstream rows behind the published snapshot, {@code null} when COLD
 * @param builtAt        when the published snapshot was built, {@code null} when COLD
 * @param origin         REMOTE or CACHE, {@code null} when COLD
 * @param cache          on-disk cache details, {@code null} when nothing is cached
 */
public record DatasetStatusResponse(RefreshState state,
                                    Integer rowCount,
                                    Long sourceRowCount,
                                    Instant builtAt,
                                    String origin,
                                    CacheMetadata cache) {
}
