package io.github.jakubt4.meteorites.store;

import java.time.Instant;

/**
 * Size and age of the cached dataset.
 *
 * @param rowCount       normalized records in the cache file
 * @param sourceRowCount raw rows the upstream returned for the fetch that produced the cache
 * @param lastModified   when the cache file was last written
 */
public record CacheMetadata(int rowCount, long sourceRowCount, Instant lastModified) {
}
