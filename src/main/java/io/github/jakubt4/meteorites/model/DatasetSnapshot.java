package io.github.jakubt4.meteorites.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable, fully built dataset version. Published as a whole and never modified
 * afterwards; readers holding an older instance keep a consistent view.
 *
 * @param records        normalized records in source order
 * @param aggregates     count tables derived from {@code records}
 * @param sourceRowCount raw rows the upstream source returned when this data was fetched
 * @param builtAt        when the snapshot was assembled
 * @param origin         where the records came from
 */
public record DatasetSnapshot(List<Meteorite> records,
                              AggregateViews aggregates,
                              long sourceRowCount,
                              Instant builtAt,
                              Origin origin) {

    public DatasetSnapshot {
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public enum Origin {
        REMOTE,
        CACHE
    }
}
