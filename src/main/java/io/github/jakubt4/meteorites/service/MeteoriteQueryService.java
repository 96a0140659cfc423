package io.github.jakubt4.meteorites.service;

import io.github.jakubt4.meteorites.model.AggregateViews;
import io.github.jakubt4.meteorites.model.DatasetSnapshot;
import io.github.jakubt4.meteorites.model.Meteorite;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Read side of the dataset: filtered, paginated row views and the precomputed
 * aggregate tables.
 *
 * <p>Every call reads the published snapshot exactly once, so a refresh that lands
 * mid-call cannot mix rows or counts from two dataset versions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeteoriteQueryService {

    private final DatasetSnapshotHolder snapshotHolder;

    /**
     * @throws io.github.jakubt4.meteorites.exception.DatasetUnavailableException when no dataset is loaded
     */
    public QueryResult query(final QueryFilter filter, final PageRequest page) {
        final var snapshot = snapshotHolder.require();
        return query(snapshot, filter, page);
    }

    static QueryResult query(final DatasetSnapshot snapshot, final QueryFilter filter, final PageRequest page) {
        final var records = snapshot.records();

        List<Meteorite> matching = records;
        if (!filter.isUnfiltered()) {
            final var needle = filter.needle();
            matching = records.stream()
                    .filter(meteorite -> meteorite.name().toLowerCase(Locale.ROOT).contains(needle))
                    .toList();
        }
        if (filter.sort() != null) {
            final var sorted = new ArrayList<>(matching);
            sorted.sort(filter.sort().comparator());
            matching = sorted;
        }

        final var filteredCount = matching.size();
        final List<Meteorite> rows;
        if (page.offset() >= filteredCount) {
            rows = List.of();
        } else {
            final var end = (int) Math.min((long) page.offset() + page.limit(), filteredCount);
            rows = matching.subList(page.offset(), end);
        }

        log.debug("Query [{}] matched {} of {} rows, returning {} from offset {}",
                filter.nameContains(), filteredCount, records.size(), rows.size(), page.offset());
        return new QueryResult(rows, records.size(), filteredCount);
    }

    /**
     * The first {@code limit} records of the current snapshot together with its total size.
     */
    public QueryResult listing(final int limit) {
        final var snapshot = snapshotHolder.require();
        return query(snapshot, QueryFilter.all(), PageRequest.of(0, limit));
    }

    public AggregateViews aggregates() {
        return snapshotHolder.require().aggregates();
    }
}
