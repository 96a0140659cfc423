package io.github.jakubt4.meteorites.service;

import io.github.jakubt4.meteorites.model.Meteorite;

import java.util.List;

/**
 * @param rows          the requested page
 * @param totalCount    size of the snapshot the query ran against
 * @param filteredCount rows matching the filter, before pagination
 */
public record QueryResult(List<Meteorite> rows, int totalCount, int filteredCount) {

    public QueryResult {
        rows = List.copyOf(rows);
    }
}
