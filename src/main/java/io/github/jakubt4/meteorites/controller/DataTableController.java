package io.github.jakubt4.meteorites.controller;

import io.github.jakubt4.meteorites.dto.DataTableResponse;
import io.github.jakubt4.meteorites.dto.DataTableRow;
import io.github.jakubt4.meteorites.service.MeteoriteQueryService;
import io.github.jakubt4.meteorites.service.PageRequest;
import io.github.jakubt4.meteorites.service.QueryFilter;
import io.github.jakubt4.meteorites.service.QueryFilter.SortField;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Server-side processing endpoint for the meteorite table.
 *
 * <p>Speaks the DataTables request protocol: {@code draw}, {@code start}, {@code length},
 * {@code search[value]} and the first {@code order[...]} entry. A {@code length} of
 * {@code -1} asks for every matching row.
 */
@RestController
@RequiredArgsConstructor
public class DataTableController {

    // Column order of the table on the page
    private static final List<SortField> COLUMNS = List.of(
            SortField.NAME, SortField.CLASS, SortField.GROUP, SortField.MASS,
            SortField.YEAR, SortField.LATITUDE, SortField.LONGITUDE, SortField.FALL);

    private final MeteoriteQueryService queryService;

    @GetMapping("/data")
    public DataTableResponse data(@RequestParam(defaultValue = "0") final int draw,
                                  @RequestParam(defaultValue = "0") final int start,
                                  @RequestParam(defaultValue = "25") final int length,
                                  @RequestParam(name = "search[value]", required = false) final String search,
                                  @RequestParam(name = "order[0][column]", required = false) final Integer orderColumn,
                                  @RequestParam(name = "order[0][dir]", defaultValue = "asc") final String orderDir) {
        var filter = QueryFilter.nameContains(search);
        if (orderColumn != null && orderColumn >= 0 && orderColumn < COLUMNS.size()) {
            filter = filter.sortedBy(COLUMNS.get(orderColumn), "desc".equalsIgnoreCase(orderDir));
        }
        final var page = PageRequest.of(start, length == -1 ? Integer.MAX_VALUE : length);

        final var result = queryService.query(filter, page);
        return new DataTableResponse(
                draw,
                result.totalCount(),
                result.filteredCount(),
                result.rows().stream().map(DataTableRow::from).toList());
    }
}
