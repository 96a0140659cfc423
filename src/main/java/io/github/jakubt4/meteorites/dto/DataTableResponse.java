package io.github.jakubt4.meteorites.dto;

import java.util.List;

/**
 * Server-side processing reply for DataTables.
 *
 * @param draw            echo of the request's draw counter
 * @param recordsTotal    rows in the dataset
 * @param recordsFiltered rows matching the search, before paging
 * @param data            the requested page
 */
public record DataTableResponse(int draw, int recordsTotal, int recordsFiltered, List<DataTableRow> data) {
}
