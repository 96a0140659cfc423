package io.github.jakubt4.meteorites.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.jakubt4.meteorites.model.Meteorite;

import java.util.Locale;

/**
 * One table row in the field names the DataTables front end binds its columns to.
 */
public record DataTableRow(String name,
                           String recclass,
                           @JsonProperty("recclass_clean") String recclassClean,
                           double mass,
                           @JsonProperty("mass_formatted") String massFormatted,
                           Integer year,
                           @JsonProperty("year_formatted") String yearFormatted,
                           Double reclat,
                           Double reclong,
                           String fall,
                           String nametype,
                           @JsonProperty("mass_band") String massBand) {

    public static DataTableRow from(final Meteorite meteorite) {
        return new DataTableRow(
                meteorite.name(),
                meteorite.classificationRaw(),
                meteorite.classificationGroup().label(),
                meteorite.massGrams(),
                String.format(Locale.US, "%,.2f g", meteorite.massGrams()),
                meteorite.year(),
                meteorite.year() == null ? "Unknown" : meteorite.year().toString(),
                meteorite.latitude(),
                meteorite.longitude(),
                meteorite.fallOrFind(),
                meteorite.nameType(),
                meteorite.massBand().label()
        );
    }
}
