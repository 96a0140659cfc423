package io.github.jakubt4.meteorites.service;

import io.github.jakubt4.meteorites.model.Meteorite;

import java.util.Comparator;
import java.util.Locale;

/**
 * Row selection for {@link MeteoriteQueryService#query}.
 *
 * @param nameContains case-insensitive substring of the meteorite name; {@code null} or blank selects all rows
 * @param sort         optional ordering; {@code null} keeps source order
 */
public record QueryFilter(String nameContains, Sort sort) {

    public static QueryFilter all() {
        return new QueryFilter(null, null);
    }

    public static QueryFilter nameContains(final String fragment) {
        return new QueryFilter(fragment, null);
    }

    public QueryFilter sortedBy(final SortField field, final boolean descending) {
        return new QueryFilter(nameContains, new Sort(field, descending));
    }

    boolean isUnfiltered() {
        return nameContains == null || nameContains.isBlank();
    }

    String needle() {
        return nameContains.toLowerCase(Locale.ROOT);
    }

    public record Sort(SortField field, boolean descending) {

        Comparator<Meteorite> comparator() {
            final Comparator<Meteorite> ascending = field.comparator();
            return descending ? ascending.reversed() : ascending;
        }
    }

    public enum SortField {
        NAME(Comparator.comparing(Meteorite::name, String.CASE_INSENSITIVE_ORDER)),
        CLASS(Comparator.comparing(Meteorite::classificationRaw, Comparator.nullsLast(Comparator.naturalOrder()))),
        GROUP(Comparator.comparing(Meteorite::classificationGroup)),
        MASS(Comparator.comparingDouble(Meteorite::massGrams)),
        YEAR(Comparator.comparing(Meteorite::year, Comparator.nullsLast(Comparator.naturalOrder()))),
        LATITUDE(Comparator.comparing(Meteorite::latitude, Comparator.nullsLast(Comparator.naturalOrder()))),
        LONGITUDE(Comparator.comparing(Meteorite::longitude, Comparator.nullsLast(Comparator.naturalOrder()))),
        FALL(Comparator.comparing(Meteorite::fallOrFind, Comparator.nullsLast(Comparator.naturalOrder())));

        private final Comparator<Meteorite> comparator;

        SortField(final Comparator<Meteorite> comparator) {
            this.comparator = comparator;
        }

        Comparator<Meteorite> comparator() {
            return comparator;
        }
    }
}
