package io.github.jakubt4.meteorites.service;

import io.github.jakubt4.meteorites.model.AggregateViews.GeoCellCount;
import io.github.jakubt4.meteorites.model.ClassificationGroup;
import io.github.jakubt4.meteorites.model.MassBand;
import io.github.jakubt4.meteorites.model.Meteorite;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.github.jakubt4.meteorites.TestMeteorites.meteorite;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.within;

class MeteoriteAggregatorTest {

    private final MeteoriteAggregator aggregator = new MeteoriteAggregator(MassBinning.FIXED, 5, 10.0);

    private final List<Meteorite> fixture = List.of(
            meteorite("Tiny", ClassificationGroup.H_TYPE, 5.0, 1990),
            meteorite("Medium", ClassificationGroup.H_TYPE, 1500.0, 1990),
            meteorite("Huge", ClassificationGroup.IRON, 2_000_000.0, 1920));

    @Test
    void countsPerGroupAndMassBand() {
        final var counts = aggregator.countsByGroupAndMassBand(fixture);

        assertThat(counts).containsOnlyKeys(ClassificationGroup.H_TYPE, ClassificationGroup.IRON);
        assertThat(counts.get(ClassificationGroup.H_TYPE))
                .containsExactly(entry("Microscopic", 1L), entry("Large", 1L));
        assertThat(counts.get(ClassificationGroup.IRON))
                .containsExactly(entry("Massive", 1L));
    }

    @Test
    void groupAndBandCountsAddUpToRecordCount() {
        final var counts = aggregator.countsByGroupAndMassBand(fixture);

        final var total = counts.values().stream()
                .flatMap(bands -> bands.values().stream())
                .mapToLong(Long::longValue)
                .sum();
        assertThat(total).isEqualTo(fixture.size());
    }

    @Test
    void bandsWithinAGroupFollowAscendingMass() {
        final var records = List.of(
                meteorite("C", ClassificationGroup.L_TYPE, 50_000.0, 1900),
                meteorite("A", ClassificationGroup.L_TYPE, 1.0, 1900),
                meteorite("B", ClassificationGroup.L_TYPE, 500.0, 1900));

        assertThat(aggregator.countsByGroupAndMassBand(records).get(ClassificationGroup.L_TYPE).keySet())
                .containsExactly(MassBand.MICROSCOPIC.label(), MassBand.MEDIUM.label(), MassBand.VERY_LARGE.label());
    }

    @Test
    void countsPerYearAscending() {
        assertThat(aggregator.countsByYear(fixture))
                .containsExactly(entry(1920, 1L), entry(1990, 2L));
    }

    @Test
    void recordsWithoutYearAreLeftOutOfTimeSeries() {
        final var records = new ArrayList<>(fixture);
        records.add(meteorite("Undated", ClassificationGroup.H_TYPE, 20.0, null));

        assertThat(aggregator.countsByYear(records).values().stream().mapToLong(Long::longValue).sum())
                .isEqualTo(3);
        assertThat(aggregator.countsByGroupOverTime(records).get(ClassificationGroup.H_TYPE))
                .containsExactly(entry(1990, 2L));
    }

    @Test
    void countsPerGroupOverTime() {
        final var overTime = aggregator.countsByGroupOverTime(fixture);

        assertThat(overTime.get(ClassificationGroup.H_TYPE)).containsExactly(entry(1990, 2L));
        assertThat(overTime.get(ClassificationGroup.IRON)).containsExactly(entry(1920, 1L));
        assertThat(overTime).doesNotContainKey(ClassificationGroup.LUNAR);
    }

    @Test
    void geoCellsUseCellCentresAndSkipRecordsWithoutCoordinates() {
        final var records = List.of(
                new Meteorite("North", "H5", ClassificationGroup.H_TYPE, 10.0, 1900, 51.0, 6.0,
                        "Fell", "Valid", MassBand.SMALL),
                new Meteorite("NorthToo", "H5", ClassificationGroup.H_TYPE, 30.0, 1900, 55.0, 9.9,
                        "Fell", "Valid", MassBand.SMALL),
                new Meteorite("South", "L6", ClassificationGroup.L_TYPE, 1.0, 1900, -45.0, -170.0,
                        "Found", "Valid", MassBand.MICROSCOPIC),
                new Meteorite("Nowhere", "L6", ClassificationGroup.L_TYPE, 1.0, 1900, null, null,
                        "Found", "Valid", MassBand.MICROSCOPIC));

        final var cells = aggregator.countsByGeoCell(records);

        assertThat(cells).containsExactly(
                new GeoCellCount(-45.0, -165.0, 1, 1.0),
                new GeoCellCount(55.0, 5.0, 2, 40.0));
    }

    @Test
    void poleAndAntimeridianFallIntoTheLastCell() {
        final var records = List.of(new Meteorite("Pole", "H5", ClassificationGroup.H_TYPE, 10.0, 1900, 90.0, 180.0,
                "Found", "Valid", MassBand.SMALL));

        assertThat(aggregator.countsByGeoCell(records))
                .containsExactly(new GeoCellCount(85.0, 175.0, 1, 10.0));
    }

    @Test
    void summarizesHeadlineFigures() {
        final var summary = aggregator.summarize(fixture);

        assertThat(summary.totalCount()).isEqualTo(3);
        assertThat(summary.averageMassGrams()).isCloseTo((5.0 + 1500.0 + 2_000_000.0) / 3, within(1e-6));
        assertThat(summary.earliestYear()).isEqualTo(1920);
        assertThat(summary.latestYear()).isEqualTo(1990);
        assertThat(summary.topClasses()).extracting("classification").containsExactly("H-type", "Iron");
        assertThat(summary.topClasses()).extracting("count").containsExactly(2L, 1L);
    }

    @Test
    void summaryOfEmptyDatasetHasNoYears() {
        final var summary = aggregator.summarize(List.of());

        assertThat(summary.totalCount()).isZero();
        assertThat(summary.averageMassGrams()).isZero();
        assertThat(summary.earliestYear()).isNull();
        assertThat(summary.latestYear()).isNull();
        assertThat(summary.topClasses()).isEmpty();
    }

    @Test
    void aggregateBundlesAllViews() {
        final var views = aggregator.aggregate(fixture);

        assertThat(views.byGroupAndMassBand()).isEqualTo(aggregator.countsByGroupAndMassBand(fixture));
        assertThat(views.byYear()).isEqualTo(aggregator.countsByYear(fixture));
        assertThat(views.byGeoCell()).hasSize(1);
        assertThat(views.summary().totalCount()).isEqualTo(3);
    }

    @Test
    void quantileBinningSplitsIntoEqualPopulations() {
        final var quantiles = new MeteoriteAggregator(MassBinning.QUANTILE, 4, 10.0);
        final var records = new ArrayList<Meteorite>();
        for (var i = 1; i <= 8; i++) {
            records.add(meteorite("M" + i, ClassificationGroup.L_TYPE, i * 10.0, 1900));
        }

        assertThat(quantiles.countsByGroupAndMassBand(records).get(ClassificationGroup.L_TYPE))
                .containsExactly(entry("Q1", 2L), entry("Q2", 2L), entry("Q3", 2L), entry("Q4", 2L));
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new MeteoriteAggregator(MassBinning.QUANTILE, 0, 10.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MeteoriteAggregator(MassBinning.FIXED, 5, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
