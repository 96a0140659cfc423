package io.github.jakubt4.meteorites.service;

import io.github.jakubt4.meteorites.model.AggregateViews;
import io.github.jakubt4.meteorites.model.AggregateViews.GeoCellCount;
import io.github.jakubt4.meteorites.model.ClassificationGroup;
import io.github.jakubt4.meteorites.model.MassBand;
import io.github.jakubt4.meteorites.model.Meteorite;
import io.github.jakubt4.meteorites.model.SummaryStatistics;
import io.github.jakubt4.meteorites.model.SummaryStatistics.ClassCount;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Stateless count tables over a list of meteorites.
 *
 * <p>All methods are pure; {@link #aggregate} bundles them so a snapshot can carry its
 * views precomputed. Keys with a zero count are never emitted.
 */
@Service
public class MeteoriteAggregator {

    private static final int TOP_CLASSES = 10;

    private final MassBinning massBinning;
    private final int quantileBins;
    private final double geoCellDegrees;

    public MeteoriteAggregator(@Value("${explorer.aggregation.mass-binning:FIXED}") final MassBinning massBinning,
                               @Value("${explorer.aggregation.quantile-bins:5}") final int quantileBins,
                               @Value("${explorer.aggregation.geo-cell-degrees:10}") final double geoCellDegrees) {
        if (quantileBins < 1) {
            throw new IllegalArgumentException("quantile-bins must be positive, got " + quantileBins);
        }
        if (geoCellDegrees <= 0 || geoCellDegrees > 180) {
            throw new IllegalArgumentException("geo-cell-degrees must be in (0, 180], got " + geoCellDegrees);
        }
        this.massBinning = massBinning;
        this.quantileBins = quantileBins;
        this.geoCellDegrees = geoCellDegrees;
    }

    public AggregateViews aggregate(final List<Meteorite> records) {
        return new AggregateViews(
                countsByGroupAndMassBand(records),
                countsByYear(records),
                countsByGroupOverTime(records),
                countsByGeoCell(records),
                summarize(records)
        );
    }

    /**
     * Counts per classification group and mass band. Band order within a group follows
     * ascending mass.
     */
    public Map<ClassificationGroup, Map<String, Long>> countsByGroupAndMassBand(final List<Meteorite> records) {
        final Function<Meteorite, String> bandOf = massBinning == MassBinning.QUANTILE
                ? quantileLabeller(records)
                : meteorite -> meteorite.massBand().label();
        final var bandOrder = massBinning == MassBinning.QUANTILE
                ? quantileLabels()
                : Arrays.stream(MassBand.values()).map(MassBand::label).toList();

        final var counts = new EnumMap<ClassificationGroup, Map<String, Long>>(ClassificationGroup.class);
        for (final Meteorite meteorite : records) {
            counts.computeIfAbsent(meteorite.classificationGroup(), group -> new HashMap<>())
                    .merge(bandOf.apply(meteorite), 1L, Long::sum);
        }

        final var ordered = new EnumMap<ClassificationGroup, Map<String, Long>>(ClassificationGroup.class);
        counts.forEach((group, bands) -> {
            final var inBandOrder = new LinkedHashMap<String, Long>();
            bandOrder.stream()
                    .filter(bands::containsKey)
                    .forEach(label -> inBandOrder.put(label, bands.get(label)));
            ordered.put(group, inBandOrder);
        });
        return ordered;
    }

    public SortedMap<Integer, Long> countsByYear(final List<Meteorite> records) {
        final var counts = new TreeMap<Integer, Long>();
        for (final Meteorite meteorite : records) {
            if (meteorite.year() != null) {
                counts.merge(meteorite.year(), 1L, Long::sum);
            }
        }
        return counts;
    }

    public Map<ClassificationGroup, SortedMap<Integer, Long>> countsByGroupOverTime(final List<Meteorite> records) {
        final var counts = new EnumMap<ClassificationGroup, SortedMap<Integer, Long>>(ClassificationGroup.class);
        for (final Meteorite meteorite : records) {
            if (meteorite.year() != null) {
                counts.computeIfAbsent(meteorite.classificationGroup(), group -> new TreeMap<>())
                        .merge(meteorite.year(), 1L, Long::sum);
            }
        }
        return counts;
    }

    /**
     * Counts on a regular latitude/longitude grid. Records without coordinates are skipped.
     * Cells are ordered south to north, then west to east.
     */
    public List<GeoCellCount> countsByGeoCell(final List<Meteorite> records) {
        final var cells = new TreeMap<Long, double[]>();
        final var columns = (long) Math.ceil(360.0 / geoCellDegrees);
        for (final Meteorite meteorite : records) {
            if (!meteorite.hasCoordinates()) {
                continue;
            }
            final var row = cellIndex(meteorite.latitude() + 90.0, 180.0);
            final var column = cellIndex(meteorite.longitude() + 180.0, 360.0);
            final var cell = cells.computeIfAbsent(row * columns + column, key -> new double[2]);
            cell[0] += 1;
            cell[1] += meteorite.massGrams();
        }

        final var result = new ArrayList<GeoCellCount>(cells.size());
        cells.forEach((key, cell) -> {
            final var row = key / columns;
            final var column = key % columns;
            result.add(new GeoCellCount(
                    -90.0 + (row + 0.5) * geoCellDegrees,
                    -180.0 + (column + 0.5) * geoCellDegrees,
                    (long) cell[0],
                    cell[1]));
        });
        return result;
    }

    public SummaryStatistics summarize(final List<Meteorite> records) {
        final var massStats = records.stream().mapToDouble(Meteorite::massGrams).summaryStatistics();
        final var yearStats = records.stream()
                .filter(meteorite -> meteorite.year() != null)
                .mapToInt(Meteorite::year)
                .summaryStatistics();
        final var hasYears = yearStats.getCount() > 0;

        final var classCounts = new HashMap<String, Long>();
        for (final Meteorite meteorite : records) {
            if (meteorite.classificationRaw() != null) {
                classCounts.merge(meteorite.classificationRaw(), 1L, Long::sum);
            }
        }
        final var topClasses = classCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_CLASSES)
                .map(entry -> new ClassCount(entry.getKey(), entry.getValue()))
                .toList();

        return new SummaryStatistics(
                records.size(),
                records.isEmpty() ? 0.0 : massStats.getAverage(),
                hasYears ? yearStats.getMin() : null,
                hasYears ? yearStats.getMax() : null,
                topClasses);
    }

    private long cellIndex(final double offset, final double span) {
        final var maxIndex = (long) Math.ceil(span / geoCellDegrees) - 1;
        return Math.min((long) Math.floor(offset / geoCellDegrees), maxIndex);
    }

    /**
     * Equal-population bins: cut points sit at the i/n quantiles of the sorted masses and
     * a mass equal to a cut point falls into the upper bin, matching the left-closed
     * convention of the fixed bands.
     */
    private Function<Meteorite, String> quantileLabeller(final List<Meteorite> records) {
        final var masses = records.stream().mapToDouble(Meteorite::massGrams).sorted().toArray();
        final var cuts = new double[Math.max(quantileBins - 1, 0)];
        for (var i = 1; i < quantileBins && masses.length > 0; i++) {
            cuts[i - 1] = masses[(int) ((long) i * masses.length / quantileBins)];
        }
        return meteorite -> {
            var bin = 0;
            while (bin < cuts.length && masses.length > 0 && meteorite.massGrams() >= cuts[bin]) {
                bin++;
            }
            return "Q" + (bin + 1);
        };
    }

    private List<String> quantileLabels() {
        final var labels = new ArrayList<String>(quantileBins);
        for (var i = 1; i <= quantileBins; i++) {
            labels.add("Q" + i);
        }
        return labels;
    }
}
