package dev.seriescache.series;

import java.util.Iterator;

/**
 * Restricts a cached series to a time window.
 *
 * <p>Both trims yield the points with {@code start <= timestamp <= end}, or {@code timestamp >= start}
 * when {@code end} is null, in ascending order. The returned iterators are single-pass.
 * For any series accepted by {@link #conformsToEfficientConstraints(SeriesEntry)} the two trims
 * produce identical sequences.
 */
public interface SeriesTrimmer {

    /**
     * Linear scan; valid for any series.
     */
    Iterator<DataPoint> robustTrim(SeriesEntry entry, long startMillis, Long endMillis);

    /**
     * Index arithmetic over a uniformly sampled series; only valid when
     * {@link #conformsToEfficientConstraints(SeriesEntry)} holds.
     */
    Iterator<DataPoint> efficientTrim(SeriesEntry entry, long startMillis, Long endMillis);

    /**
     * Whether the series is aligned to a fixed sampling interval that matches its actual spacing.
     */
    boolean conformsToEfficientConstraints(SeriesEntry entry);
}
