package dev.seriescache.api;

import dev.seriescache.query.SeriesQuery;
import dev.seriescache.series.SeriesResult;

import java.util.List;

/**
 * The time-series database the cache reads through to.
 */
public interface UpstreamSource {

    /**
     * Runs {@code query} over {@code [startMillis, endMillis]}.
     *
     * @param query       the query to run
     * @param startMillis inclusive start, epoch millis
     * @param endMillis   inclusive end, epoch millis, or null for "up to now"
     * @return one result per matching series, values ascending by timestamp
     */
    List<SeriesResult> fetch(SeriesQuery query, long startMillis, Long endMillis);
}
