package dev.seriescache.series;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Default {@link SeriesTrimmer}.
 *
 * <p>Aligned-sampling metadata is read from the series' own {@code aggregators} field, falling back to
 * the aggregators in the query mask. An aggregator qualifies when it looks like
 * {@code {"align_sampling": true, "sampling": {"value": 10, "unit": "seconds"}}}.
 */
public class WindowTrimmer implements SeriesTrimmer {
    private static final Logger logger = LoggerFactory.getLogger(WindowTrimmer.class);

    static final String ALIGN_SAMPLING = "align_sampling";
    static final String SAMPLING = "sampling";
    static final String SAMPLING_VALUE = "value";
    static final String SAMPLING_UNIT = "unit";

    @Override
    public Iterator<DataPoint> robustTrim(SeriesEntry entry, long startMillis, Long endMillis) {
        List<DataPoint> values = entry.requireValues();
        return values.stream()
                .filter(dp -> dp.timestamp() >= startMillis && (endMillis == null || dp.timestamp() <= endMillis))
                .iterator();
    }

    @Override
    public Iterator<DataPoint> efficientTrim(SeriesEntry entry, long startMillis, Long endMillis) {
        List<DataPoint> values = entry.requireValues();
        int n = values.size();
        if (n == 0) {
            return Collections.emptyIterator();
        }
        long interval = samplingIntervalMillis(entry);
        if (interval <= 0) {
            throw new IllegalStateException("Series has no aligned sampling interval: " + entry.describe());
        }
        long first = values.get(0).timestamp();
        long last = values.get(n - 1).timestamp();
        // bounds outside [first - 1, last + 1] select the same points and keep the subtraction in range
        long start = Math.max(first, Math.min(startMillis, last + 1));
        // first index at or after start, one past the last index at or before end
        long from = clamp(-Math.floorDiv(first - start, interval), n);
        long to = n;
        if (endMillis != null) {
            long end = Math.max(first - 1, Math.min(endMillis, last));
            to = clamp(Math.floorDiv(end - first, interval) + 1, n);
        }
        if (from >= to) {
            return Collections.emptyIterator();
        }
        logger.trace("Efficient trim of {} selects [{}, {}) of {} points", entry.describe(), from, to, n);
        return new ArrayList<>(values.subList((int) from, (int) to)).iterator();
    }

    @Override
    public boolean conformsToEfficientConstraints(SeriesEntry entry) {
        long interval = samplingIntervalMillis(entry);
        if (interval <= 0) {
            return false;
        }
        List<DataPoint> values = entry.requireValues();
        if (values.size() < 2) {
            return false;
        }
        long prev = values.get(0).timestamp();
        for (int i = 1; i < values.size(); i++) {
            long ts = values.get(i).timestamp();
            if (ts - prev != interval) {
                logger.debug("Series {} breaks {}ms alignment at index {}", entry.describe(), interval, i);
                return false;
            }
            prev = ts;
        }
        return true;
    }

    /**
     * @return the aligned sampling interval in millis, or -1 when the series is not aligned
     */
    long samplingIntervalMillis(SeriesEntry entry) {
        Map<?, ?> aggregator = aggregatorOf(entry);
        if (aggregator == null || !Boolean.TRUE.equals(aggregator.get(ALIGN_SAMPLING))) {
            return -1;
        }
        if (!(aggregator.get(SAMPLING) instanceof Map)) {
            return -1;
        }
        Map<?, ?> sampling = (Map<?, ?>) aggregator.get(SAMPLING);
        Object value = sampling.get(SAMPLING_VALUE);
        SamplingUnit unit = SamplingUnit.fromName(String.valueOf(sampling.get(SAMPLING_UNIT)));
        if (!(value instanceof Number) || unit == null) {
            return -1;
        }
        long amount = ((Number) value).longValue();
        if (amount <= 0 || amount != ((Number) value).doubleValue()) {
            return -1;
        }
        try {
            return unit.toMillis(amount);
        } catch (ArithmeticException e) {
            return -1;
        }
    }

    private static Map<?, ?> aggregatorOf(SeriesEntry entry) {
        SeriesResult result = entry.getResult();
        if (result != null && result.getAggregators() != null) {
            return result.getAggregators();
        }
        Map<String, Object> mask = entry.getQueryMask();
        if (mask != null && mask.get(SeriesResult.AGGREGATORS) instanceof Map) {
            return (Map<?, ?>) mask.get(SeriesResult.AGGREGATORS);
        }
        return null;
    }

    private static long clamp(long index, int size) {
        return Math.max(0, Math.min(index, size));
    }
}
