package dev.seriescache.series;

import java.util.Map;

/**
 * Absolute query window in epoch millis.
 *
 * @param startAbsolute inclusive start
 * @param endAbsolute   inclusive end, or null for open-ended ("up to now")
 */
public record TimeRange(long startAbsolute, Long endAbsolute) {
    public static final String START_ABSOLUTE = "start_absolute";
    public static final String END_ABSOLUTE = "end_absolute";

    public TimeRange {
        if (endAbsolute != null && endAbsolute < startAbsolute) {
            throw new IllegalArgumentException("end_absolute " + endAbsolute + " is before start_absolute " + startAbsolute);
        }
    }

    public static TimeRange startingAt(long startAbsolute) {
        return new TimeRange(startAbsolute, null);
    }

    /**
     * Reads {@code start_absolute} (required) and {@code end_absolute} (optional) from a request map.
     * Either may be a number or a numeric string such as {@code "1234567880000"}.
     */
    public static TimeRange fromRequest(Map<String, ?> request) {
        if (request == null || request.get(START_ABSOLUTE) == null) {
            throw new IllegalArgumentException("Time range requires " + START_ABSOLUTE);
        }
        long start = toMillis(START_ABSOLUTE, request.get(START_ABSOLUTE));
        Object end = request.get(END_ABSOLUTE);
        return new TimeRange(start, end == null ? null : toMillis(END_ABSOLUTE, end));
    }

    private static long toMillis(String field, Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).longValue();
        }
        try {
            return Long.parseLong(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " is not an epoch millis value: " + raw, e);
        }
    }
}
