package dev.seriescache.series;

import java.util.Locale;

/**
 * Fixed-length sampling units an aligned aggregator may use. Months and years are
 * absent: their length varies, so they never qualify for index-based trimming.
 */
public enum SamplingUnit {
    MILLISECONDS(1L),
    SECONDS(1_000L),
    MINUTES(60_000L),
    HOURS(3_600_000L),
    DAYS(86_400_000L),
    WEEKS(604_800_000L);

    private final long millis;

    SamplingUnit(long millis) {
        this.millis = millis;
    }

    public long toMillis(long amount) {
        return Math.multiplyExact(amount, millis);
    }

    /**
     * @return the unit for a name such as {@code "seconds"}, or null if it is not a fixed-length unit
     */
    public static SamplingUnit fromName(String name) {
        if (name == null) {
            return null;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
