package dev.seriescache.series;

import dev.seriescache.api.BlobStore;
import dev.seriescache.config.CacheConfig;
import dev.seriescache.ser.JsonSerializer;
import dev.seriescache.ser.Serializer;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single cached series: the upstream result, the query mask it was fetched under, and its TTLs.
 *
 * <p>An entry exclusively owns its {@code values} list. Merges install a freshly built list and
 * never alias the list of the entry being merged in; trimming (see {@link ResponseAssembler})
 * works on copies and leaves the cached payload alone.
 *
 * <p>Merge semantics, for cached values {@code C} and fresh values {@code F}:
 * <ul>
 *   <li>{@link #mergeAtEnd(SeriesEntry)}: the cached points at or after {@code F}'s first timestamp are
 *       dropped and {@code F} is appended, provided some cached point survives. If every cached point
 *       overlaps, {@code F} replaces {@code C} when it ends later than {@code C}, otherwise nothing changes.</li>
 *   <li>{@link #mergeAtBeginning(SeriesEntry)}: the mirror image, anchored on {@code F}'s last timestamp.</li>
 * </ul>
 * Fresh values always win on overlapping timestamps.
 *
 * <p>Instances are not thread-safe; each request works on its own entries.
 */
public class SeriesEntry {
    private static final Logger logger = LoggerFactory.getLogger(SeriesEntry.class);

    public static final String CACHE_TYPE = "mts";

    private final BlobStore store;
    private final Serializer<SeriesResult> serializer;
    private final KeyBasisStrategy fingerprint;
    private final Clock clock;
    private final String keyPrefix;

    @Getter
    @Setter
    private SeriesResult result;

    @Getter
    @Setter
    private Map<String, Object> queryMask;

    @Getter
    private long expiry;

    @Getter
    private long gcExpiry;

    @Getter
    @Setter
    private String storeKey;

    /**
     * Creates an entry with the default fingerprint, JSON serialization and the system UTC clock.
     */
    public SeriesEntry(BlobStore store, CacheConfig config) {
        this(store, config, new CardinalityFingerprint(), new JsonSerializer<>(), null);
    }

    /**
     * @param store       where {@link #upsert()} writes
     * @param config      supplies default expiries and the key prefix
     * @param fingerprint identity strategy used for store keys and log output
     * @param serializer  payload serializer
     * @param clock       clock for expiry decisions, null for system UTC
     */
    public SeriesEntry(
            BlobStore store,
            CacheConfig config,
            KeyBasisStrategy fingerprint,
            Serializer<SeriesResult> serializer,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer cannot be null");
        this.clock = (clock != null) ? clock : Clock.systemUTC();
        this.keyPrefix = config.getKeyPrefix();
        setExpiry(config.getDefaultExpirySeconds());
        setGcExpiry(config.getDefaultGcExpirySeconds());
    }

    public String getCacheType() {
        return CACHE_TYPE;
    }

    public void setExpiry(long expirySeconds) {
        if (expirySeconds <= 0) {
            throw new IllegalArgumentException("expiry must be positive, got " + expirySeconds);
        }
        this.expiry = expirySeconds;
    }

    public void setGcExpiry(long gcExpirySeconds) {
        if (gcExpirySeconds <= 0) {
            throw new IllegalArgumentException("gcExpiry must be positive, got " + gcExpirySeconds);
        }
        this.gcExpiry = gcExpirySeconds;
    }

    /**
     * Identity of this series under its query mask.
     */
    public Map<String, Object> keyBasis() {
        return fingerprint.keyBasis(result, queryMask);
    }

    /**
     * The store key derived from {@link #keyBasis()}.
     */
    public String computeStoreKey() {
        return fingerprint.storeKey(keyPrefix, result, queryMask);
    }

    /**
     * Merges {@code fresh}, which covers a later range than this entry, into this entry.
     *
     * @param fresh newly fetched data for the same series
     * @throws IllegalStateException if either side has no values list
     */
    public void mergeAtEnd(SeriesEntry fresh) {
        Objects.requireNonNull(fresh, "fresh cannot be null");
        List<DataPoint> cached = requireValues();
        List<DataPoint> incoming = fresh.requireValues();

        if (incoming.isEmpty()) {
            logger.debug("Nothing to merge at end of {}", this);
            return;
        }
        if (cached.isEmpty()) {
            replaceValues(incoming);
            return;
        }

        long freshStart = incoming.get(0).timestamp();
        int overlap = 0;
        for (int i = cached.size() - 1; i >= 0 && cached.get(i).timestamp() >= freshStart; i--) {
            overlap++;
        }

        if (overlap < cached.size()) {
            List<DataPoint> merged = new ArrayList<>(cached.size() - overlap + incoming.size());
            merged.addAll(cached.subList(0, cached.size() - overlap));
            merged.addAll(incoming);
            result.setValues(merged);
            logger.debug("Appended {} points to {} ({} superseded)", incoming.size(), this, overlap);
        } else if (last(incoming).timestamp() > last(cached).timestamp()) {
            logger.debug("Fresh data covers all of {} and extends past it, replacing", this);
            replaceValues(incoming);
        } else {
            logger.debug("Fresh data adds nothing past the end of {}, keeping cached values", this);
        }
    }

    /**
     * Merges {@code fresh}, which covers an earlier range than this entry, into this entry.
     *
     * @param fresh newly fetched data for the same series
     * @throws IllegalStateException if either side has no values list
     */
    public void mergeAtBeginning(SeriesEntry fresh) {
        Objects.requireNonNull(fresh, "fresh cannot be null");
        List<DataPoint> cached = requireValues();
        List<DataPoint> incoming = fresh.requireValues();

        if (incoming.isEmpty()) {
            logger.debug("Nothing to merge at beginning of {}", this);
            return;
        }
        if (cached.isEmpty()) {
            replaceValues(incoming);
            return;
        }

        long freshEnd = last(incoming).timestamp();
        int overlap = 0;
        for (int i = 0; i < cached.size() && cached.get(i).timestamp() <= freshEnd; i++) {
            overlap++;
        }

        if (overlap < cached.size()) {
            List<DataPoint> merged = new ArrayList<>(incoming.size() + cached.size() - overlap);
            merged.addAll(incoming);
            merged.addAll(cached.subList(overlap, cached.size()));
            result.setValues(merged);
            logger.debug("Prepended {} points to {} ({} superseded)", incoming.size(), this, overlap);
        } else if (incoming.get(0).timestamp() < cached.get(0).timestamp()) {
            logger.debug("Fresh data covers all of {} and starts before it, replacing", this);
            replaceValues(incoming);
        } else {
            logger.debug("Fresh data adds nothing before the start of {}, keeping cached values", this);
        }
    }

    /**
     * Decides whether cached history has outgrown the GC horizon.
     *
     * @return empty if the oldest point is no older than {@code gcExpiry} seconds (or there are no points);
     * otherwise the instant {@code now - expiry} before which cached data should be dropped
     */
    public Optional<Instant> ttlExpire() {
        List<DataPoint> values = result == null ? null : result.getValues();
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        long now = clock.millis();
        long oldestAgeMillis = now - values.get(0).timestamp();
        if (oldestAgeMillis <= secondsToMillis(gcExpiry)) {
            return Optional.empty();
        }
        long cutoff;
        try {
            cutoff = Math.subtractExact(now, secondsToMillis(expiry));
        } catch (ArithmeticException e) {
            cutoff = Long.MIN_VALUE;
        }
        return Optional.of(Instant.ofEpochMilli(cutoff));
    }

    // saturates at Long.MAX_VALUE, so very long horizons mean "never"
    private static long secondsToMillis(long seconds) {
        try {
            return Math.multiplyExact(seconds, 1000L);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Drops every point older than {@code cutoff}.
     *
     * @return number of points removed
     */
    public int pruneBefore(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff cannot be null");
        List<DataPoint> values = requireValues();
        long cutoffMillis = cutoff.toEpochMilli();
        int firstKept = 0;
        while (firstKept < values.size() && values.get(firstKept).timestamp() < cutoffMillis) {
            firstKept++;
        }
        if (firstKept > 0) {
            result.setValues(new ArrayList<>(values.subList(firstKept, values.size())));
            logger.debug("Pruned {} points older than {} from {}", firstKept, cutoff, this);
        }
        return firstKept;
    }

    /**
     * Writes the result to the store under {@link #getStoreKey()}, computing the key first if unset.
     */
    public void upsert() {
        Objects.requireNonNull(result, "result cannot be null");
        if (storeKey == null) {
            storeKey = computeStoreKey();
        }
        store.set(storeKey, serializer.serialize(result), expiry);
        logger.trace("Upserted {} with expiry {}s", storeKey, expiry);
    }

    /**
     * Number of points currently held.
     */
    public int size() {
        List<DataPoint> values = result == null ? null : result.getValues();
        return values == null ? 0 : values.size();
    }

    /**
     * The values list, failing fast when the entry was built from a payload without one.
     */
    public List<DataPoint> requireValues() {
        if (result == null || result.getValues() == null) {
            throw new IllegalStateException("Series has no values: " + (storeKey != null ? storeKey : "<unkeyed>"));
        }
        return result.getValues();
    }

    /**
     * Short label for logs: the store key, or the key basis when the entry has not been keyed yet.
     */
    public String describe() {
        return storeKey != null ? storeKey : String.valueOf(keyBasis());
    }

    @Override
    public String toString() {
        return describe();
    }

    private void replaceValues(List<DataPoint> incoming) {
        result.setValues(new ArrayList<>(incoming));
    }

    private static DataPoint last(List<DataPoint> values) {
        return values.get(values.size() - 1);
    }
}
