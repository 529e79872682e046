package dev.seriescache.series;

import dev.seriescache.api.BlobStore;
import dev.seriescache.api.QueryDescriptor;
import dev.seriescache.config.CacheConfig;
import dev.seriescache.ser.JsonSerializer;
import dev.seriescache.ser.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds {@link SeriesEntry} instances from fresh upstream results or from the store.
 */
public class SeriesEntryFactory {
    private static final Logger logger = LoggerFactory.getLogger(SeriesEntryFactory.class);

    private final BlobStore store;
    private final CacheConfig config;
    private final KeyBasisStrategy fingerprint;
    private final Serializer<SeriesResult> serializer;
    private final Clock clock;

    public SeriesEntryFactory(BlobStore store, CacheConfig config) {
        this(store, config, new CardinalityFingerprint(), new JsonSerializer<>(), null);
    }

    public SeriesEntryFactory(
            BlobStore store,
            CacheConfig config,
            KeyBasisStrategy fingerprint,
            Serializer<SeriesResult> serializer,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer cannot be null");
        this.clock = clock;
    }

    /**
     * An empty entry with default expiries.
     */
    public SeriesEntry newEntry() {
        return new SeriesEntry(store, config, fingerprint, serializer, clock);
    }

    /**
     * Wraps each fresh result in an entry, lazily and in input order. Touches no storage.
     *
     * @param results upstream results
     * @param query   the query the results answer; its mask is stamped on every entry
     * @return a single-pass iterator of new entries
     */
    public Iterator<SeriesEntry> fromResult(List<SeriesResult> results, QueryDescriptor query) {
        Objects.requireNonNull(results, "results cannot be null");
        Objects.requireNonNull(query, "query cannot be null");
        Map<String, Object> mask = query.queryMask();
        Iterator<SeriesResult> source = results.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public SeriesEntry next() {
                SeriesEntry entry = newEntry();
                entry.setResult(source.next());
                entry.setQueryMask(mask);
                return entry;
            }
        };
    }

    /**
     * Loads entries for {@code keys} with one bulk read.
     *
     * @param keys store keys
     * @return one slot per key in key order; empty where the key is absent, expired or unreadable
     */
    public List<Optional<SeriesEntry>> fromCache(List<String> keys) {
        Objects.requireNonNull(keys, "keys cannot be null");
        List<byte[]> payloads = store.multiGet(keys);
        if (payloads.size() != keys.size()) {
            throw new IllegalStateException("Store returned " + payloads.size() + " slots for " + keys.size() + " keys");
        }
        List<Optional<SeriesEntry>> entries = new ArrayList<>(keys.size());
        int misses = 0;
        for (int i = 0; i < keys.size(); i++) {
            byte[] payload = payloads.get(i);
            if (payload == null) {
                entries.add(Optional.empty());
                misses++;
                continue;
            }
            SeriesResult result;
            try {
                result = serializer.deserialize(payload, SeriesResult.class);
            } catch (RuntimeException e) {
                logger.warn("Skipping unreadable series under '{}': {}", keys.get(i), e.getMessage());
                entries.add(Optional.empty());
                misses++;
                continue;
            }
            SeriesEntry entry = newEntry();
            entry.setResult(result);
            entry.setStoreKey(keys.get(i));
            entries.add(Optional.of(entry));
        }
        logger.debug("Loaded {} of {} series from cache", keys.size() - misses, keys.size());
        return entries;
    }
}
