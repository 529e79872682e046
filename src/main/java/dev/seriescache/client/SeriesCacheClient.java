package dev.seriescache.client;

import dev.seriescache.api.BlobStore;
import dev.seriescache.api.UpstreamSource;
import dev.seriescache.config.CacheConfig;
import dev.seriescache.core.RocksBlobStore;
import dev.seriescache.core.Utils;
import dev.seriescache.query.SeriesQuery;
import dev.seriescache.ser.JsonSerializer;
import dev.seriescache.ser.Serializer;
import dev.seriescache.series.CardinalityFingerprint;
import dev.seriescache.series.DataPoint;
import dev.seriescache.series.KeyBasisStrategy;
import dev.seriescache.series.ResponseAssembler;
import dev.seriescache.series.ResponseEnvelope;
import dev.seriescache.series.SeriesEntry;
import dev.seriescache.series.SeriesEntryFactory;
import dev.seriescache.series.SeriesResult;
import dev.seriescache.series.SeriesTrimmer;
import dev.seriescache.series.TimeRange;
import dev.seriescache.series.WindowTrimmer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Read-through cache for range queries.
 *
 * <p>Each query mask has a stored {@link QueryIndex} listing the keys of the series that answered it.
 * A query is served:
 * <ul>
 *   <li><strong>COLD</strong> when the index or any of its series is missing: full upstream fetch,
 *       every series and a new index are written back.</li>
 *   <li><strong>WARM</strong> when the cached series do not cover the window: the missing head and/or
 *       tail is fetched and merged into the cached series, which are then written back.</li>
 *   <li><strong>HOT</strong> otherwise: answered from the cached series alone.</li>
 * </ul>
 * Cached series whose history has outgrown their GC horizon are pruned on load, which usually turns
 * the query WARM and re-fetches the pruned range.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * CacheConfig config = new CacheConfig().setBasePath("/tmp/seriescache");
 * try (SeriesCacheClient client = new SeriesCacheClient(config, upstream)) {
 *     SeriesQuery query = new SeriesQuery("loadavg.05").setTags(Map.of("ecosystem", List.of("dev")));
 *     QueryOutcome outcome = client.query(query, TimeRange.startingAt(now - 3_600_000));
 * }
 * }</pre>
 */
public class SeriesCacheClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SeriesCacheClient.class);

    static final String MDC_QUERY_KEY = "seriesQuery";

    private final CacheConfig config;
    private final BlobStore store;
    private final UpstreamSource upstream;
    private final SeriesEntryFactory factory;
    private final ResponseAssembler assembler;
    private final Serializer<QueryIndex> indexSerializer = new JsonSerializer<>();
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Opens a RocksDB-backed client using the system UTC clock.
     */
    public SeriesCacheClient(CacheConfig config, UpstreamSource upstream) {
        this(config, new RocksBlobStore(config), upstream, new WindowTrimmer(), new CardinalityFingerprint(), null);
    }

    /**
     * @param config      the cache configuration
     * @param store       blob store; closed with this client
     * @param upstream    the database to read through to
     * @param trimmer     window trimming strategy
     * @param fingerprint series identity strategy
     * @param clock       clock for expiry and open-ended windows, null for system UTC
     */
    public SeriesCacheClient(
            CacheConfig config,
            BlobStore store,
            UpstreamSource upstream,
            SeriesTrimmer trimmer,
            KeyBasisStrategy fingerprint,
            Clock clock
    ) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.upstream = Objects.requireNonNull(upstream, "upstream cannot be null");
        this.clock = (clock != null) ? clock : Clock.systemUTC();
        this.factory = new SeriesEntryFactory(store, config, fingerprint, new JsonSerializer<>(), this.clock);
        this.assembler = new ResponseAssembler(trimmer);
    }

    /**
     * Answers {@code query} over {@code range}, reading through to the upstream as needed.
     *
     * @throws IllegalStateException if the client is closed
     * @throws RuntimeException      if the store or the upstream fails
     */
    public QueryOutcome query(SeriesQuery query, TimeRange range) {
        Objects.requireNonNull(query, "query cannot be null");
        Objects.requireNonNull(range, "range cannot be null");
        if (closed.get()) {
            throw new IllegalStateException("SeriesCacheClient is closed");
        }

        String indexKey = queryIndexKey(query);
        MDC.put(MDC_QUERY_KEY, indexKey);
        try {
            Set<SeriesEntry> pruned = new HashSet<>();
            List<SeriesEntry> cached = loadCached(query, indexKey, pruned);
            if (cached == null) {
                return cold(query, range, indexKey);
            }
            return fromCached(query, range, indexKey, cached, pruned);
        } finally {
            MDC.remove(MDC_QUERY_KEY);
        }
    }

    /**
     * Store key of the index for {@code query}'s mask.
     */
    public String queryIndexKey(SeriesQuery query) {
        return config.getKeyPrefix() + ":" + QueryIndex.CACHE_TYPE + ":"
                + Utils.sha1Hex(JsonSerializer.canonicalBytes(query.queryMask()));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        store.close();
    }

    /**
     * @return the cached series in index order, or null when the query has to be served cold
     */
    private List<SeriesEntry> loadCached(SeriesQuery query, String indexKey, Set<SeriesEntry> pruned) {
        byte[] raw = store.get(indexKey);
        if (raw == null) {
            logger.debug("No query index under '{}'", indexKey);
            return null;
        }
        QueryIndex index = indexSerializer.deserialize(raw, QueryIndex.class);
        if (index.seriesKeys().isEmpty()) {
            return null;
        }

        Map<String, Object> mask = query.queryMask();
        List<SeriesEntry> entries = new ArrayList<>(index.seriesKeys().size());
        for (Optional<SeriesEntry> slot : factory.fromCache(index.seriesKeys())) {
            if (slot.isEmpty()) {
                logger.debug("Series listed in '{}' has expired, refetching everything", indexKey);
                return null;
            }
            SeriesEntry entry = slot.get();
            entry.setQueryMask(mask);
            Optional<Instant> cutoff = entry.ttlExpire();
            if (cutoff.isPresent()) {
                int dropped = entry.pruneBefore(cutoff.get());
                logger.debug("Series {} outgrew its GC horizon, pruned {} points before {}", entry, dropped, cutoff.get());
                if (dropped > 0) {
                    pruned.add(entry);
                }
            }
            if (entry.size() == 0) {
                return null;
            }
            entries.add(entry);
        }
        return entries;
    }

    private QueryOutcome cold(SeriesQuery query, TimeRange range, String indexKey) {
        List<SeriesResult> results = upstream.fetch(query, range.startAbsolute(), range.endAbsolute());
        ResponseEnvelope envelope = new ResponseEnvelope();
        Map<String, SeriesEntry> byKey = new LinkedHashMap<>();

        Iterator<SeriesEntry> fresh = factory.fromResult(results, query);
        while (fresh.hasNext()) {
            SeriesEntry entry = fresh.next();
            entry.setStoreKey(entry.computeStoreKey());
            entry.upsert();
            if (byKey.put(entry.getStoreKey(), entry) != null) {
                logger.warn("Two series share key '{}' under this query mask, keeping the last", entry.getStoreKey());
            }
            assembler.buildResponse(entry, range, envelope, false);
        }

        if (!byKey.isEmpty()) {
            writeIndex(indexKey, new ArrayList<>(byKey.keySet()));
        }
        logger.info("COLD fill of {} series for {}", byKey.size(), query.getMetricName());
        return new QueryOutcome(CacheMode.COLD, envelope);
    }

    private QueryOutcome fromCached(SeriesQuery query, TimeRange range, String indexKey,
                                    List<SeriesEntry> cached, Set<SeriesEntry> pruned) {
        long start = range.startAbsolute();
        long end = range.endAbsolute() != null ? range.endAbsolute() : clock.millis();

        long coveredFrom = Long.MIN_VALUE;
        long coveredTo = Long.MAX_VALUE;
        for (SeriesEntry entry : cached) {
            List<DataPoint> values = entry.requireValues();
            coveredFrom = Math.max(coveredFrom, values.get(0).timestamp());
            coveredTo = Math.min(coveredTo, values.get(values.size() - 1).timestamp());
        }
        boolean needsEarlier = start < coveredFrom;
        boolean needsLater = end > coveredTo + config.getStaleAfterMillis();

        Map<String, SeriesEntry> byKey = new LinkedHashMap<>();
        for (SeriesEntry entry : cached) {
            byKey.put(entry.getStoreKey(), entry);
        }

        CacheMode mode = (needsEarlier || needsLater) ? CacheMode.WARM : CacheMode.HOT;
        logger.debug("{} query for {} over [{}, {}], cache covers [{}, {}]",
                mode, query.getMetricName(), start, end, coveredFrom, coveredTo);

        if (needsEarlier) {
            mergeDelta(query, start, coveredFrom, byKey, true);
        }
        if (needsLater) {
            mergeDelta(query, coveredTo, range.endAbsolute(), byKey, false);
        }

        if (mode == CacheMode.WARM) {
            for (SeriesEntry entry : byKey.values()) {
                entry.upsert();
            }
            writeIndex(indexKey, new ArrayList<>(byKey.keySet()));
        } else {
            // a HOT answer still persists what the GC horizon pruned
            for (SeriesEntry entry : pruned) {
                entry.upsert();
            }
        }

        ResponseEnvelope envelope = new ResponseEnvelope();
        for (SeriesEntry entry : byKey.values()) {
            assembler.buildResponse(entry, range, envelope, true);
        }
        return new QueryOutcome(mode, envelope);
    }

    private void mergeDelta(SeriesQuery query, long from, Long to, Map<String, SeriesEntry> byKey, boolean atBeginning) {
        List<SeriesResult> delta = upstream.fetch(query, from, to);
        Iterator<SeriesEntry> fresh = factory.fromResult(delta, query);
        int added = 0;
        while (fresh.hasNext()) {
            SeriesEntry entry = fresh.next();
            String key = entry.computeStoreKey();
            entry.setStoreKey(key);
            SeriesEntry target = byKey.get(key);
            if (target == null) {
                byKey.put(key, entry);
                added++;
            } else if (atBeginning) {
                target.mergeAtBeginning(entry);
            } else {
                target.mergeAtEnd(entry);
            }
        }
        logger.debug("Merged {} delta series {} cache ({} new)", delta.size(), atBeginning ? "before" : "after", added);
    }

    private void writeIndex(String indexKey, List<String> seriesKeys) {
        store.set(indexKey, indexSerializer.serialize(new QueryIndex(seriesKeys)), config.getDefaultExpirySeconds());
    }
}
