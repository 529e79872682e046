package dev.seriescache.core;

import dev.seriescache.api.BlobStore;
import dev.seriescache.config.CacheConfig;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import static dev.seriescache.core.Utils.keyBytes;
import static dev.seriescache.core.Utils.sanitize;

/**
 * A persistent {@link BlobStore} backed by a single RocksDB instance.
 *
 * <p>Every value is stored behind an 8-byte expiry header (see {@link ExpiringValueEncoder}).
 * Reads treat a value whose expiry has passed as absent and delete it; {@link #purgeExpired()}
 * sweeps the whole keyspace and runs on open when {@link CacheConfig#isPurgeExpiredOnOpen()} is set.
 *
 * <p><strong>Thread Safety:</strong> RocksDB serializes writes internally, so concurrent
 * {@code get}/{@code multiGet}/{@code set} calls are safe. Concurrent writers to one key are
 * last-write-wins.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * CacheConfig config = new CacheConfig().setBasePath("/tmp/seriescache");
 * try (RocksBlobStore store = new RocksBlobStore(config)) {
 *     store.set("tscache:mts:abc", payload, 10800);
 *     List<byte[]> hits = store.multiGet(List.of("tscache:mts:abc", "tscache:mts:def"));
 * }
 * }</pre>
 */
public class RocksBlobStore implements BlobStore {
    private static final Logger logger = LoggerFactory.getLogger(RocksBlobStore.class);

    static { RocksDB.loadLibrary(); }

    private final String path;
    private final RocksDB db;
    private final Clock clock;
    private final WriteOptions writeOpts;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Opens the store with the system UTC clock.
     *
     * @param config the cache configuration
     * @throws RuntimeException if RocksDB initialization fails
     */
    public RocksBlobStore(CacheConfig config) {
        this(config, null);
    }

    /**
     * Opens the store with the given clock.
     *
     * @param config the cache configuration
     * @param clock  clock used for expiry decisions, null for system UTC
     * @throws RuntimeException if RocksDB initialization fails
     */
    public RocksBlobStore(CacheConfig config, Clock clock) {
        Objects.requireNonNull(config, "config cannot be null");
        this.clock = (clock != null) ? clock : Clock.systemUTC();
        this.path = config.getBasePath() + File.separator + sanitize(config.getStoreName());

        try {
            File dbDir = new File(path);
            if (!dbDir.exists() && !dbDir.mkdirs()) {
                throw new RuntimeException("Failed to create directory: " + path);
            }

            logger.debug("Opening RocksDB at path: {}", path);

            try (Options options = new Options()
                    .setCreateIfMissing(true)
                    .setCompressionType(config.getCompressionType())
                    .setWriteBufferSize((long) config.getWriteBufferSizeMB() * 1024 * 1024)
                    .setMaxWriteBufferNumber(config.getMaxWriteBufferNumber())) {

                this.db = RocksDB.open(options, path);
            }
            logger.info("Opened blob store at path: {}", path);
        } catch (Exception e) {
            logger.error("Failed to open blob store at '{}': {}", path, e.getMessage(), e);
            throw new RuntimeException("Failed to open RocksDB at path=" + path, e);
        }

        this.writeOpts = new WriteOptions()
                .setSync(config.isSyncWrites())
                .setDisableWAL(config.isDisableWAL());

        if (config.isPurgeExpiredOnOpen()) {
            int purged = purgeExpired();
            if (purged > 0) {
                logger.info("Purged {} expired values from blob store at '{}'", purged, path);
            }
        }
    }

    @Override
    public byte[] get(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        ensureOpen();
        try {
            byte[] raw = db.get(keyBytes(key));
            return unwrap(key, raw, clock.millis());
        } catch (RocksDBException e) {
            logger.error("Failed to read key '{}': {}", key, e.getMessage(), e);
            throw new RuntimeException("Failed to read key=" + key, e);
        }
    }

    @Override
    public List<byte[]> multiGet(List<String> keys) {
        Objects.requireNonNull(keys, "keys cannot be null");
        ensureOpen();
        if (keys.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            List<byte[]> raw = db.multiGetAsList(keyBytes(keys));
            long now = clock.millis();
            List<byte[]> out = new ArrayList<>(raw.size());
            for (int i = 0; i < raw.size(); i++) {
                out.add(unwrap(keys.get(i), raw.get(i), now));
            }
            logger.trace("multiGet of {} keys returned {} hits", keys.size(), out.stream().filter(Objects::nonNull).count());
            return out;
        } catch (RocksDBException e) {
            logger.error("Failed to multi-get {} keys: {}", keys.size(), e.getMessage(), e);
            throw new RuntimeException("Failed to multi-get " + keys.size() + " keys", e);
        }
    }

    @Override
    public void set(String key, byte[] value, long ttlSeconds) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive, got " + ttlSeconds);
        }
        ensureOpen();
        long expireAt;
        try {
            expireAt = Math.addExact(clock.millis(), Math.multiplyExact(ttlSeconds, 1000L));
        } catch (ArithmeticException e) {
            expireAt = Long.MAX_VALUE;
        }
        try {
            db.put(writeOpts, keyBytes(key), ExpiringValueEncoder.encode(expireAt, value));
        } catch (RocksDBException e) {
            logger.error("Failed to write key '{}': {}", key, e.getMessage(), e);
            throw new RuntimeException("Failed to write key=" + key, e);
        }
    }

    /**
     * Deletes every value whose expiry has passed.
     *
     * @return the number of values deleted
     */
    public int purgeExpired() {
        ensureOpen();
        long now = clock.millis();
        int purged = 0;
        try (RocksIterator it = db.newIterator();
             WriteBatch batch = new WriteBatch()) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                byte[] v = it.value();
                if (v == null || v.length < ExpiringValueEncoder.HEADER_LENGTH) {
                    logger.debug("Skipping value without expiry header during purge at '{}'", path);
                    continue;
                }
                if (ExpiringValueEncoder.decodeExpireAt(v) <= now) {
                    batch.delete(it.key());
                    purged++;
                }
            }
            if (purged > 0) {
                db.write(writeOpts, batch);
            }
        } catch (RocksDBException e) {
            logger.error("Failed to purge expired values at '{}': {}", path, e.getMessage(), e);
            throw new RuntimeException("Failed to purge expired values at path=" + path, e);
        }
        return purged;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Closes RocksDB and its options. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            logger.debug("Close called on already closed blob store at '{}'", path);
            return;
        }
        try {
            writeOpts.close();
        } catch (Exception e) {
            logger.warn("Failed to close write options at '{}': {}", path, e.getMessage(), e);
        }
        try {
            db.close();
            logger.info("Closed blob store at '{}'", path);
        } catch (Exception e) {
            logger.error("Failed to close RocksDB at '{}': {}", path, e.getMessage(), e);
        }
    }

    private byte[] unwrap(String key, byte[] raw, long now) throws RocksDBException {
        if (raw == null) {
            return null;
        }
        if (raw.length < ExpiringValueEncoder.HEADER_LENGTH) {
            logger.warn("Ignoring value without expiry header for key '{}'", key);
            return null;
        }
        StoredBlob blob = ExpiringValueEncoder.decode(raw);
        if (blob.isExpired(now)) {
            db.delete(writeOpts, keyBytes(key));
            logger.trace("Key '{}' expired at {}, deleted on read", key, blob.expireAtMillis());
            return null;
        }
        return blob.payload();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Blob store is closed: " + path);
        }
    }
}
