package dev.seriescache.api;

import java.util.List;

/**
 * Key-value blob store holding cached series and query indexes.
 *
 * <p>Semantics:
 * - Values are opaque bytes written with a time-to-live in seconds; an expired value reads as absent.
 * - {@link #multiGet(List)} resolves all keys in a single round trip and returns one slot per key,
 *   in key order, with {@code null} for a miss. A miss never aborts the batch.
 * - Concurrent writers to the same key are last-write-wins.
 */
public interface BlobStore extends AutoCloseable {

    /**
     * @param key the store key
     * @return the stored bytes, or null if absent or expired
     */
    byte[] get(String key);

    /**
     * Fetches all keys in one round trip.
     *
     * @param keys keys to fetch
     * @return one entry per key in the same order; null where the key is absent or expired
     */
    List<byte[]> multiGet(List<String> keys);

    /**
     * Writes a value that expires {@code ttlSeconds} after this call.
     *
     * @param key        the store key
     * @param value      bytes to store
     * @param ttlSeconds time-to-live, must be positive
     */
    void set(String key, byte[] value, long ttlSeconds);

    @Override
    void close();
}
