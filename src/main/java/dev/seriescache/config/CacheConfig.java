package dev.seriescache.config;

import org.rocksdb.CompressionType;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

@Getter
@Setter
@Accessors(chain = true)
public class CacheConfig {
    // System property helpers so deployments and tests can override defaults
    private static String prop(String key, String def) {
        String v = System.getProperty(key);
        return v == null ? def : v;
    }
    private static boolean boolProp(String key, boolean def) {
        String v = System.getProperty(key);
        return v == null ? def : Boolean.parseBoolean(v);
    }
    private static int intProp(String key, int def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Integer.parseInt(v); } catch (NumberFormatException e) { return def; }
    }
    private static long longProp(String key, long def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Long.parseLong(v); } catch (NumberFormatException e) { return def; }
    }

    // Paths
    private String basePath = prop("sc.basePath", "./data/seriescache");
    private String storeName = prop("sc.storeName", "blobs");

    // Keys
    private String keyPrefix = prop("sc.keyPrefix", "tscache");

    // Series expiry
    private long defaultExpirySeconds = longProp("sc.expirySeconds", 10800);      // store TTL, 3h
    private long defaultGcExpirySeconds = longProp("sc.gcExpirySeconds", 86400);  // history horizon, 1d
    private long staleAfterMillis = longProp("sc.staleAfterMillis", 10_000);      // tolerated lag at the head of a series

    // Blob store
    private boolean purgeExpiredOnOpen = boolProp("sc.purgeExpiredOnOpen", true);

    // RocksDB
    private boolean syncWrites = false;       // WAL fsync on each write
    private boolean disableWAL = false;       // keep WAL by default
    private int writeBufferSizeMB = intProp("sc.writeBufferSizeMB", 64); // per memtable
    private int maxWriteBufferNumber = 3;
    private CompressionType compressionType = CompressionType.LZ4_COMPRESSION;
}
