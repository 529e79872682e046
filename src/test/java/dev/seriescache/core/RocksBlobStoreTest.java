package dev.seriescache.core;

import dev.seriescache.config.CacheConfig;
import dev.seriescache.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RocksBlobStoreTest {

    static { RocksDB.loadLibrary(); }

    private static final long T0 = 1_700_000_000_000L;

    private Path tmp;
    private final MutableClock clock = MutableClock.startingAtMillis(T0);

    private RocksBlobStore newStore() throws Exception {
        if (tmp == null) {
            tmp = Files.createTempDirectory("seriescache-store-");
        }
        return new RocksBlobStore(new CacheConfig().setBasePath(tmp.toString()), clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (tmp != null) {
            try {
                Files.walk(tmp)
                        .sorted((a,b) -> b.getNameCount() - a.getNameCount())
                        .forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignored) {} });
            } catch (Exception ignored) {}
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void setThenGet() throws Exception {
        try (RocksBlobStore store = newStore()) {
            store.set("tscache:mts:a", bytes("payload"), 60);

            assertArrayEquals(bytes("payload"), store.get("tscache:mts:a"));
            assertNull(store.get("tscache:mts:missing"));
        }
    }

    @Test
    void overwrite_isLastWriteWins() throws Exception {
        try (RocksBlobStore store = newStore()) {
            store.set("k", bytes("one"), 60);
            store.set("k", bytes("two"), 60);

            assertArrayEquals(bytes("two"), store.get("k"));
        }
    }

    @Test
    void valuesExpireAfterTtl() throws Exception {
        try (RocksBlobStore store = newStore()) {
            store.set("k", bytes("v"), 10);

            clock.advanceMillis(9_999);
            assertNotNull(store.get("k"));

            clock.advanceMillis(1);
            assertNull(store.get("k"));

            // deleted on read, so rewinding the clock does not bring it back
            clock.advanceMillis(-5_000);
            assertNull(store.get("k"));
        }
    }

    @Test
    void multiGet_preservesKeyOrderWithMisses() throws Exception {
        try (RocksBlobStore store = newStore()) {
            store.set("a", bytes("A"), 60);
            store.set("c", bytes("C"), 5);
            store.set("d", bytes("D"), 60);
            clock.advanceSeconds(5);

            List<byte[]> out = store.multiGet(Arrays.asList("d", "b", "c", "a"));

            assertEquals(4, out.size());
            assertArrayEquals(bytes("D"), out.get(0));
            assertNull(out.get(1));
            assertNull(out.get(2), "expired values read as misses");
            assertArrayEquals(bytes("A"), out.get(3));
            assertTrue(store.multiGet(List.of()).isEmpty());
        }
    }

    @Test
    void purgeExpired_removesOnlyExpired() throws Exception {
        try (RocksBlobStore store = newStore()) {
            store.set("short1", bytes("x"), 1);
            store.set("short2", bytes("x"), 2);
            store.set("long", bytes("y"), 3600);
            clock.advanceSeconds(2);

            assertEquals(2, store.purgeExpired());
            assertEquals(0, store.purgeExpired());
            assertArrayEquals(bytes("y"), store.get("long"));
        }
    }

    @Test
    void reopen_keepsLiveValuesAndPurgesExpired() throws Exception {
        try (RocksBlobStore store = newStore()) {
            store.set("live", bytes("l"), 3600);
            store.set("dead", bytes("d"), 1);
        }
        clock.advanceSeconds(10);

        try (RocksBlobStore store = newStore()) {
            assertArrayEquals(bytes("l"), store.get("live"));
            assertEquals(0, store.purgeExpired(), "expired value was purged on open");
        }
    }

    @Test
    void ignoresValuesWithoutExpiryHeader() throws Exception {
        tmp = Files.createTempDirectory("seriescache-store-");
        Files.createDirectories(tmp.resolve("blobs"));
        try (Options opts = new Options().setCreateIfMissing(true);
             RocksDB raw = RocksDB.open(opts, tmp.resolve("blobs").toString())) {
            raw.put(bytes("short"), bytes("abc"));
        }

        try (RocksBlobStore store = newStore()) {
            assertNull(store.get("short"));
            assertNull(store.multiGet(List.of("short")).get(0));
        }
    }

    @Test
    void veryLongTtl_neverExpires() throws Exception {
        try (RocksBlobStore store = newStore()) {
            store.set("forever", bytes("f"), Long.MAX_VALUE / 100);
            store.set("max", bytes("m"), Long.MAX_VALUE);

            assertArrayEquals(bytes("f"), store.get("forever"));
            assertArrayEquals(bytes("m"), store.get("max"));

            clock.advanceSeconds(10L * 365 * 24 * 3600);
            assertEquals(0, store.purgeExpired());
            assertArrayEquals(bytes("f"), store.get("forever"));
        }
    }

    @Test
    void nonPositiveTtl_isRejected() throws Exception {
        try (RocksBlobStore store = newStore()) {
            assertThrows(IllegalArgumentException.class, () -> store.set("k", bytes("v"), 0));
            assertThrows(IllegalArgumentException.class, () -> store.set("k", bytes("v"), -1));
            assertNull(store.get("k"));
        }
    }

    @Test
    void closedStoreBehavior() throws Exception {
        RocksBlobStore store = newStore();
        store.close();
        store.close();

        assertTrue(store.isClosed());
        assertThrows(IllegalStateException.class, () -> store.get("k"));
        assertThrows(IllegalStateException.class, () -> store.multiGet(List.of("k")));
        assertThrows(IllegalStateException.class, () -> store.set("k", bytes("v"), 60));
    }
}
