package dev.seriescache.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Encodes stored values with their absolute expiry so the store can enforce TTLs on read.
 * Layout: [8 bytes big-endian expireAtMillis][payload bytes]
 */
public final class ExpiringValueEncoder {
    private ExpiringValueEncoder() {}

    public static final int HEADER_LENGTH = 8;

    public static byte[] encode(long expireAtMillis, byte[] payload) {
        if (expireAtMillis < 0) {
            throw new IllegalArgumentException("expireAtMillis must be non-negative");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        ByteBuffer buf = ByteBuffer.allocate(HEADER_LENGTH + payload.length).order(ByteOrder.BIG_ENDIAN);
        buf.putLong(expireAtMillis);
        buf.put(payload);
        return buf.array();
    }

    public static long decodeExpireAt(byte[] stored) {
        if (stored == null || stored.length < HEADER_LENGTH) {
            throw new IllegalArgumentException("Invalid stored value: expected at least " + HEADER_LENGTH + " bytes");
        }
        return ByteBuffer.wrap(stored).order(ByteOrder.BIG_ENDIAN).getLong(0);
    }

    public static StoredBlob decode(byte[] stored) {
        long expireAt = decodeExpireAt(stored);
        return new StoredBlob(expireAt, Arrays.copyOfRange(stored, HEADER_LENGTH, stored.length));
    }
}
