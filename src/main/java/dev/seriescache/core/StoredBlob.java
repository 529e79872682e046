package dev.seriescache.core;

import java.util.Objects;

/**
 * A decoded store value.
 *
 * @param expireAtMillis absolute expiry, epoch millis
 * @param payload        the caller's bytes
 */
public record StoredBlob(long expireAtMillis, byte[] payload) {
    public StoredBlob {
        Objects.requireNonNull(payload, "payload cannot be null");
        if (expireAtMillis < 0) {
            throw new IllegalArgumentException("expireAtMillis must be non-negative, got " + expireAtMillis);
        }
    }

    public boolean isExpired(long nowMillis) {
        return expireAtMillis <= nowMillis;
    }
}
