package dev.seriescache.ser;

/**
 * Converts cached payloads to and from the bytes kept in a {@link dev.seriescache.api.BlobStore}.
 */
public interface Serializer<T> {
    byte[] serialize(T payload);

    T deserialize(byte[] stored, Class<T> type);
}
