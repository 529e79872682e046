package dev.seriescache.api;

import java.util.Map;

/**
 * A parsed range query as seen by the cache.
 */
public interface QueryDescriptor {

    /**
     * Identity fields ({@code name}, {@code tags}, {@code group_by}, {@code aggregators}) that the caller
     * explicitly constrained. Fields the caller left open are absent from the map.
     */
    Map<String, Object> queryMask();
}
