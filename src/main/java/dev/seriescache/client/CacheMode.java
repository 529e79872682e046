package dev.seriescache.client;

/**
 * How a query was answered.
 */
public enum CacheMode {
    /** Entirely from cached series. */
    HOT,
    /** Cached series merged with a fetched delta. */
    WARM,
    /** Full upstream fetch. */
    COLD
}
