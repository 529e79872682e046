package dev.seriescache.series;

import java.util.Map;

/**
 * Derives the identity of a series for cache keying.
 */
public interface KeyBasisStrategy {

    /**
     * Canonical identity of {@code result} restricted to what {@code queryMask} constrains.
     *
     * @param result    the series, may be null
     * @param queryMask identity fields the query constrained, may be null
     * @return a new sorted map; empty when nothing is constrained
     */
    Map<String, Object> keyBasis(SeriesResult result, Map<String, ?> queryMask);

    /**
     * Store key for the series, stable for a given key basis.
     */
    String storeKey(String prefix, SeriesResult result, Map<String, ?> queryMask);
}
