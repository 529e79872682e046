package dev.seriescache.client;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Stored list of series keys answering one query mask.
 *
 * @param seriesKeys store keys of the cached series, in response order
 */
public record QueryIndex(@JsonProperty("series_keys") List<String> seriesKeys) {
    public static final String CACHE_TYPE = "kquery";

    public QueryIndex {
        Objects.requireNonNull(seriesKeys, "seriesKeys cannot be null");
        seriesKeys = List.copyOf(seriesKeys);
    }
}
