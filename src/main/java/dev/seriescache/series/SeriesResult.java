package dev.seriescache.series;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One series as returned by the upstream database and as persisted in the store.
 *
 * <p>{@code name}, {@code tags}, {@code group_by} and {@code aggregators} are identity fields.
 * Anything else the upstream sends is kept in {@link #getExtra()} and written back unchanged,
 * but never takes part in fingerprinting.
 */
@Getter
@Setter
@Accessors(chain = true)
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({SeriesResult.NAME, SeriesResult.TAGS, SeriesResult.GROUP_BY, SeriesResult.AGGREGATORS, SeriesResult.VALUES})
public class SeriesResult {
    public static final String NAME = "name";
    public static final String TAGS = "tags";
    public static final String GROUP_BY = "group_by";
    public static final String AGGREGATORS = "aggregators";
    public static final String VALUES = "values";

    private String name;
    private Map<String, List<String>> tags;
    @JsonProperty(GROUP_BY)
    private Map<String, Object> groupBy;
    private Map<String, Object> aggregators;
    private List<DataPoint> values;

    private final Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String field, Object value) {
        extra.put(field, value);
    }

    /**
     * Copy of this result with {@code values} replaced. The identity maps, tag value lists and extras
     * are copied; values nested deeper inside {@code group_by} and {@code aggregators} stay shared.
     */
    public SeriesResult withValues(List<DataPoint> newValues) {
        SeriesResult copy = new SeriesResult()
                .setName(name)
                .setTags(copyTags(tags))
                .setGroupBy(groupBy == null ? null : new LinkedHashMap<>(groupBy))
                .setAggregators(aggregators == null ? null : new LinkedHashMap<>(aggregators))
                .setValues(newValues);
        copy.extra.putAll(extra);
        return copy;
    }

    private static Map<String, List<String>> copyTags(Map<String, List<String>> tags) {
        if (tags == null) {
            return null;
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        tags.forEach((k, v) -> copy.put(k, v == null ? null : new ArrayList<>(v)));
        return copy;
    }

    /**
     * Reads one identity field by its wire name, or null if unset.
     */
    public Object identityField(String field) {
        switch (field) {
            case NAME:
                return name;
            case TAGS:
                return tags;
            case GROUP_BY:
                return groupBy;
            case AGGREGATORS:
                return aggregators;
            default:
                throw new IllegalArgumentException("Not an identity field: " + field);
        }
    }

    public static SeriesResult of(String name, List<DataPoint> values) {
        return new SeriesResult().setName(name).setValues(new ArrayList<>(values));
    }
}
