package dev.seriescache.query;

import dev.seriescache.api.QueryDescriptor;
import dev.seriescache.series.SeriesResult;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A range query against one metric.
 *
 * <p>Only the fields a caller sets end up in the {@link #queryMask()}; tag names that are
 * resolved later by the upstream (e.g. the concrete hosts behind a wildcard) stay out of it.
 */
@Getter
@Setter
@Accessors(chain = true)
@EqualsAndHashCode
@ToString
public class SeriesQuery implements QueryDescriptor {
    private final String metricName;
    private Map<String, List<String>> tags;
    private Map<String, Object> groupBy;
    private Map<String, Object> aggregators;

    public SeriesQuery(String metricName) {
        this.metricName = Objects.requireNonNull(metricName, "metricName cannot be null");
        if (metricName.trim().isEmpty()) {
            throw new IllegalArgumentException("metricName cannot be empty or whitespace");
        }
    }

    @Override
    public Map<String, Object> queryMask() {
        Map<String, Object> mask = new LinkedHashMap<>();
        mask.put(SeriesResult.NAME, metricName);
        if (tags != null && !tags.isEmpty()) {
            mask.put(SeriesResult.TAGS, tags);
        }
        if (groupBy != null && !groupBy.isEmpty()) {
            mask.put(SeriesResult.GROUP_BY, groupBy);
        }
        if (aggregators != null && !aggregators.isEmpty()) {
            mask.put(SeriesResult.AGGREGATORS, aggregators);
        }
        return mask;
    }
}
