package dev.seriescache.series;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Response for one query, built up one series at a time.
 */
@Getter
@ToString
public class ResponseEnvelope {
    private final List<SeriesResult> results = new ArrayList<>();

    @JsonProperty("sample_size")
    private long sampleSize;

    public ResponseEnvelope addResult(SeriesResult result) {
        results.add(result);
        return this;
    }

    public ResponseEnvelope addSamples(long count) {
        sampleSize += count;
        return this;
    }
}
