package dev.seriescache.series;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Folds cached series into a {@link ResponseEnvelope}.
 */
public class ResponseAssembler {
    private static final Logger logger = LoggerFactory.getLogger(ResponseAssembler.class);

    private final SeriesTrimmer trimmer;

    public ResponseAssembler() {
        this(new WindowTrimmer());
    }

    public ResponseAssembler(SeriesTrimmer trimmer) {
        this.trimmer = Objects.requireNonNull(trimmer, "trimmer cannot be null");
    }

    /**
     * Adds one series to {@code envelope}.
     *
     * <p>{@code sample_size} always grows by the untrimmed point count. Without trimming the entry's
     * result is appended as is; with trimming a copy restricted to {@code range} is appended, using
     * the efficient trim when the series is aligned and the robust trim otherwise.
     *
     * @param entry    the series to add
     * @param range    the requested window; required when {@code trim} is true
     * @param envelope the response being built
     * @param trim     whether to restrict the series to {@code range}
     * @return {@code envelope}, for chaining
     */
    public ResponseEnvelope buildResponse(SeriesEntry entry, TimeRange range, ResponseEnvelope envelope, boolean trim) {
        Objects.requireNonNull(entry, "entry cannot be null");
        Objects.requireNonNull(envelope, "envelope cannot be null");

        envelope.addSamples(entry.requireValues().size());

        if (!trim) {
            envelope.addResult(entry.getResult());
            return envelope;
        }
        if (range == null) {
            throw new IllegalArgumentException("A time range is required to trim " + entry.describe());
        }

        Iterator<DataPoint> trimmed;
        if (trimmer.conformsToEfficientConstraints(entry)) {
            trimmed = trimmer.efficientTrim(entry, range.startAbsolute(), range.endAbsolute());
        } else {
            trimmed = trimmer.robustTrim(entry, range.startAbsolute(), range.endAbsolute());
        }

        List<DataPoint> values = new ArrayList<>();
        trimmed.forEachRemaining(values::add);
        if (logger.isTraceEnabled()) {
            logger.trace("Trimmed {} from {} to {} points", entry.describe(), entry.size(), values.size());
        }
        envelope.addResult(entry.getResult().withValues(values));
        return envelope;
    }
}
