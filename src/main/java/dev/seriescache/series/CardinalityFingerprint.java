package dev.seriescache.series;

import dev.seriescache.core.Utils;
import dev.seriescache.ser.JsonSerializer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fingerprints a series by the identity fields its query actually constrained.
 *
 * <p>Tags are masked per tag name: a tag name the query never mentioned (a resolved
 * {@code hostname} list, say) is left out entirely so its cardinality can grow without
 * fragmenting the cache key, while a constrained tag keeps the value list the upstream
 * resolved for it. Identity fields absent from the mask and any non-identity field are dropped.
 */
public class CardinalityFingerprint implements KeyBasisStrategy {

    static final String SERIES_KEY_SEGMENT = "mts";

    private static final List<String> IDENTITY_FIELDS = List.of(
            SeriesResult.TAGS, SeriesResult.GROUP_BY, SeriesResult.AGGREGATORS, SeriesResult.NAME);

    @Override
    public Map<String, Object> keyBasis(SeriesResult result, Map<String, ?> queryMask) {
        Map<String, Object> basis = new TreeMap<>();
        if (result == null || queryMask == null) {
            return basis;
        }
        for (String field : IDENTITY_FIELDS) {
            if (!queryMask.containsKey(field)) {
                continue;
            }
            Object value = result.identityField(field);
            if (value == null) {
                continue;
            }
            if (SeriesResult.TAGS.equals(field)) {
                basis.put(field, maskTags(result.getTags(), queryMask.get(field)));
            } else {
                basis.put(field, value);
            }
        }
        return basis;
    }

    @Override
    public String storeKey(String prefix, SeriesResult result, Map<String, ?> queryMask) {
        byte[] canonical = JsonSerializer.canonicalBytes(keyBasis(result, queryMask));
        return prefix + ":" + SERIES_KEY_SEGMENT + ":" + Utils.sha1Hex(canonical);
    }

    private static Map<String, List<String>> maskTags(Map<String, List<String>> resultTags, Object maskTags) {
        Map<String, List<String>> kept = new TreeMap<>();
        if (!(maskTags instanceof Map)) {
            return kept;
        }
        for (Object tagName : ((Map<?, ?>) maskTags).keySet()) {
            List<String> resolved = resultTags.get(String.valueOf(tagName));
            if (resolved != null) {
                kept.put(String.valueOf(tagName), new ArrayList<>(resolved));
            }
        }
        return kept;
    }
}
