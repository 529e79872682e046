package dev.seriescache.series;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static dev.seriescache.testing.SeriesFixtures.cardinality;
import static dev.seriescache.testing.SeriesFixtures.cardinalityResult;
import static org.junit.jupiter.api.Assertions.*;

class CardinalityFingerprintTest {

    private final CardinalityFingerprint fingerprint = new CardinalityFingerprint();

    @Test
    void maskEqualToResult_keepsEveryIdentityField() {
        assertEquals(cardinality(), fingerprint.keyBasis(cardinalityResult(), cardinality()));
    }

    @Test
    void extraFieldsNeverReachTheBasis() {
        SeriesResult result = cardinalityResult();
        result.putExtra("something-irrelevant", "whatever");

        assertEquals(cardinality(), fingerprint.keyBasis(result, cardinality()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void unconstrainedTagNamesAreMaskedOut() {
        Map<String, Object> mask = Map.of("tags", Map.of("ecosystem", List.of("dev")));

        Map<String, Object> basis = fingerprint.keyBasis(cardinalityResult(), mask);

        Map<String, List<String>> tags = (Map<String, List<String>>) basis.get("tags");
        assertTrue(tags.containsKey("ecosystem"));
        assertFalse(tags.containsKey("hostname"));
        assertEquals(1, basis.size(), "only tags were constrained");
    }

    @Test
    @SuppressWarnings("unchecked")
    void constrainedTagKeepsTheResolvedValues() {
        SeriesResult result = cardinalityResult();
        result.getTags().put("ecosystem", List.of("dev", "dev-canary"));
        Map<String, Object> mask = Map.of("tags", Map.of("ecosystem", List.of("dev")));

        Map<String, List<String>> tags = (Map<String, List<String>>) fingerprint.keyBasis(result, mask).get("tags");

        assertEquals(List.of("dev", "dev-canary"), tags.get("ecosystem"));
    }

    @Test
    void fieldsUnsetOnBothSidesAreLeftOut() {
        SeriesResult result = cardinalityResult().setGroupBy(null);
        Map<String, Object> mask = cardinality();
        mask.remove("group_by");

        Map<String, Object> basis = fingerprint.keyBasis(result, mask);

        assertEquals(mask, basis);
        assertFalse(basis.containsKey("group_by"));
    }

    @Test
    void maskedFieldMissingFromResultIsLeftOut() {
        SeriesResult result = cardinalityResult().setAggregators(null);

        assertFalse(fingerprint.keyBasis(result, cardinality()).containsKey("aggregators"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void basisNeverExceedsTheMask() {
        List<Map<String, Object>> masks = List.of(
                Map.of(),
                Map.of("name", "loadavg.05"),
                Map.of("tags", Map.of("hostname", List.of("x"), "absent-tag", List.of("y"))),
                Map.of("aggregators", Map.of(), "tags", Map.of()),
                cardinality());

        for (Map<String, Object> mask : masks) {
            Map<String, Object> basis = fingerprint.keyBasis(cardinalityResult(), mask);
            assertTrue(mask.keySet().containsAll(basis.keySet()), "fields of " + mask);
            if (basis.containsKey("tags")) {
                Map<String, ?> maskTags = (Map<String, ?>) mask.get("tags");
                Map<String, ?> basisTags = (Map<String, ?>) basis.get("tags");
                assertTrue(maskTags.keySet().containsAll(basisTags.keySet()), "tags of " + mask);
            }
        }
    }

    @Test
    void nullResultOrMaskGivesEmptyBasis() {
        assertTrue(fingerprint.keyBasis(null, cardinality()).isEmpty());
        assertTrue(fingerprint.keyBasis(cardinalityResult(), null).isEmpty());
    }

    @Test
    void storeKeyIgnoresGrowthInUnconstrainedTags() {
        Map<String, Object> mask = Map.of("name", "loadavg.05", "tags", Map.of("ecosystem", List.of("dev")));
        SeriesResult before = cardinalityResult();
        SeriesResult after = cardinalityResult();
        after.getTags().put("hostname", List.of("dev1", "dev2", "dev3"));

        String key = fingerprint.storeKey("tscache", before, mask);

        assertEquals(key, fingerprint.storeKey("tscache", after, mask));
        assertTrue(key.matches("tscache:mts:[0-9a-f]{40}"), key);
    }

    @Test
    void storeKeyChangesWithConstrainedValues() {
        Map<String, Object> mask = Map.of("tags", Map.of("ecosystem", List.of("dev")));
        SeriesResult prod = cardinalityResult();
        prod.getTags().put("ecosystem", List.of("prod"));

        assertNotEquals(fingerprint.storeKey("tscache", cardinalityResult(), mask),
                fingerprint.storeKey("tscache", prod, mask));
    }

    @Test
    void storeKeyDoesNotDependOnMapInsertionOrder() {
        SeriesResult a = cardinalityResult();
        SeriesResult b = cardinalityResult();
        b.setAggregators(Map.of("sampling", Map.of("unit", "seconds", "value", 10L),
                "align_sampling", true, "name", "sum"));

        assertEquals(fingerprint.storeKey("p", a, cardinality()), fingerprint.storeKey("p", b, cardinality()));
    }
}
