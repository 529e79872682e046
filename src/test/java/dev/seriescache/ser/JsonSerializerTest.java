package dev.seriescache.ser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.seriescache.series.SeriesResult;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dev.seriescache.testing.SeriesFixtures.points;
import static org.junit.jupiter.api.Assertions.*;

class JsonSerializerTest {

    private final JsonSerializer<SeriesResult> serializer = new JsonSerializer<>();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void seriesResult_usesWireShape() throws Exception {
        SeriesResult result = SeriesResult.of("loadavg.05", points(1000, 1, 2000, 2))
                .setGroupBy(Map.of("name", "tag"));

        JsonNode json = mapper.readTree(serializer.serialize(result));

        assertEquals("loadavg.05", json.get("name").asText());
        assertTrue(json.has("group_by"));
        assertFalse(json.has("groupBy"));
        assertFalse(json.has("tags"), "null identity fields are omitted");
        JsonNode values = json.get("values");
        assertEquals(2, values.size());
        assertEquals(1000L, values.get(0).get(0).asLong());
        assertEquals(1.0, values.get(0).get(1).asDouble());
    }

    @Test
    void unknownFields_areKeptAsExtras() {
        String stored = "{\"name\":\"loadavg.05\",\"values\":[[1000,1.5]],\"tsd_host\":\"tsd-01\",\"exclude_tags\":[\"a\"]}";

        SeriesResult result = serializer.deserialize(stored.getBytes(StandardCharsets.UTF_8), SeriesResult.class);

        assertEquals("tsd-01", result.getExtra().get("tsd_host"));
        assertEquals(List.of("a"), result.getExtra().get("exclude_tags"));
        assertEquals(points(1000, 0).get(0).timestamp(), result.getValues().get(0).timestamp());
        assertEquals(1.5, result.getValues().get(0).value());

        SeriesResult again = serializer.deserialize(serializer.serialize(result), SeriesResult.class);
        assertEquals(result, again);
    }

    @Test
    void malformedPair_fails() {
        byte[] stored = "{\"name\":\"m\",\"values\":[[1000]]}".getBytes(StandardCharsets.UTF_8);

        RuntimeException e = assertThrows(RuntimeException.class, () -> serializer.deserialize(stored, SeriesResult.class));
        assertTrue(e.getMessage().contains(SeriesResult.class.getName()));
    }

    @Test
    void canonicalBytes_ignoresInsertionOrder() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("name", "m");
        a.put("tags", Map.of("host", List.of("h1")));
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("tags", Map.of("host", List.of("h1")));
        b.put("name", "m");

        assertArrayEquals(JsonSerializer.canonicalBytes(a), JsonSerializer.canonicalBytes(b));
        assertEquals("{\"name\":\"m\",\"tags\":{\"host\":[\"h1\"]}}",
                new String(JsonSerializer.canonicalBytes(b), StandardCharsets.UTF_8));
    }
}
