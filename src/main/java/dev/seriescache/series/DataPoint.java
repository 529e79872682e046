package dev.seriescache.series;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;

/**
 * One sample of a series, stored as the JSON pair {@code [timestamp_ms, value]}.
 *
 * @param timestamp epoch millis
 * @param value     sample value
 */
@JsonSerialize(using = DataPoint.PairSerializer.class)
@JsonDeserialize(using = DataPoint.PairDeserializer.class)
public record DataPoint(long timestamp, double value) {

    public static final class PairSerializer extends StdSerializer<DataPoint> {
        public PairSerializer() {
            super(DataPoint.class);
        }

        @Override
        public void serialize(DataPoint dp, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartArray();
            gen.writeNumber(dp.timestamp());
            gen.writeNumber(dp.value());
            gen.writeEndArray();
        }
    }

    public static final class PairDeserializer extends StdDeserializer<DataPoint> {
        public PairDeserializer() {
            super(DataPoint.class);
        }

        @Override
        public DataPoint deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            if (node == null || !node.isArray() || node.size() != 2
                    || !node.get(0).isNumber() || !node.get(1).isNumber()) {
                return ctxt.reportInputMismatch(DataPoint.class, "Expected [timestamp_ms, value] pair, got %s", node);
            }
            return new DataPoint(node.get(0).asLong(), node.get(1).asDouble());
        }
    }
}
