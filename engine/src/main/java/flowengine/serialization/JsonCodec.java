package flowengine.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.util.Objects;

public final class JsonCodec {
    private final ObjectMapper mapper;

    public JsonCodec() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public byte[] serialize(Object value) {
        Objects.requireNonNull(value, "value");
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getName(), e);
        }
    }

    public <T> T deserialize(byte[] bytes, Class<T> type) {
        if (bytes == null || bytes.length == 0) {
            throw new DeserializationException("No stored bytes for " + type.getName(), null);
        }
        try {
            T value = mapper.readValue(bytes, type);
            if (value == null) {
                throw new DeserializationException("Stored bytes decoded to null for " + type.getName(), null);
            }
            return value;
        } catch (IOException e) {
            throw new DeserializationException("Failed to deserialize stored " + type.getName(), e);
        }
    }

    public JsonNode toTree(Object value) {
        return value == null ? null : mapper.valueToTree(value);
    }

    public <T> T fromTree(JsonNode node, Class<T> type) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new DeserializationException("Failed to convert JSON to " + type.getName(), e);
        }
    }
}
