package com.umitunal.tasklite.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON codec using Jackson. Every value written to the persistent store goes
 * through this codec, so the size of an item is the length of its JSON form.
 */
public class JsonCodec {
    private final ObjectMapper mapper;

    public JsonCodec() {
        this(createDefaultMapper());
    }

    public JsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public byte[] encode(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize to JSON", e);
        }
    }

    public <T> T decode(byte[] bytes, Class<T> type) {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new SerializationException("Failed to deserialize " + type.getSimpleName() + " from JSON", e);
        }
    }

    /**
     * Convert a value to a JSON tree. {@code null} becomes a JSON null node.
     */
    public JsonNode toTree(Object value) {
        return mapper.valueToTree(value);
    }

    public <T> T fromTree(JsonNode node, Class<T> type) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to convert JSON tree to " + type.getSimpleName(), e);
        }
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
