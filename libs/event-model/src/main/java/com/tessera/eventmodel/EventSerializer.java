package com.tessera.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON conversion for event payloads and captured entity state.
 *
 * <p>The shared mapper writes properties in alphabetical order and map entries sorted by key, so
 * a given value always produces the same text. {@code Instant} and the other {@code java.time}
 * types are written as ISO 8601 strings.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Converts a value to a JSON object tree.
     *
     * @throws MappingException if the value does not serialize to a JSON object
     */
    public static ObjectNode toTree(Object value) {
        JsonNode node;
        try {
            node = MAPPER.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new MappingException(
                    "Failed to serialize " + value.getClass().getName(), e);
        }
        if (!(node instanceof ObjectNode objectNode)) {
            throw new MappingException(
                    "Expected a JSON object for " + value.getClass().getName() + " but got "
                            + node.getNodeType());
        }
        return objectNode;
    }

    /**
     * Writes a JSON tree as compact text.
     *
     * @throws MappingException if writing fails
     */
    public static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new MappingException("Failed to write JSON tree", e);
        }
    }

    /**
     * Parses JSON text that must contain an object.
     *
     * @throws MappingException if the text is malformed or not an object
     */
    public static ObjectNode readObject(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MappingException("Malformed JSON payload", e);
        }
        if (!(node instanceof ObjectNode objectNode)) {
            throw new MappingException("Expected a JSON object payload");
        }
        return objectNode;
    }

    /**
     * Binds a JSON tree to the given type.
     *
     * @throws MappingException if the tree does not match the type
     */
    public static <T> T fromTree(JsonNode node, Class<T> type) {
        try {
            return MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MappingException("Failed to deserialize payload as " + type.getName(), e);
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }
}
