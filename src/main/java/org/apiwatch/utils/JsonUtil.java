package org.apiwatch.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;

public class JsonUtil {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonUtil() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Response bodies that look like a JSON object or array and parse cleanly are kept as JSON;
     * anything else is stored as a JSON string holding the raw text.
     */
    public static JsonNode readPayload(String body) {
        if (body == null) return null;
        String trimmed = body.stripLeading();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            try {
                return MAPPER.readTree(body);
            } catch (JsonProcessingException e) {
                return TextNode.valueOf(body);
            }
        }
        return TextNode.valueOf(body);
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable to JSON", e);
        }
    }

    /** Null and blank columns read back as an empty, insertion-ordered map. */
    public static Map<String, Object> toMap(String json) {
        if (json == null || json.isBlank()) return new LinkedHashMap<>();
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stored JSON is not an object: " + e.getOriginalMessage(), e);
        }
    }

    public static JsonNode toNode(String json) {
        if (json == null) return null;
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stored JSON is malformed: " + e.getOriginalMessage(), e);
        }
    }
}
