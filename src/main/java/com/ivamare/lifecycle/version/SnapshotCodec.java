package com.ivamare.lifecycle.version;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.Map;

/**
 * Deep copies and serializes JSON-shaped snapshots with Jackson.
 *
 * <p>Snapshots go through a JSON tree on every copy, so values come back as
 * plain JSON types (maps, lists, strings, numbers, booleans, null).
 */
public class SnapshotCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public SnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Independent, unmodifiable deep copy of a snapshot. Null becomes an empty map.
     *
     * @throws IllegalArgumentException if the snapshot is not JSON-serializable
     */
    public Map<String, Object> copy(Map<String, Object> snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            return Map.of();
        }
        JsonNode tree = objectMapper.valueToTree(snapshot);
        return Collections.unmodifiableMap(objectMapper.convertValue(tree, MAP_TYPE));
    }

    public String toJson(Map<String, Object> snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize snapshot", e);
        }
    }

    public Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse snapshot", e);
        }
    }
}
