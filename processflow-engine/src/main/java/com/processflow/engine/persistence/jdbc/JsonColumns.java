package com.processflow.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSONB and timestamp conversions shared by the JDBC repositories.
 */
final class JsonColumns {

    private static final TypeReference<LinkedHashMap<String, JsonNode>> VARIABLES = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    JsonNode readTree(String json) throws JsonProcessingException {
        if (json == null || json.isEmpty()) {
            return null;
        }
        return objectMapper.readTree(json);
    }

    Map<String, JsonNode> readVariables(String json) throws JsonProcessingException {
        if (json == null || json.isEmpty()) {
            return Map.of();
        }
        return objectMapper.readValue(json, VARIABLES);
    }

    <T> T read(String json, TypeReference<T> type, T empty) throws JsonProcessingException {
        if (json == null || json.isEmpty()) {
            return empty;
        }
        return objectMapper.readValue(json, type);
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
