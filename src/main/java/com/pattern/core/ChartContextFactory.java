package com.pattern.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Factory for chart contexts built from the JSON output of an external chart engine.
 * Nested objects stay nested (maps of maps and lists) so scripts can navigate them
 * with ordinary property access.
 */
public class ChartContextFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parse a chart context from a JSON document.
     *
     * @param json JSON object text
     * @return Nested map graph
     */
    public static Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Chart JSON cannot be empty");
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid chart JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse a chart context from a JSON stream.
     */
    public static Map<String, Object> fromJson(InputStream json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid chart JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read chart JSON", e);
        }
    }
}
