package com.prospectenhancer.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalizes a side-channel payload (map, JSON text or anything else) into one mutable map.
 */
@Slf4j
public final class ExtraPayloads {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private ExtraPayloads() {
    }

    /**
     * @return a mutable map; empty when the payload is null, blank, not valid JSON or not a JSON object
     */
    public static Map<String, Object> normalize(Object payload) {
        if (payload == null) {
            return new LinkedHashMap<>();
        }
        if (payload instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }
        if (payload instanceof String text) {
            if (text.isBlank()) {
                return new LinkedHashMap<>();
            }
            try {
                LinkedHashMap<String, Object> parsed = MAPPER.readValue(text, MAP_TYPE);
                return parsed == null ? new LinkedHashMap<>() : parsed;
            } catch (JsonProcessingException e) {
                log.warn("Side-channel payload is not a JSON object, treating as empty: {}", e.getOriginalMessage());
                return new LinkedHashMap<>();
            }
        }
        log.warn("Unsupported side-channel payload type {}, treating as empty", payload.getClass().getSimpleName());
        return new LinkedHashMap<>();
    }
}
