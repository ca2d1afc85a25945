package com.acme.render.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;

public final class Jsons {
    private static final ObjectMapper M = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT = new TypeReference<>() {};

    private Jsons() {
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch(Exception e) {
            throw new RuntimeException(e);
        }
    }

    public static String of(String k, Object v) {
        return toJson(Map.of(k, v));
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return M.readValue(json, clazz);
        } catch(Exception e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Parses a JSON object; null or blank input gives an empty map.
     */
    public static Map<String, Object> toMap(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return M.readValue(json, OBJECT);
        } catch(Exception e) {
            throw new RuntimeException("Malformed JSON object", e);
        }
    }

    /**
     * Shallow merge of a JSON object with extra fields; the patch wins on conflicts.
     */
    public static String merge(String json, Map<String, ?> patch) {
        Map<String, Object> merged = toMap(json);
        merged.putAll(patch);
        return toJson(merged);
    }
}
