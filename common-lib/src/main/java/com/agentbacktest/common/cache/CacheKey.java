package com.agentbacktest.common.cache;

import com.agentbacktest.common.model.AgentRole;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stable request key: SHA-256 over the canonical JSON (keys sorted at every level)
 * of the agent role and the context fields that influence its answer.
 * Equal inputs always hash equally, regardless of map iteration order.
 */
public final class CacheKey {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
        .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
        .build();

    private CacheKey() {}

    public static String of(AgentRole role, Map<String, ?> contextFields) {
        Map<String, Object> normalized = new TreeMap<>();
        normalized.put("role", role.name());
        normalized.put("context", new TreeMap<>(contextFields));
        return sha256(canonicalJson(normalized));
    }

    static String canonicalJson(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Context is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
