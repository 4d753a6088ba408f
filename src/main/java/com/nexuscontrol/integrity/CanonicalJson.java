package com.nexuscontrol.integrity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;

/**
 * Canonical JSON: keys sorted at every level, no whitespace, UTF-8, ISO-8601
 * timestamps. Two semantically equal objects always serialize to the same bytes.
 *
 * Uses its own mapper so application-level Jackson customization can never
 * change a digest.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(SerializationFeature.INDENT_OUTPUT)
        .build();

    private CanonicalJson() {
    }

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("value is not JSON-serializable: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Binds a parsed JSON tree (maps, lists, scalars) to {@code type}. Unknown
     * properties are rejected.
     *
     * @throws IllegalArgumentException if the tree does not fit the type
     */
    public static <T> T read(Object tree, Class<T> type) {
        return MAPPER.convertValue(tree, type);
    }

    public static byte[] writeBytes(Object value) {
        return write(value).getBytes(StandardCharsets.UTF_8);
    }
}
