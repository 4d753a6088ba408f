package com.nexuscontrol.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Self-description an adapter publishes: what it can do, which router
 * versions it supports and which configuration keys it accepts.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AdapterManifest(
    int schemaVersion,
    String kind,
    List<String> capabilities,
    String supportedRouterVersions,
    Map<String, ConfigOption> configSchema,
    List<String> errorCodes
) {

    public static final int SCHEMA_VERSION = 1;

    public AdapterManifest {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind must not be blank");
        }
        capabilities = capabilities == null ? List.of() : capabilities.stream().sorted().toList();
        configSchema = configSchema == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(configSchema));
        errorCodes = errorCodes == null ? List.of() : List.copyOf(errorCodes);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ConfigOption(
        String type,
        boolean required,
        @JsonProperty("default") @JsonInclude(JsonInclude.Include.NON_NULL) Object defaultValue,
        String description
    ) {

        public static ConfigOption optional(String type, Object defaultValue, String description) {
            return new ConfigOption(type, false, defaultValue, description);
        }
    }
}
