package com.nexuscontrol.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ExecutionMode {
    DRY_RUN("dry_run"),
    APPLY("apply");

    private final String value;

    ExecutionMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isDryRun() {
        return this == DRY_RUN;
    }

    public static boolean isKnown(String raw) {
        return Arrays.stream(values()).anyMatch(v -> v.value.equals(raw));
    }

    @JsonCreator
    public static ExecutionMode fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equals(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown execution mode: " + raw));
    }
}
