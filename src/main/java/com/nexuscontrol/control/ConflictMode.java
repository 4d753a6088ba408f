package com.nexuscontrol.control;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** What an import does when the exported decision id is already taken. */
public enum ConflictMode {
    REJECT_ON_CONFLICT("reject_on_conflict"),
    NEW_DECISION_ID("new_decision_id");

    private final String value;

    ConflictMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ConflictMode fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equals(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown conflict_mode: " + raw));
    }
}
