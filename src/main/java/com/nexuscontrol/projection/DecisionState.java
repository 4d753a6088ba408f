package com.nexuscontrol.projection;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DecisionState {
    /** Created, no policy attached yet. */
    DRAFT("draft"),
    PENDING_APPROVAL("pending_approval"),
    APPROVED("approved"),
    EXECUTING("executing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    DecisionState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
