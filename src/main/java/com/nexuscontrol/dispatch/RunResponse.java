package com.nexuscontrol.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexuscontrol.contract.ExecutionMode;

import java.util.Locale;

/**
 * Outcome of one dispatch cycle. On failure {@code responseDigest} and
 * {@code stepsExecuted} are null and the error fields are set.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
    String decisionId,
    String runId,
    String adapterId,
    ExecutionMode mode,
    String requestDigest,
    String responseDigest,
    Integer stepsExecuted,
    Status status,
    String errorCode,
    String errorMessage
) {

    public static final String ADAPTER_ERROR = "ADAPTER_ERROR";
    public static final String TIMEOUT = "TIMEOUT";
    public static final String MAX_STEPS_EXCEEDED = "MAX_STEPS_EXCEEDED";

    public boolean succeeded() {
        return status == Status.COMPLETED;
    }

    public enum Status {
        COMPLETED,
        FAILED;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
