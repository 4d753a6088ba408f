package com.nexuscontrol.projection;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One execution cycle, opened by EXECUTION_REQUESTED and filled in by the
 * STARTED / COMPLETED / FAILED events that follow it.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExecutionRecord(
    String adapterId,
    boolean dryRun,
    Instant requestedAt,
    Instant startedAt,
    Instant completedAt,
    String runId,
    String requestDigest,
    String responseDigest,
    Integer stepsExecuted,
    String errorCode,
    String errorMessage
) {

    public static ExecutionRecord requested(String adapterId, boolean dryRun, Instant at) {
        return new ExecutionRecord(adapterId, dryRun, at, null, null, null, null, null, null, null, null);
    }

    public ExecutionRecord started(Instant at, String requestDigest, String runId) {
        return new ExecutionRecord(adapterId, dryRun, requestedAt, at, completedAt, runId,
            requestDigest, responseDigest, stepsExecuted, errorCode, errorMessage);
    }

    public ExecutionRecord completed(Instant at, String runId, String responseDigest, int steps) {
        return new ExecutionRecord(adapterId, dryRun, requestedAt, startedAt, at, runId,
            requestDigest, responseDigest, steps, null, null);
    }

    public ExecutionRecord failed(Instant at, String runId, String code, String message) {
        return new ExecutionRecord(adapterId, dryRun, requestedAt, startedAt, at,
            runId != null ? runId : this.runId, requestDigest, null, null, code, message);
    }

    @JsonIgnore
    public boolean isFinished() {
        return completedAt != null;
    }

    public boolean succeeded() {
        return isFinished() && errorCode == null;
    }
}
