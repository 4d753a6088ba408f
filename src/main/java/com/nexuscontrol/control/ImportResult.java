package com.nexuscontrol.control;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexuscontrol.projection.DecisionLifecycle.BlockingReason;
import com.nexuscontrol.projection.DecisionState;

import java.util.List;

/**
 * Outcome of a successful import.
 *
 * @param decisionId         id the log was stored under
 * @param originalDecisionId id in the exported record; differs from {@code decisionId} when remapped
 * @param blockingReasons    lifecycle of the imported decision after replay
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ImportResult(
    String decisionId,
    String originalDecisionId,
    int eventsImported,
    boolean digestVerified,
    ConflictMode conflictMode,
    DecisionState state,
    List<BlockingReason> blockingReasons
) {

    @JsonProperty("remapped")
    public boolean remapped() {
        return !decisionId.equals(originalDecisionId);
    }
}
