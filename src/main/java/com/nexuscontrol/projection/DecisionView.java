package com.nexuscontrol.projection;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexuscontrol.contract.ExecutionMode;

import java.util.List;
import java.util.Map;

/**
 * Read-only projection of a decision as served over the API.
 *
 * {@code projectionVersion} is the highest sequence number consumed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DecisionView(
    String decisionId,
    DecisionState state,
    String goal,
    String plan,
    ExecutionMode requestedMode,
    List<String> labels,
    Map<String, Object> policy,
    TemplateRef template,
    int activeApprovals,
    int totalApprovals,
    boolean isApproved,
    List<Approval> approvals,
    List<ExecutionRecord> executions,
    int eventCount,
    long projectionVersion,
    DecisionLifecycle lifecycle
) {

    public static DecisionView of(Decision decision, int timelineLimit) {
        return new DecisionView(
            decision.getDecisionId(),
            decision.getState(),
            decision.getGoal(),
            decision.getPlan(),
            decision.getRequestedMode(),
            decision.getLabels(),
            decision.hasPolicy() ? decision.getPolicy().toMap() : null,
            decision.getTemplateRef(),
            decision.getActiveApprovalCount(),
            decision.getApprovals().size(),
            decision.isApproved(),
            List.copyOf(decision.getApprovals().values()),
            decision.getExecutions(),
            decision.getEvents().size(),
            decision.getLastSequence(),
            DecisionLifecycle.of(decision, timelineLimit)
        );
    }

    /** Compact row for decision listings. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Summary(
        String decisionId,
        DecisionState state,
        String goal,
        int activeApprovals,
        Integer requiredApprovals,
        boolean isBlocked,
        String createdAt
    ) {}
}
