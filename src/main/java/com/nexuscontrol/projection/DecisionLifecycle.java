package com.nexuscontrol.projection;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.contract.EventPayload;
import com.nexuscontrol.contract.EventType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lifecycle view of a decision: why it cannot execute yet, how far it is,
 * and what happened so far. Derived from the aggregate, never stored.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DecisionLifecycle(
    DecisionState state,
    List<BlockingReason> blockingReasons,
    Progress progress,
    List<TimelineEntry> timeline,
    int timelineTotal,
    boolean timelineTruncated
) {

    public static final int DEFAULT_TIMELINE_LIMIT = 20;

    static final String THRESHOLD_MET = "THRESHOLD_MET";

    @JsonProperty("is_blocked")
    public boolean isBlocked() {
        return !blockingReasons.isEmpty();
    }

    /** @param timelineLimit keep only the last N timeline entries; 0 or less keeps all */
    public static DecisionLifecycle of(Decision decision, int timelineLimit) {
        List<TimelineEntry> full = timeline(decision);
        List<TimelineEntry> kept = full;
        boolean truncated = false;
        if (timelineLimit > 0 && full.size() > timelineLimit) {
            kept = List.copyOf(full.subList(full.size() - timelineLimit, full.size()));
            truncated = true;
        }
        return new DecisionLifecycle(
            decision.getState(),
            blockingReasons(decision),
            progress(decision),
            kept,
            full.size(),
            truncated
        );
    }

    /**
     * Reasons in fixed priority order. Once a terminal or missing-prerequisite
     * reason is found, lower-priority checks are skipped.
     */
    static List<BlockingReason> blockingReasons(Decision decision) {
        if (!decision.hasPolicy()) {
            return List.of(new BlockingReason(BlockingCode.NO_POLICY,
                "Decision has no policy attached", Map.of()));
        }
        if (decision.getState() == DecisionState.COMPLETED) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("run_id", decision.getLatestRunId());
            return List.of(new BlockingReason(BlockingCode.ALREADY_EXECUTED,
                "Decision has already been executed successfully", details));
        }
        if (decision.getState() == DecisionState.FAILED) {
            ExecutionRecord latest = decision.getLatestExecution();
            String errorMessage = latest != null && latest.errorMessage() != null ? latest.errorMessage() : "";
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error_code", latest != null ? latest.errorCode() : null);
            details.put("error_message", errorMessage);
            return List.of(new BlockingReason(BlockingCode.EXECUTION_FAILED,
                errorMessage.isEmpty() ? "Previous execution failed" : "Previous execution failed: " + errorMessage,
                details));
        }

        int required = decision.getPolicy().minApprovals();
        int current = decision.getActiveApprovalCount();
        if (current >= required) {
            return List.of();
        }

        List<Approval> unrevoked = decision.getApprovals().values().stream()
            .filter(a -> !a.revoked())
            .toList();
        long expired = unrevoked.stream().filter(a -> a.isExpired(decision.getAsOf())).count();
        if (expired > 0 && unrevoked.size() >= required) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("expired_count", expired);
            details.put("current_valid", current);
            details.put("required", required);
            return List.of(new BlockingReason(BlockingCode.APPROVAL_EXPIRED,
                "Approvals expired: " + expired + " approval(s) have expired", details));
        }

        int missing = required - current;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("required", required);
        details.put("current", current);
        details.put("missing", missing);
        return List.of(new BlockingReason(BlockingCode.MISSING_APPROVALS,
            "Missing " + missing + " approval" + (missing == 1 ? "" : "s"), details));
    }

    static Progress progress(Decision decision) {
        DecisionState state = decision.getState();
        String outcome = switch (state) {
            case COMPLETED -> "success";
            case FAILED -> "failed";
            case EXECUTING -> "pending";
            default -> null;
        };
        return new Progress(
            decision.getActiveApprovalCount(),
            decision.hasPolicy() ? decision.getPolicy().minApprovals() : 1,
            decision.isApproved() && state != DecisionState.COMPLETED && state != DecisionState.FAILED,
            state == DecisionState.COMPLETED || state == DecisionState.FAILED || state == DecisionState.EXECUTING,
            outcome
        );
    }

    static List<TimelineEntry> timeline(Decision decision) {
        List<TimelineEntry> entries = new ArrayList<>();
        for (EventEnvelope event : decision.getEvents()) {
            TimelineEntry entry = entryFor(event);
            if (entry != null) {
                entries.add(entry);
            }
        }

        if (decision.hasPolicy()) {
            int required = decision.getPolicy().minApprovals();
            int count = 0;
            for (EventEnvelope event : decision.getEvents()) {
                if (event.eventType() == EventType.APPROVAL_GRANTED) {
                    count++;
                    if (count == required) {
                        entries.add(new TimelineEntry(event.occurredAt().toString(), "decision", "approved",
                            "Approval threshold met (" + required + "/" + required + ")",
                            null, THRESHOLD_MET, event.sequenceNumber()));
                        break;
                    }
                } else if (event.eventType() == EventType.APPROVAL_REVOKED) {
                    count--;
                }
            }
        }

        // Synthetic entries sort right after the event that triggered them.
        entries.sort(Comparator.comparingLong(TimelineEntry::seq)
            .thenComparing(e -> THRESHOLD_MET.equals(e.eventType()) ? 1 : 0));
        return List.copyOf(entries);
    }

    private static TimelineEntry entryFor(EventEnvelope event) {
        String ts = event.occurredAt().toString();
        String actor = event.actor().displayName();
        String type = event.eventType().name();
        long seq = event.sequenceNumber();

        switch (event.eventType()) {
            case DECISION_CREATED:
                return new TimelineEntry(ts, "decision", "created", "Decision created", actor, type, seq);
            case POLICY_ATTACHED: {
                EventPayload.PolicyAttached p = (EventPayload.PolicyAttached) event.payload();
                String summary = p.isFromTemplate()
                    ? "Policy attached from template \"" + p.templateName() + "\""
                    : "Policy attached";
                return new TimelineEntry(ts, "policy", "policy", summary, actor, type, seq);
            }
            case APPROVAL_GRANTED: {
                EventPayload.ApprovalGranted p = (EventPayload.ApprovalGranted) event.payload();
                String summary = "Approval granted by " + event.actor().id();
                if (p.comment() != null && !p.comment().isEmpty()) {
                    summary += ": \"" + p.comment() + "\"";
                }
                return new TimelineEntry(ts, "approval", "approved", summary, actor, type, seq);
            }
            case APPROVAL_REVOKED: {
                EventPayload.ApprovalRevoked p = (EventPayload.ApprovalRevoked) event.payload();
                String summary = "Approval revoked by " + event.actor().id();
                if (!p.reason().isEmpty()) {
                    summary += ": \"" + p.reason() + "\"";
                }
                return new TimelineEntry(ts, "approval", "revoked", summary, actor, type, seq);
            }
            case EXECUTION_REQUESTED: {
                EventPayload.ExecutionRequested p = (EventPayload.ExecutionRequested) event.payload();
                String summary = "Execution requested (" + (p.dryRun() ? "dry-run" : "apply") + ") via "
                    + (p.adapterId() != null ? p.adapterId() : "unknown");
                return new TimelineEntry(ts, "execution", "requested", summary, actor, type, seq);
            }
            case EXECUTION_STARTED:
                return new TimelineEntry(ts, "execution", "started", "Execution started", actor, type, seq);
            case EXECUTION_COMPLETED: {
                EventPayload.ExecutionCompleted p = (EventPayload.ExecutionCompleted) event.payload();
                String summary = p.stepsExecuted() > 0
                    ? "Execution completed (" + p.stepsExecuted() + " steps)"
                    : "Execution completed";
                return new TimelineEntry(ts, "execution", "completed", summary, actor, type, seq);
            }
            case EXECUTION_FAILED: {
                EventPayload.ExecutionFailed p = (EventPayload.ExecutionFailed) event.payload();
                String summary = "Execution failed";
                if (p.errorMessage() != null && !p.errorMessage().isEmpty()) {
                    String message = p.errorMessage().length() > 50
                        ? p.errorMessage().substring(0, 47) + "..."
                        : p.errorMessage();
                    summary += ": " + message;
                }
                return new TimelineEntry(ts, "execution", "failed", summary, actor, type, seq);
            }
            default:
                return null;
        }
    }

    public enum BlockingCode {
        NO_POLICY,
        ALREADY_EXECUTED,
        EXECUTION_FAILED,
        APPROVAL_EXPIRED,
        MISSING_APPROVALS
    }

    public record BlockingReason(BlockingCode code, String message, Map<String, Object> details) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Progress(
        int approvalsCurrent,
        int approvalsRequired,
        boolean readyToExecute,
        boolean hasExecuted,
        String executionOutcome
    ) {

        @JsonProperty("approvals")
        public String approvals() {
            return approvalsCurrent + "/" + approvalsRequired;
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record TimelineEntry(
        String ts,
        String category,
        String label,
        String summary,
        String actor,
        String eventType,
        long seq
    ) {}
}
