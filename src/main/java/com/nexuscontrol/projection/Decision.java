package com.nexuscontrol.projection;

import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.contract.EventPayload;
import com.nexuscontrol.contract.ExecutionMode;
import com.nexuscontrol.policy.Policy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Current state of a decision, computed by folding its events in sequence
 * order. Never persisted; rebuild it from the log whenever it is needed.
 *
 * Approval expiry is evaluated against the instant passed to {@link #replay}.
 */
public final class Decision {

    private final String decisionId;
    private final Instant asOf;

    private DecisionState state = DecisionState.DRAFT;
    private String goal;
    private String plan;
    private ExecutionMode requestedMode;
    private List<String> labels = List.of();
    private Policy policy;
    private TemplateRef templateRef;
    private final Map<String, Approval> approvals = new LinkedHashMap<>();
    private final List<ExecutionRecord> executions = new ArrayList<>();
    private final List<EventEnvelope> events = new ArrayList<>();

    private Decision(String decisionId, Instant asOf) {
        this.decisionId = decisionId;
        this.asOf = asOf;
    }

    public static Decision replay(String decisionId, List<EventEnvelope> events, Instant asOf) {
        Decision decision = new Decision(decisionId, asOf);
        for (EventEnvelope event : events) {
            decision.apply(event);
        }
        return decision;
    }

    private void apply(EventEnvelope event) {
        if (!decisionId.equals(event.decisionId())) {
            throw new IllegalArgumentException(
                "event " + event.eventId() + " does not belong to decision " + decisionId);
        }
        events.add(event);

        switch (event.eventType()) {
            case DECISION_CREATED -> {
                EventPayload.DecisionCreated created = (EventPayload.DecisionCreated) event.payload();
                goal = created.goal();
                plan = created.plan();
                requestedMode = created.requestedMode();
                labels = created.labels();
                state = DecisionState.DRAFT;
            }
            case POLICY_ATTACHED -> {
                EventPayload.PolicyAttached attached = (EventPayload.PolicyAttached) event.payload();
                policy = attached.toPolicy();
                templateRef = attached.isFromTemplate()
                    ? new TemplateRef(attached.templateName(), attached.templateDigest(),
                        orEmpty(attached.templateSnapshot()), orEmpty(attached.overridesApplied()))
                    : null;
                state = DecisionState.PENDING_APPROVAL;
                updateApprovalState();
            }
            case APPROVAL_GRANTED -> {
                EventPayload.ApprovalGranted granted = (EventPayload.ApprovalGranted) event.payload();
                String approverId = event.actor().id();
                Approval existing = approvals.get(approverId);
                // A repeated grant from an active approver leaves the original in place.
                if (existing == null || existing.revoked()) {
                    approvals.put(approverId, Approval.granted(
                        event.actor(), event.occurredAt(), granted.expiresAt(), granted.comment()));
                }
                updateApprovalState();
            }
            case APPROVAL_REVOKED -> {
                EventPayload.ApprovalRevoked revoked = (EventPayload.ApprovalRevoked) event.payload();
                approvals.computeIfPresent(event.actor().id(),
                    (id, approval) -> approval.revoke(event.occurredAt(), revoked.reason()));
                updateApprovalState();
            }
            case EXECUTION_REQUESTED -> {
                EventPayload.ExecutionRequested requested = (EventPayload.ExecutionRequested) event.payload();
                executions.add(ExecutionRecord.requested(
                    requested.adapterId(), requested.dryRun(), event.occurredAt()));
            }
            case EXECUTION_STARTED -> {
                EventPayload.ExecutionStarted started = (EventPayload.ExecutionStarted) event.payload();
                replaceLatest(latest -> latest.started(
                    event.occurredAt(), started.routerRequestDigest(), started.runId()));
                state = DecisionState.EXECUTING;
            }
            case EXECUTION_COMPLETED -> {
                EventPayload.ExecutionCompleted completed = (EventPayload.ExecutionCompleted) event.payload();
                replaceLatest(latest -> latest.completed(
                    event.occurredAt(), completed.runId(), completed.responseDigest(), completed.stepsExecuted()));
                state = DecisionState.COMPLETED;
            }
            case EXECUTION_FAILED -> {
                EventPayload.ExecutionFailed failed = (EventPayload.ExecutionFailed) event.payload();
                replaceLatest(latest -> latest.failed(
                    event.occurredAt(), failed.runId(), failed.errorCode(), failed.errorMessage()));
                state = DecisionState.FAILED;
            }
            case TEMPLATE_CREATED -> {
                // template streams are never folded into a decision
            }
        }
    }

    private void updateApprovalState() {
        if (state == DecisionState.PENDING_APPROVAL || state == DecisionState.APPROVED) {
            state = isApproved() ? DecisionState.APPROVED : DecisionState.PENDING_APPROVAL;
        }
    }

    private void replaceLatest(UnaryOperator<ExecutionRecord> change) {
        if (!executions.isEmpty()) {
            int last = executions.size() - 1;
            executions.set(last, change.apply(executions.get(last)));
        }
    }

    private static Map<String, Object> orEmpty(Map<String, Object> map) {
        return map == null ? Map.of() : map;
    }

    public String getDecisionId() {
        return decisionId;
    }

    public Instant getAsOf() {
        return asOf;
    }

    public DecisionState getState() {
        return state;
    }

    public String getGoal() {
        return goal;
    }

    public String getPlan() {
        return plan;
    }

    public ExecutionMode getRequestedMode() {
        return requestedMode;
    }

    public List<String> getLabels() {
        return labels;
    }

    /** Most recently attached policy, or null while in draft. */
    public Policy getPolicy() {
        return policy;
    }

    public TemplateRef getTemplateRef() {
        return templateRef;
    }

    public Map<String, Approval> getApprovals() {
        return Collections.unmodifiableMap(approvals);
    }

    public List<ExecutionRecord> getExecutions() {
        return Collections.unmodifiableList(executions);
    }

    public List<EventEnvelope> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public boolean exists() {
        return goal != null;
    }

    public boolean hasPolicy() {
        return policy != null;
    }

    public int getActiveApprovalCount() {
        return (int) approvals.values().stream().filter(a -> a.isActive(asOf)).count();
    }

    public boolean isApproved() {
        return policy != null && getActiveApprovalCount() >= policy.minApprovals();
    }

    public boolean hasActiveApprovalFrom(String approverId) {
        Approval approval = approvals.get(approverId);
        return approval != null && approval.isActive(asOf);
    }

    public ExecutionRecord getLatestExecution() {
        return executions.isEmpty() ? null : executions.get(executions.size() - 1);
    }

    public String getLatestRunId() {
        ExecutionRecord latest = getLatestExecution();
        return latest == null ? null : latest.runId();
    }

    public long getLastSequence() {
        return events.isEmpty() ? -1 : events.get(events.size() - 1).sequenceNumber();
    }
}
