package com.nexuscontrol.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexuscontrol.policy.Policy;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed payload of a lifecycle event, one record per {@link EventType}.
 *
 * Payloads are serialized with snake_case keys; the canonical form of
 * {@code {"event_type", "payload"}} is what the event digest covers.
 */
public sealed interface EventPayload permits
        EventPayload.DecisionCreated,
        EventPayload.PolicyAttached,
        EventPayload.ApprovalGranted,
        EventPayload.ApprovalRevoked,
        EventPayload.ExecutionRequested,
        EventPayload.ExecutionStarted,
        EventPayload.ExecutionCompleted,
        EventPayload.ExecutionFailed,
        EventPayload.TemplateCreated {

    @JsonIgnore
    EventType eventType();

    /** Payload record bound to {@code type}, used when reading events back from JSON. */
    static Class<? extends EventPayload> payloadType(EventType type) {
        return switch (type) {
            case DECISION_CREATED -> DecisionCreated.class;
            case POLICY_ATTACHED -> PolicyAttached.class;
            case APPROVAL_GRANTED -> ApprovalGranted.class;
            case APPROVAL_REVOKED -> ApprovalRevoked.class;
            case EXECUTION_REQUESTED -> ExecutionRequested.class;
            case EXECUTION_STARTED -> ExecutionStarted.class;
            case EXECUTION_COMPLETED -> ExecutionCompleted.class;
            case EXECUTION_FAILED -> ExecutionFailed.class;
            case TEMPLATE_CREATED -> TemplateCreated.class;
        };
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record DecisionCreated(
        String goal,
        String plan,
        ExecutionMode requestedMode,
        List<String> labels,
        @JsonInclude(JsonInclude.Include.NON_NULL) String comment
    ) implements EventPayload {

        public DecisionCreated {
            Objects.requireNonNull(goal, "goal");
            Objects.requireNonNull(requestedMode, "requested_mode");
            labels = labels == null ? List.of() : List.copyOf(labels);
        }

        @Override
        public EventType eventType() {
            return EventType.DECISION_CREATED;
        }
    }

    /**
     * Policy fields, plus template provenance when the policy was instantiated
     * from a template.
     */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record PolicyAttached(
        int minApprovals,
        List<String> allowedModes,
        List<String> requireAdapterCapabilities,
        Integer maxSteps,
        List<String> labels,
        @JsonInclude(JsonInclude.Include.NON_NULL) String templateName,
        @JsonInclude(JsonInclude.Include.NON_NULL) Map<String, Object> templateSnapshot,
        @JsonInclude(JsonInclude.Include.NON_NULL) String templateDigest,
        @JsonInclude(JsonInclude.Include.NON_NULL) Map<String, Object> overridesApplied
    ) implements EventPayload {

        public static PolicyAttached of(Policy policy) {
            return new PolicyAttached(policy.minApprovals(), policy.allowedModes(),
                policy.requireAdapterCapabilities(), policy.maxSteps(), policy.labels(),
                null, null, null, null);
        }

        public static PolicyAttached fromTemplate(Policy effective, String templateName,
                                                  Map<String, Object> snapshot, String digest,
                                                  Map<String, Object> overridesApplied) {
            return new PolicyAttached(effective.minApprovals(), effective.allowedModes(),
                effective.requireAdapterCapabilities(), effective.maxSteps(), effective.labels(),
                templateName, snapshot, digest, overridesApplied);
        }

        /** Rebuilds the policy value; construction re-validates the fields. */
        public Policy toPolicy() {
            return new Policy(minApprovals, allowedModes, requireAdapterCapabilities, maxSteps, labels);
        }

        @JsonIgnore
        public boolean isFromTemplate() {
            return templateName != null;
        }

        @Override
        public EventType eventType() {
            return EventType.POLICY_ATTACHED;
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record ApprovalGranted(
        Instant expiresAt,
        @JsonInclude(JsonInclude.Include.NON_NULL) String comment
    ) implements EventPayload {

        @Override
        public EventType eventType() {
            return EventType.APPROVAL_GRANTED;
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record ApprovalRevoked(
        String reason,
        @JsonInclude(JsonInclude.Include.NON_NULL) String comment
    ) implements EventPayload {

        public ApprovalRevoked {
            reason = reason == null ? "" : reason;
        }

        @Override
        public EventType eventType() {
            return EventType.APPROVAL_REVOKED;
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record ExecutionRequested(String adapterId, boolean dryRun) implements EventPayload {

        @Override
        public EventType eventType() {
            return EventType.EXECUTION_REQUESTED;
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record ExecutionStarted(String routerRequestDigest, String runId) implements EventPayload {

        @Override
        public EventType eventType() {
            return EventType.EXECUTION_STARTED;
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record ExecutionCompleted(String runId, String responseDigest, int stepsExecuted) implements EventPayload {

        @Override
        public EventType eventType() {
            return EventType.EXECUTION_COMPLETED;
        }
    }

    /** {@code runId} is null when the failure happened before a run id was assigned. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record ExecutionFailed(String errorCode, String errorMessage, String runId) implements EventPayload {

        @Override
        public EventType eventType() {
            return EventType.EXECUTION_FAILED;
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    record TemplateCreated(
        String name,
        String description,
        int minApprovals,
        List<String> allowedModes,
        List<String> requireAdapterCapabilities,
        Integer maxSteps,
        List<String> labels,
        String templateDigest
    ) implements EventPayload {

        @Override
        public EventType eventType() {
            return EventType.TEMPLATE_CREATED;
        }
    }
}
