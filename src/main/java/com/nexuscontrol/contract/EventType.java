package com.nexuscontrol.contract;

/**
 * Closed set of event types in the decision lifecycle.
 * Each constant has exactly one payload record in {@link EventPayload}.
 */
public enum EventType {
    DECISION_CREATED,
    POLICY_ATTACHED,
    APPROVAL_GRANTED,
    APPROVAL_REVOKED,
    EXECUTION_REQUESTED,
    EXECUTION_STARTED,
    EXECUTION_COMPLETED,
    EXECUTION_FAILED,
    TEMPLATE_CREATED
}
