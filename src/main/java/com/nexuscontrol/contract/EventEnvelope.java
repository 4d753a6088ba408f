package com.nexuscontrol.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * An event as committed to a decision's log. Sequence number, timestamp and
 * digest are assigned by the store, never by the caller.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventEnvelope(
    String decisionId,
    long sequenceNumber,
    EventType eventType,
    Instant occurredAt,
    Actor actor,
    EventPayload payload,
    String digest
) {

    public EventEnvelope {
        if (payload.eventType() != eventType) {
            throw new IllegalArgumentException(
                "payload " + payload.getClass().getSimpleName() + " does not match event type " + eventType);
        }
    }

    @JsonProperty("event_id")
    public String eventId() {
        return "evt_" + decisionId + "_" + sequenceNumber;
    }
}
