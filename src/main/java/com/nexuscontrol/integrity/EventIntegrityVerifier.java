package com.nexuscontrol.integrity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.nexuscontrol.contract.EventEnvelope;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-verifies a stored event log: every digest is recomputed from the event's
 * type and payload, and sequence numbers must run 0, 1, 2, ... without gaps.
 */
public final class EventIntegrityVerifier {

    private EventIntegrityVerifier() {
    }

    public static IntegrityReport verify(String streamId, List<EventEnvelope> events) {
        List<String> problems = new ArrayList<>();
        long expectedSequence = 0;
        for (EventEnvelope event : events) {
            if (!streamId.equals(event.decisionId())) {
                problems.add(event.eventId() + ": belongs to " + event.decisionId());
            }
            if (event.sequenceNumber() != expectedSequence) {
                problems.add(event.eventId() + ": expected sequence " + expectedSequence
                    + " but found " + event.sequenceNumber());
            }
            expectedSequence = event.sequenceNumber() + 1;

            String recomputed = ContentDigest.ofEvent(event.eventType(), event.payload());
            if (!recomputed.equals(event.digest())) {
                problems.add(event.eventId() + ": digest mismatch (stored " + event.digest()
                    + ", recomputed " + recomputed + ")");
            }
        }
        return new IntegrityReport(streamId, events.size(), problems.isEmpty(), List.copyOf(problems));
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record IntegrityReport(String streamId, int eventCount, boolean valid, List<String> problems) {}
}
