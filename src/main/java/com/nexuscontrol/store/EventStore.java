package com.nexuscontrol.store;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.contract.EventPayload;

import java.time.Instant;
import java.util.List;

/**
 * Append-only event log keyed by decision. Sequence numbers, timestamps and
 * digests are assigned here. Events are never updated or removed.
 *
 * Implementations must serialize appends per decision and must never expose a
 * partially written event to readers.
 */
public interface EventStore {

    /**
     * @param decisionId requested id, or null to generate one
     * @return the id of the new decision
     * @throws IllegalStateException if the id is already taken
     */
    String createDecision(String decisionId);

    /**
     * @throws DecisionNotFoundException if the decision was never created
     * @throws EventStoreException       if the event could not be committed
     */
    EventEnvelope append(String decisionId, Actor actor, EventPayload payload);

    /**
     * Installs a complete, already verified log under a new decision id. The
     * events are stored as given, timestamps and digests included.
     *
     * @throws IllegalStateException if the id is already taken
     */
    void importDecision(String decisionId, List<EventEnvelope> events);

    /** Events of one decision in sequence order. */
    List<EventEnvelope> read(String decisionId);

    boolean exists(String decisionId);

    /** Most recent first. */
    List<DecisionHeader> listDecisions(int limit, int offset);

    /** Highest committed sequence number, or -1 when the log is empty. */
    long latestSequence(String decisionId);

    record DecisionHeader(String decisionId, Instant createdAt) {}
}
