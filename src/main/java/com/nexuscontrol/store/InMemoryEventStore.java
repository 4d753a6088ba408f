package com.nexuscontrol.store;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.contract.EventPayload;
import com.nexuscontrol.integrity.ContentDigest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryEventStore implements EventStore {

    private final ConcurrentHashMap<String, DecisionLog> logs = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    @Autowired
    public InMemoryEventStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String createDecision(String decisionId) {
        String id = decisionId != null ? decisionId : UUID.randomUUID().toString();
        DecisionLog previous = logs.putIfAbsent(id, new DecisionLog(id, clock.instant()));
        if (previous != null) {
            throw new IllegalStateException("Decision already exists: " + id);
        }
        return id;
    }

    @Override
    public EventEnvelope append(String decisionId, Actor actor, EventPayload payload) {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(payload, "payload");
        DecisionLog log = requireLog(decisionId);

        // Digest first: a payload that cannot be canonicalized never reaches the log.
        String digest;
        try {
            digest = ContentDigest.ofEvent(payload.eventType(), payload);
        } catch (IllegalArgumentException ex) {
            throw new EventStoreException("Could not digest " + payload.eventType() + " for " + decisionId, ex);
        }

        synchronized (log) {
            EventEnvelope event = new EventEnvelope(
                decisionId,
                log.events.size(),
                payload.eventType(),
                clock.instant(),
                actor,
                payload,
                digest
            );
            log.events.add(event);
            return event;
        }
    }

    @Override
    public void importDecision(String decisionId, List<EventEnvelope> events) {
        if (events.isEmpty()) {
            throw new IllegalArgumentException("Cannot import an empty log for " + decisionId);
        }
        for (EventEnvelope event : events) {
            if (!decisionId.equals(event.decisionId())) {
                throw new IllegalArgumentException(event.eventId() + " does not belong to " + decisionId);
            }
        }
        DecisionLog imported = new DecisionLog(decisionId, events.get(0).occurredAt());
        imported.events.addAll(events);
        if (logs.putIfAbsent(decisionId, imported) != null) {
            throw new IllegalStateException("Decision already exists: " + decisionId);
        }
    }

    @Override
    public List<EventEnvelope> read(String decisionId) {
        DecisionLog log = requireLog(decisionId);
        synchronized (log) {
            return List.copyOf(log.events);
        }
    }

    @Override
    public boolean exists(String decisionId) {
        return decisionId != null && logs.containsKey(decisionId);
    }

    @Override
    public List<DecisionHeader> listDecisions(int limit, int offset) {
        if (limit <= 0 || offset < 0) {
            return Collections.emptyList();
        }
        return logs.values().stream()
            .map(log -> new DecisionHeader(log.decisionId, log.createdAt))
            .sorted(Comparator.comparing(DecisionHeader::createdAt).reversed()
                .thenComparing(DecisionHeader::decisionId))
            .skip(offset)
            .limit(limit)
            .toList();
    }

    @Override
    public long latestSequence(String decisionId) {
        DecisionLog log = requireLog(decisionId);
        synchronized (log) {
            return log.events.size() - 1L;
        }
    }

    private DecisionLog requireLog(String decisionId) {
        DecisionLog log = decisionId == null ? null : logs.get(decisionId);
        if (log == null) {
            throw new DecisionNotFoundException(decisionId);
        }
        return log;
    }

    private static final class DecisionLog {
        private final String decisionId;
        private final Instant createdAt;
        private final List<EventEnvelope> events = new ArrayList<>();

        private DecisionLog(String decisionId, Instant createdAt) {
            this.decisionId = decisionId;
            this.createdAt = createdAt;
        }
    }
}
