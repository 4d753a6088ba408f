package com.nexuscontrol.store;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.contract.EventPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Front door to the event log: every append goes through here so that live
 * subscribers (the SSE stream) see each committed event exactly once.
 *
 * Writers that check state before appending hold the decision's writer lock
 * from the check through the last append; see {@link #withDecisionLock}.
 */
@Service
public class EventLogService {

    private static final Logger log = LoggerFactory.getLogger(EventLogService.class);

    private final EventStore eventStore;
    private final ConcurrentHashMap<String, Consumer<EventEnvelope>> subscribers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> decisionLocks = new ConcurrentHashMap<>();

    public EventLogService(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    public String createDecision(String decisionId) {
        return eventStore.createDecision(decisionId);
    }

    public EventEnvelope append(String decisionId, Actor actor, EventPayload payload) {
        EventEnvelope appended = eventStore.append(decisionId, actor, payload);
        log.debug("Appended {} seq={} to decision={}",
            appended.eventType(), appended.sequenceNumber(), decisionId);
        notifySubscribers(appended);
        return appended;
    }

    /**
     * Runs {@code action} holding the single writer lock of one decision.
     * Reentrant, so a locked operation may call another one on the same
     * decision. Different decisions never block each other.
     */
    public <T> T withDecisionLock(String decisionId, Supplier<T> action) {
        ReentrantLock lock = decisionLocks.computeIfAbsent(decisionId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void importDecision(String decisionId, List<EventEnvelope> events) {
        eventStore.importDecision(decisionId, events);
        log.debug("Imported {} events as decision={}", events.size(), decisionId);
    }

    public List<EventEnvelope> read(String decisionId) {
        return eventStore.read(decisionId);
    }

    public boolean exists(String decisionId) {
        return eventStore.exists(decisionId);
    }

    public List<EventStore.DecisionHeader> listDecisions(int limit, int offset) {
        return eventStore.listDecisions(limit, offset);
    }

    public String subscribe(Consumer<EventEnvelope> consumer) {
        String id = UUID.randomUUID().toString();
        subscribers.put(id, consumer);
        return id;
    }

    public void unsubscribe(String id) {
        subscribers.remove(id);
    }

    /** Fan-out for events committed outside a decision log, e.g. template creation. */
    public void publishCommitted(EventEnvelope event) {
        notifySubscribers(event);
    }

    private void notifySubscribers(EventEnvelope event) {
        subscribers.values().forEach(consumer -> {
            try {
                consumer.accept(event);
            } catch (Exception ex) {
                log.warn("Subscriber notification failed for event={}: {}",
                    event.eventId(), ex.getMessage());
            }
        });
    }
}
