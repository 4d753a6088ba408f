package com.nexuscontrol.store;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.contract.EventPayload;
import com.nexuscontrol.contract.EventType;
import com.nexuscontrol.contract.ExecutionMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventLogServiceTest {

    private static final Actor ALICE = Actor.human("alice");

    private EventLogService eventLog;

    @BeforeEach
    void setUp() {
        eventLog = new EventLogService(new InMemoryEventStore());
    }

    private EventPayload created() {
        return new EventPayload.DecisionCreated("noop", null, ExecutionMode.DRY_RUN, List.of(), null);
    }

    @Test
    void subscriber_receivesEachAppendOnce() {
        List<EventEnvelope> received = new ArrayList<>();
        eventLog.subscribe(received::add);

        String id = eventLog.createDecision(null);
        EventEnvelope appended = eventLog.append(id, ALICE, created());

        assertEquals(List.of(appended), received);
    }

    @Test
    void unsubscribed_receivesNothing() {
        List<EventEnvelope> received = new ArrayList<>();
        String subscription = eventLog.subscribe(received::add);
        eventLog.unsubscribe(subscription);

        String id = eventLog.createDecision(null);
        eventLog.append(id, ALICE, created());

        assertTrue(received.isEmpty());
    }

    @Test
    void failingSubscriber_doesNotBreakAppendOrOtherSubscribers() {
        List<EventEnvelope> received = new ArrayList<>();
        eventLog.subscribe(event -> {
            throw new IllegalStateException("client went away");
        });
        eventLog.subscribe(received::add);

        String id = eventLog.createDecision(null);
        EventEnvelope appended = eventLog.append(id, ALICE, created());

        assertEquals(EventType.DECISION_CREATED, appended.eventType());
        assertEquals(1, received.size());
        assertEquals(1, eventLog.read(id).size());
    }

    @Test
    void appendToUnknownDecision_throws() {
        assertThrows(DecisionNotFoundException.class, () -> eventLog.append("dec_missing", ALICE, created()));
        assertFalse(eventLog.exists("dec_missing"));
    }

    @Test
    void decisionLock_isReentrant() {
        String result = eventLog.withDecisionLock("dec-a",
            () -> eventLog.withDecisionLock("dec-a", () -> "inner"));
        assertEquals("inner", result);
    }

    @Test
    void decisionLock_blocksSameDecisionOnly() throws Exception {
        ExecutorService threads = Executors.newFixedThreadPool(3);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            Future<?> holder = threads.submit(() -> eventLog.withDecisionLock("dec-a", () -> {
                held.countDown();
                await(release);
                return null;
            }));
            assertTrue(held.await(2, TimeUnit.SECONDS));

            Future<String> sameDecision = threads.submit(() -> eventLog.withDecisionLock("dec-a", () -> "same"));
            Future<String> otherDecision = threads.submit(() -> eventLog.withDecisionLock("dec-b", () -> "other"));

            assertEquals("other", otherDecision.get(2, TimeUnit.SECONDS));
            Thread.sleep(100);
            assertFalse(sameDecision.isDone());

            release.countDown();
            holder.get(2, TimeUnit.SECONDS);
            assertEquals("same", sameDecision.get(2, TimeUnit.SECONDS));
        } finally {
            release.countDown();
            threads.shutdownNow();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
