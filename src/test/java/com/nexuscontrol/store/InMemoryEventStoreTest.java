package com.nexuscontrol.store;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.contract.EventPayload;
import com.nexuscontrol.contract.EventType;
import com.nexuscontrol.contract.ExecutionMode;
import com.nexuscontrol.integrity.ContentDigest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private InMemoryEventStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void append_assignsSequenceTimestampAndDigest() {
        String id = store.createDecision("dec-1");
        EventEnvelope created = store.append(id, Actor.human("alice"), created("noop"));
        EventEnvelope approved = store.append(id, Actor.human("bob"), new EventPayload.ApprovalGranted(null, null));

        assertEquals(0, created.sequenceNumber());
        assertEquals(1, approved.sequenceNumber());
        assertEquals("evt_dec-1_0", created.eventId());
        assertEquals(NOW, created.occurredAt());
        assertEquals(EventType.DECISION_CREATED, created.eventType());
        assertEquals(ContentDigest.ofEvent(EventType.DECISION_CREATED, created.payload()), created.digest());
        assertEquals(1, store.latestSequence(id));
    }

    @Test
    void createDecision_generatesIdWhenAbsent() {
        String id = store.createDecision(null);
        assertNotNull(id);
        assertTrue(store.exists(id));
        assertEquals(-1, store.latestSequence(id));
    }

    @Test
    void createDecision_rejectsDuplicateId() {
        store.createDecision("dup");
        assertThrows(IllegalStateException.class, () -> store.createDecision("dup"));
    }

    @Test
    void unknownDecision_isNotFound() {
        assertThrows(DecisionNotFoundException.class, () -> store.read("missing"));
        assertThrows(DecisionNotFoundException.class,
            () -> store.append("missing", Actor.human("a"), created("x")));
        assertFalse(store.exists("missing"));
    }

    @Test
    void read_returnsImmutableSnapshot() {
        String id = store.createDecision("snap");
        store.append(id, Actor.human("alice"), created("noop"));
        List<EventEnvelope> snapshot = store.read(id);

        store.append(id, Actor.human("bob"), new EventPayload.ApprovalGranted(null, null));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(snapshot.get(0)));
    }

    @Test
    void sequencesAreIndependentPerDecision() {
        String a = store.createDecision("a");
        String b = store.createDecision("b");
        store.append(a, Actor.human("x"), created("one"));
        store.append(a, Actor.human("x"), new EventPayload.ApprovalGranted(null, null));
        EventEnvelope firstOfB = store.append(b, Actor.human("x"), created("two"));

        assertEquals(0, firstOfB.sequenceNumber());
    }

    @Test
    void concurrentAppends_produceGapFreeSequence() throws Exception {
        String id = store.createDecision("busy");
        int writers = 8;
        int perWriter = 50;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            String approver = "approver-" + w;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                    store.append(id, Actor.human(approver), new EventPayload.ApprovalGranted(null, null));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        List<EventEnvelope> events = store.read(id);
        assertEquals(writers * perWriter, events.size());
        for (int i = 0; i < events.size(); i++) {
            assertEquals(i, events.get(i).sequenceNumber());
        }
    }

    @Test
    void listDecisions_appliesLimitAndOffset() {
        store.createDecision("d1");
        store.createDecision("d2");
        store.createDecision("d3");

        assertEquals(3, store.listDecisions(10, 0).size());
        assertEquals(1, store.listDecisions(1, 0).size());
        assertEquals(1, store.listDecisions(10, 2).size());
        assertTrue(store.listDecisions(0, 0).isEmpty());
    }

    @Test
    void importDecision_installsLogAndContinuesSequence() {
        String source = store.createDecision("src");
        store.append(source, Actor.human("alice"), created("noop"));
        store.append(source, Actor.human("bob"), new EventPayload.ApprovalGranted(null, null));
        List<EventEnvelope> moved = new ArrayList<>();
        for (EventEnvelope event : store.read(source)) {
            moved.add(new EventEnvelope("copy", event.sequenceNumber(), event.eventType(), event.occurredAt(),
                event.actor(), event.payload(), event.digest()));
        }

        store.importDecision("copy", moved);
        assertEquals(moved, store.read("copy"));
        assertEquals(2, store.append("copy", Actor.human("carol"), new EventPayload.ApprovalGranted(null, null))
            .sequenceNumber());
    }

    @Test
    void importDecision_rejectsExistingIdEmptyLogAndForeignEvents() {
        String id = store.createDecision("taken");
        EventEnvelope event = store.append(id, Actor.human("alice"), created("noop"));

        assertThrows(IllegalStateException.class, () -> store.importDecision("taken", List.of(event)));
        assertThrows(IllegalArgumentException.class, () -> store.importDecision("fresh", List.of()));
        assertThrows(IllegalArgumentException.class, () -> store.importDecision("fresh", List.of(event)));
        assertFalse(store.exists("fresh"));
    }

    private static EventPayload.DecisionCreated created(String goal) {
        return new EventPayload.DecisionCreated(goal, null, ExecutionMode.DRY_RUN, List.of(), null);
    }
}
