package com.nexuscontrol.integration;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.control.CreateDecisionCommand;
import com.nexuscontrol.control.DecisionService;
import com.nexuscontrol.integrity.EventIntegrityVerifier;
import com.nexuscontrol.policy.PolicyOverrides;
import com.nexuscontrol.projection.Decision;
import com.nexuscontrol.projection.DecisionView;
import com.nexuscontrol.projection.ProjectionService;
import com.nexuscontrol.store.EventStore;
import com.nexuscontrol.store.InMemoryEventStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Replaying a decision's log reproduces the live projection, and re-appending
 * the same payloads into a fresh store reproduces the same digests.
 */
@SpringBootTest
class ReplayConsistencyTest {

    @Autowired EventStore liveStore;
    @Autowired ProjectionService projectionService;
    @Autowired DecisionService decisions;

    @Test
    @DisplayName("Replay consistency: replayed projection matches live projection")
    void replayedProjection_matchesLiveProjection() {
        String id = runFullCycle();

        List<EventEnvelope> events = liveStore.read(id);
        Decision replayed = Decision.replay(id, events, Instant.now());

        assertEquals(projectionService.view(id, 0), DecisionView.of(replayed, 0));
        assertTrue(EventIntegrityVerifier.verify(id, events).valid());
    }

    @Test
    @DisplayName("Replay into a fresh store reproduces every digest")
    void replayIntoFreshStore_reproducesDigests() {
        String id = runFullCycle();
        List<EventEnvelope> live = liveStore.read(id);

        InMemoryEventStore replayStore = new InMemoryEventStore();
        replayStore.createDecision(id);
        for (EventEnvelope event : live) {
            replayStore.append(id, event.actor(), event.payload());
        }
        List<EventEnvelope> replayed = replayStore.read(id);

        assertEquals(live.size(), replayed.size());
        for (int i = 0; i < live.size(); i++) {
            assertEquals(live.get(i).digest(), replayed.get(i).digest(), "digest at seq " + i);
            assertEquals(live.get(i).eventId(), replayed.get(i).eventId());
        }
    }

    @Test
    @DisplayName("A prefix of the log replays to the historical state")
    void prefixReplay_reproducesHistoricalState() {
        String id = runFullCycle();
        List<EventEnvelope> events = liveStore.read(id);

        Decision beforeExecution = Decision.replay(id, events.subList(0, 4), Instant.now());
        assertTrue(beforeExecution.isApproved());
        assertTrue(beforeExecution.getExecutions().isEmpty());
        assertEquals(3, beforeExecution.getLastSequence());
    }

    private String runFullCycle() {
        Actor alice = Actor.human("alice");
        String id = decisions.create(CreateDecisionCommand.of("replay me",
            new PolicyOverrides(2, null, null, null, null), alice)).decisionId();
        decisions.approve(id, Actor.human("bob"), "ok", null);
        decisions.approve(id, Actor.human("carol"), null, null);
        decisions.execute(id, Map.of("goal", "replay me"), alice);
        assertEquals(7, liveStore.read(id).size());
        return id;
    }
}
