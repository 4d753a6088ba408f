package com.nexuscontrol.projection;

import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.store.DecisionNotFoundException;
import com.nexuscontrol.store.EventStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Rebuilds decision state from the event log on every call. There is no
 * cached aggregate, so a read always reflects every committed event.
 */
@Service
public class ProjectionService {

    private final EventStore eventStore;
    private final Clock clock;

    public ProjectionService(EventStore eventStore, Clock clock) {
        this.eventStore = eventStore;
        this.clock = clock;
    }

    /**
     * @throws DecisionNotFoundException if no decision exists under that id
     */
    public Decision load(String decisionId) {
        List<EventEnvelope> events = eventStore.read(decisionId);
        Decision decision = Decision.replay(decisionId, events, clock.instant());
        if (!decision.exists()) {
            throw new DecisionNotFoundException(decisionId);
        }
        return decision;
    }

    public DecisionView view(String decisionId) {
        return DecisionView.of(load(decisionId), DecisionLifecycle.DEFAULT_TIMELINE_LIMIT);
    }

    public DecisionView view(String decisionId, int timelineLimit) {
        return DecisionView.of(load(decisionId), timelineLimit);
    }

    public DecisionLifecycle lifecycle(String decisionId) {
        return DecisionLifecycle.of(load(decisionId), DecisionLifecycle.DEFAULT_TIMELINE_LIMIT);
    }

    public List<DecisionView.Summary> list(int limit, int offset) {
        return eventStore.listDecisions(limit, offset).stream()
            .filter(header -> !eventStore.read(header.decisionId()).isEmpty())
            .map(header -> {
                Decision decision = Decision.replay(
                    header.decisionId(), eventStore.read(header.decisionId()), clock.instant());
                return new DecisionView.Summary(
                    decision.getDecisionId(),
                    decision.getState(),
                    decision.getGoal(),
                    decision.getActiveApprovalCount(),
                    decision.hasPolicy() ? decision.getPolicy().minApprovals() : null,
                    !DecisionLifecycle.blockingReasons(decision).isEmpty(),
                    header.createdAt().toString()
                );
            })
            .toList();
    }
}
