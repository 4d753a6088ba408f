package com.nexuscontrol.integration;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.ContractViolationException;
import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.contract.EventType;
import com.nexuscontrol.contract.ExecutionMode;
import com.nexuscontrol.control.CreateDecisionCommand;
import com.nexuscontrol.control.DecisionService;
import com.nexuscontrol.dispatch.ApplyNotPermittedException;
import com.nexuscontrol.policy.PolicyOverrides;
import com.nexuscontrol.policy.PolicyViolationException;
import com.nexuscontrol.policy.TemplateNotFoundException;
import com.nexuscontrol.projection.DecisionLifecycle;
import com.nexuscontrol.projection.DecisionState;
import com.nexuscontrol.projection.DecisionView;
import com.nexuscontrol.store.DecisionNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Rejection paths: every refused operation leaves the log untouched.
 */
@SpringBootTest
class RejectionPathIntegrationTest {

    private static final Actor ALICE = Actor.human("alice");
    private static final Actor BOB = Actor.human("bob");

    @Autowired DecisionService decisions;

    private String newDecision(int minApprovals) {
        return decisions.create(CreateDecisionCommand.of("noop",
            new PolicyOverrides(minApprovals, null, null, null, null), ALICE)).decisionId();
    }

    private List<EventType> types(String id) {
        return decisions.events(id).stream().map(EventEnvelope::eventType).toList();
    }

    @Test
    @DisplayName("Execution without enough approvals is rejected and nothing is appended")
    void insufficientApprovals_rejected() {
        String id = newDecision(2);
        decisions.approve(id, BOB, null, null);

        PolicyViolationException ex = assertThrows(PolicyViolationException.class,
            () -> decisions.execute(id, Map.of("goal", "noop"), ALICE));
        assertEquals(List.of("Insufficient approvals: 1 < 2 required"), ex.getErrors());
        assertEquals(3, decisions.events(id).size());

        DecisionLifecycle lifecycle = decisions.status(id).lifecycle();
        assertTrue(lifecycle.isBlocked());
        assertEquals("Missing 1 approval", lifecycle.blockingReasons().get(0).message());
    }

    @Test
    @DisplayName("Apply is refused while the router gate is closed")
    void applyWithGateClosed_refused() {
        DecisionView created = decisions.create(new CreateDecisionCommand(null, "deploy", null,
            ExecutionMode.APPLY, null, null, PolicyOverrides.none(), ALICE));
        String id = created.decisionId();
        assertEquals(List.of("dry_run", "apply"), created.policy().get("allowed_modes"));
        decisions.approve(id, BOB, null, null);

        assertThrows(ApplyNotPermittedException.class,
            () -> decisions.execute(id, Map.of("goal", "deploy", "mode", "apply"), ALICE));
        assertFalse(types(id).contains(EventType.EXECUTION_REQUESTED));
    }

    @Test
    @DisplayName("Creating with a mode the policy forbids is refused before the decision exists")
    void createWithForbiddenMode_refused() {
        int before = decisions.list(1000, 0).size();
        ContractViolationException ex = assertThrows(ContractViolationException.class,
            () -> decisions.create(new CreateDecisionCommand(null, "deploy", null, ExecutionMode.APPLY, null, null,
                new PolicyOverrides(null, List.of("dry_run"), null, null, null), ALICE)));
        assertTrue(ex.getMessage().contains("Requested mode 'apply' not in allowed_modes"));
        assertEquals(before, decisions.list(1000, 0).size());
    }

    @Test
    @DisplayName("Revoking an approval drops the decision back below threshold")
    void revokedApproval_blocksExecution() {
        String id = newDecision(1);
        decisions.approve(id, BOB, null, null);
        DecisionView revoked = decisions.revoke(id, BOB, "changed my mind", null);

        assertEquals(DecisionState.PENDING_APPROVAL, revoked.state());
        assertEquals(0, revoked.activeApprovals());
        assertThrows(PolicyViolationException.class, () -> decisions.execute(id, Map.of("goal", "noop"), ALICE));
        assertThrows(IllegalStateException.class, () -> decisions.revoke(id, BOB, "again", null));
        assertThrows(IllegalStateException.class, () -> decisions.revoke(id, Actor.human("carol"), "never", null));
    }

    @Test
    @DisplayName("Duplicate approval from the same approver appends nothing")
    void duplicateApproval_isIdempotent() {
        String id = newDecision(2);
        decisions.approve(id, BOB, null, null);
        DecisionView again = decisions.approve(id, BOB, null, null);

        assertEquals(1, again.activeApprovals());
        assertEquals(3, decisions.events(id).size());
    }

    @Test
    @DisplayName("Completed decisions accept no further approvals, policies or runs")
    void completedDecision_isFrozen() {
        String id = newDecision(1);
        decisions.approve(id, BOB, null, null);
        decisions.execute(id, Map.of("goal", "noop"), ALICE);
        int size = decisions.events(id).size();

        assertThrows(IllegalStateException.class, () -> decisions.approve(id, Actor.human("carol"), null, null));
        assertThrows(IllegalStateException.class, () -> decisions.revoke(id, BOB, "late", null));
        assertThrows(IllegalStateException.class, () -> decisions.execute(id, Map.of("goal", "noop"), ALICE));
        assertEquals(size, decisions.events(id).size());
    }

    @Test
    @DisplayName("Past expiry, unknown decisions and unknown templates are refused")
    void invalidReferences_refused() {
        String id = newDecision(1);
        assertThrows(IllegalArgumentException.class,
            () -> decisions.approve(id, BOB, null, Instant.parse("2000-01-01T00:00:00Z")));
        assertThrows(DecisionNotFoundException.class, () -> decisions.status("dec_missing"));
        assertThrows(TemplateNotFoundException.class, () -> decisions.create(new CreateDecisionCommand(null,
            "noop", null, null, null, "no-such-template", null, ALICE)));
        assertThrows(ContractViolationException.class,
            () -> decisions.create(CreateDecisionCommand.of("noop", null, null)));
    }
}
