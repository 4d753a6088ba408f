package com.nexuscontrol.control;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.ContractViolationException;
import com.nexuscontrol.contract.EventEnvelope;
import com.nexuscontrol.contract.EventPayload;
import com.nexuscontrol.contract.ExecutionMode;
import com.nexuscontrol.dispatch.Router;
import com.nexuscontrol.dispatch.RunResponse;
import com.nexuscontrol.integrity.EventIntegrityVerifier;
import com.nexuscontrol.integrity.EventIntegrityVerifier.IntegrityReport;
import com.nexuscontrol.policy.Policy;
import com.nexuscontrol.policy.PolicyOverrides;
import com.nexuscontrol.policy.TemplatedPolicy;
import com.nexuscontrol.projection.Approval;
import com.nexuscontrol.projection.Decision;
import com.nexuscontrol.projection.DecisionLifecycle;
import com.nexuscontrol.projection.DecisionState;
import com.nexuscontrol.projection.DecisionView;
import com.nexuscontrol.projection.ProjectionService;
import com.nexuscontrol.store.EventLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Decision lifecycle operations. Each one rebuilds the aggregate from the log,
 * checks the transition, then appends; a refused operation writes nothing.
 */
@Service
public class DecisionService {

    private static final Logger log = LoggerFactory.getLogger(DecisionService.class);

    private final EventLogService eventLog;
    private final ProjectionService projectionService;
    private final TemplateService templateService;
    private final Router router;
    private final Clock clock;

    public DecisionService(EventLogService eventLog,
                           ProjectionService projectionService,
                           TemplateService templateService,
                           Router router,
                           Clock clock) {
        this.eventLog = eventLog;
        this.projectionService = projectionService;
        this.templateService = templateService;
        this.router = router;
        this.clock = clock;
    }

    /**
     * Creates a decision and attaches its policy in one step.
     *
     * Without a template the supplied fields are used with defaults; when
     * {@code allowed_modes} is absent it is {@code [dry_run]} for a dry-run
     * request and {@code [dry_run, apply]} for an apply request. With a
     * template the fields act as overrides on top of the template snapshot.
     *
     * @throws ContractViolationException if goal or actor is missing, or the
     *                                    requested mode is not allowed by the resulting policy
     */
    public DecisionView create(CreateDecisionCommand command) {
        requireActor(command.actor());
        if (command.goal() == null || command.goal().isBlank()) {
            throw new ContractViolationException("goal is required");
        }
        ExecutionMode mode = command.mode() != null ? command.mode() : ExecutionMode.DRY_RUN;
        PolicyOverrides fields = command.policyFields() != null ? command.policyFields() : PolicyOverrides.none();

        // Everything that can be refused is resolved before the first append.
        EventPayload.PolicyAttached policyEvent;
        Policy effective;
        if (command.templateName() != null) {
            TemplatedPolicy templated = templateService.instantiate(command.templateName(), fields);
            effective = templated.effective();
            policyEvent = EventPayload.PolicyAttached.fromTemplate(effective, templated.templateName(),
                templated.snapshot(), templated.templateDigest(), templated.overridesApplied());
        } else {
            effective = fields.applyTo(defaultPolicyFor(mode));
            policyEvent = EventPayload.PolicyAttached.of(effective);
        }
        if (!effective.allowsMode(mode)) {
            throw new ContractViolationException("Requested mode '" + mode.getValue()
                + "' not in allowed_modes: " + effective.allowedModes());
        }

        String decisionId = eventLog.createDecision(command.decisionId());
        eventLog.withDecisionLock(decisionId, () -> {
            eventLog.append(decisionId, command.actor(), new EventPayload.DecisionCreated(
                command.goal(), command.plan(), mode, effective.labels(), command.comment()));
            return eventLog.append(decisionId, command.actor(), policyEvent);
        });
        log.info("Decision created decision={} mode={} min_approvals={} template={}",
            decisionId, mode.getValue(), effective.minApprovals(), command.templateName());
        return projectionService.view(decisionId);
    }

    /**
     * Replaces the decision's policy. Refused once an execution has started or
     * completed.
     */
    public DecisionView attachPolicy(String decisionId, Policy policy, Actor actor) {
        requireActor(actor);
        eventLog.withDecisionLock(decisionId, () -> {
            Decision decision = projectionService.load(decisionId);
            requireNotExecutingOrCompleted(decision, "attach a policy to");
            return eventLog.append(decisionId, actor, EventPayload.PolicyAttached.of(policy));
        });
        log.info("Policy attached decision={} min_approvals={} allowed_modes={}",
            decisionId, policy.minApprovals(), policy.allowedModes());
        return projectionService.view(decisionId);
    }

    public DecisionView attachTemplate(String decisionId, String templateName, PolicyOverrides overrides, Actor actor) {
        requireActor(actor);
        TemplatedPolicy templated = templateService.instantiate(templateName, overrides);
        eventLog.withDecisionLock(decisionId, () -> {
            Decision decision = projectionService.load(decisionId);
            requireNotExecutingOrCompleted(decision, "attach a policy to");
            return eventLog.append(decisionId, actor, EventPayload.PolicyAttached.fromTemplate(
                templated.effective(), templated.templateName(), templated.snapshot(),
                templated.templateDigest(), templated.overridesApplied()));
        });
        log.info("Policy attached decision={} from template={}", decisionId, templateName);
        return projectionService.view(decisionId);
    }

    /**
     * Grants approval. A second grant from an approver whose approval is still
     * active changes nothing and appends nothing.
     *
     * @param expiresAt optional; must lie in the future
     */
    public DecisionView approve(String decisionId, Actor actor, String comment, Instant expiresAt) {
        requireActor(actor);
        return eventLog.withDecisionLock(decisionId, () -> grant(decisionId, actor, comment, expiresAt));
    }

    private DecisionView grant(String decisionId, Actor actor, String comment, Instant expiresAt) {
        Decision decision = projectionService.load(decisionId);
        DecisionState state = decision.getState();
        if (state != DecisionState.PENDING_APPROVAL
                && state != DecisionState.APPROVED
                && state != DecisionState.FAILED) {
            throw new IllegalStateException("Cannot approve decision in state: " + state.getValue());
        }
        if (expiresAt != null && !expiresAt.isAfter(clock.instant())) {
            throw new IllegalArgumentException("expires_at must be in the future");
        }
        if (decision.hasActiveApprovalFrom(actor.id())) {
            log.info("Approval from {} already active on decision={}, nothing recorded", actor.id(), decisionId);
            return DecisionView.of(decision, DecisionLifecycle.DEFAULT_TIMELINE_LIMIT);
        }
        eventLog.append(decisionId, actor, new EventPayload.ApprovalGranted(expiresAt, comment));
        DecisionView view = projectionService.view(decisionId);
        log.info("Approval granted decision={} approver={} approvals={}/{}",
            decisionId, actor.id(), view.activeApprovals(), view.lifecycle().progress().approvalsRequired());
        return view;
    }

    /**
     * @throws IllegalStateException if execution has started or completed, or
     *                               the actor holds no unrevoked approval
     */
    public DecisionView revoke(String decisionId, Actor actor, String reason, String comment) {
        requireActor(actor);
        return eventLog.withDecisionLock(decisionId, () -> withdraw(decisionId, actor, reason, comment));
    }

    private DecisionView withdraw(String decisionId, Actor actor, String reason, String comment) {
        Decision decision = projectionService.load(decisionId);
        requireNotExecutingOrCompleted(decision, "revoke approval for");
        Approval approval = decision.getApprovals().get(actor.id());
        if (approval == null) {
            throw new IllegalStateException("Actor " + actor.id() + " has not approved this decision");
        }
        if (approval.revoked()) {
            throw new IllegalStateException("Actor " + actor.id() + "'s approval is already revoked");
        }
        eventLog.append(decisionId, actor, new EventPayload.ApprovalRevoked(reason, comment));
        log.info("Approval revoked decision={} approver={}", decisionId, actor.id());
        return projectionService.view(decisionId);
    }

    public RunResponse execute(String decisionId, Map<String, Object> request, Actor actor) {
        requireActor(actor);
        return router.run(decisionId, request, actor);
    }

    public DecisionView status(String decisionId) {
        return projectionService.view(decisionId);
    }

    public DecisionView status(String decisionId, int timelineLimit) {
        return projectionService.view(decisionId, timelineLimit);
    }

    public List<DecisionView.Summary> list(int limit, int offset) {
        return projectionService.list(limit, offset);
    }

    public List<EventEnvelope> events(String decisionId) {
        projectionService.load(decisionId);
        return eventLog.read(decisionId);
    }

    public IntegrityReport verifyIntegrity(String decisionId) {
        return EventIntegrityVerifier.verify(decisionId, events(decisionId));
    }

    public AuditRecord exportAudit(String decisionId) {
        Decision decision = projectionService.load(decisionId);
        List<EventEnvelope> events = decision.getEvents();
        return AuditRecord.of(new AuditRecord.Body(
            AuditRecord.SCHEMA_VERSION,
            clock.instant().toString(),
            DecisionView.of(decision, 0),
            List.copyOf(events),
            EventIntegrityVerifier.verify(decisionId, events)
        ));
    }

    private static Policy defaultPolicyFor(ExecutionMode mode) {
        return mode == ExecutionMode.APPLY
            ? Policy.of(Policy.DEFAULT_MIN_APPROVALS, ExecutionMode.DRY_RUN, ExecutionMode.APPLY)
            : Policy.defaults();
    }

    private static void requireNotExecutingOrCompleted(Decision decision, String action) {
        if (decision.getState() == DecisionState.EXECUTING || decision.getState() == DecisionState.COMPLETED) {
            throw new IllegalStateException(
                "Cannot " + action + " decision in state: " + decision.getState().getValue());
        }
    }

    private static void requireActor(Actor actor) {
        if (actor == null) {
            throw new ContractViolationException("actor is required");
        }
    }
}
