package com.nexuscontrol.dispatch;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.ContractViolationException;
import com.nexuscontrol.contract.EventPayload;
import com.nexuscontrol.contract.RunRequest;
import com.nexuscontrol.contract.RunRequestValidator;
import com.nexuscontrol.integrity.ContentDigest;
import com.nexuscontrol.policy.Policy;
import com.nexuscontrol.policy.PolicyValidationResult;
import com.nexuscontrol.policy.PolicyValidator;
import com.nexuscontrol.policy.PolicyViolationException;
import com.nexuscontrol.projection.Decision;
import com.nexuscontrol.projection.DecisionState;
import com.nexuscontrol.projection.ProjectionService;
import com.nexuscontrol.store.EventLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches approved decisions to adapters.
 *
 * Every refusal (bad request, missing policy, closed apply gate, policy
 * violation) happens before the first event is written. Once
 * EXECUTION_REQUESTED is appended the cycle always ends with
 * EXECUTION_COMPLETED or EXECUTION_FAILED, unless the store itself fails.
 *
 * A run holds the decision's writer lock from the first check to the final
 * append, so approvals, revocations and policy changes on the same decision
 * wait for it. Runs on different decisions proceed in parallel.
 */
public class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    public static final String ROUTER_TOOL = "nexus-router";
    public static final String ROUTER_METHOD = "run";
    public static final Actor ROUTER_ACTOR = Actor.system("nexus-router");

    private final RunRequestValidator requestValidator;
    private final PolicyValidator policyValidator;
    private final ProjectionService projectionService;
    private final EventLogService eventLog;
    private final AdapterRegistry adapters;
    private final ExecutorService adapterExecutor;
    private final RouterProperties properties;

    public Router(RunRequestValidator requestValidator,
                  PolicyValidator policyValidator,
                  ProjectionService projectionService,
                  EventLogService eventLog,
                  AdapterRegistry adapters,
                  ExecutorService adapterExecutor,
                  RouterProperties properties) {
        this.requestValidator = requestValidator;
        this.policyValidator = policyValidator;
        this.projectionService = projectionService;
        this.eventLog = eventLog;
        this.adapters = adapters;
        this.adapterExecutor = adapterExecutor;
        this.properties = properties;
    }

    /**
     * @throws ContractViolationException   malformed request, no policy, or goal mismatch
     * @throws AdapterNotFoundException     no adapter matches the requested id or kind
     * @throws ApplyNotPermittedException   apply requested but not permitted
     * @throws PolicyViolationException     the policy rejects the run
     * @throws IllegalStateException        the decision already completed or is executing
     */
    public RunResponse run(String decisionId, Map<String, Object> request, Actor actor) {
        RunRequest runRequest = requestValidator.validate(request);
        return eventLog.withDecisionLock(decisionId, () -> dispatch(decisionId, runRequest, actor));
    }

    private RunResponse dispatch(String decisionId, RunRequest request, Actor actor) {
        Decision decision = projectionService.load(decisionId);
        Policy policy = decision.getPolicy();
        if (policy == null) {
            throw new ContractViolationException("Decision " + decisionId + " has no policy attached");
        }
        if (!request.goal().equals(decision.getGoal())) {
            throw new ContractViolationException(
                "goal '" + request.goal() + "' does not match decision goal '" + decision.getGoal() + "'");
        }
        if (decision.getState() == DecisionState.COMPLETED) {
            throw new IllegalStateException("Decision " + decisionId
                + " has already been executed successfully (run_id=" + decision.getLatestRunId() + ")");
        }
        if (decision.getState() == DecisionState.EXECUTING) {
            throw new IllegalStateException("Decision " + decisionId + " is already executing");
        }

        DispatchAdapter adapter = adapters.resolve(
            request.adapterId() != null ? request.adapterId() : properties.defaultAdapterId());

        if (!request.dryRun()) {
            checkApplyGate(adapter);
        }

        PolicyValidationResult validation = policyValidator.validateExecutionRequest(
            policy, request.mode(), decision.getActiveApprovalCount(), adapter.capabilities());
        if (!validation.isValid()) {
            log.warn("Run rejected by policy for decision={}: {}", decisionId, validation.errors());
            throw new PolicyViolationException(validation);
        }

        Integer maxSteps = stricterLimit(policy.maxSteps(), request.maxSteps());
        Map<String, Object> compiled = policy.withMaxSteps(maxSteps).compileToRouterRequest(
            decision.getGoal(),
            request.plan() != null ? request.plan() : decision.getPlan(),
            adapter.adapterId(),
            request.dryRun());
        String requestDigest = ContentDigest.of(compiled);
        String runId = "run_" + UUID.randomUUID();

        eventLog.append(decisionId, actor, new EventPayload.ExecutionRequested(adapter.adapterId(), request.dryRun()));
        eventLog.append(decisionId, ROUTER_ACTOR, new EventPayload.ExecutionStarted(requestDigest, runId));
        log.info("Dispatching decision={} run_id={} adapter={} mode={}",
            decisionId, runId, adapter.adapterId(), request.mode().getValue());

        Map<String, Object> response;
        try {
            response = callAdapter(adapter, compiled);
        } catch (AdapterCallFailure failure) {
            return fail(decisionId, runId, adapter, request, requestDigest, failure.code, failure.getMessage());
        }

        int steps = response.get("steps_executed") instanceof Number number ? number.intValue() : 1;
        if (maxSteps != null && steps > maxSteps) {
            return fail(decisionId, runId, adapter, request, requestDigest, RunResponse.MAX_STEPS_EXCEEDED,
                "Adapter executed " + steps + " steps, exceeding max_steps " + maxSteps);
        }

        String responseDigest;
        try {
            responseDigest = ContentDigest.of(response);
        } catch (IllegalArgumentException ex) {
            return fail(decisionId, runId, adapter, request, requestDigest, RunResponse.ADAPTER_ERROR,
                "Adapter response is not serializable: " + ex.getMessage());
        }

        eventLog.append(decisionId, ROUTER_ACTOR, new EventPayload.ExecutionCompleted(runId, responseDigest, steps));
        log.info("Execution completed decision={} run_id={} steps={}", decisionId, runId, steps);
        return new RunResponse(decisionId, runId, adapter.adapterId(), request.mode(), requestDigest,
            responseDigest, steps, RunResponse.Status.COMPLETED, null, null);
    }

    private void checkApplyGate(DispatchAdapter adapter) {
        if (!properties.applyAllowed()) {
            throw new ApplyNotPermittedException("Apply mode is disabled on this router (nexus.router.apply-allowed=false)");
        }
        if (!adapter.capabilities().contains(Capabilities.APPLY)) {
            throw new ApplyNotPermittedException(
                "Adapter '" + adapter.adapterId() + "' does not declare the apply capability");
        }
    }

    private Map<String, Object> callAdapter(DispatchAdapter adapter, Map<String, Object> compiled) {
        Duration timeout = properties.adapterTimeout();
        Future<Map<String, Object>> future;
        try {
            future = adapterExecutor.submit(() -> adapter.call(ROUTER_TOOL, ROUTER_METHOD, compiled));
        } catch (RejectedExecutionException ex) {
            throw new AdapterCallFailure(RunResponse.ADAPTER_ERROR, "Adapter pool is saturated");
        }

        try {
            Map<String, Object> response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return response == null ? Map.of() : response;
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new AdapterCallFailure(RunResponse.TIMEOUT,
                "Adapter '" + adapter.adapterId() + "' did not respond within " + timeout);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            String code = cause instanceof AdapterException adapterError && adapterError.getErrorCode() != null
                ? adapterError.getErrorCode()
                : RunResponse.ADAPTER_ERROR;
            throw new AdapterCallFailure(code, String.valueOf(cause.getMessage()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new AdapterCallFailure(RunResponse.ADAPTER_ERROR, "Interrupted while waiting for adapter");
        }
    }

    private RunResponse fail(String decisionId, String runId, DispatchAdapter adapter, RunRequest request,
                             String requestDigest, String code, String message) {
        eventLog.append(decisionId, ROUTER_ACTOR, new EventPayload.ExecutionFailed(code, message, runId));
        log.warn("Execution failed decision={} run_id={} error_code={}: {}", decisionId, runId, code, message);
        return new RunResponse(decisionId, runId, adapter.adapterId(), request.mode(), requestDigest,
            null, null, RunResponse.Status.FAILED, code, message);
    }

    static Integer stricterLimit(Integer policyLimit, Integer requestLimit) {
        if (policyLimit == null) {
            return requestLimit;
        }
        if (requestLimit == null) {
            return policyLimit;
        }
        return Math.min(policyLimit, requestLimit);
    }

    private static final class AdapterCallFailure extends RuntimeException {
        private final String code;

        private AdapterCallFailure(String code, String message) {
            super(message);
            this.code = code;
        }
    }
}
