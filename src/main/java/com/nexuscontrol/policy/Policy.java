package com.nexuscontrol.policy;

import com.nexuscontrol.contract.ExecutionMode;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Immutable rule set governing a decision's approval and execution.
 *
 * Invariants are checked at construction and violations raise
 * {@link IllegalArgumentException}. A changed policy is a new value.
 *
 * @param minApprovals               minimum distinct approvers, at least 1
 * @param allowedModes               non-empty, each element {@code dry_run} or {@code apply}
 * @param requireAdapterCapabilities capabilities the target adapter must declare
 * @param maxSteps                   step limit, null for unbounded
 * @param labels                     governance metadata, never forwarded to execution
 */
public record Policy(
    int minApprovals,
    List<String> allowedModes,
    List<String> requireAdapterCapabilities,
    Integer maxSteps,
    List<String> labels
) {

    public static final int DEFAULT_MIN_APPROVALS = 1;
    public static final List<String> DEFAULT_ALLOWED_MODES = List.of(ExecutionMode.DRY_RUN.getValue());

    public Policy {
        if (minApprovals < 1) {
            throw new IllegalArgumentException("min_approvals must be at least 1");
        }
        if (allowedModes == null || allowedModes.isEmpty()) {
            throw new IllegalArgumentException("allowed_modes cannot be empty");
        }
        for (String mode : allowedModes) {
            if (!ExecutionMode.isKnown(mode)) {
                throw new IllegalArgumentException("Invalid mode: " + mode);
            }
        }
        if (maxSteps != null && maxSteps < 1) {
            throw new IllegalArgumentException("max_steps must be at least 1 if specified");
        }
        allowedModes = List.copyOf(new LinkedHashSet<>(allowedModes));
        requireAdapterCapabilities = requireAdapterCapabilities == null
            ? List.of()
            : List.copyOf(new LinkedHashSet<>(requireAdapterCapabilities));
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public static Policy defaults() {
        return new Policy(DEFAULT_MIN_APPROVALS, DEFAULT_ALLOWED_MODES, List.of(), null, List.of());
    }

    public static Policy of(int minApprovals, ExecutionMode... allowedModes) {
        List<String> modes = Arrays.stream(allowedModes).map(ExecutionMode::getValue).toList();
        return new Policy(minApprovals, modes, List.of(), null, List.of());
    }

    public boolean allowsMode(ExecutionMode mode) {
        return mode != null && allowedModes.contains(mode.getValue());
    }

    public boolean hasStepLimit() {
        return maxSteps != null;
    }

    public Policy withMaxSteps(Integer newMaxSteps) {
        return new Policy(minApprovals, allowedModes, requireAdapterCapabilities, newMaxSteps, labels);
    }

    public Policy withRequiredCapabilities(List<String> capabilities) {
        return new Policy(minApprovals, allowedModes, capabilities, maxSteps, labels);
    }

    public Policy withLabels(List<String> newLabels) {
        return new Policy(minApprovals, allowedModes, requireAdapterCapabilities, maxSteps, newLabels);
    }

    /**
     * Compiles policy and decision parameters into the request forwarded to the
     * dispatcher. Labels are governance-only and are never included.
     */
    public Map<String, Object> compileToRouterRequest(String goal, String plan, String adapterId, boolean dryRun) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("goal", goal);
        request.put("adapter_id", adapterId);
        request.put("dry_run", dryRun);
        if (plan != null) {
            request.put("plan", plan);
        }
        if (maxSteps != null) {
            request.put("max_steps", maxSteps);
        }
        if (!requireAdapterCapabilities.isEmpty()) {
            request.put("require_capabilities", requireAdapterCapabilities);
        }
        return request;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("min_approvals", minApprovals);
        map.put("allowed_modes", allowedModes);
        map.put("require_adapter_capabilities", requireAdapterCapabilities);
        map.put("max_steps", maxSteps);
        map.put("labels", labels);
        return map;
    }
}
