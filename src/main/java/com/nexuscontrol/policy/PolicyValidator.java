package com.nexuscontrol.policy;

import com.nexuscontrol.contract.ExecutionMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks a proposed execution against a policy. Deterministic, no side
 * effects, and every violated rule is reported rather than only the first.
 */
public class PolicyValidator {

    /**
     * @param adapterCapabilities capabilities of the resolved adapter, or null if unknown
     */
    public PolicyValidationResult validateExecutionRequest(Policy policy,
                                                           ExecutionMode mode,
                                                           int approvalCount,
                                                           Set<String> adapterCapabilities) {
        List<String> errors = new ArrayList<>();

        if (!policy.allowsMode(mode)) {
            errors.add("Mode '" + (mode == null ? null : mode.getValue())
                + "' not allowed by policy (allowed: " + policy.allowedModes() + ")");
        }

        if (approvalCount < policy.minApprovals()) {
            errors.add("Insufficient approvals: " + approvalCount + " < " + policy.minApprovals() + " required");
        }

        if (adapterCapabilities != null && !policy.requireAdapterCapabilities().isEmpty()) {
            List<String> missing = policy.requireAdapterCapabilities().stream()
                .filter(capability -> !adapterCapabilities.contains(capability))
                .toList();
            if (!missing.isEmpty()) {
                errors.add("Adapter missing required capabilities: " + missing);
            }
        }

        return PolicyValidationResult.of(errors);
    }
}
