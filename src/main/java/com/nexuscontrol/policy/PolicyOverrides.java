package com.nexuscontrol.policy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-level overrides applied on top of a template. A null field means the
 * template value is kept. Lists replace, they do not merge.
 */
public record PolicyOverrides(
    Integer minApprovals,
    List<String> allowedModes,
    List<String> requireAdapterCapabilities,
    Integer maxSteps,
    List<String> labels
) {

    public static PolicyOverrides none() {
        return new PolicyOverrides(null, null, null, null, null);
    }

    public boolean isEmpty() {
        return toMap().isEmpty();
    }

    public Policy applyTo(Policy base) {
        return new Policy(
            minApprovals != null ? minApprovals : base.minApprovals(),
            allowedModes != null ? allowedModes : base.allowedModes(),
            requireAdapterCapabilities != null ? requireAdapterCapabilities : base.requireAdapterCapabilities(),
            maxSteps != null ? maxSteps : base.maxSteps(),
            labels != null ? labels : base.labels()
        );
    }

    /** Only the overrides that were actually supplied, keyed like policy fields. */
    public Map<String, Object> toMap() {
        Map<String, Object> applied = new LinkedHashMap<>();
        if (minApprovals != null) {
            applied.put("min_approvals", minApprovals);
        }
        if (allowedModes != null) {
            applied.put("allowed_modes", List.copyOf(allowedModes));
        }
        if (requireAdapterCapabilities != null) {
            applied.put("require_adapter_capabilities", List.copyOf(requireAdapterCapabilities));
        }
        if (maxSteps != null) {
            applied.put("max_steps", maxSteps);
        }
        if (labels != null) {
            applied.put("labels", List.copyOf(labels));
        }
        return applied;
    }
}
