package com.nexuscontrol.contract;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Boundary validator for router run requests.
 *
 * Required: goal (non-blank string). Optional: plan (string),
 * mode (dry_run|apply, default dry_run), adapter_id (string),
 * max_steps (positive integer). All violations are reported together.
 */
@Component
public class RunRequestValidator {

    public RunRequest validate(Map<String, Object> request) {
        if (request == null) {
            throw new ContractViolationException("request cannot be null");
        }
        List<String> violations = new ArrayList<>();

        String goal = null;
        if (!(request.get("goal") instanceof String text) || text.isBlank()) {
            violations.add("goal is required");
        } else {
            goal = text;
        }

        String plan = optionalString(request, "plan", violations);
        String adapterId = optionalString(request, "adapter_id", violations);
        if (adapterId != null && adapterId.isBlank()) {
            violations.add("adapter_id must not be blank");
        }

        ExecutionMode mode = ExecutionMode.DRY_RUN;
        Object rawMode = request.get("mode");
        if (rawMode != null) {
            if (rawMode instanceof String text && ExecutionMode.isKnown(text)) {
                mode = ExecutionMode.fromValue(text);
            } else {
                violations.add("mode must be one of: dry_run, apply (got " + rawMode + ")");
            }
        }

        Integer maxSteps = null;
        Object rawMaxSteps = request.get("max_steps");
        if (rawMaxSteps != null) {
            if ((rawMaxSteps instanceof Integer || rawMaxSteps instanceof Long)
                    && ((Number) rawMaxSteps).longValue() >= 1
                    && ((Number) rawMaxSteps).longValue() <= Integer.MAX_VALUE) {
                maxSteps = ((Number) rawMaxSteps).intValue();
            } else {
                violations.add("max_steps must be a positive integer (got " + rawMaxSteps + ")");
            }
        }

        if (!violations.isEmpty()) {
            throw new ContractViolationException(violations);
        }
        return new RunRequest(goal, plan, mode, adapterId, maxSteps);
    }

    private String optionalString(Map<String, Object> request, String field, List<String> violations) {
        Object value = request.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            violations.add(field + " must be a string");
            return null;
        }
        return text;
    }
}
