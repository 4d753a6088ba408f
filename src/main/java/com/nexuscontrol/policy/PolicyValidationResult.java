package com.nexuscontrol.policy;

import java.util.List;

/**
 * Outcome of checking an execution request against a policy.
 * Valid exactly when {@code errors} is empty.
 */
public record PolicyValidationResult(boolean valid, List<String> errors) {

    public PolicyValidationResult {
        errors = List.copyOf(errors);
        if (valid != errors.isEmpty()) {
            throw new IllegalArgumentException("valid must be true exactly when there are no errors");
        }
    }

    public static PolicyValidationResult of(List<String> errors) {
        return new PolicyValidationResult(errors.isEmpty(), errors);
    }

    public boolean isValid() {
        return valid;
    }
}
