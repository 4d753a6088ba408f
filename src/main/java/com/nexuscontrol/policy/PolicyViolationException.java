package com.nexuscontrol.policy;

import java.util.List;

/**
 * A request was rejected by policy. Carries every violated rule.
 */
public class PolicyViolationException extends RuntimeException {

    private final List<String> errors;

    public PolicyViolationException(PolicyValidationResult result) {
        super("Policy validation failed: " + String.join("; ", result.errors()));
        this.errors = result.errors();
    }

    public List<String> getErrors() {
        return errors;
    }
}
