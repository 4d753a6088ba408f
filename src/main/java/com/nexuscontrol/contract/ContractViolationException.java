package com.nexuscontrol.contract;

import java.util.List;

/**
 * Raised when input crossing the service boundary is malformed or incomplete.
 * Nothing has been written to the event log when this is thrown.
 */
public class ContractViolationException extends RuntimeException {

    private final List<String> violations;

    public ContractViolationException(String message) {
        super(message);
        this.violations = List.of(message);
    }

    public ContractViolationException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
