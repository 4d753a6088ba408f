package com.nexuscontrol.policy;

import com.nexuscontrol.contract.ExecutionMode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PolicyValidatorTest {

    private final PolicyValidator validator = new PolicyValidator();

    @Test
    void satisfiedPolicy_isValid() {
        PolicyValidationResult result = validator.validateExecutionRequest(
            Policy.defaults(), ExecutionMode.DRY_RUN, 1, Set.of("dry_run"));
        assertTrue(result.isValid());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void disallowedMode_isReported() {
        PolicyValidationResult result = validator.validateExecutionRequest(
            Policy.defaults(), ExecutionMode.APPLY, 1, null);
        assertFalse(result.isValid());
        assertEquals(List.of("Mode 'apply' not allowed by policy (allowed: [dry_run])"), result.errors());
    }

    @Test
    void insufficientApprovals_isReported() {
        PolicyValidationResult result = validator.validateExecutionRequest(
            Policy.defaults(), ExecutionMode.DRY_RUN, 0, null);
        assertEquals(List.of("Insufficient approvals: 0 < 1 required"), result.errors());
    }

    @Test
    void missingCapabilities_listedInDeclarationOrder() {
        Policy policy = Policy.defaults().withRequiredCapabilities(List.of("timeout", "dry_run", "external"));
        PolicyValidationResult result = validator.validateExecutionRequest(
            policy, ExecutionMode.DRY_RUN, 1, Set.of("dry_run"));
        assertEquals(List.of("Adapter missing required capabilities: [timeout, external]"), result.errors());
    }

    @Test
    void unknownCapabilities_skipCapabilityCheck() {
        Policy policy = Policy.defaults().withRequiredCapabilities(List.of("timeout"));
        assertTrue(validator.validateExecutionRequest(policy, ExecutionMode.DRY_RUN, 1, null).isValid());
    }

    @Test
    void allViolations_areAccumulated() {
        Policy policy = new Policy(2, List.of("dry_run"), List.of("external"), null, List.of());
        PolicyValidationResult result = validator.validateExecutionRequest(
            policy, ExecutionMode.APPLY, 1, Set.of("dry_run", "apply"));
        assertEquals(3, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("Mode 'apply' not allowed"));
        assertEquals("Insufficient approvals: 1 < 2 required", result.errors().get(1));
        assertEquals("Adapter missing required capabilities: [external]", result.errors().get(2));
    }

    @Test
    void validation_isDeterministic() {
        Policy policy = new Policy(3, List.of("dry_run"), List.of("a", "b"), 4, List.of());
        PolicyValidationResult first = validator.validateExecutionRequest(policy, ExecutionMode.APPLY, 0, Set.of());
        PolicyValidationResult second = validator.validateExecutionRequest(policy, ExecutionMode.APPLY, 0, Set.of());
        assertEquals(first, second);
    }

    @Test
    void result_rejectsInconsistentValidity() {
        assertThrows(IllegalArgumentException.class,
            () -> new PolicyValidationResult(true, List.of("boom")));
    }

    @Test
    void violationException_carriesEveryError() {
        PolicyValidationResult result = validator.validateExecutionRequest(
            Policy.defaults(), ExecutionMode.APPLY, 0, null);
        PolicyViolationException ex = new PolicyViolationException(result);
        assertEquals(2, ex.getErrors().size());
        assertTrue(ex.getMessage().startsWith("Policy validation failed: "));
    }
}
