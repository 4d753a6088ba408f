package com.nexuscontrol.control;

import com.nexuscontrol.contract.Actor;
import com.nexuscontrol.contract.ExecutionMode;
import com.nexuscontrol.policy.PolicyOverrides;

/**
 * @param decisionId   requested id, null to generate one
 * @param mode         requested mode, null for dry_run
 * @param templateName template to take policy defaults from, or null
 * @param policyFields explicit policy values; overrides when a template is named
 */
public record CreateDecisionCommand(
    String decisionId,
    String goal,
    String plan,
    ExecutionMode mode,
    String comment,
    String templateName,
    PolicyOverrides policyFields,
    Actor actor
) {

    public static CreateDecisionCommand of(String goal, PolicyOverrides policyFields, Actor actor) {
        return new CreateDecisionCommand(null, goal, null, ExecutionMode.DRY_RUN, null, null, policyFields, actor);
    }
}
