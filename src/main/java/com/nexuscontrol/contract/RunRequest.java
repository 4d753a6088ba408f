package com.nexuscontrol.contract;

/**
 * A router run request after boundary validation.
 *
 * @param adapterId null when the caller did not name an adapter
 * @param maxSteps  null when the caller did not tighten the step limit
 */
public record RunRequest(
    String goal,
    String plan,
    ExecutionMode mode,
    String adapterId,
    Integer maxSteps
) {

    public boolean dryRun() {
        return mode.isDryRun();
    }
}
