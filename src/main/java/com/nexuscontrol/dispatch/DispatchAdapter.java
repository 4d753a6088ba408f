package com.nexuscontrol.dispatch;

import java.util.Map;
import java.util.Set;

/**
 * Execution backend the router dispatches compiled requests to.
 *
 * Implementations must be safe to call from the router's worker threads.
 * Failures are reported by throwing; {@link AdapterException} lets the adapter
 * choose the error code recorded in EXECUTION_FAILED.
 */
public interface DispatchAdapter {

    /** Stable id, unique within a registry. */
    String adapterId();

    /** Adapter type, e.g. {@code stdout}. Several instances may share a kind. */
    String adapterKind();

    Set<String> capabilities();

    AdapterManifest manifest();

    /**
     * @return response object; {@code steps_executed}, when present and numeric,
     *         is taken as the number of steps the adapter performed
     */
    Map<String, Object> call(String tool, String method, Map<String, Object> args);
}
