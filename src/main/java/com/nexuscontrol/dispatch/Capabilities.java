package com.nexuscontrol.dispatch;

/**
 * Capability names an adapter can declare. Policies refer to the same names in
 * {@code require_adapter_capabilities}.
 */
public final class Capabilities {

    public static final String DRY_RUN = "dry_run";
    public static final String APPLY = "apply";
    public static final String TIMEOUT = "timeout";
    public static final String EXTERNAL = "external";

    private Capabilities() {
    }
}
