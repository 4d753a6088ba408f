package com.nexuscontrol.dispatch;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the built-in stdout adapter. Absent flags keep the adapter's
 * own defaults.
 */
@ConfigurationProperties(prefix = "nexus.adapters.stdout")
public record StdoutAdapterProperties(
    Boolean enabled,
    String adapterId,
    String prefix,
    Boolean includeTimestamp,
    Boolean includeArgs,
    Boolean jsonOutput,
    Boolean returnEcho
) {

    public boolean isEnabled() {
        return enabled == null || enabled;
    }

    public StdoutAdapter.Options toOptions() {
        StdoutAdapter.Options defaults = StdoutAdapter.Options.defaults();
        return new StdoutAdapter.Options(
            adapterId,
            prefix,
            includeTimestamp != null ? includeTimestamp : defaults.includeTimestamp(),
            includeArgs != null ? includeArgs : defaults.includeArgs(),
            jsonOutput != null ? jsonOutput : defaults.jsonOutput(),
            returnEcho != null ? returnEcho : defaults.returnEcho()
        );
    }
}
