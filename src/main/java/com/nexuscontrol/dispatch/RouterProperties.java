package com.nexuscontrol.dispatch;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * @param applyAllowed     global switch for apply mode; off means every apply run is refused
 * @param adapterTimeout   how long the router waits for an adapter call
 * @param defaultAdapterId adapter used when a run request names none
 * @param workerThreads    size of the adapter call pool
 * @param queueCapacity    pending adapter calls beyond which new runs fail fast
 */
@ConfigurationProperties(prefix = "nexus.router")
public record RouterProperties(
    boolean applyAllowed,
    Duration adapterTimeout,
    String defaultAdapterId,
    int workerThreads,
    int queueCapacity
) {

    public RouterProperties {
        adapterTimeout = adapterTimeout == null ? Duration.ofSeconds(30) : adapterTimeout;
        if (adapterTimeout.isNegative() || adapterTimeout.isZero()) {
            throw new IllegalArgumentException("nexus.router.adapter-timeout must be positive");
        }
        defaultAdapterId = defaultAdapterId == null || defaultAdapterId.isBlank()
            ? StdoutAdapter.KIND
            : defaultAdapterId;
        workerThreads = workerThreads <= 0 ? 4 : workerThreads;
        queueCapacity = queueCapacity <= 0 ? 64 : queueCapacity;
    }

    public static RouterProperties defaults() {
        return new RouterProperties(false, null, null, 0, 0);
    }

    public RouterProperties withApplyAllowed(boolean allowed) {
        return new RouterProperties(allowed, adapterTimeout, defaultAdapterId, workerThreads, queueCapacity);
    }

    public RouterProperties withAdapterTimeout(Duration timeout) {
        return new RouterProperties(applyAllowed, timeout, defaultAdapterId, workerThreads, queueCapacity);
    }
}
