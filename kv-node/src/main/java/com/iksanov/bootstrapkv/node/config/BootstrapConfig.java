package com.iksanov.bootstrapkv.node.config;

import java.time.Duration;

/**
 * Tunables of the bootstrap driver and of its remote calls.
 */
public record BootstrapConfig(
        Duration fetchPeriod,
        int maxChunkSize,
        Duration requestTimeout,
        int maxRetries,
        Duration retryBackoff
) {
    public BootstrapConfig {
        if (fetchPeriod == null || fetchPeriod.isNegative()) throw new IllegalArgumentException("fetchPeriod must be >= 0");
        if (maxChunkSize <= 0) throw new IllegalArgumentException("maxChunkSize must be > 0");
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero())
            throw new IllegalArgumentException("requestTimeout must be > 0");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (retryBackoff == null || retryBackoff.isNegative()) throw new IllegalArgumentException("retryBackoff must be >= 0");
    }

    public static BootstrapConfig defaults() {
        return new BootstrapConfig(Duration.ofSeconds(1), 20, Duration.ofSeconds(5), 3, Duration.ofMillis(500));
    }

    @Override
    public String toString() {
        return String.format("BootstrapConfig[period=%dms, chunk=%d, timeout=%dms, retries=%d, backoff=%dms]",
                fetchPeriod.toMillis(), maxChunkSize, requestTimeout.toMillis(), maxRetries, retryBackoff.toMillis());
    }
}
