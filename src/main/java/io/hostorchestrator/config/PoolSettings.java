package io.hostorchestrator.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

import static io.hostorchestrator.config.Constants.*;

/**
 * Per-host connection pool sizing, recycling, health-check and reconnect backoff settings.
 */
@Value
@Builder(toBuilder = true)
public class PoolSettings {
    @Builder.Default
    int minConnections = DEFAULT_POOL_MIN_CONNECTIONS;
    @Builder.Default
    int maxConnections = DEFAULT_POOL_MAX_CONNECTIONS;
    @Builder.Default
    Duration ttl = Duration.ofSeconds(DEFAULT_POOL_TTL_SECONDS);
    @Builder.Default
    Duration checkoutTimeout = Duration.ofMillis(DEFAULT_POOL_CHECKOUT_TIMEOUT_MILLIS);
    @Builder.Default
    int checkoutRetries = DEFAULT_POOL_CHECKOUT_RETRIES;
    @Builder.Default
    Duration healthCheckInterval = Duration.ofSeconds(DEFAULT_HEALTH_CHECK_INTERVAL_SECONDS);
    @Builder.Default
    int failureThreshold = DEFAULT_HEALTH_FAILURE_THRESHOLD;
    @Builder.Default
    Duration backoffBase = Duration.ofMillis(DEFAULT_BACKOFF_BASE_MILLIS);
    @Builder.Default
    Duration backoffMax = Duration.ofMillis(DEFAULT_BACKOFF_MAX_MILLIS);
    
    public static PoolSettings defaults() {
        return PoolSettings.builder().build();
    }
    
    public void validate() {
        if (minConnections < 0 || maxConnections < 1 || minConnections > maxConnections) {
            throw new IllegalArgumentException("Invalid pool bounds [" + minConnections + ", " + maxConnections + "]");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be at least 1");
        }
    }
}
