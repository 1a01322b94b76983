package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;

import java.time.Duration;
import java.util.Map;

/**
 * Every connection of a host pool is checked out and the checkout timeout elapsed.
 */
public class PoolExhaustedException extends OrchestrationException {
    
    public PoolExhaustedException(String hostId, int maxConnections, Duration waited) {
        super(ErrorCode.POOL_EXHAUSTED,
            "Connection pool for host " + hostId + " exhausted (max " + maxConnections + ", waited " + waited.toMillis() + "ms)",
            Map.of("host_id", hostId, "max_connections", maxConnections, "waited_ms", waited.toMillis()));
    }
}
