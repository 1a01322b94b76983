package io.hostorchestrator.pool;

import java.time.Instant;

/**
 * Receives host-level health signals derived from connection outcomes.
 */
public interface PoolHealthListener {
    
    /**
     * Consecutive failures on a host reached the configured threshold. Called once per outage.
     */
    void onHostUnreachable(String hostId, int consecutiveFailures, String lastError);
    
    /**
     * A connection was opened again after the host had been reported unreachable.
     */
    void onHostRecovered(String hostId);
    
    void onProbeSucceeded(String hostId, Instant at);
}
