package io.hostorchestrator.pool;

/**
 * Connection health as seen by the scheduler.
 */
public interface HostHealthView {
    
    boolean isHealthy(String hostId);
}
