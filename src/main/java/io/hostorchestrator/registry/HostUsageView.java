package io.hostorchestrator.registry;

/**
 * Read access to what is assigned to a host, consulted by deregistration.
 */
public interface HostUsageView {
    
    int workloadCount(String hostId);
    
    int reservationCount(String hostId);
}
