package io.hostorchestrator.models;

import lombok.Value;

/**
 * Point-in-time view of a host and its allocation, evaluated by the placement deciders.
 */
@Value
public class HostSnapshot {
    Host host;
    HostAllocation allocation;
    ResourceSpec effectiveCapacity;
    
    public String getHostId() {
        return host.getHostId();
    }
    
    public ResourceSpec getAvailable() {
        return effectiveCapacity.minus(allocation.getCommitted());
    }
    
    public double vcpuFraction() {
        return fraction(allocation.getCommitted().getVcpus(), host.getCapacity().getVcpus());
    }
    
    public double memoryFraction() {
        return fraction(allocation.getCommitted().getMemoryMib(), host.getCapacity().getMemoryMib());
    }
    
    private static double fraction(long used, long declared) {
        if (declared <= 0) {
            return used > 0 ? Double.POSITIVE_INFINITY : 0.0d;
        }
        return (double) used / (double) declared;
    }
}
