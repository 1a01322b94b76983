package io.hostorchestrator.allocation.deciders;

import io.hostorchestrator.enums.Decision;
import io.hostorchestrator.models.HostSnapshot;
import io.hostorchestrator.models.PlacementRequest;

/**
 * Interface for placement decision making.
 * 
 * Each PlacementDecider implements a specific rule for determining
 * whether a workload can be placed on a particular host.
 */
public interface PlacementDecider {
    
    /**
     * Determine if the workload can be placed on the host.
     * 
     * @param request the workload's requirements and constraints
     * @param host the candidate host with its current allocation
     * @return placement decision
     */
    Decision canAllocate(PlacementRequest request, HostSnapshot host);
    
    /**
     * Human-readable reason for a NO decision.
     */
    default String explainRejection(PlacementRequest request, HostSnapshot host) {
        return "rejected by " + getName();
    }
    
    /**
     * Get the name of this decider.
     */
    String getName();
    
    /**
     * Check if this decider is enabled.
     */
    boolean isEnabled();
    
    /**
     * Enable or disable this decider.
     */
    void setEnabled(boolean enabled);
}
