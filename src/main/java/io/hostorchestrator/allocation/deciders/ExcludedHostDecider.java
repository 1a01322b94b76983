package io.hostorchestrator.allocation.deciders;

import io.hostorchestrator.enums.Decision;
import io.hostorchestrator.models.HostSnapshot;
import io.hostorchestrator.models.PlacementRequest;

/**
 * Skips hosts the request explicitly excludes, such as a migrating workload's current host.
 */
public class ExcludedHostDecider implements PlacementDecider {
    private boolean enabled = true;
    
    @Override
    public Decision canAllocate(PlacementRequest request, HostSnapshot host) {
        return request.getExcludedHostIds().contains(host.getHostId()) ? Decision.NO : Decision.YES;
    }
    
    @Override
    public String explainRejection(PlacementRequest request, HostSnapshot host) {
        return "host excluded by request";
    }
    
    @Override
    public String getName() { return "ExcludedHostDecider"; }
    
    @Override
    public boolean isEnabled() { return enabled; }
    
    @Override
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
