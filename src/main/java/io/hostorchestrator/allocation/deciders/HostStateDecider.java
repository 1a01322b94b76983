package io.hostorchestrator.allocation.deciders;

import io.hostorchestrator.enums.Decision;
import io.hostorchestrator.enums.HostState;
import io.hostorchestrator.models.HostSnapshot;
import io.hostorchestrator.models.PlacementRequest;

/**
 * Only ACTIVE hosts accept workloads; draining, maintenance and unreachable hosts are skipped.
 */
public class HostStateDecider implements PlacementDecider {
    private boolean enabled = true;
    
    @Override
    public Decision canAllocate(PlacementRequest request, HostSnapshot host) {
        return host.getHost().getState() == HostState.ACTIVE ? Decision.YES : Decision.NO;
    }
    
    @Override
    public String explainRejection(PlacementRequest request, HostSnapshot host) {
        return "host is " + host.getHost().getState();
    }
    
    @Override
    public String getName() { return "HostStateDecider"; }
    
    @Override
    public boolean isEnabled() { return enabled; }
    
    @Override
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
