package io.hostorchestrator.allocation.deciders;

import io.hostorchestrator.enums.Decision;
import io.hostorchestrator.enums.ResourceDimension;
import io.hostorchestrator.models.HostSnapshot;
import io.hostorchestrator.models.PlacementRequest;
import io.hostorchestrator.models.ResourceSpec;

/**
 * Available capacity (effective capacity minus allocations and in-flight reservations) must cover
 * the request in every dimension.
 */
public class CapacityDecider implements PlacementDecider {
    private boolean enabled = true;
    
    @Override
    public Decision canAllocate(PlacementRequest request, HostSnapshot host) {
        return request.getResources().fitsWithin(host.getAvailable()) ? Decision.YES : Decision.NO;
    }
    
    @Override
    public String explainRejection(PlacementRequest request, HostSnapshot host) {
        ResourceSpec available = host.getAvailable();
        ResourceDimension shortfall = request.getResources().firstShortfall(available);
        if (shortfall == null) {
            return "insufficient capacity";
        }
        return "insufficient " + shortfall.getValue() + ": requested " + request.getResources().get(shortfall)
            + ", available " + available.get(shortfall);
    }
    
    @Override
    public String getName() { return "CapacityDecider"; }
    
    @Override
    public boolean isEnabled() { return enabled; }
    
    @Override
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
