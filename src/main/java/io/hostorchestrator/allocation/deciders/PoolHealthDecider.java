package io.hostorchestrator.allocation.deciders;

import io.hostorchestrator.enums.Decision;
import io.hostorchestrator.models.HostSnapshot;
import io.hostorchestrator.models.PlacementRequest;
import io.hostorchestrator.pool.HostHealthView;

/**
 * Decider that filters hosts whose connection pool has no live or obtainable connection.
 */
public class PoolHealthDecider implements PlacementDecider {
    private final HostHealthView healthView;
    private boolean enabled = true;
    
    public PoolHealthDecider(HostHealthView healthView) {
        this.healthView = healthView;
    }
    
    @Override
    public Decision canAllocate(PlacementRequest request, HostSnapshot host) {
        return healthView.isHealthy(host.getHostId()) ? Decision.YES : Decision.NO;
    }
    
    @Override
    public String explainRejection(PlacementRequest request, HostSnapshot host) {
        return "connection pool unhealthy";
    }
    
    @Override
    public String getName() { return "PoolHealthDecider"; }
    
    @Override
    public boolean isEnabled() { return enabled; }
    
    @Override
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
