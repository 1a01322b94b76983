package io.hostorchestrator.allocation.deciders;

import io.hostorchestrator.enums.Decision;
import io.hostorchestrator.models.HostSnapshot;
import io.hostorchestrator.models.PlacementRequest;

/**
 * Host labels must satisfy every key=value term of the request's constraints.
 */
public class LabelConstraintDecider implements PlacementDecider {
    private boolean enabled = true;
    
    @Override
    public Decision canAllocate(PlacementRequest request, HostSnapshot host) {
        return request.getConstraints().matches(host.getHost().getLabels()) ? Decision.YES : Decision.NO;
    }
    
    @Override
    public String explainRejection(PlacementRequest request, HostSnapshot host) {
        return "labels " + host.getHost().getLabels() + " do not satisfy " + request.getConstraints();
    }
    
    @Override
    public String getName() { return "LabelConstraintDecider"; }
    
    @Override
    public boolean isEnabled() { return enabled; }
    
    @Override
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
