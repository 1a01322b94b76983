package io.hostorchestrator.allocation;

import io.hostorchestrator.allocation.deciders.*;
import io.hostorchestrator.enums.Decision;
import io.hostorchestrator.models.HostSnapshot;
import io.hostorchestrator.models.PlacementRequest;
import io.hostorchestrator.pool.HostHealthView;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Placement decision engine that chains multiple PlacementDeciders.
 * 
 * Evaluates all enabled deciders and returns hosts that pass all checks.
 * Callers must explicitly enable the deciders they want to use.
 */
@Slf4j
public class PlacementDecisionEngine {
    
    private final Map<Class<? extends PlacementDecider>, PlacementDecider> availableDeciders;
    
    /**
     * List of currently enabled deciders, evaluated in enabling order.
     */
    private final List<PlacementDecider> enabledDeciders;
    
    public PlacementDecisionEngine(HostHealthView healthView) {
        this.availableDeciders = new HashMap<>();
        this.enabledDeciders = new CopyOnWriteArrayList<>();
        
        // Register all available deciders
        registerDecider(ExcludedHostDecider.class, new ExcludedHostDecider());
        registerDecider(HostStateDecider.class, new HostStateDecider());
        registerDecider(LabelConstraintDecider.class, new LabelConstraintDecider());
        registerDecider(CapacityDecider.class, new CapacityDecider());
        registerDecider(PoolHealthDecider.class, new PoolHealthDecider(healthView));
    }
    
    /**
     * Engine with every registered decider enabled; cheap checks run before the pool health lookup.
     */
    public static PlacementDecisionEngine withAllDeciders(HostHealthView healthView) {
        PlacementDecisionEngine engine = new PlacementDecisionEngine(healthView);
        engine.enableDecider(ExcludedHostDecider.class);
        engine.enableDecider(HostStateDecider.class);
        engine.enableDecider(LabelConstraintDecider.class);
        engine.enableDecider(CapacityDecider.class);
        engine.enableDecider(PoolHealthDecider.class);
        return engine;
    }
    
    /**
     * Get hosts eligible for the request by applying all enabled deciders.
     */
    public List<HostSnapshot> getEligibleHosts(PlacementRequest request, List<HostSnapshot> candidateHosts) {
        List<HostSnapshot> selectedHosts = new ArrayList<>();
        
        // If no deciders enabled, return empty list
        if (enabledDeciders.isEmpty()) {
            return selectedHosts;
        }
        
        for (HostSnapshot host : candidateHosts) {
            if (findRejectingDecider(request, host) == null) {
                selectedHosts.add(host);
            }
        }
        return selectedHosts;
    }
    
    /**
     * Reason the first rejecting decider gives for this host, or null if the host is eligible.
     */
    public String explainRejection(PlacementRequest request, HostSnapshot host) {
        if (enabledDeciders.isEmpty()) {
            return "no placement deciders enabled";
        }
        PlacementDecider decider = findRejectingDecider(request, host);
        return decider != null ? decider.explainRejection(request, host) : null;
    }
    
    /**
     * Rejection reason per host id, for hosts that are not eligible.
     */
    public Map<String, Object> explainRejections(PlacementRequest request, List<HostSnapshot> candidateHosts) {
        Map<String, Object> reasons = new LinkedHashMap<>();
        for (HostSnapshot host : candidateHosts) {
            String reason = explainRejection(request, host);
            if (reason != null) {
                reasons.put(host.getHostId(), reason);
            }
        }
        return reasons;
    }
    
    private PlacementDecider findRejectingDecider(PlacementRequest request, HostSnapshot host) {
        Decision finalDecision = Decision.YES;
        for (PlacementDecider decider : enabledDeciders) {
            if (!decider.isEnabled()) continue;
            
            Decision deciderResult = decider.canAllocate(request, host);
            finalDecision = finalDecision.merge(deciderResult);
            
            if (finalDecision == Decision.NO) {
                log.debug("Host {} rejected for workload {} by {}", host.getHostId(), request.getWorkloadId(), decider.getName());
                return decider;
            }
        }
        return null;
    }
    
    /**
     * Enable a decider.
     */
    public void enableDecider(Class<? extends PlacementDecider> deciderClass) {
        PlacementDecider decider = availableDeciders.get(deciderClass);
        if (decider != null && !enabledDeciders.contains(decider)) {
            decider.setEnabled(true);
            enabledDeciders.add(decider);
        }
    }
    
    /**
     * Disable a decider.
     */
    public void disableDecider(Class<? extends PlacementDecider> deciderClass) {
        PlacementDecider decider = availableDeciders.get(deciderClass);
        if (decider != null) {
            decider.setEnabled(false);
            enabledDeciders.remove(decider);
        }
    }
    
    /**
     * Register a decider.
     */
    public void registerDecider(Class<? extends PlacementDecider> deciderClass, PlacementDecider decider) {
        availableDeciders.put(deciderClass, decider);
    }
}
