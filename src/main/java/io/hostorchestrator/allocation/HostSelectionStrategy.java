package io.hostorchestrator.allocation;

import io.hostorchestrator.models.HostSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Picks one host among the eligible candidates. Must be deterministic for identical input.
 */
public interface HostSelectionStrategy {
    
    Optional<HostSnapshot> selectHost(List<HostSnapshot> eligibleHosts);
    
    String getStrategyName();
}
