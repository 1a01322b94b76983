package io.hostorchestrator.allocation;

import io.hostorchestrator.models.HostSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Spread selection: the least loaded host wins.
 * 
 * Ordering is allocated vCPU fraction, then allocated memory fraction, then host id,
 * where allocations include in-flight reservations.
 */
@Slf4j
public class SpreadSelectionStrategy implements HostSelectionStrategy {
    
    static final Comparator<HostSnapshot> SPREAD_ORDER = Comparator
        .comparingDouble(HostSnapshot::vcpuFraction)
        .thenComparingDouble(HostSnapshot::memoryFraction)
        .thenComparing(HostSnapshot::getHostId);
    
    @Override
    public Optional<HostSnapshot> selectHost(List<HostSnapshot> eligibleHosts) {
        Optional<HostSnapshot> selected = eligibleHosts.stream().min(SPREAD_ORDER);
        selected.ifPresent(host -> log.debug("Spread strategy selected host {} (vcpu {}, memory {}) among {} candidates",
            host.getHostId(), host.vcpuFraction(), host.memoryFraction(), eligibleHosts.size()));
        return selected;
    }
    
    @Override
    public String getStrategyName() {
        return "Spread";
    }
}
