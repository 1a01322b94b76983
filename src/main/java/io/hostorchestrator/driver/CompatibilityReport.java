package io.hostorchestrator.driver;

import lombok.Value;

import java.util.List;

/**
 * Driver verdict on whether a workload can run on a target host
 * (CPU feature compatibility, shared storage reachability of its disks).
 */
@Value
public class CompatibilityReport {
    boolean compatible;
    List<String> reasons;
    
    public static CompatibilityReport compatible() {
        return new CompatibilityReport(true, List.of());
    }
    
    public static CompatibilityReport incompatible(List<String> reasons) {
        return new CompatibilityReport(false, List.copyOf(reasons));
    }
}
