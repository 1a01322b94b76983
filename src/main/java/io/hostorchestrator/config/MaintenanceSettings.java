package io.hostorchestrator.config;

import lombok.Builder;
import lombok.Value;

/**
 * How many workloads a drain evacuates at the same time.
 */
@Value
@Builder(toBuilder = true)
public class MaintenanceSettings {
    @Builder.Default
    int evacuationConcurrency = Constants.DEFAULT_EVACUATION_CONCURRENCY;
    
    public static MaintenanceSettings defaults() {
        return MaintenanceSettings.builder().build();
    }
}
