package io.hostorchestrator.config;

import lombok.Builder;
import lombok.Value;

/**
 * Placement settings. Effective host capacity is declared capacity times the overcommit factor.
 */
@Value
@Builder(toBuilder = true)
public class SchedulerSettings {
    @Builder.Default
    double overcommitFactor = Constants.DEFAULT_OVERCOMMIT_FACTOR;
    
    public static SchedulerSettings defaults() {
        return SchedulerSettings.builder().build();
    }
}
