package io.hostorchestrator.models;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Input to the scheduler: what a workload needs and where it may go.
 */
@Value
@Builder(toBuilder = true)
public class PlacementRequest {
    String workloadId;
    ResourceSpec resources;
    @Builder.Default
    LabelSelector constraints = LabelSelector.EMPTY;
    @Builder.Default
    Set<String> excludedHostIds = Set.of();
}
