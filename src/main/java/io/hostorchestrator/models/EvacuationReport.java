package io.hostorchestrator.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.hostorchestrator.enums.HostState;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a maintenance drain.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EvacuationReport {
    String hostId;
    HostState finalState;
    @Builder.Default
    Map<String, String> evacuated = Map.of();      // workload -> new host
    @Builder.Default
    Map<String, String> failedWorkloads = Map.of(); // workload -> reason
    @Builder.Default
    List<String> migrationIds = List.of();
    
    @JsonIgnore
    public boolean isSuccessful() {
        return failedWorkloads.isEmpty() && finalState == HostState.MAINTENANCE;
    }
}
