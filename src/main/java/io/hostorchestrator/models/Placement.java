package io.hostorchestrator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Placement record: the host a workload currently runs on, with its footprint and the
 * label constraints it was placed under (re-applied when it is evacuated).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Placement {
    String workloadId;
    String hostId;
    ResourceSpec resources;
    @Builder.Default
    Map<String, String> constraints = Map.of();
    Instant placedAt;
}
