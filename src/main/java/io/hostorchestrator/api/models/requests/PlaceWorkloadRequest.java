package io.hostorchestrator.api.models.requests;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.hostorchestrator.models.ResourceSpec;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request model for placing a workload.
 *
 * Example usage:
 * <pre>
 * {
 *   "workload_id": "vm-42",
 *   "resources": {"vcpus": 2, "memory_mib": 4096, "disk_gib": 40},
 *   "constraints": {"zone": "a"}
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlaceWorkloadRequest {
    private String workloadId;
    private ResourceSpec resources;
    private Map<String, String> constraints;
}
