package io.hostorchestrator.api.models.requests;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.ResourceSpec;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request model for host registration.
 *
 * Example usage:
 * <pre>
 * {
 *   "host_id": "host-1",
 *   "endpoint": "qemu+ssh://host-1/system",
 *   "labels": {"zone": "a"},
 *   "capacity": {"vcpus": 8, "memory_mib": 16384, "disk_gib": 500}
 * }
 * </pre>
 * Without {@code capacity} the host's driver is asked for it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RegisterHostRequest {
    private String hostId;
    private String endpoint;
    private String name;
    private Map<String, String> labels;
    private ResourceSpec capacity;
    
    public Host toHost() {
        return Host.builder()
            .hostId(hostId)
            .endpoint(endpoint)
            .name(name)
            .labels(labels != null ? labels : Map.of())
            .capacity(capacity)
            .build();
    }
}
