package io.hostorchestrator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.hostorchestrator.enums.HostState;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * A virtualization host known to the registry.
 * 
 * Instances are immutable; the registry swaps in a modified copy on every mutation,
 * so readers always see a consistent snapshot.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Host {
    
    String hostId;
    
    String endpoint; // driver URI, e.g. qemu+ssh://host-1/system
    
    String name;
    
    @Builder.Default
    Map<String, String> labels = Map.of();
    
    ResourceSpec capacity;
    
    @Builder.Default
    HostState state = HostState.ACTIVE;
    
    Instant lastHealthCheckAt;
    
    Instant registeredAt;
    
    Instant stateChangedAt;
}
