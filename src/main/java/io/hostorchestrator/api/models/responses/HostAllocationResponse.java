package io.hostorchestrator.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.hostorchestrator.models.HostSnapshot;
import io.hostorchestrator.models.ResourceSpec;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Capacity accounting of one host.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HostAllocationResponse {
    private String hostId;
    private ResourceSpec capacity;
    private ResourceSpec effectiveCapacity;
    private ResourceSpec allocated;
    private ResourceSpec reserved;
    private ResourceSpec available;
    private int reservations;
    
    public static HostAllocationResponse from(HostSnapshot snapshot) {
        return HostAllocationResponse.builder()
            .hostId(snapshot.getHostId())
            .capacity(snapshot.getHost().getCapacity())
            .effectiveCapacity(snapshot.getEffectiveCapacity())
            .allocated(snapshot.getAllocation().getAllocated())
            .reserved(snapshot.getAllocation().getReserved())
            .available(snapshot.getAvailable())
            .reservations(snapshot.getAllocation().getReservations().size())
            .build();
    }
}
