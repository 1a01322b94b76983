package io.hostorchestrator.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running totals for one host: resources allocated to placed workloads plus outstanding reservations.
 * Immutable; every change produces a new instance.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HostAllocation {
    
    String hostId;
    
    @Builder.Default
    ResourceSpec allocated = ResourceSpec.ZERO;
    
    @Builder.Default
    Map<String, Reservation> reservations = Map.of();
    
    public static HostAllocation empty(String hostId) {
        return HostAllocation.builder().hostId(hostId).build();
    }
    
    @JsonIgnore
    public ResourceSpec getReserved() {
        ResourceSpec total = ResourceSpec.ZERO;
        for (Reservation reservation : reservations.values()) {
            total = total.plus(reservation.getResources());
        }
        return total;
    }
    
    /**
     * Allocated plus reserved; this is what the capacity invariant is checked against.
     */
    @JsonIgnore
    public ResourceSpec getCommitted() {
        return allocated.plus(getReserved());
    }
    
    public HostAllocation withReservation(Reservation reservation) {
        Map<String, Reservation> copy = new LinkedHashMap<>(reservations);
        copy.put(reservation.getReservationId(), reservation);
        return toBuilder().reservations(Collections.unmodifiableMap(copy)).build();
    }
    
    public HostAllocation withoutReservation(String reservationId) {
        Map<String, Reservation> copy = new LinkedHashMap<>(reservations);
        copy.remove(reservationId);
        return toBuilder().reservations(Collections.unmodifiableMap(copy)).build();
    }
    
    public HostAllocation withAllocated(ResourceSpec newAllocated) {
        return toBuilder().allocated(newAllocated).build();
    }
}
