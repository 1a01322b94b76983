package io.hostorchestrator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.hostorchestrator.enums.ReservationKind;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Provisional capacity hold against a host, taken before a placement or migration is confirmed.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Reservation {
    String reservationId;
    String hostId;
    String workloadId;
    ResourceSpec resources;
    ReservationKind kind;
    Instant createdAt;
}
