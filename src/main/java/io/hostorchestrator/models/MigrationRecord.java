package io.hostorchestrator.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.hostorchestrator.enums.ErrorCode;
import io.hostorchestrator.enums.MigrationMode;
import io.hostorchestrator.enums.MigrationState;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Migration record: one attempt to move a workload between hosts.
 * 
 * Owned by the migration coordinator, which mutates it under the record's monitor;
 * callers only ever receive copies from {@link #snapshot()}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MigrationRecord {
    
    private String migrationId;
    private String workloadId;
    private String sourceHostId;
    private String targetHostId;
    private boolean targetRequested; // false when the scheduler picks the target
    private MigrationMode mode;
    private MigrationState state;
    private ResourceSpec resources;
    private Map<String, String> constraints = new LinkedHashMap<>();
    private String reservationId;
    private int progressPercent;
    private ErrorCode failureCode;
    private String failureReason;
    private Map<MigrationState, Instant> transitions = new LinkedHashMap<>();
    private Instant createdAt;
    private Instant updatedAt;
    
    @JsonIgnore
    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }
    
    public MigrationRecord snapshot() {
        MigrationRecord copy = new MigrationRecord();
        copy.migrationId = migrationId;
        copy.workloadId = workloadId;
        copy.sourceHostId = sourceHostId;
        copy.targetHostId = targetHostId;
        copy.targetRequested = targetRequested;
        copy.mode = mode;
        copy.state = state;
        copy.resources = resources;
        copy.constraints = new LinkedHashMap<>(constraints);
        copy.reservationId = reservationId;
        copy.progressPercent = progressPercent;
        copy.failureCode = failureCode;
        copy.failureReason = failureReason;
        copy.transitions = new LinkedHashMap<>(transitions);
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }
}
