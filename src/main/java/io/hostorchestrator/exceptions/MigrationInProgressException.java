package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;

import java.util.Map;

/**
 * A second migration was requested for a workload that is already migrating.
 */
public class MigrationInProgressException extends OrchestrationException {
    
    public MigrationInProgressException(String workloadId, String activeMigrationId) {
        super(ErrorCode.MIGRATION_IN_PROGRESS,
            "Workload " + workloadId + " is already migrating (migration " + activeMigrationId + ")",
            Map.of("workload_id", workloadId, "migration_id", activeMigrationId));
    }
}
