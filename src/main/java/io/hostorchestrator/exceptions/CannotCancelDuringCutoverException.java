package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;

import java.util.Map;

/**
 * Cutover is uninterruptible; cancellation requests arriving during it are rejected.
 */
public class CannotCancelDuringCutoverException extends OrchestrationException {
    
    public CannotCancelDuringCutoverException(String migrationId) {
        super(ErrorCode.CANNOT_CANCEL_DURING_CUTOVER,
            "Migration " + migrationId + " is in cutover and cannot be cancelled",
            Map.of("migration_id", migrationId, "state", "CUTOVER"));
    }
}
