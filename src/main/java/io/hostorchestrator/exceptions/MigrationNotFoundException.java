package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;

import java.util.Map;

public class MigrationNotFoundException extends OrchestrationException {
    
    public MigrationNotFoundException(String migrationId) {
        super(ErrorCode.MIGRATION_NOT_FOUND, "Migration " + migrationId + " not found", Map.of("migration_id", migrationId));
    }
}
