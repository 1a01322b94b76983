package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;

import java.util.Map;

/**
 * The orchestrator store rejected a read or write. In-memory state is left unchanged.
 */
public class PersistenceException extends OrchestrationException {
    
    public PersistenceException(String message, String recordKind, String recordId, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILURE, message, Map.of("record", recordKind, "id", recordId), cause);
    }
}
