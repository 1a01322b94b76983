package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;

import java.util.Map;

/**
 * A host or migration state change that the transition table does not allow.
 */
public class InvalidStateTransitionException extends OrchestrationException {
    
    public InvalidStateTransitionException(String entityType, String entityId, Enum<?> from, Enum<?> to) {
        super(ErrorCode.INVALID_STATE_TRANSITION,
            "Invalid " + entityType + " transition for " + entityId + ": " + from + " -> " + to,
            Map.of(entityType + "_id", entityId, "from", String.valueOf(from), "to", String.valueOf(to)));
    }
}
