package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;

import java.util.Map;

/**
 * No host satisfies the requested capacity and label constraints.
 * Details map each rejected host id to the reason it was rejected.
 */
public class NoEligibleHostException extends OrchestrationException {
    
    public NoEligibleHostException(String message, Map<String, Object> details) {
        super(ErrorCode.NO_ELIGIBLE_HOST, message, details);
    }
}
