package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for all orchestration failures.
 * 
 * Carries an {@link ErrorCode} and structured details (host, resource dimension,
 * migration id and state) so callers can decide whether to retry, pick another
 * target, or escalate.
 */
public class OrchestrationException extends Exception {
    
    private final ErrorCode errorCode;
    private final Map<String, Object> details;
    
    public OrchestrationException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }
    
    public OrchestrationException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }
    
    public OrchestrationException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public Map<String, Object> getDetails() {
        return details;
    }
    
    public boolean isTransient() {
        return errorCode.isTransient();
    }
}
