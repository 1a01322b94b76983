package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;

import java.util.Map;

/**
 * A host's driver endpoint cannot be reached (connection open failed or reconnect backoff in effect).
 */
public class HostUnreachableException extends OrchestrationException {
    
    public HostUnreachableException(String hostId, String message) {
        super(ErrorCode.HOST_UNREACHABLE, message, Map.of("host_id", hostId));
    }
    
    public HostUnreachableException(String hostId, String message, Throwable cause) {
        super(ErrorCode.HOST_UNREACHABLE, message, Map.of("host_id", hostId), cause);
    }
}
