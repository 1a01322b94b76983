package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;

import java.util.Map;

public class HostNotFoundException extends OrchestrationException {
    
    public HostNotFoundException(String hostId) {
        super(ErrorCode.HOST_NOT_FOUND, "Host " + hostId + " not found", Map.of("host_id", hostId));
    }
}
