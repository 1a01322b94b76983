package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;

import java.util.Map;

public class HostAlreadyExistsException extends OrchestrationException {
    
    public HostAlreadyExistsException(String hostId) {
        super(ErrorCode.HOST_ALREADY_EXISTS, "Host " + hostId + " is already registered", Map.of("host_id", hostId));
    }
}
