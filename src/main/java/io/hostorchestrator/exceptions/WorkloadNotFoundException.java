package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;

import java.util.Map;

public class WorkloadNotFoundException extends OrchestrationException {
    
    public WorkloadNotFoundException(String workloadId) {
        super(ErrorCode.WORKLOAD_NOT_FOUND, "Workload " + workloadId + " has no placement", Map.of("workload_id", workloadId));
    }
}
