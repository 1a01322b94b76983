package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;

import java.util.Map;

public class WorkloadAlreadyPlacedException extends OrchestrationException {
    
    public WorkloadAlreadyPlacedException(String workloadId, String hostId) {
        super(ErrorCode.WORKLOAD_ALREADY_PLACED, "Workload " + workloadId + " is already placed on host " + hostId,
            Map.of("workload_id", workloadId, "host_id", hostId));
    }
}
