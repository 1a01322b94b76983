package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;

import java.util.Map;

/**
 * Deregistration rejected because workloads or reservations are still assigned to the host.
 */
public class HostInUseException extends OrchestrationException {
    
    public HostInUseException(String hostId, int workloads, int reservations) {
        super(ErrorCode.HOST_IN_USE,
            "Host " + hostId + " still has " + workloads + " workload(s) and " + reservations + " reservation(s)",
            Map.of("host_id", hostId, "workloads", workloads, "reservations", reservations));
    }
}
