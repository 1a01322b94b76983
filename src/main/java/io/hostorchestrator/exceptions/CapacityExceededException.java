package io.hostorchestrator.exceptions;

import io.hostorchestrator.enums.ErrorCode;
import io.hostorchestrator.enums.ResourceDimension;

import java.util.Map;

/**
 * A reservation does not fit the host's remaining effective capacity.
 */
public class CapacityExceededException extends OrchestrationException {
    
    private final String hostId;
    private final ResourceDimension dimension;
    
    public CapacityExceededException(String hostId, ResourceDimension dimension, long requested, long available) {
        super(ErrorCode.CAPACITY_EXCEEDED,
            "Host " + hostId + " lacks " + dimension.getValue() + ": requested " + requested + ", available " + available,
            Map.of("host_id", hostId, "dimension", dimension.getValue(), "requested", requested, "available", available));
        this.hostId = hostId;
        this.dimension = dimension;
    }
    
    public CapacityExceededException(String hostId, String reason) {
        super(ErrorCode.CAPACITY_EXCEEDED, "Host " + hostId + " cannot accept reservations: " + reason,
            Map.of("host_id", hostId, "reason", reason));
        this.hostId = hostId;
        this.dimension = null;
    }
    
    public String getHostId() {
        return hostId;
    }
    
    public ResourceDimension getDimension() {
        return dimension;
    }
}
