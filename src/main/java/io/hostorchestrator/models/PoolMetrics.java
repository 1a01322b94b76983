package io.hostorchestrator.models;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Connection pool counters for one host.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PoolMetrics {
    String hostId;
    int size;
    int active;
    int idle;
    long checkoutCount;
    long failureCount;
    long reconnectCount;
}
