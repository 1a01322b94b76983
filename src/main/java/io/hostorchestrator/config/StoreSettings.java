package io.hostorchestrator.config;

import lombok.Builder;
import lombok.Value;

import static io.hostorchestrator.config.Constants.*;

/**
 * Backend used to persist orchestrator records.
 */
@Value
@Builder(toBuilder = true)
public class StoreSettings {
    @Builder.Default
    String type = STORE_TYPE_MEMORY;
    @Builder.Default
    String[] etcdEndpoints = new String[]{DEFAULT_ETCD_ENDPOINT};
    @Builder.Default
    String keyPrefix = DEFAULT_KEY_PREFIX;
}
