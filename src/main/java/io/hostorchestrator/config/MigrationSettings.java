package io.hostorchestrator.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

import static io.hostorchestrator.config.Constants.*;

/**
 * Migration coordinator settings.
 */
@Value
@Builder(toBuilder = true)
public class MigrationSettings {
    @Builder.Default
    int workerThreads = DEFAULT_MIGRATION_WORKER_THREADS;
    @Builder.Default
    Duration prepareTimeout = Duration.ofSeconds(DEFAULT_PREPARE_TIMEOUT_SECONDS);
    @Builder.Default
    Duration cutoverTimeout = Duration.ofSeconds(DEFAULT_CUTOVER_TIMEOUT_SECONDS);
    @Builder.Default
    Duration retention = Duration.ofHours(DEFAULT_MIGRATION_RETENTION_HOURS);
    
    public static MigrationSettings defaults() {
        return MigrationSettings.builder().build();
    }
}
