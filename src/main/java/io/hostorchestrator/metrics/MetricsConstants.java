package io.hostorchestrator.metrics;

/**
 * Constants for metrics names and tags used by the host orchestrator.
 */
public class MetricsConstants {
    public final static String POOL_CHECKOUT_COUNT_METRIC_NAME = "pool_checkout_count";
    public final static String POOL_FAILURE_COUNT_METRIC_NAME = "pool_failure_count";
    public final static String POOL_RECONNECT_COUNT_METRIC_NAME = "pool_reconnect_count";
    public final static String POOL_SIZE_METRIC_NAME = "pool_size";
    public final static String POOL_ACTIVE_METRIC_NAME = "pool_active_connections";
    public final static String PLACEMENT_COUNT_METRIC_NAME = "placement_count";
    public final static String PLACEMENT_FAILURE_COUNT_METRIC_NAME = "placement_failure_count";
    public final static String MIGRATION_COMPLETED_COUNT_METRIC_NAME = "migration_completed_count";
    public final static String MIGRATION_FAILED_COUNT_METRIC_NAME = "migration_failed_count";
    public final static String MIGRATION_DURATION_METRIC_NAME = "migration_duration";
    public final static String HOST_ID_TAG = "hostId";
    public final static String MODE_TAG = "mode";
    public final static String ERROR_CODE_TAG = "errorCode";

    private MetricsConstants() {}
}
