package io.hostorchestrator.config;

/**
 * Application constants.
 */
public final class Constants {
    
    private Constants() {
        // Utility class
    }
    
    // Connection pool defaults
    public static final int DEFAULT_POOL_MIN_CONNECTIONS = 1;
    public static final int DEFAULT_POOL_MAX_CONNECTIONS = 10;
    public static final long DEFAULT_POOL_TTL_SECONDS = 300L;
    public static final long DEFAULT_POOL_CHECKOUT_TIMEOUT_MILLIS = 5_000L;
    public static final int DEFAULT_POOL_CHECKOUT_RETRIES = 2;
    public static final long DEFAULT_HEALTH_CHECK_INTERVAL_SECONDS = 60L;
    public static final int DEFAULT_HEALTH_FAILURE_THRESHOLD = 3;
    public static final long DEFAULT_BACKOFF_BASE_MILLIS = 500L;
    public static final long DEFAULT_BACKOFF_MAX_MILLIS = 60_000L;
    
    // Scheduler defaults
    public static final double DEFAULT_OVERCOMMIT_FACTOR = 1.0d;
    
    // Migration defaults
    public static final int DEFAULT_MIGRATION_WORKER_THREADS = 8;
    public static final long DEFAULT_PREPARE_TIMEOUT_SECONDS = 600L;
    public static final long DEFAULT_CUTOVER_TIMEOUT_SECONDS = 60L;
    public static final long DEFAULT_MIGRATION_RETENTION_HOURS = 24L * 7;
    
    // Maintenance defaults
    public static final int DEFAULT_EVACUATION_CONCURRENCY = 2;
    
    // Store
    public static final String STORE_TYPE_MEMORY = "memory";
    public static final String STORE_TYPE_ETCD = "etcd";
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String DEFAULT_KEY_PREFIX = "host-orchestrator";
    
    // Driver
    public static final String DRIVER_TYPE_FAKE = "fake";
    
    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_HOSTS = "hosts";
    public static final String PATH_ALLOCATIONS = "allocations";
    public static final String PATH_PLACEMENTS = "placements";
    public static final String PATH_MIGRATIONS = "migrations";
    
    // Event payload keys
    public static final String EVENT_HOST_ID = "hostId";
    public static final String EVENT_WORKLOAD_ID = "systemId";
    public static final String EVENT_MIGRATION_ID = "migrationId";
}
