package io.hostorchestrator.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static io.hostorchestrator.config.Constants.*;

/**
 * Configuration for the host orchestrator.
 * Loads configuration from application.yml with fallbacks to constants.
 * <p>
 * Every section is exposed as an immutable settings object consumed by one component.
 */
@Slf4j
@Getter
public class OrchestratorConfig {

    private final PoolSettings poolSettings;
    private final SchedulerSettings schedulerSettings;
    private final MigrationSettings migrationSettings;
    private final MaintenanceSettings maintenanceSettings;
    private final StoreSettings storeSettings;
    private final String driverType;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "ORCHESTRATOR_CONFIG_FILE";

    public OrchestratorConfig() {
        this(loadYamlConfig());
    }

    public OrchestratorConfig(ConfigModel config) {
        ConfigModel model = config != null ? config : new ConfigModel();
        this.poolSettings = parsePoolSettings(model);
        this.schedulerSettings = parseSchedulerSettings(model);
        this.migrationSettings = parseMigrationSettings(model);
        this.maintenanceSettings = parseMaintenanceSettings(model);
        this.storeSettings = parseStoreSettings(model);
        this.driverType = parseDriverType(model);

        log.info("Loaded orchestrator config - pool [{}, {}], overcommit {}, evacuation concurrency {}, store {}, driver {}",
                poolSettings.getMinConnections(), poolSettings.getMaxConnections(),
                schedulerSettings.getOvercommitFactor(), maintenanceSettings.getEvacuationConcurrency(),
                storeSettings.getType(), driverType);
    }

    /**
     * Parse configuration from a YAML stream. Unknown keys are ignored.
     */
    public static ConfigModel parseYaml(InputStream inputStream) {
        LoaderOptions options = new LoaderOptions();
        Constructor constructor = new Constructor(ConfigModel.class, options);
        // Spring keys such as server and management have no ConfigModel property
        PropertyUtils propertyUtils = new PropertyUtils();
        propertyUtils.setSkipMissingProperties(true);
        constructor.setPropertyUtils(propertyUtils);
        Yaml yaml = new Yaml(constructor);
        ConfigModel config = yaml.load(inputStream);
        return config != null ? config : new ConfigModel();
    }

    private static ConfigModel loadYamlConfig() {
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = OrchestratorConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try {
            ConfigModel config = parseYaml(inputStream);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config;
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        } finally {
            try {
                inputStream.close();
            } catch (IOException e) {
                log.error("Error closing config file input stream: {}", e.getMessage());
            }
        }
    }

    private PoolSettings parsePoolSettings(ConfigModel config) {
        PoolSettings.PoolSettingsBuilder builder = PoolSettings.builder();
        Pool pool = config.getPool();
        if (pool != null) {
            if (pool.getMin_connections() != null) builder.minConnections(pool.getMin_connections());
            if (pool.getMax_connections() != null) builder.maxConnections(pool.getMax_connections());
            if (pool.getTtl_seconds() != null) builder.ttl(Duration.ofSeconds(pool.getTtl_seconds()));
            if (pool.getCheckout_timeout_millis() != null) builder.checkoutTimeout(Duration.ofMillis(pool.getCheckout_timeout_millis()));
            if (pool.getCheckout_retries() != null) builder.checkoutRetries(pool.getCheckout_retries());
            if (pool.getHealth_check_interval_seconds() != null) {
                builder.healthCheckInterval(Duration.ofSeconds(pool.getHealth_check_interval_seconds()));
            }
            if (pool.getFailure_threshold() != null) builder.failureThreshold(pool.getFailure_threshold());
            if (pool.getBackoff() != null) {
                if (pool.getBackoff().getBase_millis() != null) builder.backoffBase(Duration.ofMillis(pool.getBackoff().getBase_millis()));
                if (pool.getBackoff().getMax_millis() != null) builder.backoffMax(Duration.ofMillis(pool.getBackoff().getMax_millis()));
            }
        }
        PoolSettings settings = builder.build();
        try {
            settings.validate();
            return settings;
        } catch (IllegalArgumentException e) {
            log.warn("Invalid pool configuration, using defaults: {}", e.getMessage());
            return PoolSettings.defaults();
        }
    }

    private SchedulerSettings parseSchedulerSettings(ConfigModel config) {
        if (config.getScheduler() != null && config.getScheduler().getOvercommit_factor() != null) {
            double factor = config.getScheduler().getOvercommit_factor();
            if (factor >= 1.0d) {
                return SchedulerSettings.builder().overcommitFactor(factor).build();
            }
            log.warn("Overcommit factor {} is below 1.0, using default {}", factor, DEFAULT_OVERCOMMIT_FACTOR);
        }
        return SchedulerSettings.defaults();
    }

    private MigrationSettings parseMigrationSettings(ConfigModel config) {
        MigrationSettings.MigrationSettingsBuilder builder = MigrationSettings.builder();
        Migration migration = config.getMigration();
        if (migration != null) {
            if (migration.getWorker_threads() != null && migration.getWorker_threads() > 0) {
                builder.workerThreads(migration.getWorker_threads());
            }
            if (migration.getPrepare_timeout_seconds() != null) {
                builder.prepareTimeout(Duration.ofSeconds(migration.getPrepare_timeout_seconds()));
            }
            if (migration.getCutover_timeout_seconds() != null) {
                builder.cutoverTimeout(Duration.ofSeconds(migration.getCutover_timeout_seconds()));
            }
            if (migration.getRetention_hours() != null) {
                builder.retention(Duration.ofHours(migration.getRetention_hours()));
            }
        }
        return builder.build();
    }

    private MaintenanceSettings parseMaintenanceSettings(ConfigModel config) {
        if (config.getMaintenance() != null && config.getMaintenance().getEvacuation_concurrency() != null) {
            int concurrency = config.getMaintenance().getEvacuation_concurrency();
            if (concurrency > 0) {
                return MaintenanceSettings.builder().evacuationConcurrency(concurrency).build();
            }
            log.warn("Evacuation concurrency {} must be positive, using default {}", concurrency, DEFAULT_EVACUATION_CONCURRENCY);
        }
        return MaintenanceSettings.defaults();
    }

    private StoreSettings parseStoreSettings(ConfigModel config) {
        StoreSettings.StoreSettingsBuilder builder = StoreSettings.builder();
        Store store = config.getStore();
        if (store != null) {
            if (store.getType() != null && !store.getType().isBlank()) {
                builder.type(store.getType().trim().toLowerCase());
            }
            if (store.getKey_prefix() != null && !store.getKey_prefix().isBlank()) {
                builder.keyPrefix(store.getKey_prefix());
            }
            if (store.getEtcd() != null && store.getEtcd().getEndpoints() != null && !store.getEtcd().getEndpoints().isEmpty()) {
                builder.etcdEndpoints(store.getEtcd().getEndpoints().toArray(new String[0]));
            }
        }
        return builder.build();
    }

    private String parseDriverType(ConfigModel config) {
        if (config.getDriver() != null && config.getDriver().getType() != null && !config.getDriver().getType().isBlank()) {
            return config.getDriver().getType().trim().toLowerCase();
        }
        return DRIVER_TYPE_FAKE;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Orchestrator orchestrator; // id is read by Spring @Value
        private Pool pool;
        private Scheduler scheduler;
        private Migration migration;
        private Maintenance maintenance;
        private Store store;
        private Driver driver;
    }

    @Data
    public static class Orchestrator {
        private String id;
    }

    @Data
    public static class Pool {
        private Integer min_connections;
        private Integer max_connections;
        private Long ttl_seconds;
        private Long checkout_timeout_millis;
        private Integer checkout_retries;
        private Long health_check_interval_seconds;
        private Integer failure_threshold;
        private Backoff backoff;
    }

    @Data
    public static class Backoff {
        private Long base_millis;
        private Long max_millis;
    }

    @Data
    public static class Scheduler {
        private Double overcommit_factor;
    }

    @Data
    public static class Migration {
        private Integer worker_threads;
        private Long prepare_timeout_seconds;
        private Long cutover_timeout_seconds;
        private Long retention_hours;
    }

    @Data
    public static class Maintenance {
        private Integer evacuation_concurrency;
    }

    @Data
    public static class Store {
        private String type;
        private String key_prefix;
        private Etcd etcd;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class Driver {
        private String type;
    }
}
