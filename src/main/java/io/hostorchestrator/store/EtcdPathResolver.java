package io.hostorchestrator.store;

import java.nio.file.Paths;

import static io.hostorchestrator.config.Constants.*;

/**
 * Centralized etcd path resolver for all orchestrator keys.
 * Every key lives under a configurable prefix so several orchestrators can share one etcd cluster.
 */
public class EtcdPathResolver {
    
    private final String keyPrefix;
    
    public EtcdPathResolver(String keyPrefix) {
        if (keyPrefix == null || keyPrefix.isBlank()) {
            throw new IllegalArgumentException("keyPrefix must not be blank");
        }
        this.keyPrefix = keyPrefix;
    }
    
    // =================================================================
    // HOST PATHS
    // =================================================================
    
    /**
     * Get prefix for all hosts
     * Pattern: /<prefix>/hosts
     */
    public String getHostsPrefix() {
        return Paths.get(PATH_DELIMITER, keyPrefix, PATH_HOSTS).toString();
    }
    
    /**
     * Pattern: /<prefix>/hosts/<host-id>
     */
    public String getHostPath(String hostId) {
        return Paths.get(getHostsPrefix(), hostId).toString();
    }
    
    // =================================================================
    // ALLOCATION PATHS
    // =================================================================
    
    /**
     * Get prefix for all host allocation records
     * Pattern: /<prefix>/allocations
     */
    public String getAllocationsPrefix() {
        return Paths.get(PATH_DELIMITER, keyPrefix, PATH_ALLOCATIONS).toString();
    }
    
    /**
     * Pattern: /<prefix>/allocations/<host-id>
     */
    public String getAllocationPath(String hostId) {
        return Paths.get(getAllocationsPrefix(), hostId).toString();
    }
    
    // =================================================================
    // PLACEMENT PATHS
    // =================================================================
    
    public String getPlacementsPrefix() {
        return Paths.get(PATH_DELIMITER, keyPrefix, PATH_PLACEMENTS).toString();
    }
    
    public String getPlacementPath(String workloadId) {
        return Paths.get(getPlacementsPrefix(), workloadId).toString();
    }
    
    // =================================================================
    // MIGRATION PATHS
    // =================================================================
    
    public String getMigrationsPrefix() {
        return Paths.get(PATH_DELIMITER, keyPrefix, PATH_MIGRATIONS).toString();
    }
    
    public String getMigrationPath(String migrationId) {
        return Paths.get(getMigrationsPrefix(), migrationId).toString();
    }
}
