package io.hostorchestrator.store;

import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.HostAllocation;
import io.hostorchestrator.models.MigrationRecord;
import io.hostorchestrator.models.Placement;

import java.util.List;

/**
 * Abstraction layer for orchestrator record storage supporting different backends (in-memory, etcd).
 * Writers persist a record before publishing it in memory, so every save must be visible to a
 * subsequent load from the same process.
 */
public interface OrchestratorStore {
    
    // =================================================================
    // HOST OPERATIONS
    // =================================================================
    
    void saveHost(Host host) throws Exception;
    
    void deleteHost(String hostId) throws Exception;
    
    List<Host> loadHosts() throws Exception;
    
    // =================================================================
    // ALLOCATION OPERATIONS
    // =================================================================
    
    void saveAllocation(HostAllocation allocation) throws Exception;
    
    void deleteAllocation(String hostId) throws Exception;
    
    List<HostAllocation> loadAllocations() throws Exception;
    
    // =================================================================
    // PLACEMENT OPERATIONS
    // =================================================================
    
    void savePlacement(Placement placement) throws Exception;
    
    void deletePlacement(String workloadId) throws Exception;
    
    List<Placement> loadPlacements() throws Exception;
    
    // =================================================================
    // MIGRATION OPERATIONS
    // =================================================================
    
    void saveMigration(MigrationRecord record) throws Exception;
    
    void deleteMigration(String migrationId) throws Exception;
    
    List<MigrationRecord> loadMigrations() throws Exception;
    
    /**
     * Release backend resources
     */
    void close() throws Exception;
}
