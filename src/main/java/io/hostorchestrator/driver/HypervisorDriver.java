package io.hostorchestrator.driver;

import io.hostorchestrator.exceptions.DriverException;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.ResourceSpec;

/**
 * Driver capability consumed by the orchestrator, one implementation per hypervisor backend.
 * Implementations must be thread-safe; every call carries the handle it operates on.
 */
public interface HypervisorDriver {
    
    String getType();
    
    DriverHandle openConnection(String endpoint) throws DriverException;
    
    boolean healthCheck(DriverHandle handle);
    
    ResourceSpec queryCapacity(DriverHandle handle) throws DriverException;
    
    CompatibilityReport checkCompatibility(DriverHandle handle, String workloadId, Host targetHost) throws DriverException;
    
    MigrationTask beginLiveMigration(DriverHandle handle, String workloadId, Host targetHost) throws DriverException;
    
    MigrationTask performOfflineMigration(DriverHandle handle, String workloadId, Host targetHost) throws DriverException;
    
    void close(DriverHandle handle);
}
