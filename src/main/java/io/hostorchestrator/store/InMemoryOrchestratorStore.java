package io.hostorchestrator.store;

import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.HostAllocation;
import io.hostorchestrator.models.MigrationRecord;
import io.hostorchestrator.models.Placement;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Records are kept as given (hosts, allocations and placements are immutable);
 * migration records are copied on the way in and out since they are mutable.
 */
@Slf4j
public class InMemoryOrchestratorStore implements OrchestratorStore {
    
    private final Map<String, Host> hosts = new ConcurrentHashMap<>();
    private final Map<String, HostAllocation> allocations = new ConcurrentHashMap<>();
    private final Map<String, Placement> placements = new ConcurrentHashMap<>();
    private final Map<String, MigrationRecord> migrations = new ConcurrentHashMap<>();
    
    public InMemoryOrchestratorStore() {
        log.info("InMemoryOrchestratorStore initialized");
    }
    
    @Override
    public void saveHost(Host host) {
        hosts.put(host.getHostId(), host);
    }
    
    @Override
    public void deleteHost(String hostId) {
        hosts.remove(hostId);
    }
    
    @Override
    public List<Host> loadHosts() {
        List<Host> result = new ArrayList<>(hosts.values());
        result.sort(Comparator.comparing(Host::getHostId));
        return result;
    }
    
    @Override
    public void saveAllocation(HostAllocation allocation) {
        allocations.put(allocation.getHostId(), allocation);
    }
    
    @Override
    public void deleteAllocation(String hostId) {
        allocations.remove(hostId);
    }
    
    @Override
    public List<HostAllocation> loadAllocations() {
        List<HostAllocation> result = new ArrayList<>(allocations.values());
        result.sort(Comparator.comparing(HostAllocation::getHostId));
        return result;
    }
    
    @Override
    public void savePlacement(Placement placement) {
        placements.put(placement.getWorkloadId(), placement);
    }
    
    @Override
    public void deletePlacement(String workloadId) {
        placements.remove(workloadId);
    }
    
    @Override
    public List<Placement> loadPlacements() {
        List<Placement> result = new ArrayList<>(placements.values());
        result.sort(Comparator.comparing(Placement::getWorkloadId));
        return result;
    }
    
    @Override
    public void saveMigration(MigrationRecord record) {
        migrations.put(record.getMigrationId(), record.snapshot());
    }
    
    @Override
    public void deleteMigration(String migrationId) {
        migrations.remove(migrationId);
    }
    
    @Override
    public List<MigrationRecord> loadMigrations() {
        List<MigrationRecord> result = new ArrayList<>();
        for (MigrationRecord record : migrations.values()) {
            result.add(record.snapshot());
        }
        result.sort(Comparator.comparing(MigrationRecord::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(MigrationRecord::getMigrationId));
        return result;
    }
    
    @Override
    public void close() {
        log.info("Closing in-memory orchestrator store");
    }
}
