package io.hostorchestrator;

import io.hostorchestrator.allocation.PlacementScheduler;
import io.hostorchestrator.capacity.CapacityTracker;
import io.hostorchestrator.driver.DriverHandle;
import io.hostorchestrator.driver.HypervisorDriver;
import io.hostorchestrator.enums.MigrationMode;
import io.hostorchestrator.exceptions.DriverException;
import io.hostorchestrator.exceptions.HostUnreachableException;
import io.hostorchestrator.exceptions.OrchestrationException;
import io.hostorchestrator.exceptions.PersistenceException;
import io.hostorchestrator.exceptions.WorkloadAlreadyPlacedException;
import io.hostorchestrator.maintenance.MaintenanceController;
import io.hostorchestrator.migration.MigrationCoordinator;
import io.hostorchestrator.models.EvacuationReport;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.HostSnapshot;
import io.hostorchestrator.models.LabelSelector;
import io.hostorchestrator.models.MigrationRecord;
import io.hostorchestrator.models.Placement;
import io.hostorchestrator.models.PlacementRequest;
import io.hostorchestrator.models.PoolMetrics;
import io.hostorchestrator.models.Reservation;
import io.hostorchestrator.models.ResourceSpec;
import io.hostorchestrator.pool.ConnectionPoolManager;
import io.hostorchestrator.registry.HostRegistry;
import io.hostorchestrator.store.OrchestratorStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for the operations offered to the API layer.
 *
 * Composes the registry, capacity tracker, connection pools, scheduler, migration coordinator
 * and maintenance controller. Each instance owns its own state, so several engines can run
 * side by side.
 */
@Slf4j
public class HostOrchestrationEngine {

    private final HostRegistry registry;
    private final CapacityTracker capacityTracker;
    private final ConnectionPoolManager poolManager;
    private final PlacementScheduler scheduler;
    private final MigrationCoordinator migrationCoordinator;
    private final MaintenanceController maintenanceController;
    private final HypervisorDriver driver;
    private final OrchestratorStore store;

    public HostOrchestrationEngine(HostRegistry registry, CapacityTracker capacityTracker,
                                   ConnectionPoolManager poolManager, PlacementScheduler scheduler,
                                   MigrationCoordinator migrationCoordinator, MaintenanceController maintenanceController,
                                   HypervisorDriver driver, OrchestratorStore store) {
        this.registry = registry;
        this.capacityTracker = capacityTracker;
        this.poolManager = poolManager;
        this.scheduler = scheduler;
        this.migrationCoordinator = migrationCoordinator;
        this.maintenanceController = maintenanceController;
        this.driver = driver;
        this.store = store;
    }

    // =================================================================
    // HOSTS
    // =================================================================

    /**
     * Register a host. When no capacity is declared it is queried from the host's driver endpoint.
     */
    public Host registerHost(Host host) throws OrchestrationException {
        if (host != null && host.getCapacity() == null && host.getHostId() != null
                && host.getEndpoint() != null && !host.getEndpoint().isBlank()) {
            host = host.toBuilder().capacity(queryCapacity(host)).build();
        }
        return registry.register(host);
    }

    /**
     * Remove an idle host and close its connection pool.
     */
    public Host deregisterHost(String hostId) throws OrchestrationException {
        Host removed = registry.deregister(hostId, capacityTracker);
        capacityTracker.forgetHost(hostId);
        poolManager.closePool(hostId);
        registry.getLockManager().discard(hostId);
        return removed;
    }

    public List<Host> listHosts(LabelSelector selector) {
        return registry.list(selector);
    }

    public Host getHost(String hostId) throws OrchestrationException {
        return registry.get(hostId);
    }

    /**
     * Allocation record of a host together with its effective capacity.
     */
    public HostSnapshot getHostAllocation(String hostId) throws OrchestrationException {
        return capacityTracker.snapshot(registry.get(hostId));
    }

    public PoolMetrics getPoolMetrics(String hostId) throws OrchestrationException {
        return poolManager.getMetrics(hostId);
    }

    // =================================================================
    // WORKLOADS
    // =================================================================

    /**
     * Place a new workload on the least loaded eligible host.
     *
     * @return the chosen host id
     */
    public String placeWorkload(String workloadId, ResourceSpec requirements, LabelSelector constraints)
            throws OrchestrationException {
        Optional<Placement> existing = capacityTracker.getPlacement(workloadId);
        if (existing.isPresent()) {
            throw new WorkloadAlreadyPlacedException(workloadId, existing.get().getHostId());
        }
        LabelSelector effective = constraints != null ? constraints : LabelSelector.EMPTY;
        Reservation reservation = scheduler.placeNew(PlacementRequest.builder()
            .workloadId(workloadId)
            .resources(requirements)
            .constraints(effective)
            .build());
        try {
            capacityTracker.commitPlacement(reservation, effective.getRequirements());
        } catch (OrchestrationException | RuntimeException e) {
            releaseQuietly(reservation, e);
            throw e;
        }
        return reservation.getHostId();
    }

    /**
     * Release a workload's allocation. Rejected while the workload is migrating; no migration can
     * start until the removal is done.
     */
    public Placement removeWorkload(String workloadId) throws OrchestrationException {
        return migrationCoordinator.withMigrationsBlocked(workloadId, () -> capacityTracker.removeWorkload(workloadId));
    }

    public Optional<Placement> getPlacement(String workloadId) {
        return capacityTracker.getPlacement(workloadId);
    }

    public List<Placement> listPlacements() {
        return capacityTracker.allPlacements();
    }

    // =================================================================
    // MIGRATIONS
    // =================================================================

    /**
     * Start migrating a workload.
     *
     * @param targetHostId explicit target, or null for a scheduler-chosen one
     * @return the migration id
     */
    public String migrateWorkload(String workloadId, String targetHostId, MigrationMode mode) throws OrchestrationException {
        return migrationCoordinator.requestMigration(workloadId, targetHostId, mode).getMigrationId();
    }

    public MigrationRecord getMigrationStatus(String migrationId) throws OrchestrationException {
        return migrationCoordinator.getStatus(migrationId);
    }

    public CompletableFuture<MigrationRecord> awaitMigration(String migrationId) throws OrchestrationException {
        return migrationCoordinator.awaitCompletion(migrationId);
    }

    public MigrationRecord cancelMigration(String migrationId) throws OrchestrationException {
        return migrationCoordinator.cancel(migrationId);
    }

    public List<MigrationRecord> listMigrations(String workloadId) {
        return migrationCoordinator.list(workloadId);
    }

    public int pruneMigrations(Duration olderThan) throws OrchestrationException {
        return migrationCoordinator.prune(olderThan);
    }

    public MigrationRecord reconcileMigration(String migrationId, String resolvedHostId) throws OrchestrationException {
        return migrationCoordinator.reconcile(migrationId, resolvedHostId);
    }

    // =================================================================
    // MAINTENANCE
    // =================================================================

    public CompletableFuture<EvacuationReport> enterMaintenance(String hostId) throws OrchestrationException {
        return maintenanceController.enterMaintenance(hostId);
    }

    public Host exitMaintenance(String hostId) throws OrchestrationException {
        return maintenanceController.exitMaintenance(hostId);
    }

    public Host cancelMaintenance(String hostId) throws OrchestrationException {
        return maintenanceController.cancelMaintenance(hostId);
    }

    // =================================================================
    // LIFECYCLE
    // =================================================================

    /**
     * Reload persisted state. Migrations that were in flight when the previous engine stopped are failed.
     */
    public void recover() throws OrchestrationException {
        try {
            registry.restore(store.loadHosts());
            capacityTracker.restore(store.loadAllocations(), store.loadPlacements());
            migrationCoordinator.recoverInterrupted(store.loadMigrations());
        } catch (OrchestrationException e) {
            throw e;
        } catch (Exception e) {
            throw new PersistenceException("Failed to load orchestrator state: " + e.getMessage(), "state", "all", e);
        }
        log.info("Recovered orchestrator state: {} hosts, {} placements", registry.listAll().size(),
            capacityTracker.allPlacements().size());
    }

    public void shutdown() {
        log.info("Shutting down host orchestration engine");
        migrationCoordinator.shutdown();
        poolManager.shutdown();
    }

    private ResourceSpec queryCapacity(Host host) throws HostUnreachableException {
        DriverHandle handle = null;
        try {
            handle = driver.openConnection(host.getEndpoint());
            ResourceSpec capacity = driver.queryCapacity(handle);
            log.info("Queried capacity of host {} from driver: {}", host.getHostId(), capacity);
            return capacity;
        } catch (DriverException e) {
            throw new HostUnreachableException(host.getHostId(),
                "Could not query capacity of host " + host.getHostId() + ": " + e.getMessage(), e);
        } finally {
            if (handle != null) {
                driver.close(handle);
            }
        }
    }

    private void releaseQuietly(Reservation reservation, Exception cause) {
        try {
            capacityTracker.release(reservation);
        } catch (OrchestrationException e) {
            log.error("Failed to release reservation {} on host {} after failed placement ({}): {}",
                reservation.getReservationId(), reservation.getHostId(), cause.getMessage(), e.getMessage(), e);
        }
    }
}
