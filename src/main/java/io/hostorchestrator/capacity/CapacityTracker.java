package io.hostorchestrator.capacity;

import io.hostorchestrator.config.SchedulerSettings;
import io.hostorchestrator.enums.HostState;
import io.hostorchestrator.enums.ReservationKind;
import io.hostorchestrator.enums.ResourceDimension;
import io.hostorchestrator.exceptions.CapacityExceededException;
import io.hostorchestrator.exceptions.OrchestrationException;
import io.hostorchestrator.exceptions.PersistenceException;
import io.hostorchestrator.exceptions.WorkloadAlreadyPlacedException;
import io.hostorchestrator.exceptions.WorkloadNotFoundException;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.HostAllocation;
import io.hostorchestrator.models.HostSnapshot;
import io.hostorchestrator.models.Placement;
import io.hostorchestrator.models.Reservation;
import io.hostorchestrator.models.ResourceSpec;
import io.hostorchestrator.registry.HostLockManager;
import io.hostorchestrator.registry.HostRegistry;
import io.hostorchestrator.registry.HostUsageView;
import io.hostorchestrator.store.OrchestratorStore;
import io.hostorchestrator.store.StoreWrites;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Allocated-versus-available resource counters per host, plus the workload placement table.
 * 
 * Every change to a host's allocation happens under that host's lock, so the check that a
 * reservation fits and the write that records it are one atomic step. The committed total
 * (allocated plus reserved) never exceeds capacity times the overcommit factor.
 */
@Slf4j
public class CapacityTracker implements HostUsageView {
    
    private final ConcurrentHashMap<String, HostAllocation> allocations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Placement> placements = new ConcurrentHashMap<>();
    
    private final HostRegistry registry;
    private final HostLockManager lockManager;
    private final OrchestratorStore store;
    private final SchedulerSettings settings;
    private final Clock clock;
    
    public CapacityTracker(HostRegistry registry, OrchestratorStore store, SchedulerSettings settings, Clock clock) {
        this.registry = registry;
        this.lockManager = registry.getLockManager();
        this.store = store;
        this.settings = settings;
        this.clock = clock;
    }
    
    public ResourceSpec effectiveCapacity(Host host) {
        return host.getCapacity().scale(settings.getOvercommitFactor());
    }
    
    public HostAllocation getAllocation(String hostId) {
        return allocations.getOrDefault(hostId, HostAllocation.empty(hostId));
    }
    
    public HostSnapshot snapshot(Host host) {
        return new HostSnapshot(host, getAllocation(host.getHostId()), effectiveCapacity(host));
    }
    
    public List<HostSnapshot> snapshots(Collection<Host> hosts) {
        List<HostSnapshot> result = new ArrayList<>(hosts.size());
        for (Host host : hosts) {
            result.add(snapshot(host));
        }
        return result;
    }
    
    /**
     * Hold {@code resources} on a host. Fails with {@link CapacityExceededException} naming the first
     * short dimension, or when the host is not {@link HostState#ACTIVE}.
     */
    public Reservation reserve(String hostId, String workloadId, ResourceSpec resources, ReservationKind kind)
            throws OrchestrationException {
        return lockManager.withHostLock(hostId, () -> {
            Host host = registry.get(hostId);
            if (host.getState() != HostState.ACTIVE) {
                throw new CapacityExceededException(hostId, "host is " + host.getState());
            }
            HostAllocation current = getAllocation(hostId);
            ResourceSpec available = effectiveCapacity(host).minus(current.getCommitted());
            ResourceDimension shortfall = resources.firstShortfall(available);
            if (shortfall != null) {
                throw new CapacityExceededException(hostId, shortfall, resources.get(shortfall), available.get(shortfall));
            }
            Reservation reservation = Reservation.builder()
                .reservationId(UUID.randomUUID().toString())
                .hostId(hostId)
                .workloadId(workloadId)
                .resources(resources)
                .kind(kind)
                .createdAt(clock.instant())
                .build();
            HostAllocation updated = current.withReservation(reservation);
            persistAllocation(updated);
            allocations.put(hostId, updated);
            log.debug("Reserved {} on host {} for workload {} ({})", resources, hostId, workloadId, kind);
            return reservation;
        });
    }
    
    /**
     * Turn a placement reservation into an allocation and record the workload's placement.
     * Rejected with {@link CapacityExceededException} once the host has left {@link HostState#ACTIVE};
     * the caller still owns the reservation and must release it.
     */
    public Placement commitPlacement(Reservation reservation, Map<String, String> constraints) throws OrchestrationException {
        String hostId = reservation.getHostId();
        String workloadId = reservation.getWorkloadId();
        return lockManager.withHostLock(hostId, () -> {
            Host host = registry.get(hostId);
            if (host.getState() != HostState.ACTIVE) {
                throw new CapacityExceededException(hostId, "host is " + host.getState());
            }
            HostAllocation current = getAllocation(hostId);
            if (!current.getReservations().containsKey(reservation.getReservationId())) {
                throw new IllegalStateException("Reservation " + reservation.getReservationId() + " is not held on host " + hostId);
            }
            Placement placement = Placement.builder()
                .workloadId(workloadId)
                .hostId(hostId)
                .resources(reservation.getResources())
                .constraints(constraints != null ? Map.copyOf(constraints) : Map.of())
                .placedAt(clock.instant())
                .build();
            Placement existing = placements.putIfAbsent(workloadId, placement);
            if (existing != null) {
                throw new WorkloadAlreadyPlacedException(workloadId, existing.getHostId());
            }
            HostAllocation updated = current.withoutReservation(reservation.getReservationId())
                .withAllocated(current.getAllocated().plus(reservation.getResources()));
            try {
                persistAllocation(updated);
                StoreWrites.write("placement", workloadId, () -> store.savePlacement(placement));
            } catch (PersistenceException e) {
                placements.remove(workloadId, placement);
                throw e;
            }
            allocations.put(hostId, updated);
            log.info("Placed workload {} on host {} with {}", workloadId, hostId, reservation.getResources());
            return placement;
        });
    }
    
    /**
     * Drop a reservation. Releasing one that is already gone is a no-op.
     *
     * @return true if the reservation was held
     */
    public boolean release(Reservation reservation) throws OrchestrationException {
        String hostId = reservation.getHostId();
        return lockManager.withHostLock(hostId, () -> {
            HostAllocation current = allocations.get(hostId);
            if (current == null || !current.getReservations().containsKey(reservation.getReservationId())) {
                return false;
            }
            HostAllocation updated = current.withoutReservation(reservation.getReservationId());
            persistAllocation(updated);
            allocations.put(hostId, updated);
            log.debug("Released reservation {} on host {} for workload {}", reservation.getReservationId(), hostId,
                reservation.getWorkloadId());
            return true;
        });
    }
    
    /**
     * Atomically move a workload onto the host holding {@code targetReservation}: the target reservation becomes
     * an allocation, the placement flips, and the source host's allocation is released.
     */
    public Placement completeMigration(String workloadId, Reservation targetReservation) throws OrchestrationException {
        Placement current = placements.get(workloadId);
        if (current == null) {
            throw new WorkloadNotFoundException(workloadId);
        }
        String sourceHostId = current.getHostId();
        String targetHostId = targetReservation.getHostId();
        return lockManager.withHostLocks(List.of(sourceHostId, targetHostId), () -> {
            Placement placement = placements.get(workloadId);
            if (placement == null || !placement.getHostId().equals(sourceHostId)) {
                throw new IllegalStateException("Placement of workload " + workloadId + " changed during migration");
            }
            HostAllocation target = getAllocation(targetHostId);
            if (!target.getReservations().containsKey(targetReservation.getReservationId())) {
                throw new IllegalStateException("Reservation " + targetReservation.getReservationId()
                    + " is not held on host " + targetHostId);
            }
            HostAllocation updatedTarget = target.withoutReservation(targetReservation.getReservationId())
                .withAllocated(target.getAllocated().plus(targetReservation.getResources()));
            HostAllocation source = getAllocation(sourceHostId);
            HostAllocation updatedSource = source.withAllocated(source.getAllocated().minus(placement.getResources()));
            Placement moved = placement.toBuilder()
                .hostId(targetHostId)
                .resources(targetReservation.getResources())
                .placedAt(clock.instant())
                .build();
            
            persistAllocation(updatedTarget);
            persistAllocation(updatedSource);
            StoreWrites.write("placement", workloadId, () -> store.savePlacement(moved));
            
            allocations.put(targetHostId, updatedTarget);
            allocations.put(sourceHostId, updatedSource);
            placements.put(workloadId, moved);
            log.info("Workload {} moved from host {} to host {}", workloadId, sourceHostId, targetHostId);
            return moved;
        });
    }
    
    /**
     * Release a workload's allocation and forget its placement.
     */
    public Placement removeWorkload(String workloadId) throws OrchestrationException {
        Placement current = placements.get(workloadId);
        if (current == null) {
            throw new WorkloadNotFoundException(workloadId);
        }
        String hostId = current.getHostId();
        return lockManager.withHostLock(hostId, () -> {
            Placement placement = placements.get(workloadId);
            if (placement == null || !placement.getHostId().equals(hostId)) {
                throw new WorkloadNotFoundException(workloadId);
            }
            HostAllocation allocation = getAllocation(hostId);
            HostAllocation updated = allocation.withAllocated(allocation.getAllocated().minus(placement.getResources()));
            persistAllocation(updated);
            StoreWrites.write("placement", workloadId, () -> store.deletePlacement(workloadId));
            allocations.put(hostId, updated);
            placements.remove(workloadId);
            log.info("Removed workload {} from host {}", workloadId, hostId);
            return placement;
        });
    }
    
    public Optional<Placement> getPlacement(String workloadId) {
        return Optional.ofNullable(workloadId != null ? placements.get(workloadId) : null);
    }
    
    /**
     * Placements on a host, ordered by workload id.
     */
    public List<Placement> workloadsOn(String hostId) {
        List<Placement> result = new ArrayList<>();
        for (Placement placement : placements.values()) {
            if (placement.getHostId().equals(hostId)) {
                result.add(placement);
            }
        }
        result.sort(Comparator.comparing(Placement::getWorkloadId));
        return result;
    }
    
    public List<Placement> allPlacements() {
        List<Placement> result = new ArrayList<>(placements.values());
        result.sort(Comparator.comparing(Placement::getWorkloadId));
        return result;
    }
    
    @Override
    public int workloadCount(String hostId) {
        return workloadsOn(hostId).size();
    }
    
    @Override
    public int reservationCount(String hostId) {
        return getAllocation(hostId).getReservations().size();
    }
    
    public boolean isHostInUse(String hostId) {
        return workloadCount(hostId) > 0 || reservationCount(hostId) > 0;
    }
    
    /**
     * Drop the allocation record of a deregistered host.
     */
    public void forgetHost(String hostId) throws OrchestrationException {
        lockManager.withHostLock(hostId, () -> {
            StoreWrites.write("allocation", hostId, () -> store.deleteAllocation(hostId));
            allocations.remove(hostId);
            return null;
        });
    }
    
    /**
     * Load allocation and placement records read back from the store, replacing any in-memory state.
     */
    public void restore(Collection<HostAllocation> persistedAllocations, Collection<Placement> persistedPlacements) {
        allocations.clear();
        placements.clear();
        for (HostAllocation allocation : persistedAllocations) {
            allocations.put(allocation.getHostId(), allocation);
        }
        for (Placement placement : persistedPlacements) {
            placements.put(placement.getWorkloadId(), placement);
        }
        log.info("Restored {} allocation records and {} placements from store", allocations.size(), placements.size());
    }
    
    private void persistAllocation(HostAllocation allocation) throws PersistenceException {
        StoreWrites.write("allocation", allocation.getHostId(), () -> store.saveAllocation(allocation));
    }
}
