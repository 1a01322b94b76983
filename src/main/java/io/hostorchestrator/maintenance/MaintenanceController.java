package io.hostorchestrator.maintenance;

import io.hostorchestrator.capacity.CapacityTracker;
import io.hostorchestrator.config.MaintenanceSettings;
import io.hostorchestrator.enums.EventType;
import io.hostorchestrator.enums.HostState;
import io.hostorchestrator.enums.MigrationMode;
import io.hostorchestrator.enums.MigrationState;
import io.hostorchestrator.events.EventPublisher;
import io.hostorchestrator.exceptions.InvalidStateTransitionException;
import io.hostorchestrator.exceptions.OrchestrationException;
import io.hostorchestrator.migration.MigrationCoordinator;
import io.hostorchestrator.models.EvacuationReport;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.MigrationRecord;
import io.hostorchestrator.models.Placement;
import io.hostorchestrator.models.Reservation;
import io.hostorchestrator.registry.HostRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static io.hostorchestrator.config.Constants.EVENT_HOST_ID;

/**
 * Drains hosts into maintenance and returns them to service.
 *
 * A drain migrates every workload on the host to a scheduler-chosen target, at most
 * {@code evacuationConcurrency} at a time, and only moves the host to MAINTENANCE when
 * all of them succeeded. Failed evacuations are reported, not retried.
 */
@Slf4j
public class MaintenanceController {

    private final HostRegistry registry;
    private final CapacityTracker capacityTracker;
    private final MigrationCoordinator migrationCoordinator;
    private final EventPublisher eventPublisher;
    private final MaintenanceSettings settings;
    private final Map<String, Evacuation> drains = new ConcurrentHashMap<>();

    public MaintenanceController(HostRegistry registry, CapacityTracker capacityTracker,
                                 MigrationCoordinator migrationCoordinator, EventPublisher eventPublisher,
                                 MaintenanceSettings settings) {
        this.registry = registry;
        this.capacityTracker = capacityTracker;
        this.migrationCoordinator = migrationCoordinator;
        this.eventPublisher = eventPublisher;
        this.settings = settings;
    }

    /**
     * Move the host to DRAINING and evacuate it. Calling this again on a DRAINING host retries the
     * evacuation; while a drain of the host is running, its pending report is returned instead.
     *
     * @return completes when every evacuation migration has reached a terminal state
     */
    public CompletableFuture<EvacuationReport> enterMaintenance(String hostId) throws OrchestrationException {
        Host host = registry.get(hostId);
        if (!registry.compareAndSetState(hostId, HostState.ACTIVE, HostState.DRAINING)) {
            host = registry.get(hostId);
            if (host.getState() != HostState.DRAINING) {
                throw new InvalidStateTransitionException("host", hostId, host.getState(), HostState.DRAINING);
            }
            log.info("Host {} is already draining, retrying evacuation", hostId);
        }

        Evacuation evacuation = new Evacuation(hostId, capacityTracker.workloadsOn(hostId));
        Evacuation running = drains.putIfAbsent(hostId, evacuation);
        if (running != null) {
            log.info("Evacuation of host {} already in progress", hostId);
            return running.result;
        }
        log.info("Draining host {}: evacuating {} workload(s), {} at a time", hostId, evacuation.remaining,
            settings.getEvacuationConcurrency());
        evacuation.start(settings.getEvacuationConcurrency());
        return evacuation.result;
    }

    /**
     * Return a host in MAINTENANCE to service. Workloads are not migrated back.
     */
    public Host exitMaintenance(String hostId) throws OrchestrationException {
        Host host = registry.get(hostId);
        if (!registry.compareAndSetState(hostId, HostState.MAINTENANCE, HostState.ACTIVE)) {
            throw new InvalidStateTransitionException("host", hostId, registry.get(hostId).getState(), HostState.ACTIVE);
        }
        log.info("Host {} left maintenance", hostId);
        eventPublisher.publish(EventType.HOST_MAINTENANCE_EXITED, Map.of(EVENT_HOST_ID, hostId, "name", host.getName()));
        return registry.get(hostId);
    }

    /**
     * Abandon a drain and return the DRAINING host to service. Evacuations already started run to completion.
     */
    public Host cancelMaintenance(String hostId) throws OrchestrationException {
        registry.get(hostId);
        if (!registry.compareAndSetState(hostId, HostState.DRAINING, HostState.ACTIVE)) {
            throw new InvalidStateTransitionException("host", hostId, registry.get(hostId).getState(), HostState.ACTIVE);
        }
        log.info("Maintenance of host {} cancelled", hostId);
        return registry.get(hostId);
    }

    public boolean isDraining(String hostId) {
        return drains.containsKey(hostId);
    }

    private void finish(Evacuation evacuation) {
        String hostId = evacuation.hostId;
        HostState finalState;
        Map<String, String> failed = new TreeMap<>(evacuation.failed);
        if (failed.isEmpty()) {
            finalState = moveToMaintenance(hostId, failed);
        } else {
            finalState = currentState(hostId);
            log.warn("Host {} stays {}: {} workload(s) could not be evacuated: {}", hostId, finalState, failed.size(),
                failed.keySet());
        }
        EvacuationReport report = EvacuationReport.builder()
            .hostId(hostId)
            .finalState(finalState)
            .evacuated(Collections.unmodifiableMap(new TreeMap<>(evacuation.evacuated)))
            .failedWorkloads(Collections.unmodifiableMap(failed))
            .migrationIds(List.copyOf(evacuation.migrationIds))
            .build();
        drains.remove(hostId, evacuation);
        evacuation.result.complete(report);
    }

    private HostState moveToMaintenance(String hostId, Map<String, String> failed) {
        try {
            if (registry.compareAndSetState(hostId, HostState.DRAINING, HostState.MAINTENANCE, capacityTracker)) {
                log.info("Host {} entered maintenance", hostId);
                eventPublisher.publish(EventType.HOST_MAINTENANCE_ENTERED, Map.of(EVENT_HOST_ID, hostId));
                return HostState.MAINTENANCE;
            }
        } catch (OrchestrationException e) {
            log.error("Failed to move host {} into maintenance: {}", hostId, e.getMessage(), e);
            return currentState(hostId);
        }
        HostState state = currentState(hostId);
        if (state != HostState.DRAINING) {
            log.warn("Host {} left DRAINING during evacuation, not entering maintenance", hostId);
            return state;
        }
        // placed or reserved before the host stopped accepting work
        for (Placement placement : capacityTracker.workloadsOn(hostId)) {
            failed.put(placement.getWorkloadId(), "placed on the host after the drain started");
        }
        for (Reservation reservation : capacityTracker.getAllocation(hostId).getReservations().values()) {
            failed.putIfAbsent(reservation.getWorkloadId(), "capacity still reserved on the host for an incoming "
                + reservation.getKind().name().toLowerCase());
        }
        log.warn("Host {} stays DRAINING: {} workload(s) still placed or reserved on it: {}", hostId, failed.size(),
            failed.keySet());
        return state;
    }

    private HostState currentState(String hostId) {
        return registry.find(hostId).map(Host::getState).orElse(null);
    }

    /**
     * Sliding window over a host's workloads: each finished migration starts the next one.
     */
    private final class Evacuation {
        private final String hostId;
        private final Deque<Placement> pending;
        private final Map<String, String> evacuated = new ConcurrentHashMap<>();
        private final Map<String, String> failed = new ConcurrentHashMap<>();
        private final List<String> migrationIds = Collections.synchronizedList(new ArrayList<>());
        private final CompletableFuture<EvacuationReport> result = new CompletableFuture<>();
        private int remaining;

        private Evacuation(String hostId, List<Placement> workloads) {
            this.hostId = hostId;
            this.pending = new ArrayDeque<>(workloads);
            this.remaining = workloads.size();
        }

        private void start(int concurrency) {
            if (remaining == 0) {
                finish(this);
                return;
            }
            int initial = Math.min(concurrency, remaining);
            for (int i = 0; i < initial; i++) {
                launchNext();
            }
        }

        private void launchNext() {
            Placement next;
            synchronized (this) {
                next = pending.poll();
            }
            if (next == null) {
                return;
            }
            String workloadId = next.getWorkloadId();
            try {
                MigrationRecord record = migrationCoordinator.requestMigration(workloadId, null, MigrationMode.LIVE);
                migrationIds.add(record.getMigrationId());
                migrationCoordinator.awaitCompletion(record.getMigrationId())
                    .whenComplete((terminal, error) -> onMigrationDone(workloadId, terminal, error));
            } catch (OrchestrationException | RuntimeException e) {
                log.warn("Could not start evacuation of workload {} from host {}: {}", workloadId, hostId, e.getMessage());
                onMigrationDone(workloadId, null, e);
            }
        }

        private void onMigrationDone(String workloadId, MigrationRecord terminal, Throwable error) {
            if (error != null) {
                failed.put(workloadId, error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
            } else if (terminal.getState() == MigrationState.COMPLETED) {
                evacuated.put(workloadId, terminal.getTargetHostId());
            } else {
                failed.put(workloadId, terminal.getFailureCode() + ": " + terminal.getFailureReason());
            }
            boolean done;
            synchronized (this) {
                remaining--;
                done = remaining == 0;
            }
            if (done) {
                finish(this);
            } else {
                launchNext();
            }
        }
    }
}
