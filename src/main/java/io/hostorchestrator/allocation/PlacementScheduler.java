package io.hostorchestrator.allocation;

import io.hostorchestrator.capacity.CapacityTracker;
import io.hostorchestrator.enums.ReservationKind;
import io.hostorchestrator.exceptions.CapacityExceededException;
import io.hostorchestrator.exceptions.NoEligibleHostException;
import io.hostorchestrator.exceptions.OrchestrationException;
import io.hostorchestrator.metrics.MetricsProvider;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.HostSnapshot;
import io.hostorchestrator.models.PlacementRequest;
import io.hostorchestrator.models.Reservation;
import io.hostorchestrator.registry.HostRegistry;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.hostorchestrator.metrics.MetricsConstants.PLACEMENT_COUNT_METRIC_NAME;
import static io.hostorchestrator.metrics.MetricsConstants.PLACEMENT_FAILURE_COUNT_METRIC_NAME;

/**
 * Chooses target hosts for new and migrating workloads.
 * 
 * Candidates are filtered by the decision engine from a lock-free snapshot of the registry and
 * allocations; only the final reservation is linearized, by the capacity tracker's host lock.
 * If the chosen host filled up in between, selection runs once more before giving up.
 */
@Slf4j
public class PlacementScheduler {
    
    private static final int MAX_SELECTION_ATTEMPTS = 2;
    
    private final HostRegistry registry;
    private final CapacityTracker capacityTracker;
    private final PlacementDecisionEngine decisionEngine;
    private final HostSelectionStrategy selectionStrategy;
    private final Counter placementCounter;
    private final Counter placementFailureCounter;
    
    public PlacementScheduler(HostRegistry registry, CapacityTracker capacityTracker, PlacementDecisionEngine decisionEngine,
                              HostSelectionStrategy selectionStrategy, MetricsProvider metricsProvider) {
        this.registry = registry;
        this.capacityTracker = capacityTracker;
        this.decisionEngine = decisionEngine;
        this.selectionStrategy = selectionStrategy;
        this.placementCounter = metricsProvider.counter(PLACEMENT_COUNT_METRIC_NAME, Map.of());
        this.placementFailureCounter = metricsProvider.counter(PLACEMENT_FAILURE_COUNT_METRIC_NAME, Map.of());
        log.info("PlacementScheduler initialized with {} selection", selectionStrategy.getStrategyName());
    }
    
    /**
     * Select a host for a new workload and reserve the requested resources on it.
     *
     * @return the reservation, to be committed or released by the caller
     */
    public Reservation placeNew(PlacementRequest request) throws OrchestrationException {
        return selectAndReserve(request, ReservationKind.PLACEMENT);
    }
    
    /**
     * Select and reserve, retrying selection once if the chosen host's capacity changed concurrently.
     */
    public Reservation selectAndReserve(PlacementRequest request, ReservationKind kind) throws OrchestrationException {
        validate(request);
        CapacityExceededException lastRace = null;
        for (int attempt = 1; attempt <= MAX_SELECTION_ATTEMPTS; attempt++) {
            HostSnapshot selected;
            try {
                selected = selectTarget(request);
            } catch (NoEligibleHostException e) {
                placementFailureCounter.increment();
                throw e;
            }
            try {
                Reservation reservation = capacityTracker.reserve(selected.getHostId(), request.getWorkloadId(),
                    request.getResources(), kind);
                placementCounter.increment();
                return reservation;
            } catch (CapacityExceededException e) {
                log.debug("Host {} changed before reservation for workload {} (attempt {}): {}",
                    selected.getHostId(), request.getWorkloadId(), attempt, e.getMessage());
                lastRace = e;
            }
        }
        placementFailureCounter.increment();
        Map<String, Object> details = new LinkedHashMap<>(lastRace.getDetails());
        details.put("workload_id", request.getWorkloadId());
        throw new NoEligibleHostException("No eligible host for workload " + request.getWorkloadId()
            + ": capacity changed concurrently on every selected host", details);
    }
    
    /**
     * Choose a host without reserving anything.
     */
    public HostSnapshot selectTarget(PlacementRequest request) throws NoEligibleHostException {
        validate(request);
        List<HostSnapshot> candidates = capacityTracker.snapshots(registry.listAll());
        List<HostSnapshot> eligible = decisionEngine.getEligibleHosts(request, candidates);
        Optional<HostSnapshot> selected = selectionStrategy.selectHost(eligible);
        if (selected.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("workload_id", request.getWorkloadId());
            details.put("requested", request.getResources().toString());
            details.put("constraints", request.getConstraints().toString());
            details.put("rejections", decisionEngine.explainRejections(request, candidates));
            log.info("No eligible host for workload {} among {} host(s)", request.getWorkloadId(), candidates.size());
            throw new NoEligibleHostException("No eligible host for workload " + request.getWorkloadId()
                + " requiring " + request.getResources(), details);
        }
        log.debug("Selected host {} for workload {}", selected.get().getHostId(), request.getWorkloadId());
        return selected.get();
    }
    
    /**
     * Same eligibility checks as {@link #selectTarget}, restricted to one explicitly requested host.
     */
    public HostSnapshot validateMigrationTarget(PlacementRequest request, String targetHostId) throws OrchestrationException {
        validate(request);
        Host target = registry.get(targetHostId);
        HostSnapshot snapshot = capacityTracker.snapshot(target);
        String rejection = decisionEngine.explainRejection(request, snapshot);
        if (rejection != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("workload_id", request.getWorkloadId());
            details.put("host_id", targetHostId);
            details.put("reason", rejection);
            throw new NoEligibleHostException("Host " + targetHostId + " is not an eligible target for workload "
                + request.getWorkloadId() + ": " + rejection, details);
        }
        return snapshot;
    }
    
    private static void validate(PlacementRequest request) {
        if (request == null || request.getWorkloadId() == null || request.getWorkloadId().isBlank()) {
            throw new IllegalArgumentException("workloadId must not be blank");
        }
        if (request.getResources() == null) {
            throw new IllegalArgumentException("resources must be set for workload " + request.getWorkloadId());
        }
        request.getResources().validate("resources of workload " + request.getWorkloadId());
    }
}
