package io.hostorchestrator.api.handlers;

import io.hostorchestrator.HostOrchestrationEngine;
import io.hostorchestrator.api.models.requests.MigrateWorkloadRequest;
import io.hostorchestrator.api.models.requests.PlaceWorkloadRequest;
import io.hostorchestrator.api.models.responses.AcknowledgedResponse;
import io.hostorchestrator.api.models.responses.ErrorResponse;
import io.hostorchestrator.api.models.responses.PlacementResponse;
import io.hostorchestrator.enums.MigrationMode;
import io.hostorchestrator.models.LabelSelector;
import io.hostorchestrator.models.Placement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

/**
 * REST API handler for workload placement.
 *
 * Supported operations:
 * - POST /workloads - Place a workload on a scheduler-chosen host
 * - GET /workloads - List placements
 * - GET /workloads/{workloadId} - Get a workload's placement
 * - DELETE /workloads/{workloadId} - Remove a workload and release its allocation
 * - POST /workloads/{workloadId}/migrate - Start migrating a workload
 */
@Slf4j
@RestController
@RequestMapping("/workloads")
public class WorkloadHandler {

    private final HostOrchestrationEngine engine;

    public WorkloadHandler(HostOrchestrationEngine engine) {
        this.engine = engine;
    }

    @PostMapping
    public ResponseEntity<Object> placeWorkload(@RequestBody PlaceWorkloadRequest request) {
        try {
            log.info("Placing workload: {}", request.getWorkloadId());
            String hostId = engine.placeWorkload(request.getWorkloadId(), request.getResources(),
                LabelSelector.of(request.getConstraints()));
            return ResponseEntity.status(HttpStatus.CREATED).body(PlacementResponse.builder()
                .workloadId(request.getWorkloadId())
                .hostId(hostId)
                .build());
        } catch (Exception e) {
            return HandlerErrors.toResponse("placing workload " + request.getWorkloadId(), e);
        }
    }

    @GetMapping
    public ResponseEntity<Object> listPlacements() {
        try {
            return ResponseEntity.ok(engine.listPlacements());
        } catch (Exception e) {
            return HandlerErrors.toResponse("listing placements", e);
        }
    }

    @GetMapping("/{workloadId}")
    public ResponseEntity<Object> getPlacement(@PathVariable String workloadId) {
        try {
            Optional<Placement> placement = engine.getPlacement(workloadId);
            if (placement.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Workload " + workloadId));
            }
            return ResponseEntity.ok(placement.get());
        } catch (Exception e) {
            return HandlerErrors.toResponse("getting workload " + workloadId, e);
        }
    }

    @DeleteMapping("/{workloadId}")
    public ResponseEntity<Object> removeWorkload(@PathVariable String workloadId) {
        try {
            log.info("Removing workload: {}", workloadId);
            Placement removed = engine.removeWorkload(workloadId);
            return ResponseEntity.ok(AcknowledgedResponse.builder()
                .acknowledged(true)
                .workloadId(workloadId)
                .hostId(removed.getHostId())
                .build());
        } catch (Exception e) {
            return HandlerErrors.toResponse("removing workload " + workloadId, e);
        }
    }

    @PostMapping("/{workloadId}/migrate")
    public ResponseEntity<Object> migrateWorkload(@PathVariable String workloadId,
                                                  @RequestBody(required = false) MigrateWorkloadRequest request) {
        try {
            String targetHostId = request != null ? request.getTargetHostId() : null;
            MigrationMode mode = request != null && request.getMode() != null ? request.getMode() : MigrationMode.LIVE;
            log.info("Migrating workload {} to {} ({})", workloadId, targetHostId != null ? targetHostId : "scheduler-chosen host", mode);
            String migrationId = engine.migrateWorkload(workloadId, targetHostId, mode);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(AcknowledgedResponse.builder()
                .acknowledged(true)
                .workloadId(workloadId)
                .migrationId(migrationId)
                .build());
        } catch (Exception e) {
            return HandlerErrors.toResponse("migrating workload " + workloadId, e);
        }
    }
}
