package io.hostorchestrator.api.handlers;

import io.hostorchestrator.HostOrchestrationEngine;
import io.hostorchestrator.api.models.requests.ReconcileMigrationRequest;
import io.hostorchestrator.api.models.responses.AcknowledgedResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;

/**
 * REST API handler for migration records.
 *
 * Supported operations:
 * - GET /migrations?workload_id={id} - List migration records
 * - GET /migrations/{migrationId} - Status of a migration
 * - POST /migrations/{migrationId}/cancel - Cancel a migration
 * - POST /migrations/{migrationId}/reconcile - Resolve an ambiguous migration
 * - DELETE /migrations?older_than_hours={n} - Prune finished records (default: configured retention)
 */
@Slf4j
@RestController
@RequestMapping("/migrations")
public class MigrationHandler {

    private final HostOrchestrationEngine engine;

    public MigrationHandler(HostOrchestrationEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    public ResponseEntity<Object> listMigrations(@RequestParam(value = "workload_id", required = false) String workloadId) {
        try {
            return ResponseEntity.ok(engine.listMigrations(workloadId));
        } catch (Exception e) {
            return HandlerErrors.toResponse("listing migrations", e);
        }
    }

    @GetMapping("/{migrationId}")
    public ResponseEntity<Object> getMigration(@PathVariable String migrationId) {
        try {
            return ResponseEntity.ok(engine.getMigrationStatus(migrationId));
        } catch (Exception e) {
            return HandlerErrors.toResponse("getting migration " + migrationId, e);
        }
    }

    @PostMapping("/{migrationId}/cancel")
    public ResponseEntity<Object> cancelMigration(@PathVariable String migrationId) {
        try {
            log.info("Cancelling migration: {}", migrationId);
            return ResponseEntity.ok(engine.cancelMigration(migrationId));
        } catch (Exception e) {
            return HandlerErrors.toResponse("cancelling migration " + migrationId, e);
        }
    }

    @PostMapping("/{migrationId}/reconcile")
    public ResponseEntity<Object> reconcileMigration(@PathVariable String migrationId,
                                                     @RequestBody ReconcileMigrationRequest request) {
        try {
            log.info("Reconciling migration {} to host {}", migrationId, request.getResolvedHostId());
            return ResponseEntity.ok(engine.reconcileMigration(migrationId, request.getResolvedHostId()));
        } catch (Exception e) {
            return HandlerErrors.toResponse("reconciling migration " + migrationId, e);
        }
    }

    @DeleteMapping
    public ResponseEntity<Object> pruneMigrations(@RequestParam(value = "older_than_hours", required = false) Long olderThanHours) {
        try {
            if (olderThanHours != null && olderThanHours < 0) {
                throw new IllegalArgumentException("older_than_hours must not be negative");
            }
            int removed = engine.pruneMigrations(olderThanHours != null ? Duration.ofHours(olderThanHours) : null);
            return ResponseEntity.ok(AcknowledgedResponse.builder().acknowledged(true).count(removed).build());
        } catch (Exception e) {
            return HandlerErrors.toResponse("pruning migrations", e);
        }
    }
}
