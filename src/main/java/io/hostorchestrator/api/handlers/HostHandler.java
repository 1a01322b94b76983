package io.hostorchestrator.api.handlers;

import io.hostorchestrator.HostOrchestrationEngine;
import io.hostorchestrator.api.models.requests.RegisterHostRequest;
import io.hostorchestrator.api.models.responses.AcknowledgedResponse;
import io.hostorchestrator.api.models.responses.HostAllocationResponse;
import io.hostorchestrator.models.EvacuationReport;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.LabelSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * REST API handler for host operations.
 *
 * Supported operations:
 * - POST /hosts - Register a host
 * - GET /hosts?selector=k1=v1,k2=v2 - List hosts, optionally filtered by labels
 * - GET /hosts/{hostId} - Get a host
 * - DELETE /hosts/{hostId} - Deregister an idle host
 * - GET /hosts/{hostId}/allocation - Capacity accounting of a host
 * - GET /hosts/{hostId}/pool-metrics - Connection pool counters of a host
 * - POST /hosts/{hostId}/maintenance - Drain the host into maintenance
 * - DELETE /hosts/{hostId}/maintenance - Return the host from maintenance
 * - POST /hosts/{hostId}/maintenance/cancel - Abandon a drain
 */
@Slf4j
@RestController
@RequestMapping("/hosts")
public class HostHandler {

    private final HostOrchestrationEngine engine;

    public HostHandler(HostOrchestrationEngine engine) {
        this.engine = engine;
    }

    @PostMapping
    public ResponseEntity<Object> registerHost(@RequestBody RegisterHostRequest request) {
        try {
            log.info("Registering host: {}", request.getHostId());
            Host host = engine.registerHost(request.toHost());
            return ResponseEntity.status(HttpStatus.CREATED).body(host);
        } catch (Exception e) {
            return HandlerErrors.toResponse("registering host " + request.getHostId(), e);
        }
    }

    @GetMapping
    public ResponseEntity<Object> listHosts(@RequestParam(value = "selector", required = false) String selector) {
        try {
            return ResponseEntity.ok(engine.listHosts(LabelSelector.parse(selector)));
        } catch (Exception e) {
            return HandlerErrors.toResponse("listing hosts", e);
        }
    }

    @GetMapping("/{hostId}")
    public ResponseEntity<Object> getHost(@PathVariable String hostId) {
        try {
            return ResponseEntity.ok(engine.getHost(hostId));
        } catch (Exception e) {
            return HandlerErrors.toResponse("getting host " + hostId, e);
        }
    }

    @DeleteMapping("/{hostId}")
    public ResponseEntity<Object> deregisterHost(@PathVariable String hostId) {
        try {
            log.info("Deregistering host: {}", hostId);
            engine.deregisterHost(hostId);
            return ResponseEntity.ok(AcknowledgedResponse.builder().acknowledged(true).hostId(hostId).build());
        } catch (Exception e) {
            return HandlerErrors.toResponse("deregistering host " + hostId, e);
        }
    }

    @GetMapping("/{hostId}/allocation")
    public ResponseEntity<Object> getAllocation(@PathVariable String hostId) {
        try {
            return ResponseEntity.ok(HostAllocationResponse.from(engine.getHostAllocation(hostId)));
        } catch (Exception e) {
            return HandlerErrors.toResponse("getting allocation of host " + hostId, e);
        }
    }

    @GetMapping("/{hostId}/pool-metrics")
    public ResponseEntity<Object> getPoolMetrics(@PathVariable String hostId) {
        try {
            return ResponseEntity.ok(engine.getPoolMetrics(hostId));
        } catch (Exception e) {
            return HandlerErrors.toResponse("getting pool metrics of host " + hostId, e);
        }
    }

    /**
     * Start draining a host. With {@code wait=true} the response is the evacuation report;
     * otherwise the drain continues in the background and 202 is returned.
     */
    @PostMapping("/{hostId}/maintenance")
    public ResponseEntity<Object> enterMaintenance(@PathVariable String hostId,
                                                   @RequestParam(value = "wait", defaultValue = "false") boolean wait) {
        try {
            log.info("Entering maintenance on host: {}", hostId);
            CompletableFuture<EvacuationReport> drain = engine.enterMaintenance(hostId);
            if (!wait) {
                return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(AcknowledgedResponse.builder().acknowledged(true).hostId(hostId).build());
            }
            EvacuationReport report = drain.get();
            HttpStatus status = report.isSuccessful() ? HttpStatus.OK : HttpStatus.CONFLICT;
            return ResponseEntity.status(status).body(report);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HandlerErrors.toResponse("entering maintenance on host " + hostId, e);
        } catch (ExecutionException e) {
            Exception cause = e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
            return HandlerErrors.toResponse("entering maintenance on host " + hostId, cause);
        } catch (Exception e) {
            return HandlerErrors.toResponse("entering maintenance on host " + hostId, e);
        }
    }

    @DeleteMapping("/{hostId}/maintenance")
    public ResponseEntity<Object> exitMaintenance(@PathVariable String hostId) {
        try {
            log.info("Exiting maintenance on host: {}", hostId);
            return ResponseEntity.ok(engine.exitMaintenance(hostId));
        } catch (Exception e) {
            return HandlerErrors.toResponse("exiting maintenance on host " + hostId, e);
        }
    }

    @PostMapping("/{hostId}/maintenance/cancel")
    public ResponseEntity<Object> cancelMaintenance(@PathVariable String hostId) {
        try {
            log.info("Cancelling maintenance on host: {}", hostId);
            return ResponseEntity.ok(engine.cancelMaintenance(hostId));
        } catch (Exception e) {
            return HandlerErrors.toResponse("cancelling maintenance on host " + hostId, e);
        }
    }
}
