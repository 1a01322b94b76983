package io.hostorchestrator.maintenance;

import io.hostorchestrator.driver.fake.FakeMigrationBehavior;
import io.hostorchestrator.enums.ErrorCode;
import io.hostorchestrator.enums.EventType;
import io.hostorchestrator.enums.HostState;
import io.hostorchestrator.enums.MigrationMode;
import io.hostorchestrator.enums.MigrationState;
import io.hostorchestrator.enums.ReservationKind;
import io.hostorchestrator.exceptions.CapacityExceededException;
import io.hostorchestrator.exceptions.HostNotFoundException;
import io.hostorchestrator.exceptions.InvalidStateTransitionException;
import io.hostorchestrator.models.EvacuationReport;
import io.hostorchestrator.models.LabelSelector;
import io.hostorchestrator.models.MigrationRecord;
import io.hostorchestrator.models.Reservation;
import io.hostorchestrator.models.ResourceSpec;
import io.hostorchestrator.support.TestOrchestrator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static io.hostorchestrator.support.TestHosts.host;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MaintenanceControllerTest {

    private TestOrchestrator orchestrator;
    private MaintenanceController controller;

    @BeforeEach
    void setUp() throws Exception {
        orchestrator = new TestOrchestrator();
        controller = orchestrator.maintenanceController;
        // everything lands on h1 before the other hosts exist
        orchestrator.engine.registerHost(host("h1", 16, 32768));
        for (String workloadId : List.of("vm-1", "vm-2", "vm-3")) {
            orchestrator.engine.placeWorkload(workloadId, ResourceSpec.of(2, 2048, 20), LabelSelector.EMPTY);
        }
        orchestrator.engine.registerHost(host("h2", 8, 16384));
        orchestrator.engine.registerHost(host("h3", 8, 16384));
        orchestrator.engine.registerHost(host("h4", 8, 16384));
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private HostState state(String hostId) throws Exception {
        return orchestrator.engine.getHost(hostId).getState();
    }

    @Test
    void testDrainEvacuatesAllWorkloads() throws Exception {
        EvacuationReport report = controller.enterMaintenance("h1").get(10, TimeUnit.SECONDS);

        assertThat(report.isSuccessful()).isTrue();
        assertThat(report.getFinalState()).isEqualTo(HostState.MAINTENANCE);
        assertThat(report.getEvacuated()).containsOnlyKeys("vm-1", "vm-2", "vm-3");
        assertThat(report.getEvacuated().values()).doesNotContain("h1");
        assertThat(report.getFailedWorkloads()).isEmpty();
        assertThat(report.getMigrationIds()).hasSize(3);
        assertThat(state("h1")).isEqualTo(HostState.MAINTENANCE);
        assertThat(orchestrator.capacityTracker.workloadsOn("h1")).isEmpty();
        assertThat(controller.isDraining("h1")).isFalse();
        assertThat(orchestrator.events.ofType(EventType.HOST_MAINTENANCE_ENTERED)).hasSize(1);
        assertThat(orchestrator.events.ofType(EventType.HOST_MAINTENANCE_ENTERED).get(0).getPayload())
            .containsEntry("hostId", "h1");
    }

    @Test
    void testDrainedHostIsNotUsedForPlacement() throws Exception {
        controller.enterMaintenance("h1").get(10, TimeUnit.SECONDS);

        String hostId = orchestrator.engine.placeWorkload("vm-new", ResourceSpec.of(1, 1024, 10), LabelSelector.EMPTY);

        assertThat(hostId).isNotEqualTo("h1");
    }

    @Test
    void testFailedEvacuationKeepsHostDraining() throws Exception {
        orchestrator.driver.setIncompatible("vm-2", "storage not shared");

        EvacuationReport report = controller.enterMaintenance("h1").get(10, TimeUnit.SECONDS);

        assertThat(report.isSuccessful()).isFalse();
        assertThat(report.getFinalState()).isEqualTo(HostState.DRAINING);
        assertThat(report.getEvacuated()).containsOnlyKeys("vm-1", "vm-3");
        assertThat(report.getFailedWorkloads()).containsOnlyKeys("vm-2");
        assertThat(report.getFailedWorkloads().get("vm-2")).startsWith("PRECHECK_FAILED: ").contains("storage not shared");
        assertThat(state("h1")).isEqualTo(HostState.DRAINING);
        assertThat(orchestrator.engine.getPlacement("vm-2").get().getHostId()).isEqualTo("h1");
        assertThat(orchestrator.events.ofType(EventType.HOST_MAINTENANCE_ENTERED)).isEmpty();

        // retrying only touches what is left on the host
        EvacuationReport retry = controller.enterMaintenance("h1").get(10, TimeUnit.SECONDS);
        assertThat(retry.getEvacuated()).isEmpty();
        assertThat(retry.getFailedWorkloads()).containsOnlyKeys("vm-2");
        assertThat(retry.getMigrationIds()).hasSize(1);

        assertThatThrownBy(() -> controller.exitMaintenance("h1"))
            .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(controller.cancelMaintenance("h1").getState()).isEqualTo(HostState.ACTIVE);
    }

    @Test
    void testEvacuationConcurrencyIsBounded() throws Exception {
        for (String workloadId : List.of("vm-1", "vm-2", "vm-3")) {
            orchestrator.driver.setMigrationBehavior(workloadId, FakeMigrationBehavior.HANG_SYNC);
        }
        CompletableFuture<EvacuationReport> drain = controller.enterMaintenance("h1");
        assertThat(controller.isDraining("h1")).isTrue();

        awaitActiveMigrations(2);
        Thread.sleep(100);
        assertThat(orchestrator.migrationCoordinator.list(null)).hasSize(2);
        assertThat(controller.enterMaintenance("h1")).isSameAs(drain);

        while (!drain.isDone()) {
            for (MigrationRecord record : orchestrator.migrationCoordinator.list(null)) {
                if (!record.isTerminal() && record.getState() != MigrationState.CUTOVER) {
                    try {
                        orchestrator.migrationCoordinator.cancel(record.getMigrationId());
                    } catch (InvalidStateTransitionException e) {
                        // finished between listing and cancelling
                    }
                }
            }
            Thread.sleep(20);
        }

        EvacuationReport report = drain.get(1, TimeUnit.SECONDS);
        assertThat(report.getFailedWorkloads()).containsOnlyKeys("vm-1", "vm-2", "vm-3");
        assertThat(report.getFailedWorkloads().values()).allMatch(reason -> reason.startsWith("MIGRATION_CANCELLED"));
        assertThat(orchestrator.migrationCoordinator.list(null)).hasSize(3);
    }

    @Test
    void testEmptyHostEntersMaintenanceImmediately() throws Exception {
        EvacuationReport report = controller.enterMaintenance("h4").get(1, TimeUnit.SECONDS);

        assertThat(report.getFinalState()).isEqualTo(HostState.MAINTENANCE);
        assertThat(report.getMigrationIds()).isEmpty();

        assertThat(controller.exitMaintenance("h4").getState()).isEqualTo(HostState.ACTIVE);
        assertThat(orchestrator.events.ofType(EventType.HOST_MAINTENANCE_EXITED)).hasSize(1);
    }

    @Test
    void testIncomingMigrationKeepsTargetDraining() throws Exception {
        orchestrator.driver.setSyncDuration(Duration.ofMillis(500));
        MigrationRecord incoming = orchestrator.migrationCoordinator.requestMigration("vm-1", "h4", MigrationMode.LIVE);
        awaitMigrationState(incoming.getMigrationId(), MigrationState.PREPARING);

        EvacuationReport report = controller.enterMaintenance("h4").get(1, TimeUnit.SECONDS);

        assertThat(report.isSuccessful()).isFalse();
        assertThat(report.getFinalState()).isEqualTo(HostState.DRAINING);
        assertThat(report.getFailedWorkloads()).containsOnlyKeys("vm-1");
        assertThat(report.getFailedWorkloads().get("vm-1")).contains("reserved");
        assertThat(orchestrator.events.ofType(EventType.HOST_MAINTENANCE_ENTERED)).isEmpty();

        // the migration must not land on a host that is being drained
        MigrationRecord done = orchestrator.migrationCoordinator.awaitCompletion(incoming.getMigrationId())
            .get(5, TimeUnit.SECONDS);
        assertThat(done.getState()).isEqualTo(MigrationState.FAILED);
        assertThat(done.getFailureCode()).isEqualTo(ErrorCode.CAPACITY_EXCEEDED);
        assertThat(orchestrator.engine.getPlacement("vm-1").get().getHostId()).isEqualTo("h1");
        assertThat(orchestrator.capacityTracker.reservationCount("h4")).isZero();

        EvacuationReport retry = controller.enterMaintenance("h4").get(1, TimeUnit.SECONDS);
        assertThat(retry.getFinalState()).isEqualTo(HostState.MAINTENANCE);
        assertThat(state("h4")).isEqualTo(HostState.MAINTENANCE);
    }

    @Test
    void testPendingPlacementBlocksMaintenance() throws Exception {
        Reservation reservation = orchestrator.capacityTracker.reserve("h4", "vm-new", ResourceSpec.of(1, 1024, 10),
            ReservationKind.PLACEMENT);

        EvacuationReport report = controller.enterMaintenance("h4").get(1, TimeUnit.SECONDS);

        assertThat(report.getFinalState()).isEqualTo(HostState.DRAINING);
        assertThat(report.getFailedWorkloads()).containsOnlyKeys("vm-new");
        assertThatThrownBy(() -> orchestrator.capacityTracker.commitPlacement(reservation, Map.of()))
            .isInstanceOf(CapacityExceededException.class);
        assertThat(orchestrator.engine.getPlacement("vm-new")).isEmpty();

        orchestrator.capacityTracker.release(reservation);
        EvacuationReport retry = controller.enterMaintenance("h4").get(1, TimeUnit.SECONDS);
        assertThat(retry.getFinalState()).isEqualTo(HostState.MAINTENANCE);
        assertThat(orchestrator.capacityTracker.workloadsOn("h4")).isEmpty();
    }

    @Test
    void testInvalidTransitions() throws Exception {
        assertThatThrownBy(() -> controller.exitMaintenance("h4"))
            .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> controller.cancelMaintenance("h4"))
            .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> controller.enterMaintenance("h9"))
            .isInstanceOf(HostNotFoundException.class);

        controller.enterMaintenance("h4").get(1, TimeUnit.SECONDS);
        assertThatThrownBy(() -> controller.enterMaintenance("h4"))
            .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> controller.cancelMaintenance("h4"))
            .isInstanceOf(InvalidStateTransitionException.class);
    }

    private void awaitMigrationState(String migrationId, MigrationState expected) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (orchestrator.migrationCoordinator.getStatus(migrationId).getState() != expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Migration " + migrationId + " never reached " + expected);
            }
            Thread.sleep(10);
        }
    }

    private void awaitActiveMigrations(int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (activeMigrations().size() < expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Expected " + expected + " active migrations, got " + activeMigrations());
            }
            Thread.sleep(10);
        }
    }

    private List<String> activeMigrations() {
        return orchestrator.migrationCoordinator.list(null).stream()
            .filter(record -> !record.isTerminal())
            .map(MigrationRecord::getWorkloadId)
            .collect(Collectors.toList());
    }
}
