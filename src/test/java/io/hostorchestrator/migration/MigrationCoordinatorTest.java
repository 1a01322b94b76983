package io.hostorchestrator.migration;

import io.hostorchestrator.config.MigrationSettings;
import io.hostorchestrator.driver.fake.FakeMigrationBehavior;
import io.hostorchestrator.enums.ErrorCode;
import io.hostorchestrator.enums.EventType;
import io.hostorchestrator.enums.MigrationMode;
import io.hostorchestrator.enums.MigrationState;
import io.hostorchestrator.enums.ReservationKind;
import io.hostorchestrator.exceptions.CannotCancelDuringCutoverException;
import io.hostorchestrator.exceptions.HostNotFoundException;
import io.hostorchestrator.exceptions.InvalidStateTransitionException;
import io.hostorchestrator.exceptions.MigrationInProgressException;
import io.hostorchestrator.exceptions.MigrationNotFoundException;
import io.hostorchestrator.exceptions.OrchestrationException;
import io.hostorchestrator.exceptions.WorkloadNotFoundException;
import io.hostorchestrator.models.LabelSelector;
import io.hostorchestrator.models.MigrationRecord;
import io.hostorchestrator.models.Reservation;
import io.hostorchestrator.models.ResourceSpec;
import io.hostorchestrator.support.RecordingEventSink.RecordedEvent;
import io.hostorchestrator.support.TestHosts;
import io.hostorchestrator.support.TestOrchestrator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static io.hostorchestrator.metrics.MetricsConstants.MIGRATION_COMPLETED_COUNT_METRIC_NAME;
import static io.hostorchestrator.metrics.MetricsConstants.MIGRATION_FAILED_COUNT_METRIC_NAME;
import static io.hostorchestrator.support.TestHosts.host;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MigrationCoordinatorTest {

    private static final ResourceSpec SMALL = ResourceSpec.of(2, 2048, 20);

    private TestOrchestrator orchestrator;
    private MigrationCoordinator coordinator;

    @BeforeEach
    void setUp() throws Exception {
        start(TestOrchestrator.defaultMigrationSettings());
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private void start(MigrationSettings settings) throws Exception {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
        orchestrator = new TestOrchestrator(settings);
        coordinator = orchestrator.migrationCoordinator;
        orchestrator.engine.registerHost(host("h1", 8, 16384));
        orchestrator.engine.registerHost(host("h2", 8, 16384));
        orchestrator.engine.registerHost(host("h3", 8, 16384));
    }

    private String place(String workloadId) throws Exception {
        return orchestrator.engine.placeWorkload(workloadId, SMALL, LabelSelector.EMPTY);
    }

    private static String otherHost(String hostId) {
        return "h1".equals(hostId) ? "h2" : "h1";
    }

    private MigrationRecord await(MigrationRecord started) throws Exception {
        return coordinator.awaitCompletion(started.getMigrationId()).get(5, TimeUnit.SECONDS);
    }

    private void awaitState(String migrationId, MigrationState expected) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (coordinator.getStatus(migrationId).getState() != expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Migration " + migrationId + " never reached " + expected
                    + ", state is " + coordinator.getStatus(migrationId).getState());
            }
            Thread.sleep(10);
        }
    }

    private long allocatedVcpus(String hostId) {
        return orchestrator.capacityTracker.getAllocation(hostId).getAllocated().getVcpus();
    }

    private int reservations(String hostId) {
        return orchestrator.capacityTracker.getAllocation(hostId).getReservations().size();
    }

    @Test
    void testLiveMigrationMovesPlacement() throws Exception {
        String source = place("vm-1");
        String target = otherHost(source);

        MigrationRecord started = coordinator.requestMigration("vm-1", target, MigrationMode.LIVE);
        assertThat(started.getState()).isEqualTo(MigrationState.PENDING);
        assertThat(started.getSourceHostId()).isEqualTo(source);

        MigrationRecord done = await(started);

        assertThat(done.getState()).isEqualTo(MigrationState.COMPLETED);
        assertThat(done.getProgressPercent()).isEqualTo(100);
        assertThat(done.getReservationId()).isNull();
        assertThat(done.getTransitions()).containsKeys(MigrationState.PENDING, MigrationState.PRE_CHECKING,
            MigrationState.PREPARING, MigrationState.CUTOVER, MigrationState.COMPLETED);
        assertThat(orchestrator.engine.getPlacement("vm-1").get().getHostId()).isEqualTo(target);
        assertThat(allocatedVcpus(source)).isZero();
        assertThat(allocatedVcpus(target)).isEqualTo(2);
        assertThat(reservations(target)).isZero();
        assertThat(coordinator.hasActiveMigration("vm-1")).isFalse();
        assertThat(orchestrator.driver.getCompletedMigrations()).containsExactly("vm-1->fake://" + target);

        assertThat(orchestrator.events.ofType(EventType.SYSTEM_MIGRATING)).hasSize(1);
        List<RecordedEvent> migrated = orchestrator.events.ofType(EventType.SYSTEM_MIGRATED);
        assertThat(migrated).hasSize(1);
        assertThat(migrated.get(0).getPayload())
            .containsEntry("systemId", "vm-1")
            .containsEntry("sourceHostId", source)
            .containsEntry("targetHostId", target);
        assertThat(orchestrator.meterRegistry.find(MIGRATION_COMPLETED_COUNT_METRIC_NAME).tag("mode", "LIVE")
            .counter().count()).isEqualTo(1.0);
    }

    @Test
    void testOfflineMigrationToSchedulerChosenTarget() throws Exception {
        String source = place("vm-1");

        MigrationRecord done = await(coordinator.requestMigration("vm-1", null, MigrationMode.OFFLINE));

        assertThat(done.getState()).isEqualTo(MigrationState.COMPLETED);
        assertThat(done.isTargetRequested()).isFalse();
        assertThat(done.getTargetHostId()).isNotNull().isNotEqualTo(source);
        assertThat(orchestrator.engine.getPlacement("vm-1").get().getHostId()).isEqualTo(done.getTargetHostId());
    }

    @Test
    void testRequestValidation() throws Exception {
        place("vm-1");

        assertThatThrownBy(() -> coordinator.requestMigration("ghost", null, MigrationMode.LIVE))
            .isInstanceOf(WorkloadNotFoundException.class);
        assertThatThrownBy(() -> coordinator.requestMigration("vm-1", "h9", MigrationMode.LIVE))
            .isInstanceOf(HostNotFoundException.class);
        assertThatThrownBy(() -> coordinator.requestMigration("vm-1", null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> coordinator.requestMigration(" ", null, MigrationMode.LIVE))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(coordinator.list(null)).isEmpty();
        assertThatThrownBy(() -> coordinator.getStatus("missing"))
            .isInstanceOf(MigrationNotFoundException.class);
    }

    @Test
    void testIncompatibleTargetFailsPrecheck() throws Exception {
        String source = place("vm-1");
        orchestrator.driver.setIncompatible("vm-1", "CPU model mismatch");

        MigrationRecord done = await(coordinator.requestMigration("vm-1", otherHost(source), MigrationMode.LIVE));

        assertThat(done.getState()).isEqualTo(MigrationState.FAILED);
        assertThat(done.getFailureCode()).isEqualTo(ErrorCode.PRECHECK_FAILED);
        assertThat(done.getFailureReason()).contains("CPU model mismatch");
        assertThat(orchestrator.engine.getPlacement("vm-1").get().getHostId()).isEqualTo(source);
        assertThat(reservations(otherHost(source))).isZero();
        assertThat(allocatedVcpus(otherHost(source))).isZero();
        assertThat(orchestrator.events.ofType(EventType.SYSTEM_MIGRATING)).isEmpty();
        assertThat(orchestrator.meterRegistry.find(MIGRATION_FAILED_COUNT_METRIC_NAME)
            .tag("errorCode", "PRECHECK_FAILED").counter().count()).isEqualTo(1.0);
    }

    @Test
    void testMigrationToSourceHostFailsPrecheck() throws Exception {
        String source = place("vm-1");

        MigrationRecord done = await(coordinator.requestMigration("vm-1", source, MigrationMode.LIVE));

        assertThat(done.getFailureCode()).isEqualTo(ErrorCode.PRECHECK_FAILED);
        assertThat(orchestrator.engine.getPlacement("vm-1").get().getHostId()).isEqualTo(source);
    }

    @Test
    void testTargetWithoutCapacityFailsPrecheck() throws Exception {
        String source = place("vm-1");
        String target = otherHost(source);
        orchestrator.capacityTracker.reserve(target, "blocker", ResourceSpec.of(8, 1024, 1), ReservationKind.PLACEMENT);

        MigrationRecord done = await(coordinator.requestMigration("vm-1", target, MigrationMode.LIVE));

        assertThat(done.getFailureCode()).isEqualTo(ErrorCode.PRECHECK_FAILED);
        assertThat(reservations(target)).isEqualTo(1);
    }

    @Test
    void testFailedCutoverRollsBack() throws Exception {
        String source = place("vm-1");
        String target = otherHost(source);
        orchestrator.driver.setMigrationBehavior("vm-1", FakeMigrationBehavior.FAIL_CUTOVER);

        MigrationRecord done = await(coordinator.requestMigration("vm-1", target, MigrationMode.LIVE));

        assertThat(done.getState()).isEqualTo(MigrationState.FAILED);
        assertThat(done.getFailureCode()).isEqualTo(ErrorCode.DRIVER_ERROR);
        assertThat(done.getReservationId()).isNull();
        assertThat(orchestrator.engine.getPlacement("vm-1").get().getHostId()).isEqualTo(source);
        assertThat(reservations(target)).isZero();
        assertThat(allocatedVcpus(source)).isEqualTo(2);
        assertThat(orchestrator.events.ofType(EventType.SYSTEM_MIGRATED)).isEmpty();
    }

    @Test
    void testFailedSynchronizationRollsBack() throws Exception {
        String source = place("vm-1");
        orchestrator.driver.setMigrationBehavior("vm-1", FakeMigrationBehavior.FAIL_SYNC);

        MigrationRecord done = await(coordinator.requestMigration("vm-1", otherHost(source), MigrationMode.LIVE));

        assertThat(done.getFailureCode()).isEqualTo(ErrorCode.DRIVER_ERROR);
        assertThat(done.getTransitions()).doesNotContainKey(MigrationState.CUTOVER);
        assertThat(reservations(otherHost(source))).isZero();
    }

    @Test
    void testPartialCutoverKeepsReservationUntilReconciledToTarget() throws Exception {
        String source = place("vm-1");
        String target = otherHost(source);
        orchestrator.driver.setMigrationBehavior("vm-1", FakeMigrationBehavior.PARTIAL_CUTOVER);

        MigrationRecord done = await(coordinator.requestMigration("vm-1", target, MigrationMode.LIVE));

        assertThat(done.getState()).isEqualTo(MigrationState.FAILED);
        assertThat(done.getFailureCode()).isEqualTo(ErrorCode.AMBIGUOUS_STATE);
        assertThat(done.getReservationId()).isNotNull();
        assertThat(reservations(target)).isEqualTo(1);
        assertThat(orchestrator.engine.getPlacement("vm-1").get().getHostId()).isEqualTo(source);

        MigrationRecord reconciled = coordinator.reconcile(done.getMigrationId(), target);

        assertThat(reconciled.getReservationId()).isNull();
        assertThat(reconciled.getFailureReason()).endsWith("(reconciled to host " + target + ")");
        assertThat(orchestrator.engine.getPlacement("vm-1").get().getHostId()).isEqualTo(target);
        assertThat(reservations(target)).isZero();
        assertThat(allocatedVcpus(target)).isEqualTo(2);
        assertThat(allocatedVcpus(source)).isZero();

        assertThatThrownBy(() -> coordinator.reconcile(done.getMigrationId(), target))
            .isInstanceOf(OrchestrationException.class)
            .extracting(e -> ((OrchestrationException) e).getErrorCode())
            .isEqualTo(ErrorCode.INVALID_STATE_TRANSITION);
    }

    @Test
    void testCutoverErrorReconciledToSource() throws Exception {
        String source = place("vm-1");
        String target = otherHost(source);
        orchestrator.driver.setMigrationBehavior("vm-1", FakeMigrationBehavior.ERROR_CUTOVER);

        MigrationRecord done = await(coordinator.requestMigration("vm-1", target, MigrationMode.LIVE));
        assertThat(done.getFailureCode()).isEqualTo(ErrorCode.AMBIGUOUS_STATE);

        assertThatThrownBy(() -> coordinator.reconcile(done.getMigrationId(), "h3".equals(source) ? "h2" : "h3"))
            .isInstanceOf(IllegalArgumentException.class);

        coordinator.reconcile(done.getMigrationId(), source);

        assertThat(orchestrator.engine.getPlacement("vm-1").get().getHostId()).isEqualTo(source);
        assertThat(reservations(target)).isZero();
        assertThat(allocatedVcpus(target)).isZero();
    }

    @Test
    void testReconcileRejectsCleanFailure() throws Exception {
        String source = place("vm-1");
        orchestrator.driver.setMigrationBehavior("vm-1", FakeMigrationBehavior.FAIL_CUTOVER);
        MigrationRecord done = await(coordinator.requestMigration("vm-1", otherHost(source), MigrationMode.LIVE));

        assertThatThrownBy(() -> coordinator.reconcile(done.getMigrationId(), source))
            .isInstanceOf(OrchestrationException.class)
            .hasMessageContaining("no ambiguous outcome");
    }

    @Test
    void testSecondMigrationOfSameWorkloadRejected() throws Exception {
        String source = place("vm-1");
        orchestrator.driver.setMigrationBehavior("vm-1", FakeMigrationBehavior.HANG_SYNC);
        MigrationRecord first = coordinator.requestMigration("vm-1", otherHost(source), MigrationMode.LIVE);

        assertThatThrownBy(() -> coordinator.requestMigration("vm-1", null, MigrationMode.LIVE))
            .isInstanceOf(MigrationInProgressException.class);
        assertThat(coordinator.activeMigrationId("vm-1")).contains(first.getMigrationId());
        assertThatThrownBy(() -> orchestrator.engine.removeWorkload("vm-1"))
            .isInstanceOf(MigrationInProgressException.class);

        coordinator.cancel(first.getMigrationId());
        await(first);
    }

    @Test
    void testMigrationRejectedWhileWorkloadIsBeingRemoved() throws Exception {
        String source = place("vm-1");

        coordinator.withMigrationsBlocked("vm-1", () -> {
            assertThatThrownBy(() -> coordinator.requestMigration("vm-1", otherHost(source), MigrationMode.LIVE))
                .isInstanceOf(WorkloadNotFoundException.class);
            assertThat(coordinator.activeMigrationId("vm-1")).isEmpty();
            return orchestrator.capacityTracker.removeWorkload("vm-1");
        });

        assertThat(coordinator.hasActiveMigration("vm-1")).isFalse();
        assertThat(coordinator.list("vm-1")).isEmpty();
        assertThat(reservations(otherHost(source))).isZero();
        assertThatThrownBy(() -> coordinator.requestMigration("vm-1", null, MigrationMode.LIVE))
            .isInstanceOf(WorkloadNotFoundException.class);
    }

    @Test
    void testUnreachableHostDuringCompatibilityCheckFailsPrecheck() throws Exception {
        String source = place("vm-1");
        String target = otherHost(source);
        orchestrator.driver.setReachable(TestHosts.endpoint(source), false);

        MigrationRecord done = await(coordinator.requestMigration("vm-1", target, MigrationMode.LIVE));

        assertThat(done.getState()).isEqualTo(MigrationState.FAILED);
        assertThat(done.getFailureCode()).isEqualTo(ErrorCode.PRECHECK_FAILED);
        assertThat(done.getFailureReason()).contains("Compatibility check");
        assertThat(orchestrator.engine.getPlacement("vm-1").get().getHostId()).isEqualTo(source);
        assertThat(reservations(target)).isZero();
    }

    @Test
    void testCancelWhilePreparingRollsBack() throws Exception {
        String source = place("vm-1");
        String target = otherHost(source);
        orchestrator.driver.setMigrationBehavior("vm-1", FakeMigrationBehavior.HANG_SYNC);
        MigrationRecord started = coordinator.requestMigration("vm-1", target, MigrationMode.LIVE);
        awaitState(started.getMigrationId(), MigrationState.PREPARING);

        coordinator.cancel(started.getMigrationId());
        MigrationRecord done = await(started);

        assertThat(done.getState()).isEqualTo(MigrationState.FAILED);
        assertThat(done.getFailureCode()).isEqualTo(ErrorCode.MIGRATION_CANCELLED);
        assertThat(orchestrator.engine.getPlacement("vm-1").get().getHostId()).isEqualTo(source);
        assertThat(reservations(target)).isZero();
        assertThat(coordinator.hasActiveMigration("vm-1")).isFalse();
    }

    @Test
    void testCancelTerminalMigrationRejected() throws Exception {
        String source = place("vm-1");
        MigrationRecord done = await(coordinator.requestMigration("vm-1", otherHost(source), MigrationMode.LIVE));

        assertThatThrownBy(() -> coordinator.cancel(done.getMigrationId()))
            .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    void testCancelDuringCutoverRejectedAndTimeoutIsAmbiguous() throws Exception {
        start(TestOrchestrator.defaultMigrationSettings().toBuilder().cutoverTimeout(Duration.ofMillis(300)).build());
        String source = place("vm-1");
        String target = otherHost(source);
        orchestrator.driver.setMigrationBehavior("vm-1", FakeMigrationBehavior.HANG_CUTOVER);
        MigrationRecord started = coordinator.requestMigration("vm-1", target, MigrationMode.LIVE);
        awaitState(started.getMigrationId(), MigrationState.CUTOVER);

        assertThatThrownBy(() -> coordinator.cancel(started.getMigrationId()))
            .isInstanceOf(CannotCancelDuringCutoverException.class);

        MigrationRecord done = await(started);
        assertThat(done.getFailureCode()).isEqualTo(ErrorCode.AMBIGUOUS_STATE);
        assertThat(reservations(target)).isEqualTo(1);
    }

    @Test
    void testPrepareTimeout() throws Exception {
        start(TestOrchestrator.defaultMigrationSettings().toBuilder().prepareTimeout(Duration.ofMillis(200)).build());
        String source = place("vm-1");
        String target = otherHost(source);
        orchestrator.driver.setMigrationBehavior("vm-1", FakeMigrationBehavior.HANG_SYNC);

        MigrationRecord done = await(coordinator.requestMigration("vm-1", target, MigrationMode.LIVE));

        assertThat(done.getFailureCode()).isEqualTo(ErrorCode.MIGRATION_TIMEOUT);
        assertThat(reservations(target)).isZero();
        assertThat(orchestrator.engine.getPlacement("vm-1").get().getHostId()).isEqualTo(source);
    }

    @Test
    void testListOrderedByCreationAndFilteredByWorkload() throws Exception {
        String source1 = place("vm-1");
        String source2 = place("vm-2");
        MigrationRecord first = await(coordinator.requestMigration("vm-1", otherHost(source1), MigrationMode.LIVE));
        MigrationRecord second = await(coordinator.requestMigration("vm-2", otherHost(source2), MigrationMode.OFFLINE));

        assertThat(coordinator.list(null)).extracting(MigrationRecord::getMigrationId)
            .containsExactly(first.getMigrationId(), second.getMigrationId());
        assertThat(coordinator.list("vm-2")).extracting(MigrationRecord::getMigrationId)
            .containsExactly(second.getMigrationId());
    }

    @Test
    void testPruneRemovesOnlyOldTerminalRecords() throws Exception {
        String source = place("vm-1");
        MigrationRecord done = await(coordinator.requestMigration("vm-1", otherHost(source), MigrationMode.LIVE));

        assertThat(coordinator.prune(null)).isZero();
        Thread.sleep(5);
        assertThat(coordinator.prune(Duration.ZERO)).isEqualTo(1);

        assertThat(coordinator.list(null)).isEmpty();
        assertThat(orchestrator.store.loadMigrations()).isEmpty();
        assertThatThrownBy(() -> coordinator.getStatus(done.getMigrationId()))
            .isInstanceOf(MigrationNotFoundException.class);
    }

    @Test
    void testRecoverInterruptedMigrations() throws Exception {
        String source = place("vm-1");
        String target = otherHost(source);
        place("vm-2");
        Reservation held = orchestrator.capacityTracker.reserve(target, "vm-1", SMALL, ReservationKind.MIGRATION);
        Reservation cutoverHeld = orchestrator.capacityTracker.reserve(target, "vm-2", SMALL, ReservationKind.MIGRATION);

        MigrationRecord preparing = interrupted("m-prep", "vm-1", source, target, MigrationState.PREPARING, held);
        MigrationRecord cutover = interrupted("m-cut", "vm-2", source, target, MigrationState.CUTOVER, cutoverHeld);
        MigrationRecord finished = interrupted("m-done", "vm-3", source, target, MigrationState.COMPLETED, null);

        coordinator.recoverInterrupted(List.of(preparing, cutover, finished));

        MigrationRecord failedPrep = coordinator.getStatus("m-prep");
        assertThat(failedPrep.getState()).isEqualTo(MigrationState.FAILED);
        assertThat(failedPrep.getFailureCode()).isEqualTo(ErrorCode.MIGRATION_INTERRUPTED);
        assertThat(failedPrep.getReservationId()).isNull();

        MigrationRecord ambiguous = coordinator.getStatus("m-cut");
        assertThat(ambiguous.getFailureCode()).isEqualTo(ErrorCode.AMBIGUOUS_STATE);
        assertThat(ambiguous.getReservationId()).isEqualTo(cutoverHeld.getReservationId());
        assertThat(orchestrator.capacityTracker.getAllocation(target).getReservations())
            .containsOnlyKeys(cutoverHeld.getReservationId());

        assertThat(coordinator.getStatus("m-done").getState()).isEqualTo(MigrationState.COMPLETED);
        assertThat(coordinator.awaitCompletion("m-prep")).isDone();
        assertThat(coordinator.hasActiveMigration("vm-1")).isFalse();
    }

    private static MigrationRecord interrupted(String migrationId, String workloadId, String source, String target,
                                               MigrationState state, Reservation reservation) {
        Instant createdAt = Instant.parse("2024-05-01T10:00:00Z");
        MigrationRecord record = new MigrationRecord();
        record.setMigrationId(migrationId);
        record.setWorkloadId(workloadId);
        record.setSourceHostId(source);
        record.setTargetHostId(target);
        record.setTargetRequested(true);
        record.setMode(MigrationMode.LIVE);
        record.setState(state);
        record.setResources(SMALL);
        record.setReservationId(reservation != null ? reservation.getReservationId() : null);
        record.getTransitions().put(state, createdAt);
        record.setCreatedAt(createdAt);
        record.setUpdatedAt(createdAt);
        return record;
    }
}
