package io.hostorchestrator.migration;

import io.hostorchestrator.allocation.PlacementScheduler;
import io.hostorchestrator.capacity.CapacityTracker;
import io.hostorchestrator.config.MigrationSettings;
import io.hostorchestrator.driver.CompatibilityReport;
import io.hostorchestrator.driver.HypervisorDriver;
import io.hostorchestrator.driver.MigrationTask;
import io.hostorchestrator.enums.CutoverOutcome;
import io.hostorchestrator.enums.ErrorCode;
import io.hostorchestrator.enums.EventType;
import io.hostorchestrator.enums.HostState;
import io.hostorchestrator.enums.MigrationMode;
import io.hostorchestrator.enums.MigrationState;
import io.hostorchestrator.enums.ReservationKind;
import io.hostorchestrator.events.EventPublisher;
import io.hostorchestrator.exceptions.CannotCancelDuringCutoverException;
import io.hostorchestrator.exceptions.CapacityExceededException;
import io.hostorchestrator.exceptions.DriverException;
import io.hostorchestrator.exceptions.InvalidStateTransitionException;
import io.hostorchestrator.exceptions.MigrationInProgressException;
import io.hostorchestrator.exceptions.MigrationNotFoundException;
import io.hostorchestrator.exceptions.OrchestrationException;
import io.hostorchestrator.exceptions.PersistenceException;
import io.hostorchestrator.exceptions.WorkloadNotFoundException;
import io.hostorchestrator.metrics.MetricsProvider;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.HostSnapshot;
import io.hostorchestrator.models.LabelSelector;
import io.hostorchestrator.models.MigrationRecord;
import io.hostorchestrator.models.Placement;
import io.hostorchestrator.models.PlacementRequest;
import io.hostorchestrator.models.Reservation;
import io.hostorchestrator.pool.ConnectionPoolManager;
import io.hostorchestrator.registry.HostLockManager;
import io.hostorchestrator.registry.HostRegistry;
import io.hostorchestrator.store.OrchestratorStore;
import io.hostorchestrator.store.StoreWrites;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static io.hostorchestrator.config.Constants.EVENT_MIGRATION_ID;
import static io.hostorchestrator.config.Constants.EVENT_WORKLOAD_ID;
import static io.hostorchestrator.metrics.MetricsConstants.ERROR_CODE_TAG;
import static io.hostorchestrator.metrics.MetricsConstants.MIGRATION_COMPLETED_COUNT_METRIC_NAME;
import static io.hostorchestrator.metrics.MetricsConstants.MIGRATION_DURATION_METRIC_NAME;
import static io.hostorchestrator.metrics.MetricsConstants.MIGRATION_FAILED_COUNT_METRIC_NAME;
import static io.hostorchestrator.metrics.MetricsConstants.MODE_TAG;

/**
 * Drives migration records through PENDING, PRE_CHECKING, PREPARING, CUTOVER and COMPLETED,
 * or FAILED from any non-terminal state.
 *
 * Each migration runs as an asynchronous chain on the coordinator's worker pool. Driver
 * connections are borrowed only for the duration of a single driver call; the long-running
 * synchronization and the cutover are awaited as futures, never on a pooled connection.
 * A workload has at most one non-terminal migration at a time.
 */
@Slf4j
public class MigrationCoordinator {

    private final HostRegistry registry;
    private final CapacityTracker capacityTracker;
    private final PlacementScheduler scheduler;
    private final ConnectionPoolManager poolManager;
    private final HypervisorDriver driver;
    private final OrchestratorStore store;
    private final EventPublisher eventPublisher;
    private final MigrationSettings settings;
    private final Clock clock;
    private final MetricsProvider metricsProvider;
    private final ExecutorService executor;

    private final Map<String, ActiveMigration> migrations = new ConcurrentHashMap<>();
    // workload id -> id of its non-terminal migration, or REMOVAL_MARKER while the workload is being removed
    private final Map<String, String> activeByWorkload = new ConcurrentHashMap<>();
    private static final String REMOVAL_MARKER = "removal";

    public MigrationCoordinator(HostRegistry registry, CapacityTracker capacityTracker, PlacementScheduler scheduler,
                                ConnectionPoolManager poolManager, HypervisorDriver driver, OrchestratorStore store,
                                EventPublisher eventPublisher, MigrationSettings settings, Clock clock,
                                MetricsProvider metricsProvider) {
        this.registry = registry;
        this.capacityTracker = capacityTracker;
        this.scheduler = scheduler;
        this.poolManager = poolManager;
        this.driver = driver;
        this.store = store;
        this.eventPublisher = eventPublisher;
        this.settings = settings;
        this.clock = clock;
        this.metricsProvider = metricsProvider;
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(settings.getWorkerThreads(), r -> {
            Thread thread = new Thread(r, "migration-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("MigrationCoordinator initialized with {} worker threads, prepare timeout {}s, cutover timeout {}s",
            settings.getWorkerThreads(), settings.getPrepareTimeout().getSeconds(), settings.getCutoverTimeout().getSeconds());
    }

    /**
     * Create a migration record for a placed workload and start driving it asynchronously.
     *
     * @param targetHostId explicit target, or null to let the scheduler choose
     * @return a snapshot of the new record, in state PENDING
     */
    public MigrationRecord requestMigration(String workloadId, String targetHostId, MigrationMode mode)
            throws OrchestrationException {
        if (workloadId == null || workloadId.isBlank()) {
            throw new IllegalArgumentException("workloadId must not be blank");
        }
        if (mode == null) {
            throw new IllegalArgumentException("migration mode must be set");
        }
        Placement placement = capacityTracker.getPlacement(workloadId)
            .orElseThrow(() -> new WorkloadNotFoundException(workloadId));
        if (targetHostId != null) {
            registry.get(targetHostId);
        }

        Instant now = clock.instant();
        MigrationRecord record = new MigrationRecord();
        record.setMigrationId(UUID.randomUUID().toString());
        record.setWorkloadId(workloadId);
        record.setSourceHostId(placement.getHostId());
        record.setTargetHostId(targetHostId);
        record.setTargetRequested(targetHostId != null);
        record.setMode(mode);
        record.setState(MigrationState.PENDING);
        record.setResources(placement.getResources());
        record.setConstraints(new LinkedHashMap<>(placement.getConstraints()));
        record.getTransitions().put(MigrationState.PENDING, now);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        String migrationId = record.getMigrationId();

        String existing = activeByWorkload.putIfAbsent(workloadId, migrationId);
        if (REMOVAL_MARKER.equals(existing)) {
            throw new WorkloadNotFoundException(workloadId);
        }
        if (existing != null) {
            throw new MigrationInProgressException(workloadId, existing);
        }
        Optional<Placement> claimed = capacityTracker.getPlacement(workloadId);
        if (claimed.isEmpty() || !claimed.get().getHostId().equals(placement.getHostId())) {
            // removed between the lookup and the claim
            activeByWorkload.remove(workloadId, migrationId);
            throw new WorkloadNotFoundException(workloadId);
        }
        try {
            StoreWrites.write("migration", migrationId, () -> store.saveMigration(record.snapshot()));
        } catch (PersistenceException e) {
            activeByWorkload.remove(workloadId, migrationId);
            throw e;
        }
        ActiveMigration migration = new ActiveMigration(record);
        migrations.put(migrationId, migration);
        log.info("Migration {} requested: workload {} from host {} to {} ({})", migrationId, workloadId,
            placement.getHostId(), targetHostId != null ? "host " + targetHostId : "scheduler-chosen host", mode);

        try {
            CompletableFuture.runAsync(() -> preCheck(migration), executor)
                .thenCompose(ignored -> prepare(migration))
                .thenComposeAsync(task -> cutover(migration, task), executor)
                .handle((outcome, error) -> {
                    finish(migration, outcome, error);
                    return null;
                });
        } catch (RejectedExecutionException e) {
            finish(migration, null, new StepFailure(ErrorCode.MIGRATION_INTERRUPTED, "Migration coordinator is shut down"));
        }
        return record.snapshot();
    }

    /**
     * Current record, with live progress for a migration that is still synchronizing.
     */
    public MigrationRecord getStatus(String migrationId) throws MigrationNotFoundException {
        return lookup(migrationId).snapshot();
    }

    /**
     * Migration records, oldest first, optionally restricted to one workload.
     */
    public List<MigrationRecord> list(String workloadId) {
        List<MigrationRecord> result = new ArrayList<>();
        for (ActiveMigration migration : migrations.values()) {
            MigrationRecord record = migration.snapshot();
            if (workloadId == null || workloadId.equals(record.getWorkloadId())) {
                result.add(record);
            }
        }
        result.sort(Comparator.comparing(MigrationRecord::getCreatedAt).thenComparing(MigrationRecord::getMigrationId));
        return result;
    }

    public boolean hasActiveMigration(String workloadId) {
        return activeMigrationId(workloadId).isPresent();
    }

    public Optional<String> activeMigrationId(String workloadId) {
        String migrationId = activeByWorkload.get(workloadId);
        return REMOVAL_MARKER.equals(migrationId) ? Optional.empty() : Optional.ofNullable(migrationId);
    }

    /**
     * Run {@code operation} while no migration of the workload can start. Fails with
     * {@link MigrationInProgressException} if one is already in flight.
     */
    public <T> T withMigrationsBlocked(String workloadId, HostLockManager.LockedOperation<T, OrchestrationException> operation)
            throws OrchestrationException {
        String existing = activeByWorkload.putIfAbsent(workloadId, REMOVAL_MARKER);
        if (REMOVAL_MARKER.equals(existing)) {
            throw new WorkloadNotFoundException(workloadId);
        }
        if (existing != null) {
            throw new MigrationInProgressException(workloadId, existing);
        }
        try {
            return operation.execute();
        } finally {
            activeByWorkload.remove(workloadId, REMOVAL_MARKER);
        }
    }

    /**
     * Completes with the terminal record once the migration finishes.
     */
    public CompletableFuture<MigrationRecord> awaitCompletion(String migrationId) throws MigrationNotFoundException {
        return lookup(migrationId).completion;
    }

    /**
     * Cancel a migration. PENDING and PRE_CHECKING migrations fail immediately; PREPARING is
     * best-effort (abort the driver task, then roll back); CUTOVER cannot be interrupted.
     */
    public MigrationRecord cancel(String migrationId) throws OrchestrationException {
        ActiveMigration migration = lookup(migrationId);
        MigrationTask toAbort = null;
        synchronized (migration) {
            MigrationState state = migration.record.getState();
            if (state.isTerminal()) {
                throw new InvalidStateTransitionException("migration", migrationId, state, MigrationState.FAILED);
            }
            if (state == MigrationState.CUTOVER) {
                throw new CannotCancelDuringCutoverException(migrationId);
            }
            migration.cancelRequested = true;
            if (state.isCleanlyCancellable()) {
                markFailed(migration, ErrorCode.MIGRATION_CANCELLED, "Cancelled in " + state, false);
                activeByWorkload.remove(migration.record.getWorkloadId(), migrationId);
            } else {
                toAbort = migration.task;
            }
        }
        log.info("Cancellation requested for migration {}", migrationId);
        if (toAbort != null) {
            abortQuietly(migrationId, toAbort);
        }
        return getStatus(migrationId);
    }

    /**
     * Resolve an AMBIGUOUS_STATE migration once an operator has established where the workload runs.
     * Resolving to the target commits the held reservation and flips the placement; resolving to the
     * source releases the reservation.
     */
    public MigrationRecord reconcile(String migrationId, String resolvedHostId) throws OrchestrationException {
        ActiveMigration migration = lookup(migrationId);
        synchronized (migration) {
            MigrationRecord record = migration.record;
            if (record.getFailureCode() != ErrorCode.AMBIGUOUS_STATE || record.getReservationId() == null) {
                throw new OrchestrationException(ErrorCode.INVALID_STATE_TRANSITION,
                    "Migration " + migrationId + " has no ambiguous outcome to reconcile",
                    Map.of("migration_id", migrationId, "state", String.valueOf(record.getState()),
                        "failure_code", String.valueOf(record.getFailureCode())));
            }
            Reservation reservation = heldReservation(migration);
            if (record.getTargetHostId().equals(resolvedHostId)) {
                if (reservation == null) {
                    throw new IllegalStateException("Reservation " + record.getReservationId() + " of migration "
                        + migrationId + " is no longer held on host " + record.getTargetHostId());
                }
                capacityTracker.completeMigration(record.getWorkloadId(), reservation);
            } else if (record.getSourceHostId().equals(resolvedHostId)) {
                if (reservation != null) {
                    capacityTracker.release(reservation);
                }
            } else {
                throw new IllegalArgumentException("Host " + resolvedHostId + " is neither source nor target of migration "
                    + migrationId);
            }
            migration.reservation = null;
            persistUpdate(migration, copy -> {
                copy.setReservationId(null);
                copy.setFailureReason(copy.getFailureReason() + " (reconciled to host " + resolvedHostId + ")");
            });
            log.info("Migration {} reconciled: workload {} resolved to host {}", migrationId, record.getWorkloadId(),
                resolvedHostId);
            return migration.record.snapshot();
        }
    }

    /**
     * Drop terminal records last updated before {@code now - olderThan}.
     *
     * @param olderThan minimum age, or null for the configured retention
     * @return number of records removed
     */
    public int prune(Duration olderThan) throws PersistenceException {
        Instant cutoff = clock.instant().minus(olderThan != null ? olderThan : settings.getRetention());
        int removed = 0;
        for (ActiveMigration migration : new ArrayList<>(migrations.values())) {
            MigrationRecord record = migration.snapshot();
            if (record.isTerminal() && record.getUpdatedAt().isBefore(cutoff)) {
                StoreWrites.write("migration", record.getMigrationId(), () -> store.deleteMigration(record.getMigrationId()));
                migrations.remove(record.getMigrationId());
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Pruned {} migration records older than {}", removed, cutoff);
        }
        return removed;
    }

    /**
     * Load records read back from the store after a restart. Migrations that were in flight cannot be
     * resumed: they fail with MIGRATION_INTERRUPTED, or AMBIGUOUS_STATE if they were in cutover.
     */
    public void recoverInterrupted(Collection<MigrationRecord> persisted) {
        for (MigrationRecord record : persisted) {
            ActiveMigration migration = new ActiveMigration(record.snapshot());
            migrations.put(record.getMigrationId(), migration);
            if (record.isTerminal()) {
                migration.completion.complete(record.snapshot());
                continue;
            }
            synchronized (migration) {
                if (record.getState() == MigrationState.CUTOVER) {
                    log.error("Migration {} of workload {} was interrupted during cutover; operator reconciliation required",
                        record.getMigrationId(), record.getWorkloadId());
                    markFailed(migration, ErrorCode.AMBIGUOUS_STATE, "Engine restarted during cutover", false);
                } else {
                    releaseHeldReservation(migration, ErrorCode.MIGRATION_INTERRUPTED,
                        "Engine restarted in " + record.getState());
                }
            }
            migration.completion.complete(migration.snapshot());
        }
        log.info("Recovered {} migration records", persisted.size());
    }

    public void shutdown() {
        log.info("Shutting down migration coordinator");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // PENDING -> PRE_CHECKING: pick or validate the target, ask the driver, reserve target capacity
    private void preCheck(ActiveMigration migration) {
        transition(migration, MigrationState.PRE_CHECKING, copy -> { });
        MigrationRecord record = migration.snapshot();
        PlacementRequest request = PlacementRequest.builder()
            .workloadId(record.getWorkloadId())
            .resources(record.getResources())
            .constraints(LabelSelector.of(record.getConstraints()))
            .excludedHostIds(Set.of(record.getSourceHostId()))
            .build();

        int attempts = record.isTargetRequested() ? 1 : 2;
        for (int attempt = 1; ; attempt++) {
            Host target = chooseTarget(record, request);
            checkCompatibility(record, target);
            try {
                Reservation reservation = capacityTracker.reserve(target.getHostId(), record.getWorkloadId(),
                    record.getResources(), ReservationKind.MIGRATION);
                holdReservation(migration, reservation, target);
                return;
            } catch (CapacityExceededException e) {
                if (attempt >= attempts) {
                    throw new StepFailure(ErrorCode.PRECHECK_FAILED, e.getMessage(), e);
                }
                log.debug("Target {} filled up before migration {} could reserve it, selecting again",
                    target.getHostId(), record.getMigrationId());
            } catch (OrchestrationException e) {
                throw new StepFailure(e.getErrorCode(), e.getMessage(), e);
            }
        }
    }

    // PRE_CHECKING -> PREPARING: start the driver task and await synchronization
    private CompletableFuture<MigrationTask> prepare(ActiveMigration migration) {
        transition(migration, MigrationState.PREPARING, copy -> { });
        MigrationRecord record = migration.snapshot();
        Host target = migration.targetHost;
        eventPublisher.publish(EventType.SYSTEM_MIGRATING, Map.of(
            EVENT_WORKLOAD_ID, record.getWorkloadId(),
            EVENT_MIGRATION_ID, record.getMigrationId(),
            "sourceHostId", record.getSourceHostId(),
            "targetHostId", record.getTargetHostId(),
            "mode", record.getMode().name()));

        MigrationTask task = driverCall(record.getSourceHostId(), handle -> record.getMode() == MigrationMode.LIVE
            ? driver.beginLiveMigration(handle, record.getWorkloadId(), target)
            : driver.performOfflineMigration(handle, record.getWorkloadId(), target));
        boolean abort;
        synchronized (migration) {
            migration.task = task;
            abort = migration.cancelRequested;
        }
        if (abort) {
            abortQuietly(record.getMigrationId(), task);
        }
        return task.synchronization()
            .orTimeout(settings.getPrepareTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .thenApply(ignored -> task);
    }

    // PREPARING -> CUTOVER: uninterruptible once entered
    private CompletableFuture<CutoverOutcome> cutover(ActiveMigration migration, MigrationTask task) {
        synchronized (migration) {
            if (migration.cancelRequested) {
                throw new StepFailure(ErrorCode.MIGRATION_CANCELLED, "Cancelled before cutover");
            }
            String targetHostId = migration.record.getTargetHostId();
            HostState targetState = registry.find(targetHostId).map(Host::getState).orElse(null);
            if (targetState != HostState.ACTIVE) {
                // a draining target must not receive the workload
                throw new StepFailure(ErrorCode.CAPACITY_EXCEEDED, "Target host " + targetHostId + " is "
                    + (targetState != null ? targetState : "no longer registered") + ", not cutting over");
            }
            transition(migration, MigrationState.CUTOVER, copy -> copy.setProgressPercent(task.progressPercent()));
        }
        return task.cutover().orTimeout(settings.getCutoverTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void finish(ActiveMigration migration, CutoverOutcome outcome, Throwable error) {
        Throwable cause = unwrap(error);
        String migrationId = migration.record.getMigrationId();
        try {
            synchronized (migration) {
                MigrationState reached = migration.record.getState();
                if (reached.isTerminal()) {
                    // cancelled while pre-checking; only a late reservation may need releasing
                    if (migration.reservation != null) {
                        releaseAfterCancel(migration);
                    }
                } else if (cause == null && outcome == CutoverOutcome.COMPLETED) {
                    complete(migration);
                } else if (cause == null && outcome == CutoverOutcome.FAILED) {
                    rollback(migration, ErrorCode.DRIVER_ERROR, "Driver reported cutover failure; workload stays on source");
                } else if (cause == null || reached == MigrationState.CUTOVER) {
                    String reason = cause == null
                        ? "Driver reported partial cutover"
                        : "Cutover did not finish: " + describe(cause);
                    log.error("Migration {} of workload {} ended in an ambiguous state: {}", migrationId,
                        migration.record.getWorkloadId(), reason);
                    markFailed(migration, ErrorCode.AMBIGUOUS_STATE, reason, false);
                } else {
                    if (reached == MigrationState.PREPARING && migration.task != null) {
                        abortQuietly(migrationId, migration.task);
                    }
                    ErrorCode code = migration.cancelRequested ? ErrorCode.MIGRATION_CANCELLED : errorCodeFor(cause);
                    rollback(migration, code, describe(cause));
                }
            }
        } catch (RuntimeException e) {
            log.error("Unexpected error finishing migration {}: {}", migrationId, e.getMessage(), e);
            synchronized (migration) {
                if (!migration.record.isTerminal()) {
                    markFailed(migration, ErrorCode.DRIVER_ERROR, describe(e), false);
                }
            }
        } finally {
            activeByWorkload.remove(migration.record.getWorkloadId(), migrationId);
            migration.completion.complete(migration.snapshot());
        }
    }

    // CUTOVER -> COMPLETED
    private void complete(ActiveMigration migration) {
        MigrationRecord record = migration.record;
        try {
            capacityTracker.completeMigration(record.getWorkloadId(), migration.reservation);
        } catch (OrchestrationException | IllegalStateException e) {
            log.error("Driver completed migration {} but the placement could not be flipped: {}",
                record.getMigrationId(), e.getMessage(), e);
            markFailed(migration, ErrorCode.AMBIGUOUS_STATE, "Cutover completed but placement update failed: " + e.getMessage(), false);
            return;
        }
        migration.reservation = null;
        Instant now = clock.instant();
        forceUpdate(migration, copy -> {
            copy.setState(MigrationState.COMPLETED);
            copy.setProgressPercent(100);
            copy.setReservationId(null);
            copy.getTransitions().put(MigrationState.COMPLETED, now);
        });
        log.info("Migration {} completed: workload {} now on host {}", record.getMigrationId(), record.getWorkloadId(),
            record.getTargetHostId());
        eventPublisher.publish(EventType.SYSTEM_MIGRATED, Map.of(
            EVENT_WORKLOAD_ID, record.getWorkloadId(),
            EVENT_MIGRATION_ID, record.getMigrationId(),
            "sourceHostId", record.getSourceHostId(),
            "targetHostId", record.getTargetHostId()));
        Map<String, String> tags = Map.of(MODE_TAG, record.getMode().name());
        metricsProvider.counter(MIGRATION_COMPLETED_COUNT_METRIC_NAME, tags).increment();
        metricsProvider.timer(MIGRATION_DURATION_METRIC_NAME, tags).record(Duration.between(record.getCreatedAt(), now));
    }

    private void rollback(ActiveMigration migration, ErrorCode code, String reason) {
        Reservation reservation = migration.reservation;
        if (reservation != null) {
            try {
                capacityTracker.release(reservation);
                migration.reservation = null;
            } catch (OrchestrationException e) {
                log.error("Rollback of migration {} failed, reservation {} on host {} is stuck: {}",
                    migration.record.getMigrationId(), reservation.getReservationId(), reservation.getHostId(),
                    e.getMessage(), e);
                markFailed(migration, ErrorCode.ROLLBACK_FAILED, reason + "; rollback failed: " + e.getMessage(), false);
                return;
            }
        }
        log.info("Migration {} of workload {} failed ({}): {}", migration.record.getMigrationId(),
            migration.record.getWorkloadId(), code, reason);
        markFailed(migration, code, reason, true);
    }

    private void releaseAfterCancel(ActiveMigration migration) {
        Reservation reservation = migration.reservation;
        try {
            capacityTracker.release(reservation);
            migration.reservation = null;
            forceUpdate(migration, copy -> copy.setReservationId(null));
        } catch (OrchestrationException e) {
            log.error("Failed to release reservation {} of cancelled migration {}: {}", reservation.getReservationId(),
                migration.record.getMigrationId(), e.getMessage(), e);
            forceUpdate(migration, copy -> {
                copy.setFailureCode(ErrorCode.ROLLBACK_FAILED);
                copy.setFailureReason(copy.getFailureReason() + "; rollback failed: " + e.getMessage());
            });
        }
    }

    private void releaseHeldReservation(ActiveMigration migration, ErrorCode code, String reason) {
        migration.reservation = heldReservation(migration);
        rollback(migration, code, reason);
    }

    private Host chooseTarget(MigrationRecord record, PlacementRequest request) {
        try {
            HostSnapshot target = record.isTargetRequested()
                ? scheduler.validateMigrationTarget(request, record.getTargetHostId())
                : scheduler.selectTarget(request);
            return target.getHost();
        } catch (OrchestrationException e) {
            throw new StepFailure(ErrorCode.PRECHECK_FAILED, e.getMessage(), e);
        }
    }

    private void checkCompatibility(MigrationRecord record, Host target) {
        CompatibilityReport report;
        try {
            report = driverCall(record.getSourceHostId(),
                handle -> driver.checkCompatibility(handle, record.getWorkloadId(), target));
        } catch (StepFailure e) {
            throw new StepFailure(ErrorCode.PRECHECK_FAILED, "Compatibility check of workload " + record.getWorkloadId()
                + " against host " + target.getHostId() + " failed (" + e.errorCode + "): " + e.getMessage(), e);
        }
        if (!report.isCompatible()) {
            throw new StepFailure(ErrorCode.PRECHECK_FAILED, "Workload " + record.getWorkloadId()
                + " is not compatible with host " + target.getHostId() + ": " + String.join("; ", report.getReasons()));
        }
    }

    private void holdReservation(ActiveMigration migration, Reservation reservation, Host target) {
        boolean cancelled;
        synchronized (migration) {
            cancelled = migration.record.isTerminal();
            if (!cancelled) {
                migration.reservation = reservation;
                migration.targetHost = target;
                updateRecord(migration, copy -> {
                    copy.setTargetHostId(target.getHostId());
                    copy.setReservationId(reservation.getReservationId());
                });
            }
        }
        if (cancelled) {
            try {
                capacityTracker.release(reservation);
            } catch (OrchestrationException e) {
                throw new StepFailure(ErrorCode.ROLLBACK_FAILED, e.getMessage(), e);
            }
            throw new StepFailure(ErrorCode.MIGRATION_CANCELLED, "Cancelled while pre-checking");
        }
    }

    private <T> T driverCall(String hostId, ConnectionPoolManager.ConnectionCall<T> call) {
        try {
            return poolManager.withConnection(hostId, call);
        } catch (OrchestrationException e) {
            throw new StepFailure(e.getErrorCode(), e.getMessage(), e);
        } catch (DriverException e) {
            throw new StepFailure(ErrorCode.DRIVER_ERROR, e.getMessage(), e);
        }
    }

    private void transition(ActiveMigration migration, MigrationState target, Consumer<MigrationRecord> change) {
        synchronized (migration) {
            MigrationState current = migration.record.getState();
            if (current.isTerminal()) {
                throw new StepFailure(ErrorCode.MIGRATION_CANCELLED, "Migration already " + current);
            }
            if (!current.canTransitionTo(target)) {
                throw new IllegalStateException("Illegal migration transition " + current + " -> " + target);
            }
            Instant now = clock.instant();
            updateRecord(migration, copy -> {
                copy.setState(target);
                copy.getTransitions().put(target, now);
                change.accept(copy);
            });
            log.info("Migration {} of workload {}: {} -> {}", migration.record.getMigrationId(),
                migration.record.getWorkloadId(), current, target);
        }
    }

    private void markFailed(ActiveMigration migration, ErrorCode code, String reason, boolean reservationReleased) {
        Instant now = clock.instant();
        forceUpdate(migration, copy -> {
            copy.setState(MigrationState.FAILED);
            copy.setFailureCode(code);
            copy.setFailureReason(reason);
            copy.getTransitions().put(MigrationState.FAILED, now);
            if (reservationReleased) {
                copy.setReservationId(null);
            }
        });
        metricsProvider.counter(MIGRATION_FAILED_COUNT_METRIC_NAME,
            Map.of(MODE_TAG, migration.record.getMode().name(), ERROR_CODE_TAG, code.name())).increment();
    }

    /**
     * Persist a modified copy, then publish it. Must be called holding the migration's monitor.
     */
    private void persistUpdate(ActiveMigration migration, Consumer<MigrationRecord> change) throws PersistenceException {
        MigrationRecord copy = migration.record.snapshot();
        change.accept(copy);
        copy.setUpdatedAt(clock.instant());
        StoreWrites.write("migration", copy.getMigrationId(), () -> store.saveMigration(copy));
        migration.record = copy;
    }

    private void updateRecord(ActiveMigration migration, Consumer<MigrationRecord> change) {
        try {
            persistUpdate(migration, change);
        } catch (PersistenceException e) {
            throw new StepFailure(ErrorCode.PERSISTENCE_FAILURE, e.getMessage(), e);
        }
    }

    // Terminal updates: memory must reflect the outcome even when the store is down.
    private void forceUpdate(ActiveMigration migration, Consumer<MigrationRecord> change) {
        MigrationRecord copy = migration.record.snapshot();
        change.accept(copy);
        copy.setUpdatedAt(clock.instant());
        try {
            StoreWrites.write("migration", copy.getMigrationId(), () -> store.saveMigration(copy));
        } catch (PersistenceException e) {
            log.error("Failed to persist migration {} in state {}: {}", copy.getMigrationId(), copy.getState(),
                e.getMessage(), e);
        }
        migration.record = copy;
    }

    private Reservation heldReservation(ActiveMigration migration) {
        if (migration.reservation != null) {
            return migration.reservation;
        }
        MigrationRecord record = migration.record;
        if (record.getReservationId() == null || record.getTargetHostId() == null) {
            return null;
        }
        return capacityTracker.getAllocation(record.getTargetHostId()).getReservations().get(record.getReservationId());
    }

    private void abortQuietly(String migrationId, MigrationTask task) {
        try {
            task.abort();
        } catch (RuntimeException e) {
            log.warn("Driver abort of migration {} failed: {}", migrationId, e.getMessage());
        }
    }

    private ActiveMigration lookup(String migrationId) throws MigrationNotFoundException {
        ActiveMigration migration = migrationId != null ? migrations.get(migrationId) : null;
        if (migration == null) {
            throw new MigrationNotFoundException(migrationId);
        }
        return migration;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static ErrorCode errorCodeFor(Throwable cause) {
        if (cause instanceof StepFailure) {
            return ((StepFailure) cause).errorCode;
        }
        if (cause instanceof TimeoutException) {
            return ErrorCode.MIGRATION_TIMEOUT;
        }
        if (cause instanceof OrchestrationException) {
            return ((OrchestrationException) cause).getErrorCode();
        }
        return ErrorCode.DRIVER_ERROR;
    }

    private static String describe(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "Driver operation timed out";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /**
     * Mutable state of one migration. The record itself is replaced, never mutated, so snapshots
     * handed out earlier stay stable.
     */
    private static final class ActiveMigration {
        private volatile MigrationRecord record;
        private volatile MigrationTask task;
        private volatile Reservation reservation;
        private volatile Host targetHost;
        private boolean cancelRequested;
        private final CompletableFuture<MigrationRecord> completion = new CompletableFuture<>();

        private ActiveMigration(MigrationRecord record) {
            this.record = record;
        }

        private MigrationRecord snapshot() {
            MigrationRecord copy = record.snapshot();
            MigrationTask current = task;
            if (!copy.isTerminal() && current != null) {
                copy.setProgressPercent(current.progressPercent());
            }
            return copy;
        }
    }

    /**
     * Aborts the migration chain with the error code the record should end with.
     */
    private static final class StepFailure extends RuntimeException {
        private final ErrorCode errorCode;

        private StepFailure(ErrorCode errorCode, String message) {
            super(message);
            this.errorCode = errorCode;
        }

        private StepFailure(ErrorCode errorCode, String message, Throwable cause) {
            super(message, cause);
            this.errorCode = errorCode;
        }
    }
}
