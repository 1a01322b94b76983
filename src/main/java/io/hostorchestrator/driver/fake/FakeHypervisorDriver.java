package io.hostorchestrator.driver.fake;

import io.hostorchestrator.driver.CompatibilityReport;
import io.hostorchestrator.driver.DriverHandle;
import io.hostorchestrator.driver.HypervisorDriver;
import io.hostorchestrator.driver.MigrationTask;
import io.hostorchestrator.enums.CutoverOutcome;
import io.hostorchestrator.exceptions.DriverException;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.ResourceSpec;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static io.hostorchestrator.config.Constants.DRIVER_TYPE_FAKE;

/**
 * In-memory simulated hypervisor.
 * 
 * Every endpoint is reachable and every migration succeeds unless a test scripts otherwise:
 * endpoints can be made unreachable, capacities declared, workloads marked incompatible and
 * per-workload migration behavior chosen from {@link FakeMigrationBehavior}.
 */
@Slf4j
public class FakeHypervisorDriver implements HypervisorDriver {
    
    private final Set<String> unreachableEndpoints = ConcurrentHashMap.newKeySet();
    private final Map<String, ResourceSpec> capacities = new ConcurrentHashMap<>();
    private final Map<String, List<String>> incompatibleWorkloads = new ConcurrentHashMap<>();
    private final Map<String, FakeMigrationBehavior> behaviors = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> liveConnections = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> peakLiveConnections = new ConcurrentHashMap<>();
    private final List<String> completedMigrations = new CopyOnWriteArrayList<>();
    private final AtomicLong openedConnections = new AtomicLong();
    private final AtomicLong handleSequence = new AtomicLong();
    
    private volatile Duration syncDuration = Duration.ZERO;
    private volatile Duration openDelay = Duration.ZERO;
    
    @Override
    public String getType() {
        return DRIVER_TYPE_FAKE;
    }
    
    // =================================================================
    // FAULT INJECTION
    // =================================================================
    
    public void setReachable(String endpoint, boolean reachable) {
        if (reachable) {
            unreachableEndpoints.remove(endpoint);
        } else {
            unreachableEndpoints.add(endpoint);
        }
    }
    
    public void setCapacity(String endpoint, ResourceSpec capacity) {
        capacities.put(endpoint, capacity);
    }
    
    public void setIncompatible(String workloadId, String reason) {
        incompatibleWorkloads.computeIfAbsent(workloadId, k -> new CopyOnWriteArrayList<>()).add(reason);
    }
    
    public void setMigrationBehavior(String workloadId, FakeMigrationBehavior behavior) {
        behaviors.put(workloadId, behavior);
    }
    
    public void setSyncDuration(Duration syncDuration) {
        this.syncDuration = syncDuration;
    }
    
    public void setOpenDelay(Duration openDelay) {
        this.openDelay = openDelay;
    }
    
    // =================================================================
    // INSPECTION
    // =================================================================
    
    public long getOpenedConnections() {
        return openedConnections.get();
    }
    
    public int getLiveConnections(String endpoint) {
        AtomicInteger live = liveConnections.get(endpoint);
        return live != null ? live.get() : 0;
    }
    
    public int getPeakLiveConnections(String endpoint) {
        AtomicInteger peak = peakLiveConnections.get(endpoint);
        return peak != null ? peak.get() : 0;
    }
    
    /**
     * Migrations that cut over successfully, as {@code workload->targetEndpoint}.
     */
    public List<String> getCompletedMigrations() {
        return new ArrayList<>(completedMigrations);
    }
    
    // =================================================================
    // DRIVER CAPABILITY
    // =================================================================
    
    @Override
    public DriverHandle openConnection(String endpoint) throws DriverException {
        if (!openDelay.isZero()) {
            try {
                Thread.sleep(openDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DriverException("Interrupted while connecting to " + endpoint, e);
            }
        }
        if (unreachableEndpoints.contains(endpoint)) {
            throw new DriverException("Connection refused: " + endpoint);
        }
        FakeHandle handle = new FakeHandle("fake-" + handleSequence.incrementAndGet(), endpoint);
        openedConnections.incrementAndGet();
        int live = liveConnections.computeIfAbsent(endpoint, k -> new AtomicInteger()).incrementAndGet();
        peakLiveConnections.computeIfAbsent(endpoint, k -> new AtomicInteger()).accumulateAndGet(live, Math::max);
        log.debug("Opened fake connection {} to {}", handle.getHandleId(), endpoint);
        return handle;
    }
    
    @Override
    public boolean healthCheck(DriverHandle handle) {
        FakeHandle fake = (FakeHandle) handle;
        return !fake.closed.get() && !unreachableEndpoints.contains(fake.getEndpoint());
    }
    
    @Override
    public ResourceSpec queryCapacity(DriverHandle handle) throws DriverException {
        ensureUsable(handle);
        ResourceSpec capacity = capacities.get(handle.getEndpoint());
        if (capacity == null) {
            throw new DriverException("Capacity of " + handle.getEndpoint() + " is unknown");
        }
        return capacity;
    }
    
    @Override
    public CompatibilityReport checkCompatibility(DriverHandle handle, String workloadId, Host targetHost) throws DriverException {
        ensureUsable(handle);
        List<String> reasons = new ArrayList<>(incompatibleWorkloads.getOrDefault(workloadId, List.of()));
        if (unreachableEndpoints.contains(targetHost.getEndpoint())) {
            reasons.add("Target " + targetHost.getHostId() + " cannot reach the workload's storage");
        }
        return reasons.isEmpty() ? CompatibilityReport.compatible() : CompatibilityReport.incompatible(reasons);
    }
    
    @Override
    public MigrationTask beginLiveMigration(DriverHandle handle, String workloadId, Host targetHost) throws DriverException {
        ensureUsable(handle);
        FakeMigrationTask task = new FakeMigrationTask(workloadId, targetHost.getEndpoint(),
            behaviors.getOrDefault(workloadId, FakeMigrationBehavior.SUCCEED));
        task.startSynchronization(syncDuration);
        log.debug("Started fake live migration of {} to {}", workloadId, targetHost.getEndpoint());
        return task;
    }
    
    @Override
    public MigrationTask performOfflineMigration(DriverHandle handle, String workloadId, Host targetHost) throws DriverException {
        ensureUsable(handle);
        FakeMigrationTask task = new FakeMigrationTask(workloadId, targetHost.getEndpoint(),
            behaviors.getOrDefault(workloadId, FakeMigrationBehavior.SUCCEED));
        task.startSynchronization(Duration.ZERO);
        log.debug("Started fake offline migration of {} to {}", workloadId, targetHost.getEndpoint());
        return task;
    }
    
    @Override
    public void close(DriverHandle handle) {
        FakeHandle fake = (FakeHandle) handle;
        if (fake.closed.compareAndSet(false, true)) {
            AtomicInteger live = liveConnections.get(fake.getEndpoint());
            if (live != null) {
                live.decrementAndGet();
            }
        }
    }
    
    private void ensureUsable(DriverHandle handle) throws DriverException {
        if (!healthCheck(handle)) {
            throw new DriverException("Connection " + handle.getHandleId() + " to " + handle.getEndpoint() + " is not usable");
        }
    }
    
    private static final class FakeHandle implements DriverHandle {
        private final String handleId;
        private final String endpoint;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        
        private FakeHandle(String handleId, String endpoint) {
            this.handleId = handleId;
            this.endpoint = endpoint;
        }
        
        @Override
        public String getHandleId() {
            return handleId;
        }
        
        @Override
        public String getEndpoint() {
            return endpoint;
        }
    }
    
    private final class FakeMigrationTask implements MigrationTask {
        private final String workloadId;
        private final String targetEndpoint;
        private final FakeMigrationBehavior behavior;
        private final CompletableFuture<Void> synchronization = new CompletableFuture<>();
        private final AtomicBoolean cutoverStarted = new AtomicBoolean(false);
        private volatile int progress;
        
        private FakeMigrationTask(String workloadId, String targetEndpoint, FakeMigrationBehavior behavior) {
            this.workloadId = workloadId;
            this.targetEndpoint = targetEndpoint;
            this.behavior = behavior;
        }
        
        private void startSynchronization(Duration duration) {
            if (behavior == FakeMigrationBehavior.HANG_SYNC) {
                progress = 10;
                return;
            }
            Runnable finish = () -> {
                if (behavior == FakeMigrationBehavior.FAIL_SYNC) {
                    synchronization.completeExceptionally(new DriverException("Synchronization of " + workloadId + " failed"));
                } else {
                    progress = 100;
                    synchronization.complete(null);
                }
            };
            if (duration.isZero()) {
                finish.run();
            } else {
                progress = 50;
                CompletableFuture.delayedExecutor(duration.toMillis(), TimeUnit.MILLISECONDS).execute(finish);
            }
        }
        
        @Override
        public CompletableFuture<Void> synchronization() {
            return synchronization;
        }
        
        @Override
        public CompletableFuture<CutoverOutcome> cutover() {
            if (!cutoverStarted.compareAndSet(false, true)) {
                throw new IllegalStateException("Cutover of " + workloadId + " already started");
            }
            switch (behavior) {
                case FAIL_CUTOVER:
                    return CompletableFuture.completedFuture(CutoverOutcome.FAILED);
                case PARTIAL_CUTOVER:
                    return CompletableFuture.completedFuture(CutoverOutcome.PARTIAL);
                case ERROR_CUTOVER:
                    return CompletableFuture.failedFuture(new DriverException("Cutover of " + workloadId + " lost contact"));
                case HANG_CUTOVER:
                    return new CompletableFuture<>();
                default:
                    completedMigrations.add(workloadId + "->" + targetEndpoint);
                    return CompletableFuture.completedFuture(CutoverOutcome.COMPLETED);
            }
        }
        
        @Override
        public int progressPercent() {
            return progress;
        }
        
        @Override
        public void abort() {
            if (synchronization.completeExceptionally(new DriverException("Migration of " + workloadId + " aborted"))) {
                log.debug("Aborted fake migration of {}", workloadId);
            }
        }
    }
}
