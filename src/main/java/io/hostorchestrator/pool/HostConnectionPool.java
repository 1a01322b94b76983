package io.hostorchestrator.pool;

import com.google.common.util.concurrent.AtomicDouble;
import io.hostorchestrator.config.PoolSettings;
import io.hostorchestrator.driver.DriverHandle;
import io.hostorchestrator.driver.HypervisorDriver;
import io.hostorchestrator.exceptions.DriverException;
import io.hostorchestrator.exceptions.HostUnreachableException;
import io.hostorchestrator.exceptions.PoolExhaustedException;
import io.hostorchestrator.metrics.MetricsProvider;
import io.hostorchestrator.models.PoolMetrics;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static io.hostorchestrator.metrics.MetricsConstants.*;

/**
 * Bounded pool of driver connections to a single host.
 * 
 * The number of live connections (idle plus checked out plus being opened) never exceeds the
 * configured maximum. Connections are opened lazily on checkout and outside the pool lock; a
 * failed open arms an exponential reconnect backoff during which checkouts fail fast instead
 * of hammering the host.
 */
@Slf4j
public class HostConnectionPool {
    
    private final String hostId;
    private final String endpoint;
    private final HypervisorDriver driver;
    private final PoolSettings settings;
    private final Clock clock;
    private final PoolHealthListener listener;
    
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition released = lock.newCondition();
    private final Deque<PooledConnection> idle = new ArrayDeque<>();
    private final ReconnectBackoff backoff;
    
    // Guarded by lock
    private int total;
    private int active;
    private boolean closed;
    private int consecutiveFailures;
    private boolean escalated;
    private boolean reconnecting;
    private long checkoutCount;
    private long failureCount;
    private long reconnectCount;
    
    private final Counter checkoutCounter;
    private final Counter failureCounter;
    private final Counter reconnectCounter;
    private final AtomicDouble sizeGauge;
    private final AtomicDouble activeGauge;
    
    public HostConnectionPool(String hostId, String endpoint, HypervisorDriver driver, PoolSettings settings,
                              Clock clock, PoolHealthListener listener, MetricsProvider metricsProvider) {
        this.hostId = hostId;
        this.endpoint = endpoint;
        this.driver = driver;
        this.settings = settings;
        this.clock = clock;
        this.listener = listener;
        this.backoff = new ReconnectBackoff(settings.getBackoffBase(), settings.getBackoffMax());
        
        Map<String, String> tags = Map.of(HOST_ID_TAG, hostId);
        this.checkoutCounter = metricsProvider.counter(POOL_CHECKOUT_COUNT_METRIC_NAME, tags);
        this.failureCounter = metricsProvider.counter(POOL_FAILURE_COUNT_METRIC_NAME, tags);
        this.reconnectCounter = metricsProvider.counter(POOL_RECONNECT_COUNT_METRIC_NAME, tags);
        this.sizeGauge = metricsProvider.gauge(POOL_SIZE_METRIC_NAME, tags);
        this.activeGauge = metricsProvider.gauge(POOL_ACTIVE_METRIC_NAME, tags);
    }
    
    public String getHostId() {
        return hostId;
    }
    
    /**
     * Obtain a connection, waiting up to {@code timeout} while every connection is checked out.
     */
    public PooledConnection checkout(Duration timeout) throws PoolExhaustedException, HostUnreachableException {
        long remainingNanos = timeout.toNanos();
        List<PooledConnection> expired = new ArrayList<>();
        PooledConnection reused = null;
        lock.lock();
        try {
            while (true) {
                if (closed) {
                    throw new HostUnreachableException(hostId, "Connection pool for host " + hostId + " is closed");
                }
                reused = pollIdle(expired);
                if (reused != null) {
                    active++;
                    recordCheckoutLocked();
                    break;
                }
                if (total < settings.getMaxConnections()) {
                    Instant now = clock.instant();
                    if (backoff.isBackingOff(now)) {
                        throw new HostUnreachableException(hostId, "Reconnect to host " + hostId + " backing off for "
                            + backoff.remaining(now).toMillis() + "ms after " + backoff.getAttempts() + " failure(s)");
                    }
                    // Claim the slot before opening so concurrent callers cannot overshoot max
                    total++;
                    active++;
                    updateGaugesLocked();
                    break;
                }
                if (remainingNanos <= 0L) {
                    throw new PoolExhaustedException(hostId, settings.getMaxConnections(), timeout);
                }
                try {
                    remainingNanos = released.awaitNanos(remainingNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PoolExhaustedException(hostId, settings.getMaxConnections(), timeout);
                }
            }
        } finally {
            lock.unlock();
            closeAll(expired);
        }
        
        if (reused != null) {
            log.debug("Checked out idle connection {}", reused);
            return reused.markCheckedOut(clock.instant());
        }
        
        DriverHandle handle = openClaimedSlot();
        lock.lock();
        try {
            recordCheckoutLocked();
        } finally {
            lock.unlock();
        }
        PooledConnection connection = new PooledConnection(hostId, handle, clock.instant());
        log.debug("Checked out new connection {}", connection);
        return connection.markCheckedOut(clock.instant());
    }
    
    /**
     * Return a connection. Expired or unhealthy connections are closed and not replaced eagerly.
     */
    public void checkin(PooledConnection connection) {
        if (!connection.markReturned(clock.instant())) {
            throw new IllegalStateException("Connection " + connection + " is not checked out");
        }
        boolean expired = isExpired(connection, clock.instant());
        boolean healthy = !expired && probe(connection);
        boolean keep;
        lock.lock();
        try {
            active--;
            keep = healthy && !closed;
            if (keep) {
                idle.addFirst(connection);
            } else {
                total--;
            }
            updateGaugesLocked();
            released.signal();
        } finally {
            lock.unlock();
        }
        if (!keep) {
            driver.close(connection.getHandle());
            if (expired) {
                log.debug("Recycled expired connection {}", connection);
            } else if (!healthy) {
                connection.markUnhealthy();
                recordFailure("health check failed on checkin");
            }
        }
    }
    
    /**
     * Background policy: probe idle connections, evict failures, then keep at least the minimum open.
     * While the host is reported unreachable one connection is attempted per run to detect recovery.
     */
    public void maintain() {
        List<PooledConnection> candidates;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            candidates = new ArrayList<>(idle);
            idle.clear();
        } finally {
            lock.unlock();
        }
        
        Instant now = clock.instant();
        int healthyCount = 0;
        for (PooledConnection connection : candidates) {
            boolean expired = isExpired(connection, now);
            boolean healthy = !expired && probe(connection);
            boolean keep;
            lock.lock();
            try {
                keep = healthy && !closed;
                if (keep) {
                    idle.addLast(connection);
                } else {
                    total--;
                }
                updateGaugesLocked();
                released.signal();
            } finally {
                lock.unlock();
            }
            if (keep) {
                healthyCount++;
                continue;
            }
            driver.close(connection.getHandle());
            if (!expired) {
                connection.markUnhealthy();
                recordFailure("idle connection failed health probe");
            }
        }
        if (healthyCount > 0) {
            lock.lock();
            try {
                consecutiveFailures = 0;
            } finally {
                lock.unlock();
            }
            listener.onProbeSucceeded(hostId, now);
        }
        topUp();
    }
    
    /**
     * True when a live connection exists or one could be opened right now.
     */
    public boolean isHealthy() {
        lock.lock();
        try {
            if (closed || escalated) {
                return false;
            }
            return total > 0 || !backoff.isBackingOff(clock.instant());
        } finally {
            lock.unlock();
        }
    }
    
    public PoolMetrics getMetrics() {
        lock.lock();
        try {
            return PoolMetrics.builder()
                .hostId(hostId)
                .size(total)
                .active(active)
                .idle(idle.size())
                .checkoutCount(checkoutCount)
                .failureCount(failureCount)
                .reconnectCount(reconnectCount)
                .build();
        } finally {
            lock.unlock();
        }
    }
    
    /**
     * Close idle connections and refuse further checkouts. Checked out connections are closed on return.
     */
    public void close() {
        List<PooledConnection> toClose;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayList<>(idle);
            total -= idle.size();
            idle.clear();
            updateGaugesLocked();
            released.signalAll();
        } finally {
            lock.unlock();
        }
        closeAll(toClose);
        log.info("Closed connection pool for host {} ({} idle connection(s) closed)", hostId, toClose.size());
    }
    
    private void topUp() {
        int target;
        lock.lock();
        try {
            target = Math.max(settings.getMinConnections(), escalated ? 1 : 0);
        } finally {
            lock.unlock();
        }
        while (true) {
            lock.lock();
            try {
                if (closed || total >= target || total >= settings.getMaxConnections()
                        || backoff.isBackingOff(clock.instant())) {
                    return;
                }
                total++;
                active++;
            } finally {
                lock.unlock();
            }
            DriverHandle handle;
            try {
                handle = openClaimedSlot();
            } catch (HostUnreachableException e) {
                return;
            }
            boolean poolClosed;
            lock.lock();
            try {
                active--;
                poolClosed = closed;
                if (poolClosed) {
                    total--;
                } else {
                    idle.addLast(new PooledConnection(hostId, handle, clock.instant()));
                }
                updateGaugesLocked();
                released.signal();
            } finally {
                lock.unlock();
            }
            if (poolClosed) {
                driver.close(handle);
                return;
            }
        }
    }
    
    /**
     * Open a connection for a slot already counted in {@code total} and {@code active}.
     */
    private DriverHandle openClaimedSlot() throws HostUnreachableException {
        DriverHandle handle;
        try {
            handle = driver.openConnection(endpoint);
        } catch (DriverException | RuntimeException e) {
            lock.lock();
            try {
                total--;
                active--;
                updateGaugesLocked();
                released.signal();
            } finally {
                lock.unlock();
            }
            recordOpenFailure(e);
            throw new HostUnreachableException(hostId, "Failed to connect to host " + hostId + " at " + endpoint
                + ": " + e.getMessage(), e);
        }
        recordOpenSuccess();
        return handle;
    }
    
    private PooledConnection pollIdle(List<PooledConnection> expired) {
        Instant now = clock.instant();
        PooledConnection candidate;
        while ((candidate = idle.pollFirst()) != null) {
            if (isExpired(candidate, now)) {
                total--;
                expired.add(candidate);
                continue;
            }
            return candidate;
        }
        updateGaugesLocked();
        return null;
    }
    
    private boolean isExpired(PooledConnection connection, Instant now) {
        return !connection.getCreatedAt().plus(settings.getTtl()).isAfter(now);
    }
    
    private boolean probe(PooledConnection connection) {
        try {
            return driver.healthCheck(connection.getHandle());
        } catch (RuntimeException e) {
            log.warn("Health check of {} threw: {}", connection, e.getMessage());
            return false;
        }
    }
    
    private void recordCheckoutLocked() {
        checkoutCount++;
        checkoutCounter.increment();
        updateGaugesLocked();
    }
    
    private void recordOpenSuccess() {
        boolean recovered;
        lock.lock();
        try {
            backoff.reset();
            consecutiveFailures = 0;
            if (reconnecting) {
                reconnecting = false;
                reconnectCount++;
                reconnectCounter.increment();
            }
            recovered = escalated;
            escalated = false;
        } finally {
            lock.unlock();
        }
        if (recovered) {
            log.info("Host {} reachable again", hostId);
            listener.onHostRecovered(hostId);
        }
    }
    
    private void recordOpenFailure(Exception cause) {
        Duration delay;
        lock.lock();
        try {
            delay = backoff.recordFailure(clock.instant());
        } finally {
            lock.unlock();
        }
        log.warn("Failed to open connection to host {} at {}: {} (next attempt in {}ms)",
            hostId, endpoint, cause.getMessage(), delay.toMillis());
        recordFailure(cause.getMessage());
    }
    
    private void recordFailure(String reason) {
        boolean escalate;
        int failures;
        lock.lock();
        try {
            failureCount++;
            failureCounter.increment();
            consecutiveFailures++;
            reconnecting = true;
            failures = consecutiveFailures;
            escalate = !escalated && consecutiveFailures >= settings.getFailureThreshold();
            if (escalate) {
                escalated = true;
            }
        } finally {
            lock.unlock();
        }
        if (escalate) {
            log.warn("Host {} failed {} consecutive connection attempts, reporting unreachable", hostId, failures);
            listener.onHostUnreachable(hostId, failures, reason);
        }
    }
    
    private void updateGaugesLocked() {
        sizeGauge.set(total);
        activeGauge.set(active);
    }
    
    private void closeAll(List<PooledConnection> connections) {
        for (PooledConnection connection : connections) {
            driver.close(connection.getHandle());
        }
    }
}
