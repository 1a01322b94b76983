package io.hostorchestrator.pool;

import io.hostorchestrator.config.PoolSettings;
import io.hostorchestrator.driver.DriverHandle;
import io.hostorchestrator.driver.HypervisorDriver;
import io.hostorchestrator.enums.EventType;
import io.hostorchestrator.enums.HostState;
import io.hostorchestrator.events.EventPublisher;
import io.hostorchestrator.exceptions.DriverException;
import io.hostorchestrator.exceptions.HostNotFoundException;
import io.hostorchestrator.exceptions.OrchestrationException;
import io.hostorchestrator.exceptions.PoolExhaustedException;
import io.hostorchestrator.metrics.MetricsProvider;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.PoolMetrics;
import io.hostorchestrator.registry.HostRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static io.hostorchestrator.config.Constants.EVENT_HOST_ID;

/**
 * Owns one {@link HostConnectionPool} per registered host and is the only component that holds
 * driver connections. Other components borrow a connection for a single driver call through
 * {@link #withConnection(String, ConnectionCall)}.
 * 
 * Health escalation reaches the registry only through its guarded state transitions
 * (Active to Unreachable and back).
 */
@Slf4j
public class ConnectionPoolManager implements PoolHealthListener, HostHealthView {
    
    /**
     * A driver call made with a borrowed connection.
     */
    @FunctionalInterface
    public interface ConnectionCall<T> {
        T apply(DriverHandle handle) throws DriverException;
    }
    
    private final ConcurrentHashMap<String, HostConnectionPool> pools = new ConcurrentHashMap<>();
    private final HostRegistry registry;
    private final HypervisorDriver driver;
    private final PoolSettings settings;
    private final Clock clock;
    private final EventPublisher events;
    private final MetricsProvider metricsProvider;
    
    public ConnectionPoolManager(HostRegistry registry, HypervisorDriver driver, PoolSettings settings, Clock clock,
                                 EventPublisher events, MetricsProvider metricsProvider) {
        settings.validate();
        this.registry = registry;
        this.driver = driver;
        this.settings = settings;
        this.clock = clock;
        this.events = events;
        this.metricsProvider = metricsProvider;
        log.info("ConnectionPoolManager initialized with driver {} and pool bounds [{}, {}]",
            driver.getType(), settings.getMinConnections(), settings.getMaxConnections());
    }
    
    public PoolSettings getSettings() {
        return settings;
    }
    
    public PooledConnection checkout(String hostId) throws OrchestrationException {
        return checkout(hostId, settings.getCheckoutTimeout());
    }
    
    public PooledConnection checkout(String hostId, Duration timeout) throws OrchestrationException {
        return poolFor(hostId).checkout(timeout);
    }
    
    public void checkin(PooledConnection connection) {
        HostConnectionPool pool = pools.get(connection.getHostId());
        if (pool == null) {
            // Pool already closed by deregistration
            connection.markReturned(clock.instant());
            driver.close(connection.getHandle());
            return;
        }
        pool.checkin(connection);
    }
    
    /**
     * Run a driver call on a borrowed connection, always returning the connection afterwards.
     * Pool exhaustion is retried with bounded backoff before it is surfaced.
     */
    public <T> T withConnection(String hostId, ConnectionCall<T> call) throws OrchestrationException, DriverException {
        PooledConnection connection = checkoutWithRetry(hostId);
        try {
            return call.apply(connection.getHandle());
        } finally {
            checkin(connection);
        }
    }
    
    /**
     * Whether the scheduler may use this host: it is not reported unreachable and has a live connection
     * or could open one now. A host without a pool yet is assumed reachable; it connects lazily.
     */
    @Override
    public boolean isHealthy(String hostId) {
        Optional<Host> host = registry.find(hostId);
        if (host.isEmpty() || host.get().getState() == HostState.UNREACHABLE) {
            return false;
        }
        HostConnectionPool pool = pools.get(hostId);
        return pool == null || pool.isHealthy();
    }
    
    public PoolMetrics getMetrics(String hostId) throws HostNotFoundException {
        registry.get(hostId);
        HostConnectionPool pool = pools.get(hostId);
        if (pool == null) {
            return PoolMetrics.builder().hostId(hostId).build();
        }
        return pool.getMetrics();
    }
    
    public void closePool(String hostId) {
        HostConnectionPool pool = pools.remove(hostId);
        if (pool != null) {
            pool.close();
        }
    }
    
    /**
     * One round of the background health policy over every registered host.
     */
    public void maintainAll() {
        for (String hostId : new ArrayList<>(pools.keySet())) {
            if (!registry.contains(hostId)) {
                log.info("Closing pool of deregistered host {}", hostId);
                closePool(hostId);
            }
        }
        for (Host host : registry.listAll()) {
            try {
                HostConnectionPool pool = poolFor(host.getHostId());
                pool.maintain();
            } catch (HostNotFoundException e) {
                log.debug("Host {} deregistered during health round", host.getHostId());
            } catch (RuntimeException e) {
                log.error("Health round failed for host {}: {}", host.getHostId(), e.getMessage(), e);
            }
        }
    }
    
    public void shutdown() {
        log.info("Shutting down {} connection pool(s)", pools.size());
        for (String hostId : new ArrayList<>(pools.keySet())) {
            closePool(hostId);
        }
    }
    
    // =================================================================
    // HEALTH ESCALATION
    // =================================================================
    
    @Override
    public void onHostUnreachable(String hostId, int consecutiveFailures, String lastError) {
        try {
            if (registry.compareAndSetState(hostId, HostState.ACTIVE, HostState.UNREACHABLE)) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put(EVENT_HOST_ID, hostId);
                payload.put("consecutiveFailures", consecutiveFailures);
                payload.put("reason", lastError != null ? lastError : "unknown");
                events.publish(EventType.HOST_UNREACHABLE, payload);
            } else {
                log.info("Host {} not escalated to UNREACHABLE: not ACTIVE", hostId);
            }
        } catch (OrchestrationException e) {
            log.error("Failed to mark host {} unreachable: {}", hostId, e.getMessage(), e);
        }
    }
    
    @Override
    public void onHostRecovered(String hostId) {
        try {
            if (registry.compareAndSetState(hostId, HostState.UNREACHABLE, HostState.ACTIVE)) {
                events.publish(EventType.HOST_RECOVERED, Map.of(EVENT_HOST_ID, hostId));
            }
        } catch (OrchestrationException e) {
            log.error("Failed to mark host {} recovered: {}", hostId, e.getMessage(), e);
        }
    }
    
    @Override
    public void onProbeSucceeded(String hostId, Instant at) {
        try {
            registry.markHealthy(hostId, at);
        } catch (OrchestrationException e) {
            log.warn("Failed to record health check of host {}: {}", hostId, e.getMessage());
        }
    }
    
    private PooledConnection checkoutWithRetry(String hostId) throws OrchestrationException {
        int attempts = settings.getCheckoutRetries() + 1;
        for (int attempt = 1; ; attempt++) {
            try {
                return checkout(hostId);
            } catch (PoolExhaustedException e) {
                if (attempt >= attempts) {
                    throw e;
                }
                Duration pause = retryPause(attempt);
                log.warn("Pool for host {} exhausted (attempt {}/{}), retrying in {}ms",
                    hostId, attempt, attempts, pause.toMillis());
                try {
                    Thread.sleep(pause.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }
    
    private Duration retryPause(int attempt) {
        return new ReconnectBackoff(settings.getBackoffBase(), settings.getBackoffMax()).delayFor(attempt);
    }
    
    private HostConnectionPool poolFor(String hostId) throws HostNotFoundException {
        Host host = registry.get(hostId);
        return pools.computeIfAbsent(hostId, id ->
            new HostConnectionPool(id, host.getEndpoint(), driver, settings, clock, this, metricsProvider));
    }
}
