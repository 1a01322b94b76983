package io.hostorchestrator.pool;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the pool health policy on a fixed delay, independent of request-serving threads.
 */
@Slf4j
public class PoolHealthMonitor {
    
    private final ConnectionPoolManager poolManager;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private volatile boolean isRunning = false;
    
    public PoolHealthMonitor(ConnectionPoolManager poolManager, Duration interval) {
        this.poolManager = poolManager;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "pool-health-monitor");
            thread.setDaemon(true);
            return thread;
        });
    }
    
    public void start() {
        log.info("Starting pool health monitor with interval {}s", interval.getSeconds());
        isRunning = true;
        scheduler.scheduleWithFixedDelay(
                this::runHealthRound,
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS
        );
    }
    
    public void stop() {
        log.info("Stopping pool health monitor");
        isRunning = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
    
    public boolean isRunning() {
        return isRunning;
    }
    
    void runHealthRound() {
        if (!isRunning) {
            return;
        }
        try {
            log.debug("Running pool health round");
            poolManager.maintainAll();
        } catch (Exception e) {
            log.error("Error in pool health round: {}", e.getMessage(), e);
        }
    }
}
