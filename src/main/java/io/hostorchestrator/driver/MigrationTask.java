package io.hostorchestrator.driver;

import io.hostorchestrator.enums.CutoverOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Driver-side migration in progress.
 * 
 * The coordinator awaits {@link #synchronization()} (iterative state copy for live migrations,
 * already complete for offline ones), then triggers {@link #cutover()} exactly once.
 */
public interface MigrationTask {
    
    /**
     * Completes when source and target are synchronized enough to cut over.
     */
    CompletableFuture<Void> synchronization();
    
    /**
     * Pause the workload and transfer final state. An exceptional completion means the
     * driver could not tell whether the workload is usable on either host.
     */
    CompletableFuture<CutoverOutcome> cutover();
    
    int progressPercent();
    
    /**
     * Best-effort abort of a synchronization that has not cut over yet.
     */
    void abort();
}
