package io.hostorchestrator.driver.fake;

/**
 * Scripted outcome of a simulated migration.
 */
public enum FakeMigrationBehavior {
    SUCCEED,
    FAIL_SYNC,       // synchronization fails, cutover never starts
    HANG_SYNC,       // synchronization never completes unless aborted
    FAIL_CUTOVER,    // driver reports a clean cutover failure, workload still on source
    PARTIAL_CUTOVER, // driver reports partial completion
    ERROR_CUTOVER,   // cutover call itself errors
    HANG_CUTOVER     // cutover never reports back
}
