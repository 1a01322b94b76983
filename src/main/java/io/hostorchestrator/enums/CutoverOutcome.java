package io.hostorchestrator.enums;

/**
 * Result reported by the driver for the pause-and-transfer step of a migration.
 * 
 * PARTIAL means the driver cannot tell on which host the workload is usable.
 */
public enum CutoverOutcome {
    COMPLETED,
    FAILED,
    PARTIAL
}
