package io.hostorchestrator.enums;

/**
 * Migration modes. OFFLINE skips the iterative pre-copy and expects the workload powered off.
 */
public enum MigrationMode {
    LIVE,
    OFFLINE;
    
    public static MigrationMode fromString(String value) {
        if (value == null || value.isBlank()) return LIVE;
        String trimmed = value.trim().toUpperCase();
        for (MigrationMode mode : values()) {
            if (mode.name().equals(trimmed)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown migration mode: " + value);
    }
}
