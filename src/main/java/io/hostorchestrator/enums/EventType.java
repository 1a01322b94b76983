package io.hostorchestrator.enums;

/**
 * Domain events emitted to the event sink.
 */
public enum EventType {
    SYSTEM_MIGRATING("SystemMigrating"),
    SYSTEM_MIGRATED("SystemMigrated"),
    HOST_MAINTENANCE_ENTERED("HostMaintenanceEntered"),
    HOST_MAINTENANCE_EXITED("HostMaintenanceExited"),
    HOST_UNREACHABLE("HostUnreachable"),
    HOST_RECOVERED("HostRecovered");
    
    private final String value;
    
    EventType(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
}
