package io.hostorchestrator.enums;

/**
 * Resource dimensions tracked per host.
 */
public enum ResourceDimension {
    VCPUS("vcpus"),
    MEMORY_MIB("memory_mib"),
    DISK_GIB("disk_gib");
    
    private final String value;
    
    ResourceDimension(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
}
