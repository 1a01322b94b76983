package io.hostorchestrator.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.hostorchestrator.enums.ResourceDimension;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Amount of compute resources: vCPUs, memory (MiB) and disk (GiB).
 * Used for declared host capacity, workload requirements, and allocation totals.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ResourceSpec {
    
    public static final ResourceSpec ZERO = new ResourceSpec(0, 0L, 0L);
    
    int vcpus;
    long memoryMib;
    long diskGib;
    
    public static ResourceSpec of(int vcpus, long memoryMib, long diskGib) {
        return new ResourceSpec(vcpus, memoryMib, diskGib);
    }
    
    public long get(ResourceDimension dimension) {
        switch (dimension) {
            case VCPUS:
                return vcpus;
            case MEMORY_MIB:
                return memoryMib;
            case DISK_GIB:
                return diskGib;
            default:
                throw new IllegalArgumentException("Unknown dimension: " + dimension);
        }
    }
    
    public ResourceSpec plus(ResourceSpec other) {
        return new ResourceSpec(vcpus + other.vcpus, memoryMib + other.memoryMib, diskGib + other.diskGib);
    }
    
    /**
     * Subtract, clamping every dimension at zero.
     */
    public ResourceSpec minus(ResourceSpec other) {
        return new ResourceSpec(
            Math.max(0, vcpus - other.vcpus),
            Math.max(0L, memoryMib - other.memoryMib),
            Math.max(0L, diskGib - other.diskGib));
    }
    
    /**
     * Scale by an overcommit factor, rounding down.
     */
    public ResourceSpec scale(double factor) {
        if (factor == 1.0d) {
            return this;
        }
        return new ResourceSpec(
            (int) Math.floor(vcpus * factor),
            (long) Math.floor(memoryMib * factor),
            (long) Math.floor(diskGib * factor));
    }
    
    /**
     * First dimension in which this request does not fit into {@code available}, or null if it fits.
     */
    public ResourceDimension firstShortfall(ResourceSpec available) {
        for (ResourceDimension dimension : ResourceDimension.values()) {
            if (get(dimension) > available.get(dimension)) {
                return dimension;
            }
        }
        return null;
    }
    
    public boolean fitsWithin(ResourceSpec available) {
        return firstShortfall(available) == null;
    }
    
    @JsonIgnore
    public boolean isZero() {
        return vcpus == 0 && memoryMib == 0 && diskGib == 0;
    }
    
    public void validate(String what) {
        if (vcpus < 0 || memoryMib < 0 || diskGib < 0) {
            throw new IllegalArgumentException(what + " must not be negative: " + this);
        }
    }
}
