package io.hostorchestrator.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a registered host.
 * 
 * <ul>
 *   <li><strong>ACTIVE</strong> - eligible for placement and migration targets</li>
 *   <li><strong>DRAINING</strong> - resident workloads are being evacuated</li>
 *   <li><strong>MAINTENANCE</strong> - drained, excluded from scheduling</li>
 *   <li><strong>UNREACHABLE</strong> - connection health escalated, excluded from scheduling</li>
 * </ul>
 */
public enum HostState {
    ACTIVE,
    DRAINING,
    MAINTENANCE,
    UNREACHABLE;
    
    public Set<HostState> allowedTargets() {
        switch (this) {
            case ACTIVE:
                return EnumSet.of(DRAINING, UNREACHABLE);
            case DRAINING:
                return EnumSet.of(MAINTENANCE, ACTIVE);
            case MAINTENANCE:
            case UNREACHABLE:
                return EnumSet.of(ACTIVE);
            default:
                return EnumSet.noneOf(HostState.class);
        }
    }
    
    public boolean canTransitionTo(HostState target) {
        return target != null && allowedTargets().contains(target);
    }
    
    public static HostState fromString(String value) {
        if (value == null) return null;
        String trimmed = value.trim().toUpperCase();
        for (HostState state : values()) {
            if (state.name().equals(trimmed)) {
                return state;
            }
        }
        return null;
    }
}
