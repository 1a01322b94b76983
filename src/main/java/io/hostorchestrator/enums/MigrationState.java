package io.hostorchestrator.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a migration record.
 * 
 * PENDING -> PRE_CHECKING -> PREPARING -> CUTOVER -> COMPLETED, with FAILED reachable
 * from every non-terminal state.
 */
public enum MigrationState {
    PENDING,
    PRE_CHECKING,
    PREPARING,
    CUTOVER,
    COMPLETED,
    FAILED;
    
    public Set<MigrationState> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(PRE_CHECKING, FAILED);
            case PRE_CHECKING:
                return EnumSet.of(PREPARING, FAILED);
            case PREPARING:
                return EnumSet.of(CUTOVER, FAILED);
            case CUTOVER:
                return EnumSet.of(COMPLETED, FAILED);
            default:
                return EnumSet.noneOf(MigrationState.class);
        }
    }
    
    public boolean canTransitionTo(MigrationState target) {
        return target != null && allowedTargets().contains(target);
    }
    
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
    
    /**
     * Whether cancellation can still be honoured without touching any resources.
     */
    public boolean isCleanlyCancellable() {
        return this == PENDING || this == PRE_CHECKING;
    }
}
