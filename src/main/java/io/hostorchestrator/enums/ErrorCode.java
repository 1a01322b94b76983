package io.hostorchestrator.enums;

/**
 * Error codes surfaced by the orchestration engine.
 * 
 * Transient codes may be retried by the caller; all others are terminal for the request.
 */
public enum ErrorCode {
    NO_ELIGIBLE_HOST(409, false),
    POOL_EXHAUSTED(503, true),
    HOST_UNREACHABLE(503, true),
    PRECHECK_FAILED(409, false),
    AMBIGUOUS_STATE(500, false),
    MIGRATION_IN_PROGRESS(409, false),
    HOST_IN_USE(409, false),
    INVALID_STATE_TRANSITION(409, false),
    ROLLBACK_FAILED(500, false),
    CANNOT_CANCEL_DURING_CUTOVER(409, false),
    CAPACITY_EXCEEDED(409, true),
    HOST_NOT_FOUND(404, false),
    HOST_ALREADY_EXISTS(409, false),
    WORKLOAD_NOT_FOUND(404, false),
    WORKLOAD_ALREADY_PLACED(409, false),
    MIGRATION_NOT_FOUND(404, false),
    MIGRATION_CANCELLED(409, false),
    MIGRATION_TIMEOUT(504, true),
    MIGRATION_INTERRUPTED(500, false),
    DRIVER_ERROR(502, true),
    PERSISTENCE_FAILURE(500, true);
    
    private final int httpStatus;
    private final boolean transientFailure;
    
    ErrorCode(int httpStatus, boolean transientFailure) {
        this.httpStatus = httpStatus;
        this.transientFailure = transientFailure;
    }
    
    public int getHttpStatus() {
        return httpStatus;
    }
    
    public boolean isTransient() {
        return transientFailure;
    }
}
