package io.hostorchestrator.store;

import io.hostorchestrator.exceptions.PersistenceException;
import lombok.extern.slf4j.Slf4j;

/**
 * Translates raw store failures into {@link PersistenceException} for the write-through callers.
 */
@Slf4j
public final class StoreWrites {
    
    @FunctionalInterface
    public interface StoreCall {
        void run() throws Exception;
    }
    
    private StoreWrites() {
    }
    
    public static void write(String recordKind, String recordId, StoreCall call) throws PersistenceException {
        try {
            call.run();
        } catch (Exception e) {
            log.error("Failed to persist {} {}: {}", recordKind, recordId, e.getMessage(), e);
            throw new PersistenceException("Failed to persist " + recordKind + " " + recordId, recordKind, recordId, e);
        }
    }
}
