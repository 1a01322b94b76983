package io.hostorchestrator.driver;

/**
 * Opaque handle to an open driver connection. Only the connection pool holds handles.
 */
public interface DriverHandle {
    
    String getHandleId();
    
    String getEndpoint();
}
