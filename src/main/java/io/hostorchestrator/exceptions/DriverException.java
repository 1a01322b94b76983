package io.hostorchestrator.exceptions;

/**
 * Exception thrown when a hypervisor driver call fails.
 */
public class DriverException extends Exception {
    
    public DriverException(String message) {
        super(message);
    }
    
    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
