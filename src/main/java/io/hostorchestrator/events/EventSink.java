package io.hostorchestrator.events;

import io.hostorchestrator.enums.EventType;

import java.util.Map;

/**
 * Fire-and-forget event emission. Delivery guarantees belong to the implementation;
 * callers never observe emission failures.
 */
public interface EventSink {
    
    void emit(EventType type, Map<String, Object> payload);
}
