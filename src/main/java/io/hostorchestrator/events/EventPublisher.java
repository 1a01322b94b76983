package io.hostorchestrator.events;

import io.hostorchestrator.enums.EventType;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Shields orchestration paths from a misbehaving sink: emission failures are logged and dropped.
 */
@Slf4j
public class EventPublisher {
    
    private final EventSink sink;
    
    public EventPublisher(EventSink sink) {
        this.sink = sink;
    }
    
    public void publish(EventType type, Map<String, Object> payload) {
        try {
            sink.emit(type, payload);
        } catch (RuntimeException e) {
            log.warn("Event sink rejected {} event {}: {}", type.getValue(), payload, e.getMessage());
        }
    }
}
