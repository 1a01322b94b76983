package io.hostorchestrator.support;

import io.hostorchestrator.enums.EventType;
import io.hostorchestrator.events.EventSink;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Event sink that keeps every emitted event for assertions.
 */
public class RecordingEventSink implements EventSink {
    
    private final List<RecordedEvent> events = new CopyOnWriteArrayList<>();
    
    @Override
    public void emit(EventType type, Map<String, Object> payload) {
        events.add(new RecordedEvent(type, Map.copyOf(payload)));
    }
    
    public List<RecordedEvent> getEvents() {
        return List.copyOf(events);
    }
    
    public List<RecordedEvent> ofType(EventType type) {
        return events.stream().filter(e -> e.getType() == type).collect(Collectors.toList());
    }
    
    public static final class RecordedEvent {
        private final EventType type;
        private final Map<String, Object> payload;
        
        RecordedEvent(EventType type, Map<String, Object> payload) {
            this.type = type;
            this.payload = payload;
        }
        
        public EventType getType() {
            return type;
        }
        
        public Map<String, Object> getPayload() {
            return payload;
        }
    }
}
