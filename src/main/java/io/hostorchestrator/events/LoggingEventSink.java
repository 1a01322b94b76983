package io.hostorchestrator.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.hostorchestrator.enums.EventType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes one JSON line per event to the application log.
 */
@Slf4j
public class LoggingEventSink implements EventSink {
    
    private final ObjectMapper objectMapper;
    private final Clock clock;
    
    public LoggingEventSink(Clock clock) {
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
    
    @Override
    public void emit(EventType type, Map<String, Object> payload) {
        try {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("event_type", type.getValue());
            event.put("timestamp", clock.instant());
            event.put("payload", payload);
            log.info("event {}", objectMapper.writeValueAsString(event));
        } catch (Exception e) {
            log.warn("Failed to emit {} event: {}", type.getValue(), e.getMessage());
        }
    }
}
