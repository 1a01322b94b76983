package io.hostorchestrator.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/*
 * MetricsProvider is a utility class for creating and managing counters, gauges and timers,
 * all tagged with the id of this orchestrator instance.
 */
@Component
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String ORCHESTRATOR_TAG = "orchestrator";

    private final MeterRegistry registry;
    private final String orchestratorId;
    // Gauges are registered once per name and tag set; later lookups return the same holder
    private final Map<String, AtomicDouble> gauges = new ConcurrentHashMap<>();

    @Autowired
    public MetricsProvider(
        MeterRegistry registry,
        @Value("${orchestrator.id}") String orchestratorId) {
        this.registry = registry;
        this.orchestratorId = orchestratorId;
        log.info("MetricsProvider initialized for the orchestrator: {}", orchestratorId);
    }

    /**
     * Create or retrieve a Counter metric with the given name and tags.
     *
     * @param name the name of the counter
     * @param tags a map of tag keys to tag values
     * @return the Counter instance
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Create or retrieve a Gauge metric with the given name and tags.
     *
     * @param name the name of the gauge
     * @param tags a map of tag keys to tag values
     * @return the AtomicDouble instance representing the gauge value
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        String key = name + tags;
        return gauges.computeIfAbsent(key, k -> {
            AtomicDouble value = new AtomicDouble(0);
            Gauge.builder(name, value::get).tags(mapToTagArray(tags)).register(registry);
            return value;
        });
    }

    /**
     * Create or retrieve a Timer metric with the given name and tags.
     *
     * @param name the name of the timer
     * @param tags a map of tag keys to tag values
     * @return the Timer instance
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(tags))
            .publishPercentileHistogram()
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Convert a map of tags to an array of alternating keys and values, including the orchestrator id.
     *
     * @param tags the map of tags
     * @return array of alternating keys and values
     */
    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        tagArray[index++] = ORCHESTRATOR_TAG;
        tagArray[index] = orchestratorId;
        return tagArray;
    }
}
