package io.hostorchestrator.models;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conjunction of exact {@code key=value} label matches.
 * 
 * Textual form: {@code zone=a,tier=gold}. An empty selector matches every host.
 */
@EqualsAndHashCode
public final class LabelSelector {
    
    public static final LabelSelector EMPTY = new LabelSelector(Map.of());
    
    private final Map<String, String> requirements;
    
    private LabelSelector(Map<String, String> requirements) {
        this.requirements = Collections.unmodifiableMap(new LinkedHashMap<>(requirements));
    }
    
    public static LabelSelector of(Map<String, String> requirements) {
        if (requirements == null || requirements.isEmpty()) {
            return EMPTY;
        }
        for (Map.Entry<String, String> entry : requirements.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank() || entry.getValue() == null) {
                throw new IllegalArgumentException("Invalid label requirement: " + entry);
            }
        }
        return new LabelSelector(requirements);
    }
    
    /**
     * Parse {@code k1=v1,k2=v2}. Blank input yields {@link #EMPTY}.
     */
    public static LabelSelector parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return EMPTY;
        }
        Map<String, String> parsed = new LinkedHashMap<>();
        for (String term : expression.split(",")) {
            String trimmed = term.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Malformed label term '" + trimmed + "' in selector: " + expression);
            }
            String key = trimmed.substring(0, eq).trim();
            String value = trimmed.substring(eq + 1).trim();
            String previous = parsed.putIfAbsent(key, value);
            if (previous != null && !previous.equals(value)) {
                throw new IllegalArgumentException("Conflicting values for label '" + key + "' in selector: " + expression);
            }
        }
        return of(parsed);
    }
    
    public boolean matches(Map<String, String> labels) {
        if (requirements.isEmpty()) {
            return true;
        }
        if (labels == null) {
            return false;
        }
        for (Map.Entry<String, String> requirement : requirements.entrySet()) {
            if (!requirement.getValue().equals(labels.get(requirement.getKey()))) {
                return false;
            }
        }
        return true;
    }
    
    public Map<String, String> getRequirements() {
        return requirements;
    }
    
    public boolean isEmpty() {
        return requirements.isEmpty();
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        requirements.forEach((k, v) -> {
            if (sb.length() > 0) sb.append(',');
            sb.append(k).append('=').append(v);
        });
        return sb.toString();
    }
}
