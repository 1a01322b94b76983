package io.hostorchestrator.pool;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential reconnect delay: base, 2x base, 4x base ... capped at max. Not thread-safe;
 * the owning pool guards it with its lock.
 */
public class ReconnectBackoff {
    
    private final Duration base;
    private final Duration max;
    private int attempts;
    private Instant nextAttemptAt;
    
    public ReconnectBackoff(Duration base, Duration max) {
        this.base = base;
        this.max = max;
    }
    
    /**
     * Register a failed attempt.
     *
     * @return the delay before the next attempt is allowed
     */
    public Duration recordFailure(Instant now) {
        attempts++;
        Duration delay = delayFor(attempts);
        nextAttemptAt = now.plus(delay);
        return delay;
    }
    
    public void reset() {
        attempts = 0;
        nextAttemptAt = null;
    }
    
    public boolean isBackingOff(Instant now) {
        return nextAttemptAt != null && now.isBefore(nextAttemptAt);
    }
    
    public Duration remaining(Instant now) {
        if (!isBackingOff(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, nextAttemptAt);
    }
    
    public int getAttempts() {
        return attempts;
    }
    
    public Duration delayFor(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        long baseMillis = base.toMillis();
        long maxMillis = max.toMillis();
        int shift = Math.min(attempt - 1, 30);
        long delay = baseMillis << shift;
        if (delay < 0 || (baseMillis > 0 && (delay >> shift) != baseMillis)) {
            delay = maxMillis;
        }
        return Duration.ofMillis(Math.min(delay, maxMillis));
    }
}
