package io.hostorchestrator.pool;

import io.hostorchestrator.driver.DriverHandle;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A live driver connection owned by one host's pool.
 */
@Getter
public class PooledConnection {
    
    private final String hostId;
    private final DriverHandle handle;
    private final Instant createdAt;
    private volatile Instant lastUsedAt;
    private volatile boolean healthy = true;
    
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean checkedOut = new AtomicBoolean(false);
    
    PooledConnection(String hostId, DriverHandle handle, Instant createdAt) {
        this.hostId = hostId;
        this.handle = handle;
        this.createdAt = createdAt;
        this.lastUsedAt = createdAt;
    }
    
    public boolean isCheckedOut() {
        return checkedOut.get();
    }
    
    PooledConnection markCheckedOut(Instant at) {
        checkedOut.set(true);
        lastUsedAt = at;
        return this;
    }
    
    /**
     * @return false if the connection was not checked out
     */
    boolean markReturned(Instant at) {
        if (!checkedOut.compareAndSet(true, false)) {
            return false;
        }
        lastUsedAt = at;
        return true;
    }
    
    void markUnhealthy() {
        healthy = false;
    }
    
    @Override
    public String toString() {
        return "PooledConnection{" + hostId + "/" + handle.getHandleId() + "}";
    }
}
