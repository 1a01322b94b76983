package io.hostorchestrator.registry;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-host mutual exclusion shared by the registry and the capacity tracker.
 * 
 * There is no global lock: operations on different hosts never serialize against each other.
 * Multi-host sections acquire their locks in host id order so concurrent callers cannot deadlock.
 */
@Slf4j
public class HostLockManager {
    
    /**
     * Work executed while holding one or more host locks.
     */
    @FunctionalInterface
    public interface LockedOperation<T, E extends Exception> {
        T execute() throws E;
    }
    
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    
    public <T, E extends Exception> T withHostLock(String hostId, LockedOperation<T, E> operation) throws E {
        ReentrantLock lock = acquire(hostId);
        try {
            return operation.execute();
        } finally {
            lock.unlock();
        }
    }
    
    public <T, E extends Exception> T withHostLocks(Collection<String> hostIds, LockedOperation<T, E> operation) throws E {
        List<ReentrantLock> acquired = new ArrayList<>();
        try {
            for (String hostId : new TreeSet<>(hostIds)) {
                acquired.add(acquire(hostId));
            }
            return operation.execute();
        } finally {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }
    
    public boolean isHeldByCurrentThread(String hostId) {
        ReentrantLock lock = locks.get(hostId);
        return lock != null && lock.isHeldByCurrentThread();
    }
    
    /**
     * Drop the lock of a host that no longer exists. Threads already waiting on it notice on
     * acquisition and retry with a fresh lock.
     */
    public void discard(String hostId) {
        ReentrantLock lock = locks.get(hostId);
        if (lock == null) {
            return;
        }
        lock.lock();
        try {
            locks.remove(hostId, lock);
        } finally {
            lock.unlock();
        }
        log.debug("Discarded lock of host {}", hostId);
    }
    
    int size() {
        return locks.size();
    }
    
    // The lock taken must still be the mapped one; a discarded lock is released and the lookup retried.
    private ReentrantLock acquire(String hostId) {
        while (true) {
            ReentrantLock lock = lockFor(hostId);
            lock.lock();
            if (locks.get(hostId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }
    
    private ReentrantLock lockFor(String hostId) {
        if (hostId == null) {
            throw new IllegalArgumentException("hostId must not be null");
        }
        return locks.computeIfAbsent(hostId, id -> new ReentrantLock());
    }
}
