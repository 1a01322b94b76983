package io.hostorchestrator.registry;

import io.hostorchestrator.enums.HostState;
import io.hostorchestrator.exceptions.HostAlreadyExistsException;
import io.hostorchestrator.exceptions.HostInUseException;
import io.hostorchestrator.exceptions.HostNotFoundException;
import io.hostorchestrator.exceptions.InvalidStateTransitionException;
import io.hostorchestrator.exceptions.OrchestrationException;
import io.hostorchestrator.exceptions.PersistenceException;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.LabelSelector;
import io.hostorchestrator.store.OrchestratorStore;
import io.hostorchestrator.store.StoreWrites;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative record of known hosts, their declared capacity, labels and lifecycle state.
 * 
 * Hosts are immutable snapshots; every mutation runs under the host's lock, persists the new
 * snapshot and then swaps it in, so readers never block and never see a half-applied change.
 */
@Slf4j
public class HostRegistry {
    
    private final ConcurrentHashMap<String, Host> hosts = new ConcurrentHashMap<>();
    private final HostLockManager lockManager;
    private final OrchestratorStore store;
    private final Clock clock;
    
    public HostRegistry(HostLockManager lockManager, OrchestratorStore store, Clock clock) {
        this.lockManager = lockManager;
        this.store = store;
        this.clock = clock;
    }
    
    /**
     * Register a new host. The host always starts {@link HostState#ACTIVE}.
     */
    public Host register(Host host) throws OrchestrationException {
        validate(host);
        String hostId = host.getHostId();
        return lockManager.withHostLock(hostId, () -> {
            if (hosts.containsKey(hostId)) {
                throw new HostAlreadyExistsException(hostId);
            }
            Instant now = clock.instant();
            Host registered = host.toBuilder()
                .name(host.getName() != null ? host.getName() : hostId)
                .labels(host.getLabels() != null ? new LinkedHashMap<>(host.getLabels()) : new LinkedHashMap<>())
                .state(HostState.ACTIVE)
                .registeredAt(now)
                .stateChangedAt(now)
                .build();
            persist(registered);
            hosts.put(hostId, registered);
            log.info("Registered host {} at {} with capacity {}", hostId, registered.getEndpoint(), registered.getCapacity());
            return registered;
        });
    }
    
    /**
     * Remove a host. Rejected with {@link HostInUseException} while workloads or reservations are assigned.
     */
    public Host deregister(String hostId, HostUsageView usage) throws OrchestrationException {
        return lockManager.withHostLock(hostId, () -> {
            Host existing = get(hostId);
            int workloads = usage.workloadCount(hostId);
            int reservations = usage.reservationCount(hostId);
            if (workloads > 0 || reservations > 0) {
                throw new HostInUseException(hostId, workloads, reservations);
            }
            StoreWrites.write("host", hostId, () -> store.deleteHost(hostId));
            hosts.remove(hostId);
            log.info("Deregistered host {}", hostId);
            return existing;
        });
    }
    
    public Host get(String hostId) throws HostNotFoundException {
        Host host = hostId != null ? hosts.get(hostId) : null;
        if (host == null) {
            throw new HostNotFoundException(hostId);
        }
        return host;
    }
    
    public Optional<Host> find(String hostId) {
        return Optional.ofNullable(hostId != null ? hosts.get(hostId) : null);
    }
    
    public boolean contains(String hostId) {
        return hostId != null && hosts.containsKey(hostId);
    }
    
    /**
     * Hosts whose labels satisfy the selector, ordered by host id.
     */
    public List<Host> list(LabelSelector selector) {
        LabelSelector effective = selector != null ? selector : LabelSelector.EMPTY;
        List<Host> result = new ArrayList<>();
        for (Host host : hosts.values()) {
            if (effective.matches(host.getLabels())) {
                result.add(host);
            }
        }
        result.sort(Comparator.comparing(Host::getHostId));
        return result;
    }
    
    public List<Host> listAll() {
        return list(LabelSelector.EMPTY);
    }
    
    /**
     * Move a host to a new lifecycle state, validated against the host transition table.
     */
    public Host setState(String hostId, HostState target) throws OrchestrationException {
        return lockManager.withHostLock(hostId, () -> {
            Host current = get(hostId);
            if (!current.getState().canTransitionTo(target)) {
                throw new InvalidStateTransitionException("host", hostId, current.getState(), target);
            }
            return applyState(current, target);
        });
    }
    
    /**
     * Transition only if the host is currently in {@code expected}. Used by background policies
     * that must not override a state chosen by an operator in the meantime.
     *
     * @return true if the transition was applied
     */
    public boolean compareAndSetState(String hostId, HostState expected, HostState target) throws OrchestrationException {
        return lockManager.withHostLock(hostId, () -> {
            Host current = hosts.get(hostId);
            if (current == null || current.getState() != expected || !expected.canTransitionTo(target)) {
                return false;
            }
            applyState(current, target);
            return true;
        });
    }
    
    /**
     * Like {@link #compareAndSetState(String, HostState, HostState)}, but only while nothing is placed or
     * reserved on the host. The usage check and the transition happen under the host's lock, which the
     * capacity tracker also takes for every reservation and commit.
     *
     * @return true if the transition was applied, false if the host is in use or not in {@code expected}
     */
    public boolean compareAndSetState(String hostId, HostState expected, HostState target, HostUsageView idleGuard)
            throws OrchestrationException {
        return lockManager.withHostLock(hostId, () -> {
            if (idleGuard.workloadCount(hostId) > 0 || idleGuard.reservationCount(hostId) > 0) {
                return false;
            }
            return compareAndSetState(hostId, expected, target);
        });
    }
    
    /**
     * Record a successful health check.
     */
    public void markHealthy(String hostId, Instant at) throws OrchestrationException {
        lockManager.withHostLock(hostId, () -> {
            Host current = hosts.get(hostId);
            if (current == null) {
                return null;
            }
            Host updated = current.toBuilder().lastHealthCheckAt(at).build();
            persist(updated);
            hosts.put(hostId, updated);
            return null;
        });
    }
    
    /**
     * Load hosts read back from the store, replacing any in-memory state.
     */
    public void restore(Collection<Host> persisted) {
        hosts.clear();
        for (Host host : persisted) {
            hosts.put(host.getHostId(), host);
        }
        log.info("Restored {} hosts from store", persisted.size());
    }
    
    public HostLockManager getLockManager() {
        return lockManager;
    }
    
    private Host applyState(Host current, HostState target) throws PersistenceException {
        Host updated = current.toBuilder().state(target).stateChangedAt(clock.instant()).build();
        persist(updated);
        hosts.put(current.getHostId(), updated);
        log.info("Host {} state changed: {} -> {}", current.getHostId(), current.getState(), target);
        return updated;
    }
    
    private void persist(Host host) throws PersistenceException {
        StoreWrites.write("host", host.getHostId(), () -> store.saveHost(host));
    }
    
    private static void validate(Host host) {
        if (host == null) {
            throw new IllegalArgumentException("host must not be null");
        }
        if (host.getHostId() == null || host.getHostId().isBlank()) {
            throw new IllegalArgumentException("hostId must not be blank");
        }
        if (host.getEndpoint() == null || host.getEndpoint().isBlank()) {
            throw new IllegalArgumentException("endpoint must not be blank for host " + host.getHostId());
        }
        if (host.getCapacity() == null) {
            throw new IllegalArgumentException("capacity must be set for host " + host.getHostId());
        }
        host.getCapacity().validate("capacity of host " + host.getHostId());
    }
}
