package io.hostorchestrator.registry;

import io.hostorchestrator.enums.ErrorCode;
import io.hostorchestrator.enums.HostState;
import io.hostorchestrator.exceptions.HostAlreadyExistsException;
import io.hostorchestrator.exceptions.HostInUseException;
import io.hostorchestrator.exceptions.HostNotFoundException;
import io.hostorchestrator.exceptions.InvalidStateTransitionException;
import io.hostorchestrator.exceptions.OrchestrationException;
import io.hostorchestrator.exceptions.PersistenceException;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.LabelSelector;
import io.hostorchestrator.store.InMemoryOrchestratorStore;
import io.hostorchestrator.store.OrchestratorStore;
import io.hostorchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.hostorchestrator.support.TestHosts.host;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HostRegistryTest {
    
    private MutableClock clock;
    private InMemoryOrchestratorStore store;
    private HostRegistry registry;
    
    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        store = new InMemoryOrchestratorStore();
        registry = new HostRegistry(new HostLockManager(), store, clock);
    }
    
    @Test
    void testRegisterStartsActiveAndPersists() throws Exception {
        Host registered = registry.register(host("h1", 8, 16384).toBuilder().name(null).state(HostState.MAINTENANCE).build());
        
        assertThat(registered.getState()).isEqualTo(HostState.ACTIVE);
        assertThat(registered.getName()).isEqualTo("h1");
        assertThat(registered.getRegisteredAt()).isEqualTo(clock.instant());
        assertThat(store.loadHosts()).containsExactly(registered);
    }
    
    @Test
    void testRegisterDuplicateRejected() throws Exception {
        registry.register(host("h1", 8, 16384));
        
        assertThatThrownBy(() -> registry.register(host("h1", 4, 8192)))
            .isInstanceOf(HostAlreadyExistsException.class);
        assertThat(registry.get("h1").getCapacity().getVcpus()).isEqualTo(8);
    }
    
    @Test
    void testRegisterValidatesInput() {
        assertThatThrownBy(() -> registry.register(host("h1", 8, 1024).toBuilder().endpoint(" ").build()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(host("h1", 8, 1024).toBuilder().capacity(null).build()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(host("", 8, 1024)))
            .isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    void testListFiltersBySelectorAndSortsById() throws Exception {
        registry.register(host("h3", 8, 1024, Map.of("zone", "a")));
        registry.register(host("h1", 8, 1024, Map.of("zone", "a", "tier", "gold")));
        registry.register(host("h2", 8, 1024, Map.of("zone", "b")));
        
        assertThat(registry.listAll()).extracting(Host::getHostId).containsExactly("h1", "h2", "h3");
        assertThat(registry.list(LabelSelector.parse("zone=a"))).extracting(Host::getHostId).containsExactly("h1", "h3");
        assertThat(registry.list(LabelSelector.parse("zone=a,tier=gold"))).extracting(Host::getHostId).containsExactly("h1");
    }
    
    @Test
    void testSetStateFollowsTransitionTable() throws Exception {
        registry.register(host("h1", 8, 1024));
        clock.advance(Duration.ofMinutes(5));
        
        Host draining = registry.setState("h1", HostState.DRAINING);
        assertThat(draining.getState()).isEqualTo(HostState.DRAINING);
        assertThat(draining.getStateChangedAt()).isEqualTo(clock.instant());
        
        assertThatThrownBy(() -> registry.setState("h1", HostState.UNREACHABLE))
            .isInstanceOf(InvalidStateTransitionException.class)
            .satisfies(e -> assertThat(((OrchestrationException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_STATE_TRANSITION));
        assertThat(registry.get("h1").getState()).isEqualTo(HostState.DRAINING);
    }
    
    @Test
    void testCompareAndSetStateOnlyAppliesFromExpectedState() throws Exception {
        registry.register(host("h1", 8, 1024));
        
        assertThat(registry.compareAndSetState("h1", HostState.UNREACHABLE, HostState.ACTIVE)).isFalse();
        assertThat(registry.compareAndSetState("h1", HostState.ACTIVE, HostState.UNREACHABLE)).isTrue();
        assertThat(registry.get("h1").getState()).isEqualTo(HostState.UNREACHABLE);
        assertThat(registry.compareAndSetState("missing", HostState.ACTIVE, HostState.DRAINING)).isFalse();
    }
    
    @Test
    void testGuardedStateChangeRequiresIdleHost() throws Exception {
        registry.register(host("h1", 8, 1024));
        registry.setState("h1", HostState.DRAINING);
        HostUsageView reserved = mock(HostUsageView.class);
        when(reserved.reservationCount("h1")).thenReturn(1);
        
        assertThat(registry.compareAndSetState("h1", HostState.DRAINING, HostState.MAINTENANCE, reserved)).isFalse();
        assertThat(registry.get("h1").getState()).isEqualTo(HostState.DRAINING);
        
        HostUsageView idle = mock(HostUsageView.class);
        assertThat(registry.compareAndSetState("h1", HostState.DRAINING, HostState.MAINTENANCE, idle)).isTrue();
        assertThat(registry.get("h1").getState()).isEqualTo(HostState.MAINTENANCE);
    }
    
    @Test
    void testDeregisterRejectedWhileInUse() throws Exception {
        registry.register(host("h1", 8, 1024));
        HostUsageView busy = mock(HostUsageView.class);
        when(busy.workloadCount("h1")).thenReturn(2);
        
        assertThatThrownBy(() -> registry.deregister("h1", busy))
            .isInstanceOf(HostInUseException.class)
            .satisfies(e -> assertThat(((OrchestrationException) e).getErrorCode()).isEqualTo(ErrorCode.HOST_IN_USE));
        assertThat(registry.contains("h1")).isTrue();
    }
    
    @Test
    void testDeregisterIdleHost() throws Exception {
        registry.register(host("h1", 8, 1024));
        HostUsageView idle = mock(HostUsageView.class);
        
        registry.deregister("h1", idle);
        
        assertThat(registry.find("h1")).isEmpty();
        assertThat(store.loadHosts()).isEmpty();
        assertThatThrownBy(() -> registry.get("h1")).isInstanceOf(HostNotFoundException.class);
    }
    
    @Test
    void testFailedPersistLeavesMemoryUnchanged() throws Exception {
        OrchestratorStore failing = mock(OrchestratorStore.class);
        doThrow(new RuntimeException("etcd down")).when(failing).saveHost(any());
        HostRegistry failingRegistry = new HostRegistry(new HostLockManager(), failing, clock);
        
        assertThatThrownBy(() -> failingRegistry.register(host("h1", 8, 1024)))
            .isInstanceOf(PersistenceException.class);
        assertThat(failingRegistry.listAll()).isEmpty();
    }
    
    @Test
    void testRestoreReplacesState() throws Exception {
        registry.register(host("old", 8, 1024));
        Host restored = host("h9", 4, 2048).toBuilder().state(HostState.MAINTENANCE).build();
        
        registry.restore(List.of(restored));
        
        assertThat(registry.listAll()).containsExactly(restored);
    }
}
