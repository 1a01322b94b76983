package io.hostorchestrator.allocation.deciders;

import io.hostorchestrator.enums.Decision;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.HostAllocation;
import io.hostorchestrator.models.HostSnapshot;
import io.hostorchestrator.models.PlacementRequest;
import io.hostorchestrator.models.ResourceSpec;
import io.hostorchestrator.pool.HostHealthView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class PoolHealthDeciderTest {
    
    @Mock
    private HostHealthView healthView;
    
    private PoolHealthDecider decider;
    private HostSnapshot snapshot;
    private PlacementRequest request;
    
    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        decider = new PoolHealthDecider(healthView);
        ResourceSpec capacity = ResourceSpec.of(4, 4096, 100);
        snapshot = new HostSnapshot(Host.builder().hostId("h1").endpoint("fake://h1").capacity(capacity).build(),
            HostAllocation.empty("h1"), capacity);
        request = PlacementRequest.builder().workloadId("vm-1").resources(ResourceSpec.of(1, 1, 1)).build();
    }
    
    @Test
    void testHealthyHostAccepted() {
        when(healthView.isHealthy("h1")).thenReturn(true);
        assertThat(decider.canAllocate(request, snapshot)).isEqualTo(Decision.YES);
    }
    
    @Test
    void testUnhealthyHostRejected() {
        when(healthView.isHealthy("h1")).thenReturn(false);
        assertThat(decider.canAllocate(request, snapshot)).isEqualTo(Decision.NO);
        assertThat(decider.getName()).isEqualTo("PoolHealthDecider");
    }
}
