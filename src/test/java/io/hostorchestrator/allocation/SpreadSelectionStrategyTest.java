package io.hostorchestrator.allocation;

import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.HostAllocation;
import io.hostorchestrator.models.HostSnapshot;
import io.hostorchestrator.models.ResourceSpec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SpreadSelectionStrategyTest {
    
    private final SpreadSelectionStrategy strategy = new SpreadSelectionStrategy();
    
    @Test
    void testLeastVcpuLoadedHostWins() {
        HostSnapshot a = snapshot("A", 8, 2, 16384, 8192);
        HostSnapshot b = snapshot("B", 8, 6, 16384, 0);
        
        assertThat(strategy.selectHost(List.of(b, a))).contains(a);
    }
    
    @Test
    void testMemoryBreaksVcpuTie() {
        HostSnapshot a = snapshot("A", 8, 4, 16384, 8192);
        HostSnapshot b = snapshot("B", 8, 4, 16384, 1024);
        
        assertThat(strategy.selectHost(List.of(a, b))).contains(b);
    }
    
    @Test
    void testHostIdBreaksFullTieRegardlessOfOrder() {
        List<HostSnapshot> hosts = new ArrayList<>(List.of(
            snapshot("h3", 8, 2, 16384, 0),
            snapshot("h1", 8, 2, 16384, 0),
            snapshot("h2", 8, 2, 16384, 0)));
        
        for (int i = 0; i < 5; i++) {
            Collections.shuffle(hosts);
            assertThat(strategy.selectHost(hosts).get().getHostId()).isEqualTo("h1");
        }
    }
    
    @Test
    void testFractionsAreRelativeToHostSize() {
        // 4 of 32 vCPUs is less loaded than 2 of 8
        HostSnapshot big = snapshot("big", 32, 4, 65536, 0);
        HostSnapshot small = snapshot("small", 8, 2, 16384, 0);
        
        assertThat(strategy.selectHost(List.of(small, big))).contains(big);
    }
    
    @Test
    void testEmptyCandidates() {
        assertThat(strategy.selectHost(List.of())).isEmpty();
        assertThat(strategy.getStrategyName()).isEqualTo("Spread");
    }
    
    private HostSnapshot snapshot(String hostId, int vcpus, int usedVcpus, long memory, long usedMemory) {
        ResourceSpec capacity = ResourceSpec.of(vcpus, memory, 100);
        Host host = Host.builder().hostId(hostId).endpoint("fake://" + hostId).capacity(capacity).build();
        HostAllocation allocation = HostAllocation.empty(hostId).withAllocated(ResourceSpec.of(usedVcpus, usedMemory, 0));
        return new HostSnapshot(host, allocation, capacity);
    }
}
