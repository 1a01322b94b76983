package io.hostorchestrator.store;

import io.hostorchestrator.enums.MigrationMode;
import io.hostorchestrator.enums.MigrationState;
import io.hostorchestrator.models.HostAllocation;
import io.hostorchestrator.models.MigrationRecord;
import io.hostorchestrator.models.Placement;
import io.hostorchestrator.models.ResourceSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static io.hostorchestrator.support.TestHosts.host;
import static org.assertj.core.api.Assertions.assertThat;

class InMemoryOrchestratorStoreTest {

    private InMemoryOrchestratorStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryOrchestratorStore();
    }

    @Test
    void testHostsLoadedSortedById() {
        store.saveHost(host("h2", 4, 4096));
        store.saveHost(host("h1", 4, 4096));
        store.saveHost(host("h1", 8, 8192));

        assertThat(store.loadHosts()).extracting(h -> h.getHostId()).containsExactly("h1", "h2");
        assertThat(store.loadHosts().get(0).getCapacity().getVcpus()).isEqualTo(8);

        store.deleteHost("h1");
        assertThat(store.loadHosts()).extracting(h -> h.getHostId()).containsExactly("h2");
    }

    @Test
    void testAllocationsAndPlacements() {
        store.saveAllocation(HostAllocation.empty("h1").withAllocated(ResourceSpec.of(2, 2048, 20)));
        store.savePlacement(Placement.builder().workloadId("vm-1").hostId("h1")
            .resources(ResourceSpec.of(2, 2048, 20)).placedAt(Instant.now()).build());

        assertThat(store.loadAllocations()).hasSize(1);
        assertThat(store.loadPlacements()).extracting(Placement::getHostId).containsExactly("h1");

        store.deleteAllocation("h1");
        store.deletePlacement("vm-1");
        assertThat(store.loadAllocations()).isEmpty();
        assertThat(store.loadPlacements()).isEmpty();
    }

    @Test
    void testMigrationRecordsAreCopied() {
        MigrationRecord record = new MigrationRecord();
        record.setMigrationId("m-1");
        record.setWorkloadId("vm-1");
        record.setMode(MigrationMode.LIVE);
        record.setState(MigrationState.PENDING);
        record.setCreatedAt(Instant.parse("2024-05-01T10:00:00Z"));
        store.saveMigration(record);

        record.setState(MigrationState.COMPLETED);
        MigrationRecord loaded = store.loadMigrations().get(0);
        assertThat(loaded.getState()).isEqualTo(MigrationState.PENDING);

        loaded.setState(MigrationState.FAILED);
        assertThat(store.loadMigrations().get(0).getState()).isEqualTo(MigrationState.PENDING);

        store.deleteMigration("m-1");
        assertThat(store.loadMigrations()).isEmpty();
    }
}
