package io.hostorchestrator.store;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.DeleteResponse;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.PutResponse;
import io.etcd.jetcd.options.GetOption;
import io.hostorchestrator.enums.ErrorCode;
import io.hostorchestrator.enums.HostState;
import io.hostorchestrator.enums.MigrationMode;
import io.hostorchestrator.enums.MigrationState;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.MigrationRecord;
import io.hostorchestrator.models.ResourceSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for EtcdOrchestratorStore against a mocked KV client.
 */
public class EtcdOrchestratorStoreTest {

    private static final String PREFIX = "test-orchestrator";

    private Client mockEtcdClient;
    private KV mockKv;
    private EtcdOrchestratorStore store;

    @BeforeEach
    public void setUp() {
        mockEtcdClient = mock(Client.class);
        mockKv = mock(KV.class);
        when(mockEtcdClient.getKVClient()).thenReturn(mockKv);
        store = EtcdOrchestratorStore.createTestInstance(PREFIX, mockEtcdClient, mockKv);
    }

    // ------------------------- helpers -------------------------

    private static ByteSequence bytes(String value) {
        return ByteSequence.from(value, UTF_8);
    }

    private void stubPut() {
        when(mockKv.put(any(ByteSequence.class), any(ByteSequence.class)))
            .thenReturn(CompletableFuture.completedFuture(mock(PutResponse.class)));
    }

    private void stubGet(String prefix, String... jsonValues) {
        List<KeyValue> kvs = new ArrayList<>();
        for (String json : jsonValues) {
            KeyValue kv = mock(KeyValue.class);
            when(kv.getValue()).thenReturn(bytes(json));
            kvs.add(kv);
        }
        GetResponse response = mock(GetResponse.class);
        when(response.getKvs()).thenReturn(kvs);
        when(mockKv.get(eq(bytes(prefix + "/")), any(GetOption.class)))
            .thenReturn(CompletableFuture.completedFuture(response));
    }

    private String capturePut(String expectedKey) {
        ArgumentCaptor<ByteSequence> value = ArgumentCaptor.forClass(ByteSequence.class);
        verify(mockKv).put(eq(bytes(expectedKey)), value.capture());
        return value.getValue().toString(UTF_8);
    }

    private static Host sampleHost() {
        return Host.builder()
            .hostId("h1")
            .endpoint("qemu+ssh://h1/system")
            .name("rack1-h1")
            .labels(Map.of("zone", "a"))
            .capacity(ResourceSpec.of(32, 131072, 2000))
            .state(HostState.DRAINING)
            .registeredAt(Instant.parse("2024-05-01T10:00:00Z"))
            .build();
    }

    // ------------------------- hosts -------------------------

    @Test
    public void testSaveHostWritesSnakeCaseJson() throws Exception {
        stubPut();

        store.saveHost(sampleHost());

        String json = capturePut("/test-orchestrator/hosts/h1");
        assertThat(json).contains("\"host_id\":\"h1\"")
            .contains("\"memory_mib\":131072")
            .contains("\"registered_at\":\"2024-05-01T10:00:00Z\"");
    }

    @Test
    public void testSavedHostLoadsBack() throws Exception {
        stubPut();
        store.saveHost(sampleHost());
        stubGet("/test-orchestrator/hosts", capturePut("/test-orchestrator/hosts/h1"));

        List<Host> hosts = store.loadHosts();

        assertThat(hosts).containsExactly(sampleHost());
    }

    @Test
    public void testLoadIgnoresUnknownFields() throws Exception {
        stubGet("/test-orchestrator/hosts",
            "{\"host_id\":\"h2\",\"endpoint\":\"fake://h2\",\"state\":\"MAINTENANCE\",\"rack\":\"r7\"}");

        List<Host> hosts = store.loadHosts();

        assertThat(hosts).hasSize(1);
        assertThat(hosts.get(0).getHostId()).isEqualTo("h2");
        assertThat(hosts.get(0).getState()).isEqualTo(HostState.MAINTENANCE);
    }

    @Test
    public void testSaveHostFailure() {
        when(mockKv.put(any(ByteSequence.class), any(ByteSequence.class)))
            .thenReturn(CompletableFuture.failedFuture(new RuntimeException("etcd unavailable")));

        assertThatThrownBy(() -> store.saveHost(sampleHost()))
            .hasMessage("Failed to save host in etcd")
            .hasRootCauseMessage("etcd unavailable");
    }

    @Test
    public void testDeleteHost() throws Exception {
        when(mockKv.delete(any(ByteSequence.class)))
            .thenReturn(CompletableFuture.completedFuture(mock(DeleteResponse.class)));

        store.deleteHost("h1");

        verify(mockKv).delete(bytes("/test-orchestrator/hosts/h1"));
    }

    @Test
    public void testLoadHostsFailure() {
        when(mockKv.get(any(ByteSequence.class), any(GetOption.class)))
            .thenReturn(CompletableFuture.failedFuture(new RuntimeException("timeout")));

        assertThatThrownBy(() -> store.loadHosts())
            .hasMessage("Failed to retrieve hosts from etcd");
    }

    // ------------------------- migrations -------------------------

    @Test
    public void testMigrationRecordLoadsBack() throws Exception {
        stubPut();
        MigrationRecord record = new MigrationRecord();
        record.setMigrationId("m-1");
        record.setWorkloadId("vm-1");
        record.setSourceHostId("h1");
        record.setTargetHostId("h2");
        record.setMode(MigrationMode.LIVE);
        record.setState(MigrationState.FAILED);
        record.setFailureCode(ErrorCode.AMBIGUOUS_STATE);
        record.setReservationId("r-1");
        record.getTransitions().put(MigrationState.CUTOVER, Instant.parse("2024-05-01T10:00:05Z"));
        record.setCreatedAt(Instant.parse("2024-05-01T10:00:00Z"));
        store.saveMigration(record);

        stubGet("/test-orchestrator/migrations", capturePut("/test-orchestrator/migrations/m-1"));
        MigrationRecord loaded = store.loadMigrations().get(0);

        assertThat(loaded).isEqualTo(record);
    }

    @Test
    public void testDeleteMigration() throws Exception {
        when(mockKv.delete(any(ByteSequence.class)))
            .thenReturn(CompletableFuture.completedFuture(mock(DeleteResponse.class)));

        store.deleteMigration("m-1");

        verify(mockKv).delete(bytes("/test-orchestrator/migrations/m-1"));
    }

    @Test
    public void testEmptyPrefixLoadsNothing() throws Exception {
        stubGet("/test-orchestrator/placements");

        assertThat(store.loadPlacements()).isEmpty();
    }

    @Test
    public void testCloseClosesClient() throws Exception {
        store.close();

        verify(mockEtcdClient).close();
    }
}
