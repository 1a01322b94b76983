package io.hostorchestrator.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.GetOption;
import io.hostorchestrator.config.StoreSettings;
import io.hostorchestrator.models.Host;
import io.hostorchestrator.models.HostAllocation;
import io.hostorchestrator.models.MigrationRecord;
import io.hostorchestrator.models.Placement;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static io.hostorchestrator.config.Constants.PATH_DELIMITER;

/**
 * etcd-based implementation of OrchestratorStore.
 * Records are stored as JSON documents under the configured key prefix.
 */
@Slf4j
public class EtcdOrchestratorStore implements OrchestratorStore {
    
    // TODO: Make etcd timeout configurable through StoreSettings
    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;
    
    private final Client etcdClient;
    private final KV kvClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;
    
    public EtcdOrchestratorStore(StoreSettings settings) {
        this(Client.builder().endpoints(settings.getEtcdEndpoints()).build(), settings.getKeyPrefix());
        log.info("EtcdOrchestratorStore initialized with endpoints: {} and key prefix: {}",
            String.join(",", settings.getEtcdEndpoints()), settings.getKeyPrefix());
    }
    
    private EtcdOrchestratorStore(Client etcdClient, String keyPrefix) {
        this(etcdClient, etcdClient.getKVClient(), keyPrefix);
    }
    
    /**
     * Test constructor with injected dependencies
     */
    private EtcdOrchestratorStore(Client etcdClient, KV kvClient, String keyPrefix) {
        this.etcdClient = etcdClient;
        this.kvClient = kvClient;
        this.pathResolver = new EtcdPathResolver(keyPrefix);
        
        // Initialize Jackson ObjectMapper
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
    
    /**
     * Create test instance with mocked dependencies (for testing only)
     */
    public static EtcdOrchestratorStore createTestInstance(String keyPrefix, Client etcdClient, KV kvClient) {
        return new EtcdOrchestratorStore(etcdClient, kvClient, keyPrefix);
    }
    
    public EtcdPathResolver getPathResolver() {
        return pathResolver;
    }
    
    // =================================================================
    // HOST OPERATIONS
    // =================================================================
    
    @Override
    public void saveHost(Host host) throws Exception {
        log.debug("Saving host {} to etcd", host.getHostId());
        try {
            storeObjectAsJson(pathResolver.getHostPath(host.getHostId()), host);
        } catch (Exception e) {
            log.error("Failed to save host {} to etcd: {}", host.getHostId(), e.getMessage(), e);
            throw new Exception("Failed to save host in etcd", e);
        }
    }
    
    @Override
    public void deleteHost(String hostId) throws Exception {
        log.info("Deleting host {} from etcd", hostId);
        try {
            executeEtcdDelete(pathResolver.getHostPath(hostId));
        } catch (Exception e) {
            log.error("Failed to delete host {} from etcd: {}", hostId, e.getMessage(), e);
            throw new Exception("Failed to delete host from etcd", e);
        }
    }
    
    @Override
    public List<Host> loadHosts() throws Exception {
        try {
            List<Host> hosts = getAllObjectsByPrefix(pathResolver.getHostsPrefix(), Host.class);
            log.debug("Retrieved {} hosts from etcd", hosts.size());
            return hosts;
        } catch (Exception e) {
            log.error("Failed to load hosts from etcd: {}", e.getMessage(), e);
            throw new Exception("Failed to retrieve hosts from etcd", e);
        }
    }
    
    // =================================================================
    // ALLOCATION OPERATIONS
    // =================================================================
    
    @Override
    public void saveAllocation(HostAllocation allocation) throws Exception {
        try {
            storeObjectAsJson(pathResolver.getAllocationPath(allocation.getHostId()), allocation);
        } catch (Exception e) {
            log.error("Failed to save allocation of host {} to etcd: {}", allocation.getHostId(), e.getMessage(), e);
            throw new Exception("Failed to save allocation in etcd", e);
        }
    }
    
    @Override
    public void deleteAllocation(String hostId) throws Exception {
        try {
            executeEtcdDelete(pathResolver.getAllocationPath(hostId));
        } catch (Exception e) {
            log.error("Failed to delete allocation of host {} from etcd: {}", hostId, e.getMessage(), e);
            throw new Exception("Failed to delete allocation from etcd", e);
        }
    }
    
    @Override
    public List<HostAllocation> loadAllocations() throws Exception {
        try {
            return getAllObjectsByPrefix(pathResolver.getAllocationsPrefix(), HostAllocation.class);
        } catch (Exception e) {
            log.error("Failed to load allocations from etcd: {}", e.getMessage(), e);
            throw new Exception("Failed to retrieve allocations from etcd", e);
        }
    }
    
    // =================================================================
    // PLACEMENT OPERATIONS
    // =================================================================
    
    @Override
    public void savePlacement(Placement placement) throws Exception {
        try {
            storeObjectAsJson(pathResolver.getPlacementPath(placement.getWorkloadId()), placement);
        } catch (Exception e) {
            log.error("Failed to save placement of workload {} to etcd: {}", placement.getWorkloadId(), e.getMessage(), e);
            throw new Exception("Failed to save placement in etcd", e);
        }
    }
    
    @Override
    public void deletePlacement(String workloadId) throws Exception {
        try {
            executeEtcdDelete(pathResolver.getPlacementPath(workloadId));
        } catch (Exception e) {
            log.error("Failed to delete placement of workload {} from etcd: {}", workloadId, e.getMessage(), e);
            throw new Exception("Failed to delete placement from etcd", e);
        }
    }
    
    @Override
    public List<Placement> loadPlacements() throws Exception {
        try {
            return getAllObjectsByPrefix(pathResolver.getPlacementsPrefix(), Placement.class);
        } catch (Exception e) {
            log.error("Failed to load placements from etcd: {}", e.getMessage(), e);
            throw new Exception("Failed to retrieve placements from etcd", e);
        }
    }
    
    // =================================================================
    // MIGRATION OPERATIONS
    // =================================================================
    
    @Override
    public void saveMigration(MigrationRecord record) throws Exception {
        try {
            storeObjectAsJson(pathResolver.getMigrationPath(record.getMigrationId()), record);
        } catch (Exception e) {
            log.error("Failed to save migration {} to etcd: {}", record.getMigrationId(), e.getMessage(), e);
            throw new Exception("Failed to save migration in etcd", e);
        }
    }
    
    @Override
    public void deleteMigration(String migrationId) throws Exception {
        try {
            executeEtcdDelete(pathResolver.getMigrationPath(migrationId));
        } catch (Exception e) {
            log.error("Failed to delete migration {} from etcd: {}", migrationId, e.getMessage(), e);
            throw new Exception("Failed to delete migration from etcd", e);
        }
    }
    
    @Override
    public List<MigrationRecord> loadMigrations() throws Exception {
        try {
            return getAllObjectsByPrefix(pathResolver.getMigrationsPrefix(), MigrationRecord.class);
        } catch (Exception e) {
            log.error("Failed to load migrations from etcd: {}", e.getMessage(), e);
            throw new Exception("Failed to retrieve migrations from etcd", e);
        }
    }
    
    @Override
    public void close() throws Exception {
        log.info("Closing etcd orchestrator store");
        try {
            if (etcdClient != null) {
                etcdClient.close();
                log.info("etcd client closed successfully");
            }
        } catch (Exception e) {
            log.error("Error closing etcd client: {}", e.getMessage(), e);
            throw new Exception("Failed to close etcd client", e);
        }
    }
    
    // =================================================================
    // PRIVATE HELPER METHODS FOR ETCD OPERATIONS
    // =================================================================
    
    /**
     * Executes etcd prefix query to retrieve all keys matching the given prefix
     */
    private GetResponse executeEtcdPrefixQuery(String prefix) throws Exception {
        // Add trailing slash for etcd prefix queries to ensure precise matching
        String prefixWithSlash = prefix + PATH_DELIMITER;
        ByteSequence prefixBytes = ByteSequence.from(prefixWithSlash, StandardCharsets.UTF_8);
        return kvClient.get(
            prefixBytes,
            GetOption.newBuilder().withPrefix(prefixBytes).build()
        ).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }
    
    /**
     * Executes etcd put operation for a key-value pair
     */
    private void executeEtcdPut(String key, String value) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, StandardCharsets.UTF_8);
        ByteSequence valueBytes = ByteSequence.from(value, StandardCharsets.UTF_8);
        kvClient.put(keyBytes, valueBytes).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }
    
    /**
     * Executes etcd delete operation for a key
     */
    private void executeEtcdDelete(String key) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, StandardCharsets.UTF_8);
        kvClient.delete(keyBytes).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }
    
    /**
     * Retrieves all objects of a specific type using etcd prefix query
     */
    private <T> List<T> getAllObjectsByPrefix(String prefix, Class<T> clazz) throws Exception {
        GetResponse response = executeEtcdPrefixQuery(prefix);
        List<T> items = new ArrayList<>();
        for (var kv : response.getKvs()) {
            String json = kv.getValue().toString(StandardCharsets.UTF_8);
            items.add(objectMapper.readValue(json, clazz));
        }
        return items;
    }
    
    /**
     * Stores object as JSON at the specified etcd path
     */
    private void storeObjectAsJson(String path, Object object) throws Exception {
        String json = objectMapper.writeValueAsString(object);
        executeEtcdPut(path, json);
    }
}
