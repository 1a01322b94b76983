package io.hostorchestrator;

import io.hostorchestrator.allocation.PlacementDecisionEngine;
import io.hostorchestrator.allocation.PlacementScheduler;
import io.hostorchestrator.allocation.SpreadSelectionStrategy;
import io.hostorchestrator.capacity.CapacityTracker;
import io.hostorchestrator.config.OrchestratorConfig;
import io.hostorchestrator.config.StoreSettings;
import io.hostorchestrator.driver.HypervisorDriver;
import io.hostorchestrator.driver.fake.FakeHypervisorDriver;
import io.hostorchestrator.events.EventPublisher;
import io.hostorchestrator.events.LoggingEventSink;
import io.hostorchestrator.maintenance.MaintenanceController;
import io.hostorchestrator.metrics.MetricsProvider;
import io.hostorchestrator.migration.MigrationCoordinator;
import io.hostorchestrator.pool.ConnectionPoolManager;
import io.hostorchestrator.pool.PoolHealthMonitor;
import io.hostorchestrator.registry.HostLockManager;
import io.hostorchestrator.registry.HostRegistry;
import io.hostorchestrator.store.EtcdOrchestratorStore;
import io.hostorchestrator.store.InMemoryOrchestratorStore;
import io.hostorchestrator.store.OrchestratorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

import static io.hostorchestrator.config.Constants.DRIVER_TYPE_FAKE;
import static io.hostorchestrator.config.Constants.STORE_TYPE_ETCD;
import static io.hostorchestrator.config.Constants.STORE_TYPE_MEMORY;

/**
 * Main Spring Boot application class for the Host Orchestrator.
 *
 * Wires the orchestration core (registry, capacity tracker, connection pools, scheduler,
 * migration coordinator, maintenance controller) as plain objects and exposes it through
 * the REST handlers.
 */
@Slf4j
@SpringBootApplication
public class HostOrchestratorApplication {

    public static void main(String[] args) {
        log.info("Starting Host Orchestrator Application");

        try {
            SpringApplication.run(HostOrchestratorApplication.class, args);
            log.info("Host Orchestrator started successfully");

        } catch (Exception e) {
            log.error("Failed to start Host Orchestrator: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public OrchestratorConfig config() {
        OrchestratorConfig config = new OrchestratorConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Record store selected by {@code store.type}.
     */
    @Bean(destroyMethod = "close")
    public OrchestratorStore orchestratorStore(OrchestratorConfig config) {
        StoreSettings settings = config.getStoreSettings();
        switch (settings.getType()) {
            case STORE_TYPE_MEMORY:
                log.info("Using in-memory orchestrator store");
                return new InMemoryOrchestratorStore();
            case STORE_TYPE_ETCD:
                log.info("Initializing etcd orchestrator store at {}", String.join(", ", settings.getEtcdEndpoints()));
                try {
                    return new EtcdOrchestratorStore(settings);
                } catch (Exception e) {
                    log.error("Failed to initialize etcd store: {}", e.getMessage(), e);
                    throw new RuntimeException("Orchestrator store initialization failed", e);
                }
            default:
                throw new IllegalStateException("Unknown store type: " + settings.getType());
        }
    }

    /**
     * Hypervisor driver selected by {@code driver.type}.
     */
    @Bean
    public HypervisorDriver hypervisorDriver(OrchestratorConfig config) {
        if (DRIVER_TYPE_FAKE.equals(config.getDriverType())) {
            log.info("Using simulated hypervisor driver");
            return new FakeHypervisorDriver();
        }
        throw new IllegalStateException("Unsupported driver type: " + config.getDriverType());
    }

    @Bean
    public EventPublisher eventPublisher(Clock clock) {
        return new EventPublisher(new LoggingEventSink(clock));
    }

    @Bean
    public HostRegistry hostRegistry(OrchestratorStore store, Clock clock) {
        log.info("Initializing HostRegistry");
        return new HostRegistry(new HostLockManager(), store, clock);
    }

    @Bean
    public CapacityTracker capacityTracker(HostRegistry registry, OrchestratorStore store, OrchestratorConfig config,
                                           Clock clock) {
        log.info("Initializing CapacityTracker");
        return new CapacityTracker(registry, store, config.getSchedulerSettings(), clock);
    }

    @Bean
    public ConnectionPoolManager connectionPoolManager(HostRegistry registry, HypervisorDriver driver,
                                                       OrchestratorConfig config, Clock clock,
                                                       EventPublisher eventPublisher, MetricsProvider metricsProvider) {
        log.info("Initializing ConnectionPoolManager");
        return new ConnectionPoolManager(registry, driver, config.getPoolSettings(), clock, eventPublisher, metricsProvider);
    }

    /**
     * Background pool health policy, started with the context.
     */
    @Bean(destroyMethod = "stop")
    public PoolHealthMonitor poolHealthMonitor(ConnectionPoolManager poolManager, OrchestratorConfig config) {
        PoolHealthMonitor monitor = new PoolHealthMonitor(poolManager, config.getPoolSettings().getHealthCheckInterval());
        monitor.start();
        return monitor;
    }

    @Bean
    public PlacementScheduler placementScheduler(HostRegistry registry, CapacityTracker capacityTracker,
                                                 ConnectionPoolManager poolManager, MetricsProvider metricsProvider) {
        log.info("Initializing PlacementScheduler with spread selection");
        return new PlacementScheduler(registry, capacityTracker, PlacementDecisionEngine.withAllDeciders(poolManager),
            new SpreadSelectionStrategy(), metricsProvider);
    }

    @Bean
    public MigrationCoordinator migrationCoordinator(HostRegistry registry, CapacityTracker capacityTracker,
                                                     PlacementScheduler scheduler, ConnectionPoolManager poolManager,
                                                     HypervisorDriver driver, OrchestratorStore store,
                                                     EventPublisher eventPublisher, OrchestratorConfig config,
                                                     Clock clock, MetricsProvider metricsProvider) {
        log.info("Initializing MigrationCoordinator");
        return new MigrationCoordinator(registry, capacityTracker, scheduler, poolManager, driver, store, eventPublisher,
            config.getMigrationSettings(), clock, metricsProvider);
    }

    @Bean
    public MaintenanceController maintenanceController(HostRegistry registry, CapacityTracker capacityTracker,
                                                       MigrationCoordinator migrationCoordinator,
                                                       EventPublisher eventPublisher, OrchestratorConfig config) {
        log.info("Initializing MaintenanceController");
        return new MaintenanceController(registry, capacityTracker, migrationCoordinator, eventPublisher,
            config.getMaintenanceSettings());
    }

    /**
     * Engine facade. Persisted state is reloaded before the REST surface starts serving.
     */
    @Bean(destroyMethod = "shutdown")
    public HostOrchestrationEngine hostOrchestrationEngine(HostRegistry registry, CapacityTracker capacityTracker,
                                                           ConnectionPoolManager poolManager, PlacementScheduler scheduler,
                                                           MigrationCoordinator migrationCoordinator,
                                                           MaintenanceController maintenanceController,
                                                           HypervisorDriver driver, OrchestratorStore store) {
        HostOrchestrationEngine engine = new HostOrchestrationEngine(registry, capacityTracker, poolManager, scheduler,
            migrationCoordinator, maintenanceController, driver, store);
        try {
            engine.recover();
        } catch (Exception e) {
            log.error("Failed to recover orchestrator state: {}", e.getMessage(), e);
            throw new RuntimeException("Orchestrator state recovery failed", e);
        }
        return engine;
    }
}
