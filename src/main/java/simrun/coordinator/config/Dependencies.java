package simrun.coordinator.config;

import simrun.coordinator.compute.BatchComputeClient;
import simrun.coordinator.compute.HttpBatchComputeClient;
import simrun.coordinator.events.LoggingRunEventListener;
import simrun.coordinator.events.RunEventBus;
import simrun.coordinator.packaging.ResultsPackager;
import simrun.coordinator.packaging.ZipResultsPackager;
import simrun.coordinator.repository.JobRepository;
import simrun.coordinator.repository.OrphanRepository;
import simrun.coordinator.repository.RunRepository;
import simrun.coordinator.scheduler.Scheduler;
import simrun.coordinator.scheduler.StatusRefreshTask;
import simrun.coordinator.service.ResultsPublisher;
import simrun.coordinator.service.RunLifecycleService;
import simrun.coordinator.service.RunStatusSynchronizer;
import simrun.coordinator.storage.FileSystemObjectStorage;
import simrun.coordinator.storage.ObjectStorageProvider;
import simrun.coordinator.storage.ResultsStoreGateway;
import simrun.coordinator.store.Database;
import simrun.coordinator.store.JdbcJobRepository;
import simrun.coordinator.store.JdbcOrphanRepository;
import simrun.coordinator.store.JdbcRunRepository;
import simrun.coordinator.util.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.startScheduler(); // periodic status refresh
 * deps.resultsPublisher().publishResults(jobId, runId, dir);
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final JobRepository jobRepository;
    private final RunRepository runRepository;
    private final OrphanRepository orphanRepository;
    private final RunEventBus eventBus;
    private final ResultsStoreGateway storeGateway;
    private final ResultsPackager packager;
    private final BatchComputeClient computeClient;
    private final RunStatusSynchronizer synchronizer;
    private final ResultsPublisher resultsPublisher;
    private final RunLifecycleService lifecycleService;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(CoordinatorConfig config, ObjectStorageProvider storageProvider,
            BatchComputeClient computeClient) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.eventBus = new RunEventBus().subscribe(new LoggingRunEventListener());

        // Repositories
        this.jobRepository = new JdbcJobRepository(database);
        this.runRepository = new JdbcRunRepository(database);
        this.orphanRepository = new JdbcOrphanRepository(database);

        // External systems
        this.storeGateway = new ResultsStoreGateway(storageProvider, config.uploadTimeout());
        this.packager = new ZipResultsPackager(config.scratchDirectory());
        this.computeClient = computeClient;

        // Services
        this.synchronizer = new RunStatusSynchronizer(computeClient, runRepository, RetryPolicy.from(config),
                eventBus, config.refreshPoolSize());
        this.resultsPublisher = new ResultsPublisher(runRepository, jobRepository, orphanRepository, packager,
                storeGateway, eventBus, config.downloadUrlTtl());
        this.lifecycleService = new RunLifecycleService(jobRepository, runRepository, computeClient, eventBus);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, using the file-system object store
     * and the HTTP compute client.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return create(config,
                new FileSystemObjectStorage(config.storageRoot(), config.resultsBucket()),
                new HttpBatchComputeClient(config));
    }

    /**
     * Create dependencies with explicit adapters for the external systems.
     */
    public static Dependencies create(CoordinatorConfig config, ObjectStorageProvider storageProvider,
            BatchComputeClient computeClient) {
        return new Dependencies(config, storageProvider, computeClient);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public RunRepository runRepository() {
        return runRepository;
    }

    public OrphanRepository orphanRepository() {
        return orphanRepository;
    }

    public RunEventBus eventBus() {
        return eventBus;
    }

    public RunStatusSynchronizer synchronizer() {
        return synchronizer;
    }

    public ResultsPublisher resultsPublisher() {
        return resultsPublisher;
    }

    public RunLifecycleService lifecycleService() {
        return lifecycleService;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            StatusRefreshTask task = new StatusRefreshTask(runRepository, synchronizer, config.refreshBatchSize());
            scheduler = new Scheduler(task, config.refreshInterval());
        }
        return scheduler;
    }

    /**
     * Start periodic status refresh.
     */
    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        synchronizer.close();
        storeGateway.close();
        eventBus.close();

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
