package simrun.coordinator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;

/**
 * Configuration holder for the run coordinator.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/simrun;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Object storage settings
    private Path storageRoot = Path.of("./data/objects");
    private String resultsBucket = "simrun-results";
    private Duration uploadTimeout = Duration.ofMinutes(2);
    private Duration downloadUrlTtl = Duration.ofHours(1);
    private Path scratchDirectory = Path.of(System.getProperty("java.io.tmpdir"));

    // Compute service settings
    private String computeEndpoint = "http://localhost:9000";
    private String computeJobQueue = "simrun-queue";
    private String computeJobDefinition = "simrun-runner";
    private Duration statusQueryTimeout = Duration.ofSeconds(10);

    // Status sync settings
    private int syncMaxAttempts = 3;
    private Duration syncInitialBackoff = Duration.ofMillis(500);
    private double syncBackoffMultiplier = 2.0;
    private Duration syncMaxBackoff = Duration.ofSeconds(10);
    private Duration refreshInterval = Duration.ofSeconds(30);
    private int refreshPoolSize = 4;
    private int refreshBatchSize = 500;

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        String dbUrl = System.getenv("SIMRUN_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String storageRoot = System.getenv("SIMRUN_STORAGE_ROOT");
        if (storageRoot != null && !storageRoot.isBlank()) {
            config.storageRoot = Path.of(storageRoot);
        }

        String bucket = System.getenv("SIMRUN_RESULTS_BUCKET");
        if (bucket != null && !bucket.isBlank()) {
            config.resultsBucket = bucket;
        }

        String endpoint = System.getenv("SIMRUN_COMPUTE_ENDPOINT");
        if (endpoint != null && !endpoint.isBlank()) {
            config.computeEndpoint = endpoint;
        }

        String maxAttempts = System.getenv("SIMRUN_SYNC_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.syncMaxAttempts = Integer.parseInt(maxAttempts);
        }

        String refreshSeconds = System.getenv("SIMRUN_REFRESH_INTERVAL_SECONDS");
        if (refreshSeconds != null && !refreshSeconds.isBlank()) {
            config.refreshInterval = Duration.ofSeconds(Long.parseLong(refreshSeconds));
        }

        return config;
    }

    /**
     * Load settings from an INI file. Missing sections or keys keep their defaults.
     * <pre>
     * [database]  url, pool_size
     * [storage]   root, bucket, upload_timeout_seconds, download_url_ttl_seconds, scratch_dir
     * [compute]   endpoint, job_queue, job_definition, status_timeout_seconds
     * [sync]      max_attempts, initial_backoff_ms, backoff_multiplier, max_backoff_ms,
     *             refresh_interval_seconds, pool_size, batch_size
     * </pre>
     */
    public static CoordinatorConfig fromIni(Path file) throws IOException {
        Ini ini = new Ini(file.toFile());
        CoordinatorConfig config = new CoordinatorConfig();

        Profile.Section db = ini.get("database");
        config.databaseUrl = opt(db, "url", config.databaseUrl, Function.identity());
        config.databasePoolSize = opt(db, "pool_size", config.databasePoolSize, Integer::parseInt);

        Profile.Section storage = ini.get("storage");
        config.storageRoot = opt(storage, "root", config.storageRoot, Path::of);
        config.resultsBucket = opt(storage, "bucket", config.resultsBucket, Function.identity());
        config.uploadTimeout = opt(storage, "upload_timeout_seconds", config.uploadTimeout, CoordinatorConfig::seconds);
        config.downloadUrlTtl = opt(storage, "download_url_ttl_seconds", config.downloadUrlTtl, CoordinatorConfig::seconds);
        config.scratchDirectory = opt(storage, "scratch_dir", config.scratchDirectory, Path::of);

        Profile.Section compute = ini.get("compute");
        config.computeEndpoint = opt(compute, "endpoint", config.computeEndpoint, Function.identity());
        config.computeJobQueue = opt(compute, "job_queue", config.computeJobQueue, Function.identity());
        config.computeJobDefinition = opt(compute, "job_definition", config.computeJobDefinition, Function.identity());
        config.statusQueryTimeout = opt(compute, "status_timeout_seconds", config.statusQueryTimeout, CoordinatorConfig::seconds);

        Profile.Section sync = ini.get("sync");
        config.syncMaxAttempts = opt(sync, "max_attempts", config.syncMaxAttempts, Integer::parseInt);
        config.syncInitialBackoff = opt(sync, "initial_backoff_ms", config.syncInitialBackoff, CoordinatorConfig::millis);
        config.syncBackoffMultiplier = opt(sync, "backoff_multiplier", config.syncBackoffMultiplier, Double::parseDouble);
        config.syncMaxBackoff = opt(sync, "max_backoff_ms", config.syncMaxBackoff, CoordinatorConfig::millis);
        config.refreshInterval = opt(sync, "refresh_interval_seconds", config.refreshInterval, CoordinatorConfig::seconds);
        config.refreshPoolSize = opt(sync, "pool_size", config.refreshPoolSize, Integer::parseInt);
        config.refreshBatchSize = opt(sync, "batch_size", config.refreshBatchSize, Integer::parseInt);

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Path storageRoot() {
        return storageRoot;
    }

    public String resultsBucket() {
        return resultsBucket;
    }

    public Duration uploadTimeout() {
        return uploadTimeout;
    }

    public Duration downloadUrlTtl() {
        return downloadUrlTtl;
    }

    public Path scratchDirectory() {
        return scratchDirectory;
    }

    public String computeEndpoint() {
        return computeEndpoint;
    }

    public String computeJobQueue() {
        return computeJobQueue;
    }

    public String computeJobDefinition() {
        return computeJobDefinition;
    }

    public Duration statusQueryTimeout() {
        return statusQueryTimeout;
    }

    public int syncMaxAttempts() {
        return syncMaxAttempts;
    }

    public Duration syncInitialBackoff() {
        return syncInitialBackoff;
    }

    public double syncBackoffMultiplier() {
        return syncBackoffMultiplier;
    }

    public Duration syncMaxBackoff() {
        return syncMaxBackoff;
    }

    public Duration refreshInterval() {
        return refreshInterval;
    }

    public int refreshPoolSize() {
        return refreshPoolSize;
    }

    public int refreshBatchSize() {
        return refreshBatchSize;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withStorageRoot(Path root) {
        this.storageRoot = root;
        return this;
    }

    public CoordinatorConfig withResultsBucket(String bucket) {
        this.resultsBucket = bucket;
        return this;
    }

    public CoordinatorConfig withUploadTimeout(Duration timeout) {
        this.uploadTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withScratchDirectory(Path dir) {
        this.scratchDirectory = dir;
        return this;
    }

    public CoordinatorConfig withComputeEndpoint(String endpoint) {
        this.computeEndpoint = endpoint;
        return this;
    }

    public CoordinatorConfig withStatusQueryTimeout(Duration timeout) {
        this.statusQueryTimeout = timeout;
        return this;
    }

    public CoordinatorConfig withSyncMaxAttempts(int attempts) {
        this.syncMaxAttempts = attempts;
        return this;
    }

    public CoordinatorConfig withSyncInitialBackoff(Duration backoff) {
        this.syncInitialBackoff = backoff;
        return this;
    }

    public CoordinatorConfig withSyncMaxBackoff(Duration backoff) {
        this.syncMaxBackoff = backoff;
        return this;
    }

    public CoordinatorConfig withDownloadUrlTtl(Duration ttl) {
        this.downloadUrlTtl = ttl;
        return this;
    }

    public CoordinatorConfig withRefreshInterval(Duration interval) {
        this.refreshInterval = interval;
        return this;
    }

    public CoordinatorConfig withRefreshPoolSize(int poolSize) {
        this.refreshPoolSize = poolSize;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", storageRoot=" + storageRoot +
                ", resultsBucket='" + resultsBucket + '\'' +
                ", computeEndpoint='" + computeEndpoint + '\'' +
                ", syncMaxAttempts=" + syncMaxAttempts +
                ", refreshInterval=" + refreshInterval +
                '}';
    }

    // ===== helpers =====
    private static <T> T opt(Profile.Section s, String key, T def, Function<String, T> parse) {
        String v = s == null ? null : s.get(key);
        return (v == null || v.isBlank()) ? def : parse.apply(v.trim());
    }

    private static Duration seconds(String v) {
        return Duration.ofSeconds(Long.parseLong(v));
    }

    private static Duration millis(String v) {
        return Duration.ofMillis(Long.parseLong(v));
    }
}
