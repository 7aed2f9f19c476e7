package simrun.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import simrun.coordinator.config.CoordinatorConfig;
import simrun.coordinator.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("simrun-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * True when a pooled connection answers within two seconds.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id              BIGINT PRIMARY KEY,
                            owner_id        BIGINT NOT NULL,
                            created_at      TIMESTAMP NOT NULL
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_tags (
                            job_id          BIGINT NOT NULL REFERENCES jobs(id) ON DELETE CASCADE,
                            tag             VARCHAR(256) NOT NULL,
                            PRIMARY KEY (job_id, tag)
                        );
                    """);

            // ---------- RUNS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS runs (
                            id                   BIGINT PRIMARY KEY,
                            job_id               BIGINT NOT NULL REFERENCES jobs(id),
                            status               VARCHAR(20) NOT NULL,
                            results_location     VARCHAR(2048),
                            results_published_at TIMESTAMP,
                            external_job_handle  VARCHAR(256),
                            status_detail        VARCHAR(2048),
                            created_at           TIMESTAMP NOT NULL,
                            updated_at           TIMESTAMP NOT NULL,
                            version              BIGINT NOT NULL DEFAULT 0,
                            last_polled_at       TIMESTAMP,
                            CONSTRAINT chk_runs_location_done
                                CHECK (results_location IS NULL OR status = 'DONE')
                        );
                    """);

            // ---------- ORPHANS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS orphans (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            location        VARCHAR(2048) NOT NULL,
                            job_id          BIGINT NOT NULL,
                            run_id          BIGINT NOT NULL,
                            created_at      TIMESTAMP NOT NULL,
                            reason          VARCHAR(2048)
                        );
                    """);

            st.addBatch("CREATE SEQUENCE IF NOT EXISTS job_ids START WITH 1;");
            st.addBatch("CREATE SEQUENCE IF NOT EXISTS run_ids START WITH 1;");

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_job ON runs(job_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_status ON runs(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_polled ON runs(last_polled_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_orphans_run ON orphans(job_id, run_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new PersistenceException("Failed to initialize database schema", e);
        }
    }

    /**
     * Next value of a schema sequence.
     */
    long nextValue(String sequence) {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {
            try (var rs = st.executeQuery("SELECT NEXT VALUE FOR " + sequence)) {
                rs.next();
                long value = rs.getLong(1);
                conn.commit();
                return value;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to allocate id from " + sequence, e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
