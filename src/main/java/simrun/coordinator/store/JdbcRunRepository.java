package simrun.coordinator.store;

import simrun.coordinator.error.PersistenceException;
import simrun.coordinator.error.RunNotFoundException;
import simrun.coordinator.error.StaleRunException;
import simrun.coordinator.model.Run;
import simrun.coordinator.model.RunStatus;
import simrun.coordinator.model.StorageLocation;
import simrun.coordinator.repository.RunRepository;
import simrun.coordinator.storage.StorageLocations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of RunRepository.
 * Uses an optimistic version column so that each update is a single guarded row write.
 */
public class JdbcRunRepository implements RunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunRepository.class);

    private final Database db;

    public JdbcRunRepository(Database db) {
        this.db = db;
    }

    @Override
    public Run insert(Run run) {
        String sql = """
                    INSERT INTO runs (id, job_id, status, results_location, results_published_at,
                                      external_job_handle, status_detail, created_at, updated_at, version)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, 0)
                """;

        Instant now = Instant.now();
        Instant createdAt = run.createdAt() != null ? run.createdAt() : now;
        Instant updatedAt = run.updatedAt() != null ? run.updatedAt() : createdAt;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, run.id());
            ps.setLong(2, run.jobId());
            ps.setString(3, run.status().name());
            ps.setString(4, handleOf(run.resultsLocation()));
            setTimestamp(ps, 5, run.resultsPublishedAt());
            ps.setString(6, run.externalJobHandle());
            ps.setString(7, run.statusDetail());
            setTimestamp(ps, 8, createdAt);
            setTimestamp(ps, 9, updatedAt);

            ps.executeUpdate();
            conn.commit();

            log.debug("Inserted run {} for job {}", run.id(), run.jobId());
        } catch (SQLException e) {
            throw new PersistenceException("Failed to insert run: " + run.id(), e);
        }

        return run.toBuilder()
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .version(0)
                .build();
    }

    @Override
    public Optional<Run> findById(long runId) {
        String sql = "SELECT * FROM runs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find run: " + runId, e);
        }
    }

    @Override
    public Optional<Run> find(long jobId, long runId) {
        return findById(runId).filter(run -> run.jobId() == jobId);
    }

    @Override
    public List<Run> findByJobId(long jobId) {
        String sql = "SELECT * FROM runs WHERE job_id = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, jobId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find runs for job: " + jobId, e);
        }
    }

    @Override
    public List<Run> findActiveWithHandle(int limit) {
        String sql = """
                    SELECT * FROM runs
                    WHERE status NOT IN ('DONE', 'FAILED', 'CANCELLED')
                      AND external_job_handle IS NOT NULL
                    ORDER BY last_polled_at NULLS FIRST, updated_at, id
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find active runs", e);
        }
    }

    @Override
    public void markPolled(Collection<Long> runIds, Instant at) {
        if (runIds.isEmpty()) {
            return;
        }
        String sql = "UPDATE runs SET last_polled_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (Long runId : runIds) {
                setTimestamp(ps, 1, at);
                ps.setLong(2, runId);
                ps.addBatch();
            }
            ps.executeBatch();
            conn.commit();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to mark " + runIds.size() + " runs as polled", e);
        }
    }

    @Override
    public Run save(Run run) {
        String sql = """
                    UPDATE runs
                    SET status = ?, results_location = ?, results_published_at = ?,
                        external_job_handle = ?, status_detail = ?, updated_at = ?,
                        version = version + 1
                    WHERE id = ? AND job_id = ? AND version = ?
                """;

        Instant updatedAt = run.updatedAt() != null ? run.updatedAt() : Instant.now();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, run.status().name());
            ps.setString(2, handleOf(run.resultsLocation()));
            setTimestamp(ps, 3, run.resultsPublishedAt());
            ps.setString(4, run.externalJobHandle());
            ps.setString(5, run.statusDetail());
            setTimestamp(ps, 6, updatedAt);
            ps.setLong(7, run.id());
            ps.setLong(8, run.jobId());
            ps.setLong(9, run.version());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                if (find(run.jobId(), run.id()).isEmpty()) {
                    throw new RunNotFoundException(run.jobId(), run.id());
                }
                throw new StaleRunException(run.id(), run.version());
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save run: " + run.id(), e);
        }

        log.debug("Saved run {} as {} (version {})", run.id(), run.status(), run.version() + 1);
        return run.toBuilder()
                .updatedAt(updatedAt)
                .version(run.version() + 1)
                .build();
    }

    @Override
    public long nextId() {
        return db.nextValue("run_ids");
    }

    // --- Helpers ---

    private List<Run> executeQuery(PreparedStatement ps) throws SQLException {
        List<Run> runs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                runs.add(mapRow(rs));
            }
        }
        return runs;
    }

    private Run mapRow(ResultSet rs) throws SQLException {
        String location = rs.getString("results_location");
        return Run.restore(
                rs.getLong("id"),
                rs.getLong("job_id"),
                RunStatus.valueOf(rs.getString("status")),
                location != null ? StorageLocations.parse(location) : null,
                toInstant(rs.getTimestamp("results_published_at")),
                rs.getString("external_job_handle"),
                rs.getString("status_detail"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")),
                rs.getLong("version"));
    }

    private static String handleOf(StorageLocation location) {
        return location != null ? location.handle() : null;
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, java.sql.Types.TIMESTAMP);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
