package simrun.coordinator.store;

import simrun.coordinator.error.PersistenceException;
import simrun.coordinator.model.OrphanRecord;
import simrun.coordinator.repository.OrphanRepository;
import simrun.coordinator.storage.StorageLocations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of OrphanRepository.
 */
public class JdbcOrphanRepository implements OrphanRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcOrphanRepository.class);

    private final Database db;

    public JdbcOrphanRepository(Database db) {
        this.db = db;
    }

    @Override
    public void record(OrphanRecord orphan) {
        String sql = "INSERT INTO orphans (location, job_id, run_id, created_at, reason) VALUES (?, ?, ?, ?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, orphan.location().handle());
            ps.setLong(2, orphan.jobId());
            ps.setLong(3, orphan.runId());
            ps.setTimestamp(4, Timestamp.from(orphan.createdAt()));
            ps.setString(5, truncate(orphan.reason(), 2048));

            ps.executeUpdate();
            conn.commit();

            log.debug("Recorded orphan {} for job {} run {}", orphan.location(), orphan.jobId(), orphan.runId());
        } catch (SQLException e) {
            throw new PersistenceException("Failed to record orphan: " + orphan.location(), e);
        }
    }

    @Override
    public List<OrphanRecord> findByRun(long jobId, long runId) {
        String sql = "SELECT * FROM orphans WHERE job_id = ? AND run_id = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, jobId);
            ps.setLong(2, runId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find orphans for run: " + runId, e);
        }
    }

    @Override
    public List<OrphanRecord> findRecent(int limit) {
        String sql = "SELECT * FROM orphans ORDER BY id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find recent orphans", e);
        }
    }

    private List<OrphanRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<OrphanRecord> orphans = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                orphans.add(new OrphanRecord(
                        StorageLocations.parse(rs.getString("location")),
                        rs.getLong("job_id"),
                        rs.getLong("run_id"),
                        rs.getTimestamp("created_at").toInstant(),
                        rs.getString("reason")));
            }
        }
        return orphans;
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }
}
