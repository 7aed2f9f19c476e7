package simrun.coordinator.store;

import simrun.coordinator.error.PersistenceException;
import simrun.coordinator.model.Job;
import simrun.coordinator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Job job) {
        String jobSql = "INSERT INTO jobs (id, owner_id, created_at) VALUES (?, ?, ?)";
        String tagSql = "INSERT INTO job_tags (job_id, tag) VALUES (?, ?)";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(jobSql);
                    PreparedStatement tagPs = conn.prepareStatement(tagSql)) {

                ps.setLong(1, job.id());
                ps.setLong(2, job.ownerId());
                ps.setTimestamp(3, Timestamp.from(job.createdAt()));
                ps.executeUpdate();

                for (String tag : job.tags()) {
                    tagPs.setLong(1, job.id());
                    tagPs.setString(2, tag);
                    tagPs.addBatch();
                }
                if (!job.tags().isEmpty()) {
                    tagPs.executeBatch();
                }

                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            log.debug("Saved job: {}", job.id());
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(long jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(Job.builder()
                        .id(rs.getLong("id"))
                        .ownerId(rs.getLong("owner_id"))
                        .tags(loadTags(conn, jobId))
                        .createdAt(rs.getTimestamp("created_at").toInstant())
                        .build());
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public long nextId() {
        return db.nextValue("job_ids");
    }

    // --- Helpers ---

    private Set<String> loadTags(Connection conn, long jobId) throws SQLException {
        Set<String> tags = new LinkedHashSet<>();
        try (PreparedStatement ps = conn.prepareStatement("SELECT tag FROM job_tags WHERE job_id = ? ORDER BY tag")) {
            ps.setLong(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tags.add(rs.getString(1));
                }
            }
        }
        return tags;
    }
}
