package simrun.coordinator.repository;

import simrun.coordinator.model.Run;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Run persistence.
 * <p>
 * Updates are single-row and guarded by the run's {@code version}: a write based
 * on an outdated copy fails instead of overwriting a concurrent change.
 */
public interface RunRepository {

    /**
     * Insert a new run. The owning job must exist.
     *
     * @return the stored run (version 0)
     */
    Run insert(Run run);

    /**
     * Find a run by its ID regardless of owning job.
     */
    Optional<Run> findById(long runId);

    /**
     * Find a run of a given job.
     *
     * @return empty if the run does not exist or belongs to another job
     */
    Optional<Run> find(long jobId, long runId);

    /**
     * All runs of a job, ordered by ID.
     */
    List<Run> findByJobId(long jobId);

    /**
     * Non-terminal runs that were submitted to the compute service, never-polled
     * runs first, then the longest unpolled.
     *
     * @param limit maximum number of results
     */
    List<Run> findActiveWithHandle(int limit);

    /**
     * Record that the given runs were queried at {@code at}. Does not touch a run's
     * state or version.
     */
    void markPolled(Collection<Long> runIds, Instant at);

    /**
     * Atomically replace the mutable columns of a run.
     *
     * @param run the new state, carrying the version it was derived from
     * @return the stored run with its incremented version
     * @throws simrun.coordinator.error.StaleRunException if the stored version differs
     * @throws simrun.coordinator.error.RunNotFoundException if the run no longer exists
     */
    Run save(Run run);

    /**
     * Allocate a new unique run ID.
     */
    long nextId();
}
