package simrun.coordinator.repository;

import simrun.coordinator.model.OrphanRecord;

import java.util.List;

/**
 * Durable compensation log for artifacts stored without committed metadata.
 */
public interface OrphanRepository {

    /**
     * Append an orphan record.
     */
    void record(OrphanRecord orphan);

    /**
     * Orphans recorded for a run, oldest first.
     */
    List<OrphanRecord> findByRun(long jobId, long runId);

    /**
     * Most recent orphans, for the cleanup sweeper.
     *
     * @param limit maximum results
     */
    List<OrphanRecord> findRecent(int limit);
}
