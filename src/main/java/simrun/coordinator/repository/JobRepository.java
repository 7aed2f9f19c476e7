package simrun.coordinator.repository;

import simrun.coordinator.model.Job;

import java.util.Optional;

/**
 * Repository interface for Job persistence.
 */
public interface JobRepository {

    /**
     * Insert a new job together with its tags.
     *
     * @param job the job to save
     */
    void save(Job job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(long jobId);

    /**
     * Allocate a new unique job ID.
     */
    long nextId();
}
