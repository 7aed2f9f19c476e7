package simrun.coordinator.compute;

import simrun.coordinator.model.ExternalStatus;
import simrun.coordinator.model.RunSubmission;

/**
 * External batch-compute service that executes simulation runs.
 * <p>
 * Failures are reported as {@link simrun.coordinator.error.TransientExternalException}
 * (worth retrying) or {@link simrun.coordinator.error.TerminalExternalException}
 * (the job is gone or permanently rejected). Every call is bounded by a timeout;
 * an expired call is reported as transient.
 */
public interface BatchComputeClient {

    /**
     * Submit a run for execution.
     *
     * @return opaque handle identifying the job on the compute side
     */
    String submit(RunSubmission submission);

    /**
     * Current phase of a submitted job.
     */
    ExternalStatus describe(String handle);

    /**
     * Ask the service to stop a job. Already finished jobs are left as they are.
     */
    void cancel(String handle, String reason);
}
