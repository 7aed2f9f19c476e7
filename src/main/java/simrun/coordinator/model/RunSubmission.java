package simrun.coordinator.model;

import java.util.Map;

/**
 * What the batch-compute service needs to start one run.
 *
 * @param jobName     unique name on the compute side, e.g. {@code job-12-run-4}
 * @param environment container environment variables
 */
public record RunSubmission(long jobId, long runId, String jobName, Map<String, String> environment) {

    public RunSubmission {
        environment = Map.copyOf(environment);
    }

    public static RunSubmission of(long jobId, long runId, Map<String, String> environment) {
        return new RunSubmission(jobId, runId, "job-" + jobId + "-run-" + runId, environment);
    }
}
