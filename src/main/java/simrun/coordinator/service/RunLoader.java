package simrun.coordinator.service;

import simrun.coordinator.error.RunNotFoundException;
import simrun.coordinator.error.RunOwnershipMismatchException;
import simrun.coordinator.error.ValidationException;
import simrun.coordinator.model.Run;
import simrun.coordinator.repository.RunRepository;

/**
 * Loads a run on behalf of a job, checking that the job owns it.
 */
final class RunLoader {

    private RunLoader() {
    }

    static Run load(RunRepository runRepository, long jobId, long runId) {
        requireId("jobId", jobId);
        requireId("runId", runId);

        Run run = runRepository.findById(runId)
                .orElseThrow(() -> new RunNotFoundException(jobId, runId));
        if (run.jobId() != jobId) {
            throw new RunOwnershipMismatchException(jobId, run.jobId(), runId);
        }
        return run;
    }

    static void requireId(String name, long id) {
        if (id <= 0) {
            throw new ValidationException(name + " must be positive: " + id);
        }
    }
}
