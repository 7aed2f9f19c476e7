package simrun.coordinator.error;

public class RunNotFoundException extends CoordinatorException {

    private final long jobId;
    private final long runId;

    public RunNotFoundException(long jobId, long runId) {
        super("Run " + runId + " not found for job " + jobId);
        this.jobId = jobId;
        this.runId = runId;
    }

    public long jobId() {
        return jobId;
    }

    public long runId() {
        return runId;
    }
}
