package simrun.coordinator.error;

public class RunOwnershipMismatchException extends CoordinatorException {

    private final long requestedJobId;
    private final long actualJobId;
    private final long runId;

    public RunOwnershipMismatchException(long requestedJobId, long actualJobId, long runId) {
        super("Run " + runId + " belongs to job " + actualJobId + ", not job " + requestedJobId);
        this.requestedJobId = requestedJobId;
        this.actualJobId = actualJobId;
        this.runId = runId;
    }

    public long requestedJobId() {
        return requestedJobId;
    }

    public long actualJobId() {
        return actualJobId;
    }

    public long runId() {
        return runId;
    }
}
