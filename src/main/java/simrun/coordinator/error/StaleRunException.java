package simrun.coordinator.error;

/**
 * Optimistic version check failed: another writer updated the run first.
 */
public class StaleRunException extends CoordinatorException {

    private final long runId;
    private final long expectedVersion;

    public StaleRunException(long runId, long expectedVersion) {
        super("Run " + runId + " was modified concurrently (expected version " + expectedVersion + ")");
        this.runId = runId;
        this.expectedVersion = expectedVersion;
    }

    public long runId() {
        return runId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
