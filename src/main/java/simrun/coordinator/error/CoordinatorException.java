package simrun.coordinator.error;

/**
 * Base of the closed set of failures raised by the run coordinator.
 * Callers decide on retry via {@link #isRetryable()}, never by message text.
 */
public abstract class CoordinatorException extends RuntimeException {

    protected CoordinatorException(String message) {
        super(message);
    }

    protected CoordinatorException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether repeating the same call may succeed. */
    public boolean isRetryable() {
        return false;
    }
}
