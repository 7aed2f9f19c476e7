package simrun.coordinator.error;

/**
 * Compute service call failed in a way that may succeed on retry
 * (network, throttling, 5xx, timeout).
 */
public class TransientExternalException extends CoordinatorException {

    public TransientExternalException(String message) {
        super(message);
    }

    public TransientExternalException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
