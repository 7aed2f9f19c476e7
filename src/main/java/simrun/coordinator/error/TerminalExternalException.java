package simrun.coordinator.error;

/**
 * Compute service reports the job as permanently gone or failed.
 */
public class TerminalExternalException extends CoordinatorException {

    public TerminalExternalException(String message) {
        super(message);
    }

    public TerminalExternalException(String message, Throwable cause) {
        super(message, cause);
    }
}
