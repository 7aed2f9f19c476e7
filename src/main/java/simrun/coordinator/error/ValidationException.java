package simrun.coordinator.error;

/**
 * Bad identifiers or malformed input. Surfaced immediately, never retried.
 */
public class ValidationException extends CoordinatorException {

    public ValidationException(String message) {
        super(message);
    }
}
