package simrun.coordinator.error;

/**
 * Relational store failure.
 */
public class PersistenceException extends CoordinatorException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
