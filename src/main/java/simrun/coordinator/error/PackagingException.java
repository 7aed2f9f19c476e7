package simrun.coordinator.error;

/**
 * Reading the results directory or writing the archive failed.
 */
public class PackagingException extends CoordinatorException {

    public PackagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
