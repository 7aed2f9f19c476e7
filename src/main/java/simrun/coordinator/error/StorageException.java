package simrun.coordinator.error;

/**
 * Object store failure. The message has always been through the credential
 * sanitizer; the raw provider exception is never attached as cause.
 */
public class StorageException extends CoordinatorException {

    public StorageException(String sanitizedMessage) {
        super(sanitizedMessage);
    }
}
