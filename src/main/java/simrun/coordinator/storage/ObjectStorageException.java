package simrun.coordinator.storage;

/**
 * Failure reported by an object storage provider. The message may contain
 * raw provider output, including credentials; only {@link ResultsStoreGateway}
 * sees it, and only after sanitizing.
 */
public class ObjectStorageException extends Exception {

    public ObjectStorageException(String message) {
        super(message);
    }

    public ObjectStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
