package simrun.coordinator.error;

import java.nio.file.Path;

/**
 * Results directory is missing, not a directory, or holds no RUN* output.
 */
public class InvalidResultsDirectoryException extends ValidationException {

    private final Path directory;

    public InvalidResultsDirectoryException(Path directory, String reason) {
        super(reason + ": " + directory);
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }
}
