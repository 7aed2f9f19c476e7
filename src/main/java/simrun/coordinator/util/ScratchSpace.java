package simrun.coordinator.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Private temporary directory that is removed when closed.
 * Use in try-with-resources so it is released on every exit path, including
 * exceptions and thread interruption.
 */
public final class ScratchSpace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScratchSpace.class);

    private final Path directory;

    private ScratchSpace(Path directory) {
        this.directory = directory;
    }

    /**
     * Create a new scratch directory under {@code parent}.
     */
    public static ScratchSpace create(Path parent, String prefix) throws IOException {
        Files.createDirectories(parent);
        return new ScratchSpace(Files.createTempDirectory(parent, prefix));
    }

    public Path directory() {
        return directory;
    }

    public Path resolve(String name) {
        return directory.resolve(name);
    }

    @Override
    public void close() {
        if (!Files.exists(directory)) {
            return;
        }
        try {
            Files.walkFileTree(directory, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    if (exc != null) {
                        throw exc;
                    }
                    Files.delete(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.error("Failed to remove scratch directory {}", directory, e);
            throw new UncheckedIOException("Failed to remove scratch directory " + directory, e);
        }
    }
}
