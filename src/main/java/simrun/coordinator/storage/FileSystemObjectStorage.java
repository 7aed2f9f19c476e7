package simrun.coordinator.storage;

import simrun.coordinator.model.StorageLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;

/**
 * Object storage on a local or mounted file system.
 * <p>
 * Buckets are directories under {@code root}; an object with key {@code a/b.zip}
 * in bucket {@code results} lives at {@code root/results/a/b.zip}. Locations are
 * reported as {@code s3://bucket/key}. Writes go to a temporary file first and are
 * moved into place, so readers never see a partial object.
 */
public class FileSystemObjectStorage implements ObjectStorageProvider {

    private static final Logger log = LoggerFactory.getLogger(FileSystemObjectStorage.class);

    private final Path root;
    private final String bucket;
    private final Clock clock;

    public FileSystemObjectStorage(Path root, String bucket) {
        this(root, bucket, Clock.systemUTC());
    }

    public FileSystemObjectStorage(Path root, String bucket, Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.bucket = bucket;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "filesystem:" + root;
    }

    @Override
    public String put(String key, byte[] content, String contentType) throws ObjectStorageException {
        Path target = resolve(bucket, key);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), ".upload-", ".part");
            try {
                Files.write(tmp, content);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new ObjectStorageException("PutObject failed for " + bucket + "/" + key + ": " + e.getMessage(), e);
        }
        log.debug("Stored {} bytes ({}) at {}/{}", content.length, contentType, bucket, key);
        return "s3://" + bucket + "/" + key;
    }

    @Override
    public String presign(StorageLocation location, Duration ttl) throws ObjectStorageException {
        Path object = resolve(location.bucket(), location.key());
        if (!Files.isRegularFile(object)) {
            throw new ObjectStorageException("NoSuchKey: " + location.handle());
        }
        long expires = clock.instant().plus(ttl).getEpochSecond();
        return object.toUri() + "?expires=" + expires;
    }

    private Path resolve(String bucketName, String key) throws ObjectStorageException {
        Path bucketDir = root.resolve(bucketName).normalize();
        Path object = bucketDir.resolve(key).normalize();
        if (!bucketDir.startsWith(root) || !object.startsWith(bucketDir) || object.equals(bucketDir)) {
            throw new ObjectStorageException("Invalid object key: " + bucketName + "/" + key);
        }
        return object;
    }
}
