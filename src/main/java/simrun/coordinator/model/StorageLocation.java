package simrun.coordinator.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Where a stored artifact lives: a bucket and an object key.
 * The canonical handle is {@code s3://bucket/key}; equality is structural.
 */
public final class StorageLocation implements Comparable<StorageLocation> {

    private static final Comparator<StorageLocation> ORDER =
            Comparator.comparing(StorageLocation::bucket).thenComparing(StorageLocation::key);

    private final String bucket;
    private final String key;

    public StorageLocation(String bucket, String key) {
        this.bucket = requireText(bucket, "bucket");
        this.key = requireText(key, "key");
    }

    public String bucket() {
        return bucket;
    }

    public String key() {
        return key;
    }

    /** Canonical, comparable handle. */
    public String handle() {
        return "s3://" + bucket + "/" + key;
    }

    @Override
    public int compareTo(StorageLocation other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StorageLocation that))
            return false;
        return bucket.equals(that.bucket) && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucket, key);
    }

    @Override
    public String toString() {
        return handle();
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
