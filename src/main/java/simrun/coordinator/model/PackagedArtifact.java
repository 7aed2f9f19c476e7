package simrun.coordinator.model;

import java.util.Objects;

/**
 * Immutable packaged output of a run's results directory.
 *
 * @param totalSizeBytes   sum of the sizes of the archived files
 * @param checksum         SHA-256 of the archive bytes, lowercase hex
 * @param directoryName    name of the packaged results directory
 */
public record PackagedArtifact(byte[] payload, int fileCount, long totalSizeBytes, String checksum,
        String directoryName) {

    public PackagedArtifact {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(checksum, "checksum");
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public long archiveSizeBytes() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PackagedArtifact that))
            return false;
        return fileCount == that.fileCount
                && totalSizeBytes == that.totalSizeBytes
                && checksum.equals(that.checksum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileCount, totalSizeBytes, checksum);
    }

    @Override
    public String toString() {
        return "PackagedArtifact{files=" + fileCount + ", totalSize=" + totalSizeBytes
                + ", archiveSize=" + payload.length + ", checksum=" + checksum + "}";
    }
}
