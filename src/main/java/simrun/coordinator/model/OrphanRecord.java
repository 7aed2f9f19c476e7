package simrun.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Compensation log entry: an artifact was stored but its run metadata was not committed.
 * Consumed by an out-of-band cleanup process.
 *
 * @param reason sanitized description of the commit failure
 */
public record OrphanRecord(StorageLocation location, long jobId, long runId, Instant createdAt, String reason) {

    public OrphanRecord {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
