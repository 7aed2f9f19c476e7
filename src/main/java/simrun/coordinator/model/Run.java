package simrun.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of one simulation run.
 * <p>
 * Status changes go through {@link RunTransitions}; a changed run is a new
 * instance. {@code version} is the optimistic-lock counter maintained by the
 * repository.
 */
public final class Run {
    private final long id;
    private final long jobId;
    private final RunStatus status;
    private final StorageLocation resultsLocation;
    private final Instant resultsPublishedAt;
    private final String externalJobHandle;
    private final String statusDetail;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final long version;

    private Run(Builder builder) {
        this.id = builder.id;
        this.jobId = builder.jobId;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.resultsLocation = builder.resultsLocation;
        this.resultsPublishedAt = builder.resultsPublishedAt;
        this.externalJobHandle = builder.externalJobHandle;
        this.statusDetail = builder.statusDetail;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.version = builder.version;
        if (resultsLocation != null && status != RunStatus.DONE) {
            throw new IllegalStateException(
                    "Run " + id + " has a results location but status " + status);
        }
    }

    public long id() {
        return id;
    }

    public long jobId() {
        return jobId;
    }

    public RunStatus status() {
        return status;
    }

    public StorageLocation resultsLocation() {
        return resultsLocation;
    }

    public Instant resultsPublishedAt() {
        return resultsPublishedAt;
    }

    public String externalJobHandle() {
        return externalJobHandle;
    }

    public String statusDetail() {
        return statusDetail;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public long version() {
        return version;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean hasExternalHandle() {
        return externalJobHandle != null && !externalJobHandle.isBlank();
    }

    /** DONE with a stored artifact */
    public boolean isPublished() {
        return status == RunStatus.DONE && resultsLocation != null;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .jobId(jobId)
                .status(status)
                .resultsLocation(resultsLocation)
                .resultsPublishedAt(resultsPublishedAt)
                .externalJobHandle(externalJobHandle)
                .statusDetail(statusDetail)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .version(version);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private long jobId;
        private RunStatus status = RunStatus.CREATED;
        private StorageLocation resultsLocation;
        private Instant resultsPublishedAt;
        private String externalJobHandle;
        private String statusDetail;
        private Instant createdAt;
        private Instant updatedAt;
        private long version;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder jobId(long jobId) {
            this.jobId = jobId;
            return this;
        }

        // Package-private: callers outside the model move status through RunTransitions.
        Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        Builder resultsLocation(StorageLocation resultsLocation) {
            this.resultsLocation = resultsLocation;
            return this;
        }

        Builder resultsPublishedAt(Instant resultsPublishedAt) {
            this.resultsPublishedAt = resultsPublishedAt;
            return this;
        }

        public Builder externalJobHandle(String externalJobHandle) {
            this.externalJobHandle = externalJobHandle;
            return this;
        }

        public Builder statusDetail(String statusDetail) {
            this.statusDetail = statusDetail;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Run build() {
            return new Run(this);
        }
    }

    /**
     * Rebuild a run exactly as it was stored. Only persistence adapters call this.
     */
    public static Run restore(long id, long jobId, RunStatus status, StorageLocation resultsLocation,
            Instant resultsPublishedAt, String externalJobHandle, String statusDetail,
            Instant createdAt, Instant updatedAt, long version) {
        return new Builder()
                .id(id)
                .jobId(jobId)
                .status(status)
                .resultsLocation(resultsLocation)
                .resultsPublishedAt(resultsPublishedAt)
                .externalJobHandle(externalJobHandle)
                .statusDetail(statusDetail)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .version(version)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Run run))
            return false;
        return id == run.id && jobId == run.jobId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, jobId);
    }

    @Override
    public String toString() {
        return "Run{id=" + id + ", jobId=" + jobId + ", status=" + status
                + ", handle='" + externalJobHandle + "', version=" + version + "}";
    }
}
