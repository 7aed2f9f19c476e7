package simrun.coordinator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable domain model of a simulation job.
 * A job groups the runs submitted by one owner.
 */
public final class Job {
    private final long id;
    private final long ownerId;
    private final Set<String> tags;
    private final Instant createdAt;

    private Job(Builder builder) {
        this.id = builder.id;
        this.ownerId = builder.ownerId;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
    }

    public long id() {
        return id;
    }

    public long ownerId() {
        return ownerId;
    }

    public Set<String> tags() {
        return tags;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .ownerId(ownerId)
                .tags(tags)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private long ownerId;
        private Set<String> tags = new LinkedHashSet<>();
        private Instant createdAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder ownerId(long ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = new LinkedHashSet<>(tags);
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return id == job.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", ownerId=" + ownerId + ", tags=" + tags + "}";
    }
}
