package skytiles.acquisition.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one timestamp's processing history.
 * Owned by the state store; everything else reads snapshots.
 */
public final class TaskRecord {
    private final ImageTimestamp timestamp;
    private final TaskStatus status;
    private final int attempts;
    private final String lastError;
    private final Instant lastAttemptAt;
    private final Instant createdAt;
    private final Instant finishedAt;
    private final String artifactPath; // final artifact of the succeeded run

    private TaskRecord(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.attempts = builder.attempts;
        this.lastError = builder.lastError;
        this.lastAttemptAt = builder.lastAttemptAt;
        this.createdAt = builder.createdAt;
        this.finishedAt = builder.finishedAt;
        this.artifactPath = builder.artifactPath;
    }

    public ImageTimestamp timestamp() {
        return timestamp;
    }

    public TaskStatus status() {
        return status;
    }

    public int attempts() {
        return attempts;
    }

    public String lastError() {
        return lastError;
    }

    public Instant lastAttemptAt() {
        return lastAttemptAt;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public String artifactPath() {
        return artifactPath;
    }

    public boolean isSucceeded() {
        return status == TaskStatus.SUCCEEDED;
    }

    /** Failed at least {@code maxAttempts} times; no longer retried automatically */
    public boolean isExhausted(int maxAttempts) {
        return status == TaskStatus.FAILED && attempts >= maxAttempts;
    }

    /** Running, but no progress reported within the liveness timeout */
    public boolean isStale(Instant now, Duration livenessTimeout) {
        return status == TaskStatus.RUNNING
                && lastAttemptAt != null
                && lastAttemptAt.isBefore(now.minus(livenessTimeout));
    }

    public Builder toBuilder() {
        return new Builder()
                .timestamp(timestamp)
                .status(status)
                .attempts(attempts)
                .lastError(lastError)
                .lastAttemptAt(lastAttemptAt)
                .createdAt(createdAt)
                .finishedAt(finishedAt)
                .artifactPath(artifactPath);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ImageTimestamp timestamp;
        private TaskStatus status = TaskStatus.PENDING;
        private int attempts = 0;
        private String lastError;
        private Instant lastAttemptAt;
        private Instant createdAt;
        private Instant finishedAt;
        private String artifactPath;

        public Builder timestamp(ImageTimestamp timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder lastAttemptAt(Instant lastAttemptAt) {
            this.lastAttemptAt = lastAttemptAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder artifactPath(String artifactPath) {
            this.artifactPath = artifactPath;
            return this;
        }

        public TaskRecord build() {
            return new TaskRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskRecord that))
            return false;
        return timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp);
    }

    @Override
    public String toString() {
        return "TaskRecord{timestamp=" + timestamp + ", status=" + status + ", attempts=" + attempts + "}";
    }
}
