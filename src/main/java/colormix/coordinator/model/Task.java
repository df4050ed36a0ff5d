package colormix.coordinator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of one color-mixing experiment request.
 * State changes produce a new instance via {@link #toBuilder()}.
 */
public final class Task {
    private final SessionToken token;
    private final Volumes volumes;
    private final String well;
    private final TaskStatus status;
    private final String errorMessage;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    private Task(Builder builder) {
        this.token = Objects.requireNonNull(builder.token, "token is required");
        this.volumes = Objects.requireNonNull(builder.volumes, "volumes are required");
        this.well = Objects.requireNonNull(builder.well, "well is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.errorMessage = builder.errorMessage;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    public SessionToken token() {
        return token;
    }

    public String sessionId() {
        return token.sessionId();
    }

    public String experimentId() {
        return token.experimentId();
    }

    public Volumes volumes() {
        return volumes;
    }

    public String well() {
        return well;
    }

    public TaskStatus status() {
        return status;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Time spent processing as of {@code now}; zero if not started. */
    public Duration elapsed(Instant now) {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, now);
    }

    public Builder toBuilder() {
        return new Builder()
                .token(token)
                .volumes(volumes)
                .well(well)
                .status(status)
                .errorMessage(errorMessage)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SessionToken token;
        private Volumes volumes;
        private String well;
        private TaskStatus status = TaskStatus.QUEUED;
        private String errorMessage;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder token(SessionToken token) {
            this.token = token;
            return this;
        }

        public Builder volumes(Volumes volumes) {
            this.volumes = volumes;
            return this;
        }

        public Builder well(String well) {
            this.well = well;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(token, task.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(token);
    }

    @Override
    public String toString() {
        return "Task{token=" + token + ", well='" + well + "', status=" + status + "}";
    }
}
