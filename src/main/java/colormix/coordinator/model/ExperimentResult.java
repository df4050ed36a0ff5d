package colormix.coordinator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal outcome of an experiment, handed to the submitter and optionally
 * persisted.
 *
 * @param token        session token of the task
 * @param status       COMPLETED, TIMED_OUT or ERRORED
 * @param volumes      volumes that were mixed
 * @param well         well the mix went into
 * @param sensorData   last sensor reading; empty unless COMPLETED
 * @param errorMessage reason for TIMED_OUT / ERRORED, null otherwise
 * @param startedAt    when processing started
 * @param finishedAt   when the task was finalized
 */
public record ExperimentResult(
        SessionToken token,
        TaskStatus status,
        Volumes volumes,
        String well,
        Map<String, Object> sensorData,
        String errorMessage,
        Instant startedAt,
        Instant finishedAt) {

    public ExperimentResult {
        Objects.requireNonNull(token, "token is required");
        Objects.requireNonNull(status, "status is required");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("result status must be terminal: " + status);
        }
        sensorData = sensorData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sensorData));
    }

    public static ExperimentResult completed(Task task, Map<String, Object> sensorData, Instant finishedAt) {
        return new ExperimentResult(task.token(), TaskStatus.COMPLETED, task.volumes(), task.well(),
                sensorData, null, task.startedAt(), finishedAt);
    }

    public static ExperimentResult timedOut(Task task, String message, Instant finishedAt) {
        return new ExperimentResult(task.token(), TaskStatus.TIMED_OUT, task.volumes(), task.well(),
                Map.of(), message, task.startedAt(), finishedAt);
    }

    public static ExperimentResult errored(Task task, String message, Instant finishedAt) {
        return new ExperimentResult(task.token(), TaskStatus.ERRORED, task.volumes(), task.well(),
                Map.of(), message, task.startedAt(), finishedAt);
    }

    public boolean isSuccess() {
        return status == TaskStatus.COMPLETED;
    }
}
