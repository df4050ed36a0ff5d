package colormix.coordinator.api.v1.dto;

import colormix.coordinator.model.ExperimentResult;
import colormix.coordinator.model.ProgressEvent;
import colormix.coordinator.model.Task;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for one experiment, whether just submitted, still open or
 * finished.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExperimentResponse(
        @JsonProperty("sessionId") String sessionId,
        @JsonProperty("experimentId") String experimentId,
        @JsonProperty("status") String status,
        @JsonProperty("well") String well,
        @JsonProperty("R") Integer red,
        @JsonProperty("Y") Integer yellow,
        @JsonProperty("B") Integer blue,
        @JsonProperty("queuePosition") Integer queuePosition,
        @JsonProperty("rejection") String rejection,
        @JsonProperty("message") String message,
        @JsonProperty("sensorData") Map<String, Object> sensorData,
        @JsonProperty("error") String error,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    /** First event of a submission: QUEUED or REJECTED */
    public static ExperimentResponse from(ProgressEvent event) {
        if (event.result() != null) {
            return from(event.result());
        }
        return new ExperimentResponse(
                event.token() != null ? event.token().sessionId() : null,
                event.token() != null ? event.token().experimentId() : null,
                event.type().name(),
                event.well(),
                null, null, null,
                event.queuePosition() > 0 ? event.queuePosition() : null,
                event.rejection() != null ? event.rejection().name() : null,
                event.message(),
                null, null,
                null, null, null);
    }

    /** Task still held in memory */
    public static ExperimentResponse from(Task task, int queuePosition) {
        return new ExperimentResponse(
                task.sessionId(),
                task.experimentId(),
                task.status().name(),
                task.well(),
                task.volumes().red(),
                task.volumes().yellow(),
                task.volumes().blue(),
                queuePosition > 0 ? queuePosition : null,
                null,
                null,
                null,
                task.errorMessage(),
                task.createdAt(),
                task.startedAt(),
                task.finishedAt());
    }

    public static ExperimentResponse from(ExperimentResult result) {
        return new ExperimentResponse(
                result.token().sessionId(),
                result.token().experimentId(),
                result.status().name(),
                result.well(),
                result.volumes() != null ? result.volumes().red() : null,
                result.volumes() != null ? result.volumes().yellow() : null,
                result.volumes() != null ? result.volumes().blue() : null,
                null,
                null,
                null,
                result.sensorData(),
                result.errorMessage(),
                null,
                result.startedAt(),
                result.finishedAt());
    }
}
