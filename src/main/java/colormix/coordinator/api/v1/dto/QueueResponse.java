package colormix.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for the device queue.
 * GET /api/v1/queue
 */
public record QueueResponse(
        @JsonProperty("active") ExperimentResponse active,
        @JsonProperty("queueLength") int queueLength,
        @JsonProperty("queued") List<ExperimentResponse> queued) {
}
