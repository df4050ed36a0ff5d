package colormix.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for submitting an experiment.
 * POST /api/v1/experiments
 *
 * Range checks of the volumes are left to admission, which answers with a
 * rejection rather than a bad request.
 */
public record SubmitExperimentRequest(
        @JsonProperty("submitterId") String submitterId,
        @JsonProperty("R") Integer red,
        @JsonProperty("Y") Integer yellow,
        @JsonProperty("B") Integer blue) {

    /** Validate the request */
    public void validate() {
        if (submitterId == null || submitterId.isBlank()) {
            throw new IllegalArgumentException("submitterId is required");
        }
        if (red == null || yellow == null || blue == null) {
            throw new IllegalArgumentException("R, Y and B are required");
        }
    }
}
