package colormix.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("mqtt") String mqtt,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("queuedTasks") Integer queuedTasks,
        @JsonProperty("processingTasks") Integer processingTasks,
        @JsonProperty("unusedWells") Integer unusedWells) {

    public static HealthResponse healthy(boolean mqttConnected, String uptime, String version, int queuedTasks,
            int processingTasks, int unusedWells) {
        return new HealthResponse("healthy", "ok", mqttConnected ? "connected" : "disconnected",
                uptime, version, queuedTasks, processingTasks, unusedWells);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
