package colormix.coordinator.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound sensor reading. The measurement map is opaque to the coordinator.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SensorDataMessage(
        @JsonProperty("sensor_data") Map<String, Object> sensorData,
        @JsonProperty("experiment_id") String experimentId,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("timestamp") Double timestamp) {
}
