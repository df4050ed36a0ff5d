package colormix.coordinator.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound device status event.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeviceStatusMessage(
        @JsonProperty("status") Status status,
        @JsonProperty("experiment_id") String experimentId,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("timestamp") Double timestamp) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(@JsonProperty("sensor_status") SensorStatus sensorStatus) {
    }

    public SensorStatus sensorStatus() {
        if (status == null || status.sensorStatus() == null) {
            return SensorStatus.UNKNOWN;
        }
        return status.sensorStatus();
    }
}
