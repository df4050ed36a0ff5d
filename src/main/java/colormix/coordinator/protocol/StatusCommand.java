package colormix.coordinator.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the confirm-read and timeout commands.
 */
public record StatusCommand(@JsonProperty("sensor_status") SensorStatus sensorStatus) {
}
