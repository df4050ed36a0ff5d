package colormix.coordinator.protocol;

import colormix.coordinator.model.Task;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Volumes and target well, the body of both the pipette and the sensor-read
 * commands.
 */
public record MixCommand(
        @JsonProperty("R") int red,
        @JsonProperty("Y") int yellow,
        @JsonProperty("B") int blue,
        @JsonProperty("well") String well) {

    public static MixCommand of(Task task) {
        return new MixCommand(task.volumes().red(), task.volumes().yellow(), task.volumes().blue(), task.well());
    }
}
