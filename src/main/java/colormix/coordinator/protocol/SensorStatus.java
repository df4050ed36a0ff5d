package colormix.coordinator.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Values of the {@code sensor_status} field, inbound and outbound.
 */
public enum SensorStatus {
    /** Device: pipette is positioned over the well, sensor may read */
    IN_PLACE("in_place"),
    /** Device: back at the charging/idle position, measurement cycle done */
    CHARGING("charging"),
    /** Coordinator: sensor reading received, device may move on */
    READ("read"),
    /** Coordinator: task timed out, device should reset */
    SENSOR_TIMEOUT("sensor_timeout"),
    /** Anything outside the vocabulary */
    UNKNOWN("unknown");

    private final String wire;

    SensorStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static SensorStatus fromWire(String value) {
        if (value != null) {
            for (SensorStatus s : values()) {
                if (s.wire.equalsIgnoreCase(value.trim())) {
                    return s;
                }
            }
        }
        return UNKNOWN;
    }
}
