package colormix.coordinator.protocol;

import colormix.coordinator.model.SessionToken;
import colormix.coordinator.model.Task;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * JSON encoding of device commands and decoding of device events.
 */
public final class DeviceMessages {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private DeviceMessages() {
    }

    /** Pipette command: mix the task's volumes into its well. */
    public static String mixCommand(Task task) {
        return write(CommandEnvelope.of(MixCommand.of(task), task.token()));
    }

    /** Sensor command: read the well the device is positioned over. */
    public static String sensorReadCommand(Task task) {
        return write(CommandEnvelope.of(MixCommand.of(task), task.token()));
    }

    /** Tell the device the sensor reading arrived. */
    public static String confirmReadCommand(SessionToken token) {
        return write(CommandEnvelope.of(new StatusCommand(SensorStatus.READ), token));
    }

    /** Tell the device the task timed out so it can reset. */
    public static String timeoutCommand(SessionToken token) {
        return write(CommandEnvelope.of(new StatusCommand(SensorStatus.SENSOR_TIMEOUT), token));
    }

    public static String deviceStatus(SensorStatus status, SessionToken token) {
        return write(new DeviceStatusMessage(new DeviceStatusMessage.Status(status),
                token.experimentId(), token.sessionId(), now()));
    }

    public static String sensorData(Map<String, Object> data, SessionToken token) {
        return write(new SensorDataMessage(data, token.experimentId(), token.sessionId(), now()));
    }

    public static DeviceStatusMessage parseDeviceStatus(String payload) {
        return read(payload, DeviceStatusMessage.class);
    }

    public static SensorDataMessage parseSensorData(String payload) {
        return read(payload, SensorDataMessage.class);
    }

    /** Parse a command envelope with a generic body, used by the device simulator. */
    public static CommandEnvelope<Map<String, Object>> parseCommand(String payload) {
        try {
            return MAPPER.readValue(payload,
                    MAPPER.getTypeFactory().constructParametricType(CommandEnvelope.class,
                            MAPPER.getTypeFactory().constructMapType(Map.class, String.class,
                                    Object.class)));
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Malformed command: " + e.getOriginalMessage(), e);
        }
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    private static <T> T read(String payload, Class<T> type) {
        try {
            T value = MAPPER.readValue(payload, type);
            if (value == null) {
                throw new MalformedMessageException("Empty " + type.getSimpleName(), null);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Malformed " + type.getSimpleName() + ": " + e.getOriginalMessage(),
                    e);
        }
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    private static double now() {
        return System.currentTimeMillis() / 1000.0;
    }
}
