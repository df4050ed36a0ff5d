package colormix.coordinator.protocol;

import colormix.coordinator.model.SessionToken;
import colormix.coordinator.model.Task;
import colormix.coordinator.model.Volumes;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeviceMessagesTest {

    private final SessionToken token = new SessionToken("s1", "abcd1234");
    private final Task task = Task.builder()
            .token(token)
            .volumes(new Volumes(120, 80, 40))
            .well("B3")
            .build();

    @Test
    void mixCommandCarriesVolumesWellAndToken() throws Exception {
        JsonNode json = DeviceMessages.mapper().readTree(DeviceMessages.mixCommand(task));

        assertEquals(120, json.at("/command/R").asInt());
        assertEquals(80, json.at("/command/Y").asInt());
        assertEquals(40, json.at("/command/B").asInt());
        assertEquals("B3", json.at("/command/well").asText());
        assertEquals("abcd1234", json.get("experiment_id").asText());
        assertEquals("s1", json.get("session_id").asText());
    }

    @Test
    void sensorReadCommandHasTheSameShapeAsMix() {
        assertEquals(DeviceMessages.mixCommand(task), DeviceMessages.sensorReadCommand(task));
    }

    @Test
    void timeoutAndConfirmReadUseSensorStatus() throws Exception {
        JsonNode timeout = DeviceMessages.mapper().readTree(DeviceMessages.timeoutCommand(token));
        JsonNode confirm = DeviceMessages.mapper().readTree(DeviceMessages.confirmReadCommand(token));

        assertEquals("sensor_timeout", timeout.at("/command/sensor_status").asText());
        assertEquals("read", confirm.at("/command/sensor_status").asText());
        assertEquals("s1", timeout.get("session_id").asText());
        assertEquals("abcd1234", timeout.get("experiment_id").asText());
    }

    @Test
    void parsesDeviceStatusIgnoringUnknownFields() {
        String payload = """
                {"status":{"sensor_status":"in_place","extra":1},"experiment_id":"abcd1234",
                 "session_id":"s1","timestamp":1708250400.5,"robot":"ot2"}
                """;

        DeviceStatusMessage message = DeviceMessages.parseDeviceStatus(payload);

        assertEquals(SensorStatus.IN_PLACE, message.sensorStatus());
        assertEquals("abcd1234", message.experimentId());
        assertEquals("s1", message.sessionId());
    }

    @Test
    void unknownOrMissingStatusIsUnknown() {
        assertEquals(SensorStatus.UNKNOWN,
                DeviceMessages.parseDeviceStatus("{\"status\":{\"sensor_status\":\"dancing\"}}").sensorStatus());
        assertEquals(SensorStatus.UNKNOWN,
                DeviceMessages.parseDeviceStatus("{\"experiment_id\":\"x\"}").sensorStatus());
    }

    @Test
    void parsesSensorData() {
        String payload = DeviceMessages.sensorData(Map.of("ch410", 100, "ch670", 800), token);

        SensorDataMessage message = DeviceMessages.parseSensorData(payload);

        assertEquals(100, ((Number) message.sensorData().get("ch410")).intValue());
        assertEquals("abcd1234", message.experimentId());
        assertNotNull(message.timestamp());
    }

    @Test
    void malformedPayloadThrows() {
        assertThrows(MalformedMessageException.class, () -> DeviceMessages.parseSensorData("{not json"));
        assertThrows(MalformedMessageException.class, () -> DeviceMessages.parseDeviceStatus("null"));
        assertThrows(MalformedMessageException.class, () -> DeviceMessages.parseCommand("[1,2"));
    }

    @Test
    void parsesCommandEnvelopeGenerically() {
        CommandEnvelope<Map<String, Object>> envelope = DeviceMessages.parseCommand(DeviceMessages.mixCommand(task));

        assertEquals("s1", envelope.sessionId());
        assertEquals("B3", envelope.command().get("well"));
        assertEquals(120, ((Number) envelope.command().get("R")).intValue());
    }
}
