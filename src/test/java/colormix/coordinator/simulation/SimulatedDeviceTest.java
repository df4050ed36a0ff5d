package colormix.coordinator.simulation;

import colormix.coordinator.config.CoordinatorConfig;
import colormix.coordinator.messaging.InMemoryMessagingGateway;
import colormix.coordinator.messaging.InMemoryMessagingGateway.PublishedMessage;
import colormix.coordinator.model.SessionToken;
import colormix.coordinator.model.Task;
import colormix.coordinator.model.Volumes;
import colormix.coordinator.protocol.DeviceMessages;
import colormix.coordinator.protocol.DeviceStatusMessage;
import colormix.coordinator.protocol.SensorDataMessage;
import colormix.coordinator.protocol.SensorStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedDeviceTest {

    private final CoordinatorConfig config = CoordinatorConfig.defaults()
            .withSimulatedDeviceDelay(Duration.ofMillis(10));
    private final SessionToken token = new SessionToken("s1", "0badf00d");
    private final Task task = Task.builder()
            .token(token)
            .volumes(new Volumes(100, 50, 150))
            .well("D4")
            .createdAt(Instant.now())
            .build();

    private InMemoryMessagingGateway bus;
    private SimulationService simulation;
    private SimulatedDevice device;

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessagingGateway();
        bus.connect();
        simulation = new SimulationService(bus, config);
        device = simulation.start();
    }

    @AfterEach
    void tearDown() {
        simulation.close();
        bus.close();
    }

    private List<PublishedMessage> waitFor(String topic, int count) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        while (bus.publishedTo(topic).size() < count && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        return bus.publishedTo(topic);
    }

    @Test
    void mixAnswersInPlace() throws Exception {
        bus.publish(config.deviceCommandTopic(), DeviceMessages.mixCommand(task));

        List<PublishedMessage> statuses = waitFor(config.deviceStatusTopic(), 1);
        assertEquals(1, statuses.size());
        DeviceStatusMessage status = DeviceMessages.parseDeviceStatus(statuses.get(0).payload());
        assertEquals(SensorStatus.IN_PLACE, status.sensorStatus());
        assertEquals("s1", status.sessionId());
        assertEquals("0badf00d", status.experimentId());
        assertEquals(1, device.mixCount());
    }

    @Test
    void sensorReadAnswersWithSpectrum() throws Exception {
        bus.publish(config.sensorCommandTopic(), DeviceMessages.sensorReadCommand(task));

        List<PublishedMessage> data = waitFor(config.sensorDataTopic(), 1);
        SensorDataMessage reading = DeviceMessages.parseSensorData(data.get(0).payload());
        assertEquals(SimulatedDevice.CHANNELS.size(), reading.sensorData().size());
        assertEquals(token.experimentId(), reading.experimentId());
    }

    @Test
    void confirmReadAnswersCharging() throws Exception {
        bus.publish(config.deviceCommandTopic(), DeviceMessages.confirmReadCommand(token));

        List<PublishedMessage> statuses = waitFor(config.deviceStatusTopic(), 1);
        assertEquals(SensorStatus.CHARGING,
                DeviceMessages.parseDeviceStatus(statuses.get(0).payload()).sensorStatus());
    }

    @Test
    void timeoutCommandIsCountedNotAnswered() throws Exception {
        bus.publish(config.deviceCommandTopic(), DeviceMessages.timeoutCommand(token));
        bus.awaitDelivery(1000);
        Thread.sleep(50);

        assertEquals(1, device.timeoutCount());
        assertTrue(bus.publishedTo(config.deviceStatusTopic()).isEmpty());
    }

    @Test
    void silentDeviceNeverAnswers() throws Exception {
        device.setSilent(true);
        bus.publish(config.deviceCommandTopic(), DeviceMessages.mixCommand(task));
        bus.awaitDelivery(1000);
        Thread.sleep(50);

        assertTrue(bus.publishedTo(config.deviceStatusTopic()).isEmpty());
        assertEquals(1, device.mixCount());
    }

    @Test
    void garbageIsIgnored() throws Exception {
        bus.publish(config.deviceCommandTopic(), "not json");
        bus.publish(config.deviceCommandTopic(), "{\"command\":{}}");
        bus.awaitDelivery(1000);
        Thread.sleep(50);

        assertEquals(0, device.mixCount());
        assertEquals(2, bus.published().size());
    }

    @Test
    void readingDependsOnVolumes() {
        Map<String, Object> blue = SimulatedDevice.reading(Map.of("R", 0, "Y", 0, "B", 300));
        Map<String, Object> red = SimulatedDevice.reading(Map.of("R", 300, "Y", 0, "B", 0));

        assertNotEquals(blue, red);
        assertEquals(SimulatedDevice.CHANNELS, List.copyOf(blue.keySet()));
        assertTrue((Integer) blue.get("ch410") > (Integer) red.get("ch410"));
    }

    @Test
    void serviceStartIsIdempotent() {
        assertSame(device, simulation.start());
        assertTrue(simulation.isRunning());

        simulation.stop();
        assertFalse(simulation.isRunning());
        assertNull(simulation.device());
    }
}
