package colormix.coordinator.simulation;

import colormix.coordinator.config.CoordinatorConfig;
import colormix.coordinator.messaging.MessageHandler;
import colormix.coordinator.messaging.MessagingGateway;
import colormix.coordinator.model.SessionToken;
import colormix.coordinator.protocol.CommandEnvelope;
import colormix.coordinator.protocol.DeviceMessages;
import colormix.coordinator.protocol.MalformedMessageException;
import colormix.coordinator.protocol.SensorStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Plays the pipetting robot and its color sensor on a message bus.
 *
 * mix command -> "in_place" status after the configured delay
 * sensor read -> AS7341 channel readings
 * confirm read -> "charging" status
 * timeout -> reset, nothing is sent back
 *
 * A silent device swallows every command, which lets the coordinator's
 * timeout path run.
 */
public final class SimulatedDevice implements MessageHandler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SimulatedDevice.class);

    static final List<String> CHANNELS = List.of(
            "ch410", "ch440", "ch470", "ch510", "ch550", "ch583", "ch620", "ch670");

    private final MessagingGateway gateway;
    private final CoordinatorConfig config;
    private final ScheduledExecutorService executor;
    private final AtomicInteger mixes = new AtomicInteger();
    private final AtomicInteger timeouts = new AtomicInteger();

    private volatile boolean silent = false;

    public SimulatedDevice(MessagingGateway gateway, CoordinatorConfig config) {
        this.gateway = gateway;
        this.config = config;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "colormix-sim-device");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Subscribe to the command topics.
     */
    public void attach() {
        gateway.subscribe(List.of(config.deviceCommandTopic(), config.sensorCommandTopic()), this);
        log.info("Simulated device listening on {} and {}", config.deviceCommandTopic(),
                config.sensorCommandTopic());
    }

    public void setSilent(boolean silent) {
        this.silent = silent;
        log.info("Simulated device is now {}", silent ? "silent" : "responsive");
    }

    public boolean isSilent() {
        return silent;
    }

    public int mixCount() {
        return mixes.get();
    }

    public int timeoutCount() {
        return timeouts.get();
    }

    @Override
    public void onMessage(String topic, String payload) {
        CommandEnvelope<Map<String, Object>> envelope;
        try {
            envelope = DeviceMessages.parseCommand(payload);
        } catch (MalformedMessageException e) {
            log.warn("Simulated device ignoring malformed command: {}", e.getMessage());
            return;
        }
        if (envelope.command() == null || envelope.sessionId() == null || envelope.experimentId() == null) {
            log.warn("Simulated device ignoring incomplete command on {}", topic);
            return;
        }

        SessionToken token = new SessionToken(envelope.sessionId(), envelope.experimentId());
        Map<String, Object> command = envelope.command();

        if (topic.equals(config.sensorCommandTopic())) {
            respond(token, "sensor read", () -> gateway.publish(config.sensorDataTopic(),
                    DeviceMessages.sensorData(reading(command), token)));
            return;
        }

        Object status = command.get("sensor_status");
        if (status == null) {
            mixes.incrementAndGet();
            respond(token, "mix", () -> gateway.publish(config.deviceStatusTopic(),
                    DeviceMessages.deviceStatus(SensorStatus.IN_PLACE, token)));
        } else if (SensorStatus.READ.wire().equals(status)) {
            respond(token, "confirm read", () -> gateway.publish(config.deviceStatusTopic(),
                    DeviceMessages.deviceStatus(SensorStatus.CHARGING, token)));
        } else if (SensorStatus.SENSOR_TIMEOUT.wire().equals(status)) {
            timeouts.incrementAndGet();
            log.info("Simulated device reset after timeout of {}", token);
        } else {
            log.debug("Simulated device ignoring status command {}", status);
        }
    }

    private void respond(SessionToken token, String what, Runnable reply) {
        if (silent) {
            log.info("Simulated device silently dropping {} for {}", what, token);
            return;
        }
        Duration delay = config.simulatedDeviceDelay();
        executor.schedule(() -> {
            try {
                reply.run();
            } catch (Exception e) {
                log.error("Simulated device failed to answer {} for {}", what, token, e);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Fake spectrum that depends on the mixed volumes so different mixes read
     * differently.
     */
    static Map<String, Object> reading(Map<String, Object> command) {
        int red = intValue(command.get("R"));
        int yellow = intValue(command.get("Y"));
        int blue = intValue(command.get("B"));

        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < CHANNELS.size(); i++) {
            int base = (i + 1) * 100;
            int shift = (blue * (CHANNELS.size() - i) + yellow * Math.min(i, CHANNELS.size() - i) + red * i) / 100;
            data.put(CHANNELS.get(i), base + shift);
        }
        return data;
    }

    private static int intValue(Object value) {
        return value instanceof Number n ? n.intValue() : 0;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
