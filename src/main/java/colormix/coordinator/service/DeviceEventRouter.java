package colormix.coordinator.service;

import colormix.coordinator.config.CoordinatorConfig;
import colormix.coordinator.core.CoordinatorCore;
import colormix.coordinator.messaging.MessageHandler;
import colormix.coordinator.messaging.MessagingException;
import colormix.coordinator.model.ExperimentResult;
import colormix.coordinator.model.Task;
import colormix.coordinator.protocol.DeviceMessages;
import colormix.coordinator.protocol.DeviceStatusMessage;
import colormix.coordinator.protocol.MalformedMessageException;
import colormix.coordinator.protocol.SensorDataMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Handles every inbound device message.
 *
 * Device status drives the measurement cycle ({@code in_place} triggers the
 * sensor read, {@code charging} completes the task); sensor data is stored as
 * the latest reading and acknowledged. Messages that do not carry the active
 * task's session token are dropped.
 */
public class DeviceEventRouter implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(DeviceEventRouter.class);

    private final CoordinatorCore core;
    private final ResultDispatcher dispatcher;
    private final DeviceCommandPublisher publisher;
    private final CoordinatorConfig config;

    public DeviceEventRouter(CoordinatorCore core, ResultDispatcher dispatcher, DeviceCommandPublisher publisher,
            CoordinatorConfig config) {
        this.core = core;
        this.dispatcher = dispatcher;
        this.publisher = publisher;
        this.config = config;
    }

    @Override
    public void onMessage(String topic, String payload) {
        try {
            if (config.deviceStatusTopic().equals(topic)) {
                onDeviceStatus(DeviceMessages.parseDeviceStatus(payload));
            } else if (config.sensorDataTopic().equals(topic)) {
                onSensorData(DeviceMessages.parseSensorData(payload));
            } else {
                log.warn("Dropping message on unexpected topic {}", topic);
            }
        } catch (MalformedMessageException e) {
            log.warn("Dropping malformed message on {}: {}", topic, e.getMessage());
        } catch (MessagingException e) {
            // the worker's timeout check finalizes the task if the device never hears from us
            log.warn("Could not publish follow-up command for message on {}: {}", topic, e.getMessage());
        }
    }

    private void onDeviceStatus(DeviceStatusMessage message) {
        Optional<Task> match = activeFor("device status", message.sessionId(), message.experimentId());
        if (match.isEmpty()) {
            return;
        }
        Task task = match.get();

        switch (message.sensorStatus()) {
            case IN_PLACE -> {
                if (!core.runIfActive(task.token(), () -> publisher.publishSensorRead(task))) {
                    log.warn("Task {} was finalized before its sensor read went out", task.token());
                }
            }
            case CHARGING -> {
                Optional<ExperimentResult> result = core.completeActive(task.token(), Instant.now());
                if (result.isPresent()) {
                    dispatcher.deposit(task.token(), result.get());
                } else {
                    log.warn("Task {} was finalized before its completion event arrived", task.token());
                }
            }
            default -> log.debug("Ignoring device status {} for {}", message.sensorStatus(), task.token());
        }
    }

    private void onSensorData(SensorDataMessage message) {
        Optional<Task> match = activeFor("sensor data", message.sessionId(), message.experimentId());
        if (match.isEmpty()) {
            return;
        }
        Task task = match.get();

        if (!core.storeSensorReading(task.token(), message.sensorData())) {
            log.warn("Task {} was finalized before its sensor data arrived", task.token());
            return;
        }
        log.info("Sensor reading stored for {}", task.token());
        if (!core.runIfActive(task.token(), () -> publisher.publishConfirmRead(task.token()))) {
            log.warn("Task {} was finalized before its read confirmation went out", task.token());
        }
    }

    private Optional<Task> activeFor(String kind, String sessionId, String experimentId) {
        Optional<Task> match = core.activeMatching(sessionId, experimentId);
        if (match.isEmpty()) {
            String active = core.active().map(t -> t.token().toString()).orElse("none");
            log.warn("Dropping {} for {}/{}: active task is {}", kind, sessionId, experimentId, active);
        }
        return match;
    }
}
