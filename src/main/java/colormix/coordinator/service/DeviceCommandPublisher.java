package colormix.coordinator.service;

import colormix.coordinator.config.CoordinatorConfig;
import colormix.coordinator.messaging.MessagingGateway;
import colormix.coordinator.model.SessionToken;
import colormix.coordinator.model.Task;
import colormix.coordinator.protocol.DeviceMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes device commands and publishes them on the configured topics.
 */
public class DeviceCommandPublisher {

    private static final Logger log = LoggerFactory.getLogger(DeviceCommandPublisher.class);

    private final MessagingGateway gateway;
    private final CoordinatorConfig config;

    public DeviceCommandPublisher(MessagingGateway gateway, CoordinatorConfig config) {
        this.gateway = gateway;
        this.config = config;
    }

    public void publishMix(Task task) {
        log.info("Mix command for {}: R={} Y={} B={} well={}", task.token(),
                task.volumes().red(), task.volumes().yellow(), task.volumes().blue(), task.well());
        gateway.publish(config.deviceCommandTopic(), DeviceMessages.mixCommand(task));
    }

    public void publishSensorRead(Task task) {
        log.info("Sensor read command for {} at well {}", task.token(), task.well());
        gateway.publish(config.sensorCommandTopic(), DeviceMessages.sensorReadCommand(task));
    }

    public void publishConfirmRead(SessionToken token) {
        log.debug("Confirm read for {}", token);
        gateway.publish(config.deviceCommandTopic(), DeviceMessages.confirmReadCommand(token));
    }

    public void publishTimeout(SessionToken token) {
        log.warn("Timeout command for {}", token);
        gateway.publish(config.deviceCommandTopic(), DeviceMessages.timeoutCommand(token));
    }
}
