package colormix.coordinator.simulation;

import colormix.coordinator.config.CoordinatorConfig;
import colormix.coordinator.messaging.MessagingGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts and stops a simulated device on the coordinator's message bus.
 */
public final class SimulationService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final MessagingGateway gateway;
    private final CoordinatorConfig config;

    private SimulatedDevice device;

    public SimulationService(MessagingGateway gateway, CoordinatorConfig config) {
        this.gateway = gateway;
        this.config = config;
    }

    public synchronized SimulatedDevice start() {
        if (device != null) {
            log.warn("Simulation already running");
            return device;
        }

        device = new SimulatedDevice(gateway, config);
        device.attach();
        log.info("Simulation started, device delay {}ms", config.simulatedDeviceDelay().toMillis());
        return device;
    }

    /**
     * Stop answering commands. The device stays subscribed but goes silent, so
     * a task in flight runs into its timeout.
     */
    public synchronized void stop() {
        if (device == null) {
            return;
        }
        device.setSilent(true);
        device.close();
        device = null;
        log.info("Simulation stopped");
    }

    public synchronized boolean isRunning() {
        return device != null;
    }

    public synchronized SimulatedDevice device() {
        return device;
    }

    @Override
    public void close() {
        stop();
    }
}
