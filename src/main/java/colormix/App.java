package colormix;

import colormix.coordinator.config.CoordinatorConfig;
import colormix.coordinator.config.Dependencies;
import colormix.coordinator.messaging.InMemoryMessagingGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point.
 *
 * <pre>
 * java -jar colormix-coordinator.jar [config.ini] [--simulate]
 * </pre>
 *
 * Without an ini file the configuration comes from the environment. With
 * --simulate the coordinator runs against an in-process message bus and a
 * simulated device instead of the MQTT broker.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        String iniPath = null;
        boolean simulate = false;
        for (String arg : args) {
            if ("--simulate".equals(arg)) {
                simulate = true;
            } else if (arg.startsWith("--")) {
                System.err.println("Unknown option: " + arg);
                System.err.println("Usage: colormix-coordinator [config.ini] [--simulate]");
                System.exit(2);
            } else {
                iniPath = arg;
            }
        }

        CoordinatorConfig config = loadConfig(iniPath);
        Dependencies deps = simulate
                ? Dependencies.create(config, new InMemoryMessagingGateway())
                : Dependencies.create(config);

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            deps.close();
            shutdown.countDown();
        }, "colormix-shutdown"));

        try {
            int created = deps.seedPlateIfEmpty();
            if (created > 0) {
                log.info("Seeded empty plate with {} wells", created);
            }
            if (simulate) {
                deps.simulationService().start();
            }
            deps.connectGateway();
            deps.startScheduler();
            int port = deps.httpServer().start();
            log.info("ColorMix coordinator running on port {}{}", port, simulate ? " (simulated device)" : "");
        } catch (RuntimeException e) {
            log.error("Startup failed", e);
            System.exit(1);
        }

        shutdown.await();
    }

    static CoordinatorConfig loadConfig(String iniPath) throws IOException {
        if (iniPath == null) {
            return CoordinatorConfig.fromEnv();
        }
        File file = new File(iniPath);
        if (!file.isFile()) {
            throw new IOException("Config file not found: " + file.getAbsolutePath());
        }
        log.info("Loading configuration from {}", file.getAbsolutePath());
        return CoordinatorConfig.fromIni(file);
    }
}
