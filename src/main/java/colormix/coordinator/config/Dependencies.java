package colormix.coordinator.config;

import colormix.coordinator.api.v1.ExperimentController;
import colormix.coordinator.api.v1.HealthController;
import colormix.coordinator.api.v1.QueueController;
import colormix.coordinator.core.CoordinatorCore;
import colormix.coordinator.messaging.MessagingGateway;
import colormix.coordinator.messaging.mqtt.NettyMqttGateway;
import colormix.coordinator.repository.QuotaRepository;
import colormix.coordinator.repository.ResultRepository;
import colormix.coordinator.repository.WellPool;
import colormix.coordinator.scheduler.Scheduler;
import colormix.coordinator.scheduler.WorkerLoop;
import colormix.coordinator.server.CoordinatorHttpServer;
import colormix.coordinator.server.RouterHandler;
import colormix.coordinator.service.AdmissionService;
import colormix.coordinator.service.DeviceCommandPublisher;
import colormix.coordinator.service.DeviceEventRouter;
import colormix.coordinator.service.ResultDispatcher;
import colormix.coordinator.service.TaskService;
import colormix.coordinator.simulation.SimulationService;
import colormix.coordinator.store.Database;
import colormix.coordinator.store.JdbcQuotaRepository;
import colormix.coordinator.store.JdbcResultRepository;
import colormix.coordinator.store.JdbcWellPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * deps.connectGateway(); // subscribe the event router, connect to the broker
 * deps.startScheduler(); // start the worker loop
 * ExperimentSubmission s = deps.admissionService().submit("s1", 100, 100, 100);
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final MessagingGateway gateway;

    // Collaborators
    private final JdbcWellPool wellPool;
    private final QuotaRepository quotaRepository;
    private final ResultRepository resultRepository;

    // Core and services
    private final CoordinatorCore core;
    private final ResultDispatcher resultDispatcher;
    private final DeviceCommandPublisher commandPublisher;
    private final DeviceEventRouter eventRouter;
    private final AdmissionService admissionService;
    private final TaskService taskService;
    private final WorkerLoop workerLoop;

    // Controllers
    private final HealthController healthController;
    private final ExperimentController experimentController;
    private final QueueController queueController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private Scheduler scheduler;
    private SimulationService simulationService;
    private CoordinatorHttpServer httpServer;
    private boolean gatewayConnected = false;

    private Dependencies(CoordinatorConfig config, MessagingGateway gateway) {
        this.config = config;
        this.gateway = gateway;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.wellPool = new JdbcWellPool(database, config);
        this.quotaRepository = new JdbcQuotaRepository(database, config.defaultQuota());
        this.resultRepository = new JdbcResultRepository(database);

        // Core and services
        this.core = new CoordinatorCore();
        this.resultDispatcher = new ResultDispatcher(resultRepository);
        this.commandPublisher = new DeviceCommandPublisher(gateway, config);
        this.eventRouter = new DeviceEventRouter(core, resultDispatcher, commandPublisher, config);
        this.admissionService = new AdmissionService(core, wellPool, quotaRepository, resultDispatcher, config);
        this.taskService = new TaskService(core, resultRepository);
        this.workerLoop = new WorkerLoop(core, commandPublisher, resultDispatcher, config);

        // Controllers (public API)
        this.healthController = new HealthController(database, gateway, wellPool, taskService);
        this.experimentController = new ExperimentController(admissionService, taskService);
        this.queueController = new QueueController(taskService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies talking to the MQTT broker named in the config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, new NettyMqttGateway(config));
    }

    /**
     * Create dependencies on a caller-supplied gateway, e.g. the in-memory bus.
     */
    public static Dependencies create(CoordinatorConfig config, MessagingGateway gateway) {
        return new Dependencies(config, gateway);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public MessagingGateway gateway() {
        return gateway;
    }

    public WellPool wellPool() {
        return wellPool;
    }

    public QuotaRepository quotaRepository() {
        return quotaRepository;
    }

    public ResultRepository resultRepository() {
        return resultRepository;
    }

    public CoordinatorCore core() {
        return core;
    }

    public ResultDispatcher resultDispatcher() {
        return resultDispatcher;
    }

    public DeviceEventRouter eventRouter() {
        return eventRouter;
    }

    public AdmissionService admissionService() {
        return admissionService;
    }

    public TaskService taskService() {
        return taskService;
    }

    public WorkerLoop workerLoop() {
        return workerLoop;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(queueController)
                    .registerController(experimentController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Subscribe the event router to the inbound topics and connect.
     */
    public synchronized void connectGateway() {
        if (gatewayConnected) {
            return;
        }
        gateway.subscribe(config.inboundTopics(), eventRouter);
        gateway.connect();
        gatewayConnected = true;
    }

    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(workerLoop, config);
        }
        return scheduler;
    }

    /**
     * Start the worker loop. Should be called after the gateway is connected.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        Scheduler s;
        synchronized (this) {
            s = scheduler;
        }
        if (s != null) {
            s.stop();
        }
    }

    public synchronized SimulationService simulationService() {
        if (simulationService == null) {
            simulationService = new SimulationService(gateway, config);
        }
        return simulationService;
    }

    public synchronized CoordinatorHttpServer httpServer() {
        if (httpServer == null) {
            httpServer = new CoordinatorHttpServer(config, routerHandler());
        }
        return httpServer;
    }

    /**
     * Fill the well table with an empty plate if it has no wells yet.
     *
     * @return number of wells created, 0 if the plate already existed
     */
    public int seedPlateIfEmpty() {
        if (wellPool.countAll() > 0) {
            log.info("Plate present: {} unused wells", wellPool.countUnused());
            return 0;
        }
        return wellPool.resetPlate();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        closeQuietly("http server", httpServer);
        closeQuietly("scheduler", scheduler);
        closeQuietly("simulation", simulationService);
        closeQuietly("admission", admissionService);
        closeQuietly("gateway", gateway);
        closeQuietly("result dispatcher", resultDispatcher);
        closeQuietly("database", database);

        log.info("Dependencies closed");
    }

    private static void closeQuietly(String name, AutoCloseable resource) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Error closing {}: {}", name, e.getMessage());
        }
    }
}
