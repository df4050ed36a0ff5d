package colormix.coordinator.api.v1;

import colormix.coordinator.api.Controller;
import colormix.coordinator.api.v1.dto.HealthResponse;
import colormix.coordinator.messaging.MessagingGateway;
import colormix.coordinator.model.TaskStatus;
import colormix.coordinator.repository.WellPool;
import colormix.coordinator.server.RouterHandler;
import colormix.coordinator.service.TaskService;
import colormix.coordinator.store.Database;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Map;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    static final String VERSION = "1.0.0";

    private final Database database;
    private final MessagingGateway gateway;
    private final WellPool wellPool;
    private final TaskService taskService;

    public HealthController(Database database, MessagingGateway gateway, WellPool wellPool,
            TaskService taskService) {
        this.database = database;
        this.gateway = gateway;
        this.wellPool = wellPool;
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("connection failed")));
            }

            Map<TaskStatus, Integer> counts = taskService.countByStatus();
            HealthResponse response = HealthResponse.healthy(
                    gateway.isConnected(),
                    formatUptime(),
                    VERSION,
                    counts.getOrDefault(TaskStatus.QUEUED, 0),
                    counts.getOrDefault(TaskStatus.PROCESSING, 0),
                    wellPool.countUnused());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.errorBody(HttpResponseStatus.SERVICE_UNAVAILABLE, "health check failed");
        }
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
