package colormix.coordinator.api.v1;

import colormix.coordinator.api.Controller;
import colormix.coordinator.api.v1.dto.ExperimentResponse;
import colormix.coordinator.api.v1.dto.QueueResponse;
import colormix.coordinator.model.SessionToken;
import colormix.coordinator.server.RouterHandler;
import colormix.coordinator.service.TaskService;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Device queue snapshot.
 * GET /api/v1/queue
 */
public class QueueController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(QueueController.class);

    private final TaskService taskService;

    public QueueController(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/queue".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            ExperimentResponse active = taskService.activeTask()
                    .map(task -> ExperimentResponse.from(task, 0))
                    .orElse(null);

            List<SessionToken> tokens = taskService.queuedTokens();
            List<ExperimentResponse> queued = new ArrayList<>();
            for (int i = 0; i < tokens.size(); i++) {
                int position = i + 1;
                // a task can leave the queue between the two reads
                taskService.findOpenTask(tokens.get(i))
                        .ifPresent(task -> queued.add(ExperimentResponse.from(task, position)));
            }

            QueueResponse response = new QueueResponse(active, queued.size(), queued);
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (Exception e) {
            log.error("Queue snapshot failed", e);
            return ControllerResponse.error("queue snapshot failed");
        }
    }
}
