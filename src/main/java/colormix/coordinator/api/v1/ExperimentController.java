package colormix.coordinator.api.v1;

import colormix.coordinator.api.Controller;
import colormix.coordinator.api.v1.dto.ExperimentResponse;
import colormix.coordinator.api.v1.dto.SubmitExperimentRequest;
import colormix.coordinator.model.ExperimentResult;
import colormix.coordinator.model.ProgressEvent;
import colormix.coordinator.model.RejectionReason;
import colormix.coordinator.model.SessionToken;
import colormix.coordinator.model.Task;
import colormix.coordinator.server.RouterHandler;
import colormix.coordinator.service.AdmissionService;
import colormix.coordinator.service.ExperimentSubmission;
import colormix.coordinator.service.TaskService;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for experiment submission and lookup (public API).
 *
 * POST /api/v1/experiments - Submit an experiment
 * GET /api/v1/experiments/{sessionId}/{experimentId} - Status or result of one experiment
 * GET /api/v1/experiments/{sessionId} - Result history of a submitter
 */
public class ExperimentController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(ExperimentController.class);

    private static final Pattern EXPERIMENTS_PATTERN = Pattern.compile("^/api/v1/experiments$");
    private static final Pattern SESSION_PATTERN = Pattern.compile("^/api/v1/experiments/([^/]+)$");
    private static final Pattern EXPERIMENT_PATTERN = Pattern.compile("^/api/v1/experiments/([^/]+)/([^/]+)$");

    static final int DEFAULT_HISTORY_LIMIT = 20;

    private final AdmissionService admissionService;
    private final TaskService taskService;

    public ExperimentController(AdmissionService admissionService, TaskService taskService) {
        this.admissionService = admissionService;
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return EXPERIMENTS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return SESSION_PATTERN.matcher(path).matches() || EXPERIMENT_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                return handleSubmit(req);
            }

            Matcher experimentMatcher = EXPERIMENT_PATTERN.matcher(path);
            if (experimentMatcher.matches()) {
                return handleGetExperiment(new SessionToken(experimentMatcher.group(1), experimentMatcher.group(2)));
            }

            Matcher sessionMatcher = SESSION_PATTERN.matcher(path);
            if (sessionMatcher.matches()) {
                return handleGetHistory(sessionMatcher.group(1), limit(req));
            }

            return ControllerResponse.notFound("unknown experiment endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Experiment controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/experiments - answers with the first progress event
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        SubmitExperimentRequest request = RouterHandler.mapper().readValue(body, SubmitExperimentRequest.class);
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        request.validate();

        ExperimentSubmission submission = admissionService.submit(
                request.submitterId(), request.red(), request.yellow(), request.blue());
        ProgressEvent first = submission.first();

        HttpResponseStatus status;
        if (first.type() != ProgressEvent.Type.REJECTED) {
            status = HttpResponseStatus.ACCEPTED;
        } else if (first.rejection() == RejectionReason.UNAVAILABLE) {
            status = HttpResponseStatus.SERVICE_UNAVAILABLE;
        } else {
            status = HttpResponseStatus.UNPROCESSABLE_ENTITY;
        }
        return ControllerResponse.json(status,
                RouterHandler.mapper().writeValueAsString(ExperimentResponse.from(first)));
    }

    /**
     * GET /api/v1/experiments/{sessionId}/{experimentId}
     */
    private ControllerResponse handleGetExperiment(SessionToken token) throws JsonProcessingException {
        Optional<Task> open = taskService.findOpenTask(token);
        if (open.isPresent()) {
            int position = taskService.queuedTokens().indexOf(token) + 1;
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(ExperimentResponse.from(open.get(), position)));
        }

        Optional<ExperimentResult> result = taskService.findResult(token);
        if (result.isPresent()) {
            return ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(ExperimentResponse.from(result.get())));
        }

        return ControllerResponse.notFound("experiment not found");
    }

    /**
     * GET /api/v1/experiments/{sessionId}?limit=N
     */
    private ControllerResponse handleGetHistory(String sessionId, int limit) throws JsonProcessingException {
        List<ExperimentResponse> results = taskService.history(sessionId, limit).stream()
                .map(ExperimentResponse::from)
                .toList();

        Map<String, Object> response = Map.of(
                "sessionId", sessionId,
                "total", results.size(),
                "results", results);

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private static int limit(FullHttpRequest req) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get("limit");
        if (values == null || values.isEmpty()) {
            return DEFAULT_HISTORY_LIMIT;
        }
        try {
            return Integer.parseInt(values.get(0));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number");
        }
    }
}
