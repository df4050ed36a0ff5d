package colormix.coordinator.service;

import colormix.coordinator.core.CoordinatorCore;
import colormix.coordinator.model.ExperimentResult;
import colormix.coordinator.model.SessionToken;
import colormix.coordinator.model.Task;
import colormix.coordinator.model.TaskStatus;
import colormix.coordinator.repository.ResultRepository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over open tasks and persisted results.
 */
public class TaskService {

    static final int MAX_HISTORY = 100;

    private final CoordinatorCore core;
    private final ResultRepository results;

    public TaskService(CoordinatorCore core, ResultRepository results) {
        this.core = core;
        this.results = results;
    }

    /**
     * Task that is still in memory (queued, processing, or finished but not yet
     * handed to its submitter).
     */
    public Optional<Task> findOpenTask(SessionToken token) {
        return core.find(token);
    }

    public Optional<ExperimentResult> findResult(SessionToken token) {
        return results.findByToken(token);
    }

    /**
     * Results of one submitter, most recent first.
     */
    public List<ExperimentResult> history(String sessionId, int limit) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return results.findBySession(sessionId, Math.min(limit, MAX_HISTORY));
    }

    public List<ExperimentResult> recent(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return results.findRecent(Math.min(limit, MAX_HISTORY));
    }

    public Optional<Task> activeTask() {
        return core.active();
    }

    public List<SessionToken> queuedTokens() {
        return core.queuedTokens();
    }

    public Map<TaskStatus, Integer> countByStatus() {
        return core.countByStatus();
    }
}
