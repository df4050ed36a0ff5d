package colormix.coordinator.core;

import colormix.coordinator.model.SessionToken;
import colormix.coordinator.model.Task;
import colormix.coordinator.model.TaskStatus;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory side table of tasks keyed by session token.
 * Not thread-safe: only {@link CoordinatorCore} touches it, under its lock.
 */
final class TaskStore {

    private final Map<SessionToken, Task> tasks = new LinkedHashMap<>();

    void put(Task task) {
        if (tasks.putIfAbsent(task.token(), task) != null) {
            throw new IllegalStateException("Task already stored: " + task.token());
        }
    }

    Optional<Task> get(SessionToken token) {
        return Optional.ofNullable(tasks.get(token));
    }

    /**
     * Replace the stored state of an existing task.
     */
    void replace(Task task) {
        if (tasks.replace(task.token(), task) == null) {
            throw new IllegalStateException("Task not stored: " + task.token());
        }
    }

    Optional<Task> remove(SessionToken token) {
        return Optional.ofNullable(tasks.remove(token));
    }

    Map<TaskStatus, Integer> countByStatus() {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0);
        }
        for (Task task : tasks.values()) {
            counts.merge(task.status(), 1, Integer::sum);
        }
        return counts;
    }

    List<Task> all() {
        return new ArrayList<>(tasks.values());
    }
}
