package colormix.coordinator.core;

import colormix.coordinator.model.ExperimentResult;
import colormix.coordinator.model.SessionToken;
import colormix.coordinator.model.Task;
import colormix.coordinator.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owner of all shared coordination state: the task store, the FIFO queue of
 * task keys, the active-task slot and the last sensor reading.
 *
 * Every read and write goes through one lock. Status transitions signal a
 * condition so submitters can wait for their task to leave the queue without
 * polling. The only I/O under the lock is what callers hand to
 * {@link #runIfActive}.
 */
public final class CoordinatorCore {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorCore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition statusChanged = lock.newCondition();

    private final TaskStore store = new TaskStore();
    private final Deque<SessionToken> queue = new ArrayDeque<>();
    private final Set<SessionToken> issued = new HashSet<>();
    private final Supplier<String> experimentIds;

    private SessionToken active;
    private Map<String, Object> lastReading;

    public CoordinatorCore() {
        this(CoordinatorCore::randomExperimentId);
    }

    CoordinatorCore(Supplier<String> experimentIds) {
        this.experimentIds = experimentIds;
    }

    static String randomExperimentId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    // ---- ADMISSION ----

    /**
     * Issue a session token that this process has never issued before.
     */
    public SessionToken reserveToken(String sessionId) {
        lock.lock();
        try {
            SessionToken token = new SessionToken(sessionId, experimentIds.get());
            while (!issued.add(token)) {
                log.debug("Experiment id collision for {}, regenerating", token);
                token = new SessionToken(sessionId, experimentIds.get());
            }
            return token;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store a QUEUED task and append its key to the queue.
     *
     * @return 1-based queue position at the time of the append
     */
    public int enqueue(Task task) {
        if (task.status() != TaskStatus.QUEUED) {
            throw new IllegalArgumentException("only QUEUED tasks can be enqueued: " + task);
        }
        lock.lock();
        try {
            store.put(task);
            queue.addLast(task.token());
            statusChanged.signalAll();
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 1-based position of the token in the queue, 0 if not queued
     */
    public int queuePosition(SessionToken token) {
        lock.lock();
        try {
            int position = 1;
            for (SessionToken queued : queue) {
                if (queued.equals(token)) {
                    return position;
                }
                position++;
            }
            return 0;
        } finally {
            lock.unlock();
        }
    }

    // ---- WORKER ----

    /**
     * Pop the next queued task and make it the active one.
     * Does nothing while another task is active.
     *
     * @return the task now PROCESSING, or empty if nothing was started
     */
    public Optional<Task> activateNext(Instant now) {
        lock.lock();
        try {
            if (active != null || queue.isEmpty()) {
                return Optional.empty();
            }
            SessionToken token = queue.pollFirst();
            Task queued = store.get(token)
                    .orElseThrow(() -> new IllegalStateException("Queued key without a stored task: " + token));
            if (queued.status() != TaskStatus.QUEUED) {
                throw new IllegalStateException("Queued key points at a " + queued.status() + " task: " + token);
            }

            Task processing = queued.toBuilder()
                    .status(TaskStatus.PROCESSING)
                    .startedAt(now)
                    .build();
            store.replace(processing);
            active = token;
            lastReading = null;
            statusChanged.signalAll();
            return Optional.of(processing);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Finalize the active task as TIMED_OUT if it has been processing for
     * longer than the timeout.
     */
    public Optional<ExperimentResult> timeOutActive(Instant now, Duration timeout) {
        lock.lock();
        try {
            Task task = activeTask();
            if (task == null || task.elapsed(now).compareTo(timeout) <= 0) {
                return Optional.empty();
            }
            String message = "Device did not respond within " + timeout.toSeconds() + "s";
            Task finished = finish(task, TaskStatus.TIMED_OUT, message, now);
            return Optional.of(ExperimentResult.timedOut(finished, message, now));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Finalize the active task as ERRORED if it still carries the given token.
     */
    public Optional<ExperimentResult> failActive(SessionToken token, String message, Instant now) {
        lock.lock();
        try {
            Task task = activeTask();
            if (task == null || !task.token().equals(token)) {
                return Optional.empty();
            }
            Task finished = finish(task, TaskStatus.ERRORED, message, now);
            return Optional.of(ExperimentResult.errored(finished, message, now));
        } finally {
            lock.unlock();
        }
    }

    // ---- DEVICE EVENTS ----

    /**
     * @return the active task if its token matches the given ids
     */
    public Optional<Task> activeMatching(String sessionId, String experimentId) {
        lock.lock();
        try {
            Task task = activeTask();
            if (task == null || !task.token().matches(sessionId, experimentId)) {
                return Optional.empty();
            }
            return Optional.of(task);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run an action while the token is guaranteed to stay active. Finalizing
     * the task waits until the action returns, so a follow-up command handed
     * to the transport here always goes out before a timeout command.
     * The action must not block.
     *
     * @return false, without running the action, if the token is not active
     */
    public boolean runIfActive(SessionToken token, Runnable action) {
        lock.lock();
        try {
            if (active == null || !active.equals(token)) {
                return false;
            }
            action.run();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remember a sensor reading for the active task.
     *
     * @return false if the token no longer belongs to the active task
     */
    public boolean storeSensorReading(SessionToken token, Map<String, Object> reading) {
        lock.lock();
        try {
            if (active == null || !active.equals(token)) {
                return false;
            }
            lastReading = reading == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(reading));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Finalize the active task as COMPLETED with the last stored sensor reading.
     *
     * @return the result, or empty if the token is not the active one
     */
    public Optional<ExperimentResult> completeActive(SessionToken token, Instant now) {
        lock.lock();
        try {
            Task task = activeTask();
            if (task == null || !task.token().equals(token)) {
                return Optional.empty();
            }
            Map<String, Object> reading = lastReading;
            if (reading == null) {
                log.warn("Task {} completed without a sensor reading", token);
                reading = Map.of();
            }
            Task finished = finish(task, TaskStatus.COMPLETED, null, now);
            return Optional.of(ExperimentResult.completed(finished, reading, now));
        } finally {
            lock.unlock();
        }
    }

    // ---- SUBMITTERS ----

    /**
     * Block until the task has left QUEUED.
     *
     * @return the task state observed after leaving the queue
     */
    public Task awaitLeftQueued(SessionToken token, Duration timeout)
            throws InterruptedException, TimeoutException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                Task task = store.get(token)
                        .orElseThrow(() -> new IllegalStateException("Unknown task: " + token));
                if (task.status() != TaskStatus.QUEUED) {
                    return task;
                }
                if (remaining <= 0) {
                    throw new TimeoutException("Task " + token + " still queued after " + timeout);
                }
                remaining = statusChanged.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop a finished task from the store once its result has been handed over.
     */
    public Optional<Task> release(SessionToken token) {
        lock.lock();
        try {
            Optional<Task> task = store.get(token);
            if (task.isEmpty()) {
                return Optional.empty();
            }
            if (!task.get().isTerminal()) {
                throw new IllegalStateException("Cannot release unfinished task: " + task.get());
            }
            return store.remove(token);
        } finally {
            lock.unlock();
        }
    }

    // ---- QUERIES ----

    public Optional<Task> find(SessionToken token) {
        lock.lock();
        try {
            return store.get(token);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Task> active() {
        lock.lock();
        try {
            return Optional.ofNullable(activeTask());
        } finally {
            lock.unlock();
        }
    }

    public List<SessionToken> queuedTokens() {
        lock.lock();
        try {
            return new ArrayList<>(queue);
        } finally {
            lock.unlock();
        }
    }

    public int queueSize() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public Map<TaskStatus, Integer> countByStatus() {
        lock.lock();
        try {
            return store.countByStatus();
        } finally {
            lock.unlock();
        }
    }

    public List<Task> tasks() {
        lock.lock();
        try {
            return store.all();
        } finally {
            lock.unlock();
        }
    }

    private Task activeTask() {
        if (active == null) {
            return null;
        }
        return store.get(active)
                .orElseThrow(() -> new IllegalStateException("Active key without a stored task: " + active));
    }

    private Task finish(Task task, TaskStatus status, String errorMessage, Instant now) {
        Task finished = task.toBuilder()
                .status(status)
                .errorMessage(errorMessage)
                .finishedAt(now)
                .build();
        store.replace(finished);
        active = null;
        lastReading = null;
        statusChanged.signalAll();
        log.info("Task {} finished: {}", finished.token(), status);
        return finished;
    }
}
