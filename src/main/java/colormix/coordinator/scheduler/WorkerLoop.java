package colormix.coordinator.scheduler;

import colormix.coordinator.config.CoordinatorConfig;
import colormix.coordinator.core.CoordinatorCore;
import colormix.coordinator.model.ExperimentResult;
import colormix.coordinator.model.Task;
import colormix.coordinator.service.DeviceCommandPublisher;
import colormix.coordinator.service.ResultDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * One tick of the device worker.
 *
 * Each tick either:
 * 1. times out the active task once it has been processing longer than the
 * task timeout, or
 * 2. starts the next queued task when the device is idle and sends its mix
 * command.
 *
 * Only one task is ever active; a task started in one tick is timed out by a
 * later tick at the earliest.
 */
public class WorkerLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    /** What a tick did, for callers that drive ticks by hand. */
    public enum TickOutcome {
        IDLE,
        BUSY,
        TIMED_OUT,
        STARTED,
        ERRORED
    }

    private final CoordinatorCore core;
    private final DeviceCommandPublisher publisher;
    private final ResultDispatcher dispatcher;
    private final CoordinatorConfig config;

    public WorkerLoop(CoordinatorCore core, DeviceCommandPublisher publisher, ResultDispatcher dispatcher,
            CoordinatorConfig config) {
        this.core = core;
        this.publisher = publisher;
        this.dispatcher = dispatcher;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            tick(Instant.now());
        } catch (Exception e) {
            log.error("Worker tick error", e);
        }
    }

    public TickOutcome tick(Instant now) {
        Optional<ExperimentResult> expired = core.timeOutActive(now, config.taskTimeout());
        if (expired.isPresent()) {
            ExperimentResult result = expired.get();
            log.warn("Task {} timed out after {}s", result.token(), config.taskTimeout().toSeconds());
            try {
                publisher.publishTimeout(result.token());
            } catch (RuntimeException e) {
                log.error("Failed to send timeout command for {}", result.token(), e);
            }
            dispatcher.deposit(result.token(), result);
            return TickOutcome.TIMED_OUT;
        }

        if (core.active().isPresent()) {
            return TickOutcome.BUSY;
        }

        Optional<Task> next = core.activateNext(now);
        if (next.isEmpty()) {
            return TickOutcome.IDLE;
        }

        Task task = next.get();
        log.info("Processing {} in well {} ({} still queued)", task.token(), task.well(), core.queueSize());
        try {
            publisher.publishMix(task);
            return TickOutcome.STARTED;
        } catch (RuntimeException e) {
            log.error("Failed to send mix command for {}", task.token(), e);
            String message = "Mix command could not be sent: " + e.getMessage();
            core.failActive(task.token(), message, Instant.now())
                    .ifPresent(result -> dispatcher.deposit(task.token(), result));
            return TickOutcome.ERRORED;
        }
    }
}
