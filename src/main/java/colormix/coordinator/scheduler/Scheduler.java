package colormix.coordinator.scheduler;

import colormix.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the worker loop on a single daemon thread at a fixed delay.
 * A tick that throws is logged by the loop and never cancels the schedule.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final WorkerLoop workerLoop;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    public Scheduler(WorkerLoop workerLoop, CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "colormix-worker");
            t.setDaemon(true);
            return t;
        });
        this.workerLoop = workerLoop;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.pollInterval().toMillis();
        executor.scheduleWithFixedDelay(workerLoop, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Worker loop scheduled every {}ms, task timeout {}s", intervalMs, config.taskTimeout().toSeconds());
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public WorkerLoop workerLoop() {
        return workerLoop;
    }
}
