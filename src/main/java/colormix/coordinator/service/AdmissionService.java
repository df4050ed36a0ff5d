package colormix.coordinator.service;

import colormix.coordinator.config.CoordinatorConfig;
import colormix.coordinator.core.CoordinatorCore;
import colormix.coordinator.model.ExperimentResult;
import colormix.coordinator.model.ProgressEvent;
import colormix.coordinator.model.RejectionReason;
import colormix.coordinator.model.SessionToken;
import colormix.coordinator.model.Task;
import colormix.coordinator.model.TaskStatus;
import colormix.coordinator.model.Volumes;
import colormix.coordinator.repository.NoUnusedWellsException;
import colormix.coordinator.repository.QuotaRepository;
import colormix.coordinator.repository.WellPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for experiment submissions.
 *
 * Validates volumes, checks quota, claims a well and enqueues the task. The
 * returned {@link ExperimentSubmission} is then driven by a follower thread
 * that reports RUNNING and the terminal result. Followers run on a pool sized
 * by {@code maxConcurrentStreams}.
 */
public class AdmissionService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdmissionService.class);

    static final Duration QUEUE_WAIT_SLICE = Duration.ofSeconds(1);
    static final Duration RESULT_GRACE = Duration.ofSeconds(5);

    private final CoordinatorCore core;
    private final WellPool wellPool;
    private final QuotaRepository quotas;
    private final ResultDispatcher dispatcher;
    private final CoordinatorConfig config;
    private final ExecutorService followers;
    private final Duration resultGrace;

    private volatile boolean closed = false;

    public AdmissionService(CoordinatorCore core, WellPool wellPool, QuotaRepository quotas,
            ResultDispatcher dispatcher, CoordinatorConfig config) {
        this(core, wellPool, quotas, dispatcher, config, RESULT_GRACE);
    }

    AdmissionService(CoordinatorCore core, WellPool wellPool, QuotaRepository quotas,
            ResultDispatcher dispatcher, CoordinatorConfig config, Duration resultGrace) {
        this.core = core;
        this.wellPool = wellPool;
        this.quotas = quotas;
        this.dispatcher = dispatcher;
        this.config = config;
        this.resultGrace = resultGrace;

        AtomicInteger seq = new AtomicInteger();
        this.followers = Executors.newFixedThreadPool(config.maxConcurrentStreams(), r -> {
            Thread t = new Thread(r, "colormix-stream-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Submit an experiment.
     *
     * @return the progress stream; its first event is QUEUED or REJECTED
     */
    public ExperimentSubmission submit(String submitterId, int red, int yellow, int blue) {
        if (submitterId == null || submitterId.isBlank()) {
            throw new IllegalArgumentException("submitterId is required");
        }
        if (closed) {
            throw new IllegalStateException("Admission is closed");
        }

        Volumes volumes = new Volumes(red, yellow, blue);
        if (!volumes.isWithin(config.maxComponentVolume(), config.maxTotalVolume())) {
            return reject(submitterId, RejectionReason.VOLUME, volumes);
        }

        String well;
        try {
            if (quotas.getRemainingQuota(submitterId) <= 0) {
                return reject(submitterId, RejectionReason.QUOTA, volumes);
            }
            well = claimWell();
        } catch (NoUnusedWellsException e) {
            return reject(submitterId, RejectionReason.NO_WELLS, volumes);
        } catch (RuntimeException e) {
            log.error("Admission of {} failed before a well was claimed", submitterId, e);
            return reject(submitterId, RejectionReason.UNAVAILABLE, volumes);
        }

        try {
            if (!quotas.decrement(submitterId)) {
                log.warn("Quota of {} ran out concurrently, well {} stays used", submitterId, well);
                return reject(submitterId, RejectionReason.QUOTA, volumes);
            }
        } catch (RuntimeException e) {
            log.error("Quota update for {} failed, well {} stays used", submitterId, well, e);
            return reject(submitterId, RejectionReason.UNAVAILABLE, volumes);
        }

        SessionToken token = core.reserveToken(submitterId);
        Task task = Task.builder()
                .token(token)
                .volumes(volumes)
                .well(well)
                .status(TaskStatus.QUEUED)
                .createdAt(Instant.now())
                .build();
        int position = core.enqueue(task);
        log.info("Queued {} in well {} at position {}", token, well, position);

        ExperimentSubmission submission = new ExperimentSubmission(token);
        submission.emit(ProgressEvent.queued(token, well, position));
        try {
            followers.execute(() -> follow(submission, task));
        } catch (RejectedExecutionException e) {
            log.warn("No follower for {}, admission is shutting down", token);
        }
        return submission;
    }

    /**
     * Claim the first well that this call manages to mark as used.
     */
    private String claimWell() {
        List<String> candidates = wellPool.findUnusedWells();
        for (String candidate : candidates) {
            if (!wellPool.markUsed(List.of(candidate)).isEmpty()) {
                return candidate;
            }
            log.debug("Well {} was claimed concurrently, trying the next one", candidate);
        }
        throw new NoUnusedWellsException();
    }

    private ExperimentSubmission reject(String submitterId, RejectionReason reason, Volumes volumes) {
        log.info("Rejected submission of {} ({}): {}", submitterId, volumes, reason.message());
        return ExperimentSubmission.rejected(reason);
    }

    private void follow(ExperimentSubmission submission, Task task) {
        SessionToken token = task.token();
        try {
            Task started = awaitStart(token);
            submission.emit(ProgressEvent.running(token, started.well()));

            Duration bound = config.taskTimeout()
                    .plus(config.pollInterval().multipliedBy(2))
                    .plus(resultGrace);
            ExperimentResult result = dispatcher.awaitResult(token, bound);
            submission.emit(ProgressEvent.finished(result));
        } catch (TimeoutException e) {
            log.error("No result for {} within the timeout budget", token);
            finish(submission, abandon(task, "No result received"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Follower for {} interrupted", token);
            finish(submission, ExperimentResult.errored(task, "Coordinator is shutting down", Instant.now()));
        } catch (Exception e) {
            log.error("Follower for {} failed", token, e);
            finish(submission, abandon(task, "Internal error: " + e.getMessage()));
        } finally {
            if (core.find(token).map(Task::isTerminal).orElse(false)) {
                core.release(token);
            }
        }
    }

    /**
     * Give up on a task: finalize it as ERRORED if it is still active, otherwise
     * take whatever result its finalizer deposits within the grace period.
     */
    private ExperimentResult abandon(Task task, String message) {
        SessionToken token = task.token();
        Optional<ExperimentResult> failed = core.failActive(token, message, Instant.now());
        if (failed.isPresent()) {
            dispatcher.deposit(token, failed.get());
        }
        try {
            return dispatcher.awaitResult(token, failed.isPresent() ? Duration.ZERO : resultGrace);
        } catch (TimeoutException e) {
            log.warn("Task {} ended without a deposited result", token);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return ExperimentResult.errored(task, message, Instant.now());
    }

    private static void finish(ExperimentSubmission submission, ExperimentResult result) {
        if (!submission.isFinished()) {
            submission.emit(ProgressEvent.finished(result));
        }
    }

    private Task awaitStart(SessionToken token) throws InterruptedException {
        while (true) {
            try {
                return core.awaitLeftQueued(token, QUEUE_WAIT_SLICE);
            } catch (TimeoutException e) {
                if (closed) {
                    throw new InterruptedException("Admission closed while " + token + " was queued");
                }
            }
        }
    }

    @Override
    public void close() {
        closed = true;
        followers.shutdownNow();
        try {
            if (!followers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Submission followers did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
