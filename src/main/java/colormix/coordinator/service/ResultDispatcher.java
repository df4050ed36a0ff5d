package colormix.coordinator.service;

import colormix.coordinator.model.DepositResult;
import colormix.coordinator.model.ExperimentResult;
import colormix.coordinator.model.SessionToken;
import colormix.coordinator.repository.ResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Rendezvous between whoever finalizes a task (worker loop or device event
 * router) and the submitter waiting for its result, keyed by session token.
 *
 * The first deposit per token wins; later ones are logged and ignored. Each
 * delivered result is also handed to the result repository in the
 * background.
 */
public class ResultDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResultDispatcher.class);

    private final ConcurrentHashMap<SessionToken, CompletableFuture<ExperimentResult>> pending = new ConcurrentHashMap<>();
    private final Set<SessionToken> delivered = ConcurrentHashMap.newKeySet();
    private final ResultRepository repository;
    private final ExecutorService persister;

    public ResultDispatcher() {
        this(null);
    }

    /**
     * @param repository where delivered results are saved, may be null
     */
    public ResultDispatcher(ResultRepository repository) {
        this.repository = repository;
        this.persister = repository == null ? null : Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "colormix-results");
            t.setDaemon(true);
            return t;
        });
    }

    public DepositResult deposit(SessionToken token, ExperimentResult result) {
        Objects.requireNonNull(token, "token is required");
        Objects.requireNonNull(result, "result is required");
        if (!token.equals(result.token())) {
            throw new IllegalArgumentException("result " + result.token() + " deposited under " + token);
        }

        if (!delivered.add(token)) {
            log.warn("Duplicate result for {} ignored ({})", token, result.status());
            return DepositResult.ALREADY_DELIVERED;
        }

        slot(token).complete(result);
        log.debug("Result deposited for {}: {}", token, result.status());
        persist(result);
        return DepositResult.DELIVERED;
    }

    /**
     * Block until the result for the token is deposited.
     *
     * @throws TimeoutException if nothing was deposited within the timeout
     */
    public ExperimentResult awaitResult(SessionToken token, Duration timeout)
            throws InterruptedException, TimeoutException {
        CompletableFuture<ExperimentResult> future = slot(token);
        try {
            ExperimentResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            pending.remove(token, future);
            return result;
        } catch (ExecutionException e) {
            // futures here are only ever completed normally
            throw new IllegalStateException("Result slot failed for " + token, e.getCause());
        }
    }

    public boolean isDelivered(SessionToken token) {
        return delivered.contains(token);
    }

    /**
     * @return number of tokens with a waiter or an unclaimed result
     */
    public int pendingCount() {
        return pending.size();
    }

    private CompletableFuture<ExperimentResult> slot(SessionToken token) {
        return pending.computeIfAbsent(token, t -> new CompletableFuture<>());
    }

    private void persist(ExperimentResult result) {
        if (persister == null) {
            return;
        }
        try {
            persister.execute(() -> {
                try {
                    repository.save(result);
                } catch (Exception e) {
                    log.error("Failed to persist result {}", result.token(), e);
                }
            });
        } catch (RuntimeException e) {
            log.warn("Result {} not persisted: {}", result.token(), e.getMessage());
        }
    }

    @Override
    public void close() {
        if (persister == null) {
            return;
        }
        persister.shutdown();
        try {
            if (!persister.awaitTermination(5, TimeUnit.SECONDS)) {
                persister.shutdownNow();
                log.warn("Result persister forcefully stopped");
            }
        } catch (InterruptedException e) {
            persister.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
