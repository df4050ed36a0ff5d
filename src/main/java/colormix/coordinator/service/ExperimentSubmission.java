package colormix.coordinator.service;

import colormix.coordinator.model.ProgressEvent;
import colormix.coordinator.model.RejectionReason;
import colormix.coordinator.model.SessionToken;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Live progress stream of one submission.
 *
 * The first event is always available when {@code submit} returns: either
 * REJECTED (terminal) or QUEUED. RUNNING and the terminal event follow as the
 * task advances.
 */
public final class ExperimentSubmission {

    private final SessionToken token;
    private final LinkedBlockingQueue<ProgressEvent> unread = new LinkedBlockingQueue<>();
    private final List<ProgressEvent> history = new ArrayList<>();
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile ProgressEvent terminal;

    ExperimentSubmission(SessionToken token) {
        this.token = token;
    }

    static ExperimentSubmission rejected(RejectionReason reason) {
        ExperimentSubmission submission = new ExperimentSubmission(null);
        submission.emit(ProgressEvent.rejected(reason));
        return submission;
    }

    /**
     * @return the session token, or null if the submission was rejected
     */
    public SessionToken token() {
        return token;
    }

    public boolean isRejected() {
        return token == null;
    }

    /**
     * The event emitted synchronously by {@code submit}.
     */
    public ProgressEvent first() {
        synchronized (history) {
            return history.get(0);
        }
    }

    /**
     * Take the next unread event.
     *
     * @return the event, or null if none arrived within the timeout
     */
    public ProgressEvent next(Duration timeout) throws InterruptedException {
        return unread.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Wait for the terminal event. Does not consume unread events.
     */
    public ProgressEvent awaitTerminal(Duration timeout) throws InterruptedException, TimeoutException {
        if (!finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new TimeoutException("No terminal event for " + token + " after " + timeout);
        }
        return terminal;
    }

    public boolean isFinished() {
        return terminal != null;
    }

    /**
     * @return every event emitted so far, in order
     */
    public List<ProgressEvent> events() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    void emit(ProgressEvent event) {
        if (terminal != null) {
            throw new IllegalStateException("Submission " + token + " already finished with " + terminal.type());
        }
        synchronized (history) {
            history.add(event);
        }
        unread.add(event);
        if (event.isTerminal()) {
            terminal = event;
            finished.countDown();
        }
    }

    @Override
    public String toString() {
        return "ExperimentSubmission{token=" + token + ", events=" + events().size() + "}";
    }
}
