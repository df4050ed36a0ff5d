package colormix.coordinator.model;

import java.time.Instant;

/**
 * One step of a submission's progress as seen by the caller.
 *
 * @param type          what happened
 * @param token         session token; null for rejections
 * @param well          assigned well; null for rejections
 * @param queuePosition 1-based position at the time of QUEUED, 0 otherwise
 * @param rejection     reason for REJECTED, null otherwise
 * @param result        terminal result for COMPLETED / TIMED_OUT / ERRORED
 * @param at            when the event was emitted
 */
public record ProgressEvent(
        Type type,
        SessionToken token,
        String well,
        int queuePosition,
        RejectionReason rejection,
        ExperimentResult result,
        Instant at) {

    public enum Type {
        REJECTED,
        QUEUED,
        RUNNING,
        COMPLETED,
        TIMED_OUT,
        ERRORED;

        public boolean isTerminal() {
            return this != QUEUED && this != RUNNING;
        }
    }

    public static ProgressEvent rejected(RejectionReason reason) {
        return new ProgressEvent(Type.REJECTED, null, null, 0, reason, null, Instant.now());
    }

    public static ProgressEvent queued(SessionToken token, String well, int position) {
        return new ProgressEvent(Type.QUEUED, token, well, position, null, null, Instant.now());
    }

    public static ProgressEvent running(SessionToken token, String well) {
        return new ProgressEvent(Type.RUNNING, token, well, 0, null, null, Instant.now());
    }

    public static ProgressEvent finished(ExperimentResult result) {
        Type type = switch (result.status()) {
            case COMPLETED -> Type.COMPLETED;
            case TIMED_OUT -> Type.TIMED_OUT;
            case ERRORED -> Type.ERRORED;
            default -> throw new IllegalArgumentException("not a terminal status: " + result.status());
        };
        return new ProgressEvent(type, result.token(), result.well(), 0, null, result, Instant.now());
    }

    public boolean isTerminal() {
        return type.isTerminal();
    }

    /** Human readable line, as shown to the submitter. */
    public String message() {
        return switch (type) {
            case REJECTED -> "Rejected: " + rejection.message();
            case QUEUED -> "Queued in well " + well + " at position " + queuePosition;
            case RUNNING -> "Running experiment " + token.experimentId() + " in well " + well;
            case COMPLETED -> "Completed experiment " + token.experimentId();
            case TIMED_OUT, ERRORED -> "Failed: " + result.errorMessage();
        };
    }
}
