package colormix.coordinator.model;

import java.util.Objects;

/**
 * Correlation key for one experiment: the submitter's session id plus the
 * experiment id. Both are echoed back by the device in every event, which is
 * the only way to tie an inbound message to the task that caused it.
 */
public record SessionToken(String sessionId, String experimentId) {

    public SessionToken {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        if (experimentId == null || experimentId.isBlank()) {
            throw new IllegalArgumentException("experimentId is required");
        }
    }

    /** True if the given ids from an inbound payload belong to this token. */
    public boolean matches(String sessionId, String experimentId) {
        return Objects.equals(this.sessionId, sessionId)
                && Objects.equals(this.experimentId, experimentId);
    }

    @Override
    public String toString() {
        return sessionId + "/" + experimentId;
    }
}
