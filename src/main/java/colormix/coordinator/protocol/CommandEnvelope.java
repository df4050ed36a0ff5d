package colormix.coordinator.protocol;

import colormix.coordinator.model.SessionToken;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outbound command with the session token the device must echo back.
 */
public record CommandEnvelope<T>(
        @JsonProperty("command") T command,
        @JsonProperty("experiment_id") String experimentId,
        @JsonProperty("session_id") String sessionId) {

    public static <T> CommandEnvelope<T> of(T command, SessionToken token) {
        return new CommandEnvelope<>(command, token.experimentId(), token.sessionId());
    }
}
