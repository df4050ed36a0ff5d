package colormix.coordinator.protocol;

/**
 * Inbound payload is not valid JSON or lacks required structure.
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
