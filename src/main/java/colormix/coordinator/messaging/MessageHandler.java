package colormix.coordinator.messaging;

/**
 * Receives inbound messages from a {@link MessagingGateway}.
 * Called on the transport's thread; implementations must not block for long.
 */
@FunctionalInterface
public interface MessageHandler {

    void onMessage(String topic, String payload);
}
