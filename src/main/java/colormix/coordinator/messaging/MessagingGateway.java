package colormix.coordinator.messaging;

import java.util.Collection;

/**
 * Publish/subscribe connection to the device's message broker.
 * Implementations deliver inbound messages on matching topics to the handlers
 * registered with {@link #subscribe}, and keep subscriptions alive across
 * reconnects.
 */
public interface MessagingGateway extends AutoCloseable {

    /**
     * Open the connection. Returns immediately; connection progress and
     * reconnects happen in the background.
     */
    void connect();

    /**
     * Register a handler for the given topic filters. MQTT wildcards
     * ({@code +}, {@code #}) are allowed.
     */
    void subscribe(Collection<String> topicFilters, MessageHandler handler);

    /**
     * Publish a message. Never blocks on the network.
     *
     * @throws MessagingException if the gateway is closed
     */
    void publish(String topic, String payload);

    /**
     * @return true if the transport is currently usable
     */
    boolean isConnected();

    @Override
    void close();
}
