package colormix.coordinator.messaging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Loopback broker running inside the process. Messages are delivered in
 * publish order on a single dispatch thread, the way an MQTT client delivers
 * them from its network thread. Used by the device simulator and by tests.
 */
public class InMemoryMessagingGateway implements MessagingGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessagingGateway.class);

    /** A message seen by the bus. */
    public record PublishedMessage(String topic, String payload) {
    }

    public static final int DEFAULT_HISTORY_LIMIT = 1000;

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Deque<PublishedMessage> published = new ArrayDeque<>();
    private final int historyLimit;
    private final ExecutorService dispatcher;

    private volatile boolean connected = false;
    private volatile boolean closed = false;

    public InMemoryMessagingGateway() {
        this(DEFAULT_HISTORY_LIMIT);
    }

    /**
     * @param historyLimit how many of the latest published messages to keep
     */
    public InMemoryMessagingGateway(int historyLimit) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be positive");
        }
        this.historyLimit = historyLimit;
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "colormix-bus");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void connect() {
        if (closed) {
            throw new MessagingException("gateway is closed");
        }
        connected = true;
        log.info("In-memory message bus connected");
    }

    @Override
    public void subscribe(Collection<String> topicFilters, MessageHandler handler) {
        subscriptions.add(new Subscription(new ArrayList<>(topicFilters), handler));
        log.debug("Subscribed {} to {}", handler.getClass().getSimpleName(), topicFilters);
    }

    @Override
    public void publish(String topic, String payload) {
        if (closed) {
            throw new MessagingException("gateway is closed");
        }
        remember(new PublishedMessage(topic, payload));
        if (!connected) {
            log.warn("Bus not connected, dropping message on {}", topic);
            return;
        }
        dispatcher.execute(() -> deliver(topic, payload));
    }

    private void remember(PublishedMessage message) {
        synchronized (published) {
            if (published.size() == historyLimit) {
                published.removeFirst();
            }
            published.addLast(message);
        }
    }

    private void deliver(String topic, String payload) {
        for (Subscription sub : subscriptions) {
            if (!sub.accepts(topic)) {
                continue;
            }
            try {
                sub.handler().onMessage(topic, payload);
            } catch (Exception e) {
                log.error("Handler failed for message on {}", topic, e);
            }
        }
    }

    /** Simulate a transport outage: messages published while down are dropped. */
    public void disconnect() {
        connected = false;
        log.info("In-memory message bus disconnected");
    }

    @Override
    public boolean isConnected() {
        return connected && !closed;
    }

    /**
     * The latest published messages, oldest first, including ones dropped
     * while disconnected.
     */
    public List<PublishedMessage> published() {
        synchronized (published) {
            return List.copyOf(published);
        }
    }

    /** Recorded messages published to one topic, in order. */
    public List<PublishedMessage> publishedTo(String topic) {
        return published().stream().filter(m -> m.topic().equals(topic)).toList();
    }

    /**
     * Wait until all messages published so far have been delivered.
     */
    public void awaitDelivery(long timeoutMs) throws InterruptedException {
        CountDownLatch marker = new CountDownLatch(1);
        dispatcher.execute(marker::countDown);
        if (!marker.await(timeoutMs, TimeUnit.MILLISECONDS)) {
            log.warn("Delivery did not drain within {}ms", timeoutMs);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        connected = false;
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(2, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("In-memory message bus closed");
    }
}
