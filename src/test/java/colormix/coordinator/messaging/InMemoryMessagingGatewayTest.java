package colormix.coordinator.messaging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMessagingGatewayTest {

    private InMemoryMessagingGateway bus;

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessagingGateway();
        bus.connect();
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void deliversInPublishOrderToMatchingSubscribers() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        bus.subscribe(List.of("status/+/complete"), (topic, payload) -> received.add(payload));

        bus.publish("status/ot2/complete", "1");
        bus.publish("command/ot2/pipette", "ignored");
        bus.publish("status/ot2/complete", "2");
        bus.awaitDelivery(1000);

        assertEquals(List.of("1", "2"), received);
        assertEquals(3, bus.published().size());
        assertEquals(1, bus.publishedTo("command/ot2/pipette").size());
    }

    @Test
    void dropsWhileDisconnectedButRecords() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        bus.subscribe(List.of("#"), (topic, payload) -> received.add(payload));

        bus.disconnect();
        assertFalse(bus.isConnected());
        bus.publish("a/b", "lost");
        bus.awaitDelivery(1000);

        assertTrue(received.isEmpty());
        assertEquals(1, bus.publishedTo("a/b").size());
    }

    @Test
    void failingHandlerDoesNotStopOthers() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        bus.subscribe(List.of("t"), (topic, payload) -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(List.of("t"), (topic, payload) -> received.add(payload));

        bus.publish("t", "x");
        bus.awaitDelivery(1000);

        assertEquals(List.of("x"), received);
    }

    @Test
    void publishAfterCloseThrows() {
        bus.close();
        assertThrows(MessagingException.class, () -> bus.publish("t", "x"));
    }
    @Test
    void historyKeepsOnlyTheLatestMessages() {
        InMemoryMessagingGateway small = new InMemoryMessagingGateway(3);
        try {
            small.connect();
            for (int i = 1; i <= 5; i++) {
                small.publish("t", String.valueOf(i));
            }

            List<String> kept = small.published().stream()
                    .map(InMemoryMessagingGateway.PublishedMessage::payload)
                    .toList();
            assertEquals(List.of("3", "4", "5"), kept);
        } finally {
            small.close();
        }
    }

    @Test
    void historyLimitMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryMessagingGateway(0));
    }
}
