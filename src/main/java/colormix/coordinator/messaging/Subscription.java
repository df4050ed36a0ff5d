package colormix.coordinator.messaging;

import java.util.List;

/**
 * A handler together with the topic filters it was registered for.
 */
public record Subscription(List<String> topicFilters, MessageHandler handler) {

    public Subscription {
        topicFilters = List.copyOf(topicFilters);
    }

    public boolean accepts(String topic) {
        for (String filter : topicFilters) {
            if (TopicFilter.matches(filter, topic)) {
                return true;
            }
        }
        return false;
    }
}
