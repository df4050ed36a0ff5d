package colormix.coordinator.messaging;

/**
 * MQTT topic filter matching.
 */
public final class TopicFilter {

    private TopicFilter() {
    }

    /**
     * Check whether a topic name matches a subscription filter.
     * {@code +} matches exactly one level, a trailing {@code #} matches any
     * number of remaining levels (including none).
     */
    public static boolean matches(String filter, String topic) {
        if (filter == null || topic == null) {
            return false;
        }
        String[] f = filter.split("/", -1);
        String[] t = topic.split("/", -1);

        for (int i = 0; i < f.length; i++) {
            if ("#".equals(f[i])) {
                return i == f.length - 1;
            }
            if (i >= t.length) {
                return false;
            }
            if (!"+".equals(f[i]) && !f[i].equals(t[i])) {
                return false;
            }
        }
        return f.length == t.length;
    }
}
