package livefeed.spi;

/**
 * Receives notifications from a {@link NotificationFeed}, in the order the store delivers them.
 */
@FunctionalInterface
public interface NotificationSink {

    /**
     * @param channel channel name without any store-level prefix
     * @param payload JSON payload as sent
     */
    void onNotification(String channel, String payload);
}
