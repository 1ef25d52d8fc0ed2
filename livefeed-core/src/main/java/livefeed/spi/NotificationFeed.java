package livefeed.spi;

/**
 * The backing store's notification mechanism, seen as one long-lived receiving feed.
 *
 * <p>The {@link livefeed.registry.ChannelRegistry} is the only caller. It opens the feed
 * lazily, calls {@link #listen} and {@link #unlisten} only on 0&rarr;1 and 1&rarr;0 listener
 * transitions, and never calls two methods concurrently except {@link #notify}.
 *
 * <p>Failures are reported as {@link livefeed.NotificationException}.
 *
 * @see livefeed.registry.InMemoryNotificationFeed
 * @see livefeed.jdbc.notify.PostgresNotificationFeed
 */
public interface NotificationFeed extends AutoCloseable {

    /**
     * Opens the receiving side. Notifications for listened channels go to {@code sink}.
     */
    void open(NotificationSink sink);

    /** Starts receiving notifications on {@code channel}. */
    void listen(String channel);

    /** Stops receiving notifications on {@code channel}. */
    void unlisten(String channel);

    /**
     * Sends {@code payload} on {@code channel} in its own auto-committed operation,
     * independent of any caller transaction.
     */
    void notify(String channel, String payload);

    @Override
    void close();
}
