package livefeed.spi;

/**
 * Observability hook for exporting session, subscription and channel counters and gauges
 * to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see livefeed.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    void incrementSessionsOpened();

    void incrementSessionsClosed();

    /** A handler returned its unsubscribe capability. */
    void incrementSubscriptionsStarted();

    /** A handler threw, or a subscribe frame was rejected. */
    void incrementSubscriptionsFailed();

    /** An unsubscribe capability ran, explicitly or on close. */
    void incrementSubscriptionsEnded();

    void incrementMessagesPublished();

    void incrementErrorsSent();

    /** The store started receiving on a channel (0&rarr;1 transition). */
    default void incrementChannelListen() {
    }

    /** The store stopped receiving on a channel (1&rarr;0 transition). */
    default void incrementChannelUnlisten() {
    }

    default void incrementNotificationsReceived() {
    }

    default void incrementListenerFailures() {
    }

    /** The liveness monitor terminated an unresponsive connection. */
    default void incrementConnectionsTerminated() {
    }

    /**
     * Records the number of open sessions.
     *
     * @param count current session count
     */
    default void recordActiveSessions(int count) {
    }

    /**
     * Records the number of channels the store is listening on.
     *
     * @param count current channel count
     */
    default void recordActiveChannels(int count) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementSessionsOpened() {
        }

        @Override
        public void incrementSessionsClosed() {
        }

        @Override
        public void incrementSubscriptionsStarted() {
        }

        @Override
        public void incrementSubscriptionsFailed() {
        }

        @Override
        public void incrementSubscriptionsEnded() {
        }

        @Override
        public void incrementMessagesPublished() {
        }

        @Override
        public void incrementErrorsSent() {
        }
    }
}
