package livefeed.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import livefeed.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code livefeed.sessions.opened} / {@code livefeed.sessions.closed}</li>
 *   <li>{@code livefeed.subscriptions.started} / {@code .failed} / {@code .ended}</li>
 *   <li>{@code livefeed.messages.published}: message frames sent</li>
 *   <li>{@code livefeed.errors.sent}: error frames sent</li>
 *   <li>{@code livefeed.channel.listen} / {@code livefeed.channel.unlisten}: store listens started and stopped</li>
 *   <li>{@code livefeed.notifications.received}</li>
 *   <li>{@code livefeed.listener.failures}</li>
 *   <li>{@code livefeed.connections.terminated}: connections dropped by the liveness monitor</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code livefeed.sessions.active}</li>
 *   <li>{@code livefeed.channels.active}</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final List<Meter> meters = new ArrayList<>();
  private final Counter sessionsOpened;
  private final Counter sessionsClosed;
  private final Counter subscriptionsStarted;
  private final Counter subscriptionsFailed;
  private final Counter subscriptionsEnded;
  private final Counter messagesPublished;
  private final Counter errorsSent;
  private final Counter channelListen;
  private final Counter channelUnlisten;
  private final Counter notificationsReceived;
  private final Counter listenerFailures;
  private final Counter connectionsTerminated;

  private final AtomicInteger activeSessions = new AtomicInteger();
  private final AtomicInteger activeChannels = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "livefeed"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "livefeed");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "chat.livefeed"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.sessionsOpened = counter(namePrefix + ".sessions.opened", "Subscription sessions opened");
    this.sessionsClosed = counter(namePrefix + ".sessions.closed", "Subscription sessions closed");
    this.subscriptionsStarted = counter(namePrefix + ".subscriptions.started", "Subscriptions established");
    this.subscriptionsFailed = counter(namePrefix + ".subscriptions.failed", "Subscribe requests rejected or failed");
    this.subscriptionsEnded = counter(namePrefix + ".subscriptions.ended", "Subscriptions torn down");
    this.messagesPublished = counter(namePrefix + ".messages.published", "Message frames sent");
    this.errorsSent = counter(namePrefix + ".errors.sent", "Error frames sent");
    this.channelListen = counter(namePrefix + ".channel.listen", "Store channel listens started");
    this.channelUnlisten = counter(namePrefix + ".channel.unlisten", "Store channel listens stopped");
    this.notificationsReceived = counter(namePrefix + ".notifications.received", "Store notifications received");
    this.listenerFailures = counter(namePrefix + ".listener.failures", "Notification listeners that threw");
    this.connectionsTerminated = counter(namePrefix + ".connections.terminated",
        "Connections terminated for missing pongs");

    meters.add(Gauge.builder(namePrefix + ".sessions.active", activeSessions, AtomicInteger::get)
        .description("Open subscription sessions")
        .register(registry));
    meters.add(Gauge.builder(namePrefix + ".channels.active", activeChannels, AtomicInteger::get)
        .description("Channels the store is listening on")
        .register(registry));
  }

  private Counter counter(String name, String description) {
    Counter counter = Counter.builder(name).description(description).register(registry);
    meters.add(counter);
    return counter;
  }

  @Override
  public void incrementSessionsOpened() {
    if (closed) return;
    sessionsOpened.increment();
  }

  @Override
  public void incrementSessionsClosed() {
    if (closed) return;
    sessionsClosed.increment();
  }

  @Override
  public void incrementSubscriptionsStarted() {
    if (closed) return;
    subscriptionsStarted.increment();
  }

  @Override
  public void incrementSubscriptionsFailed() {
    if (closed) return;
    subscriptionsFailed.increment();
  }

  @Override
  public void incrementSubscriptionsEnded() {
    if (closed) return;
    subscriptionsEnded.increment();
  }

  @Override
  public void incrementMessagesPublished() {
    if (closed) return;
    messagesPublished.increment();
  }

  @Override
  public void incrementErrorsSent() {
    if (closed) return;
    errorsSent.increment();
  }

  @Override
  public void incrementChannelListen() {
    if (closed) return;
    channelListen.increment();
  }

  @Override
  public void incrementChannelUnlisten() {
    if (closed) return;
    channelUnlisten.increment();
  }

  @Override
  public void incrementNotificationsReceived() {
    if (closed) return;
    notificationsReceived.increment();
  }

  @Override
  public void incrementListenerFailures() {
    if (closed) return;
    listenerFailures.increment();
  }

  @Override
  public void incrementConnectionsTerminated() {
    if (closed) return;
    connectionsTerminated.increment();
  }

  @Override
  public void recordActiveSessions(int count) {
    if (closed) return;
    activeSessions.set(count);
  }

  @Override
  public void recordActiveChannels(int count) {
    if (closed) return;
    activeChannels.set(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
