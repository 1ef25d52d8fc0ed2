package livefeed.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import livefeed.Channel;
import livefeed.NotificationException;
import livefeed.spi.MetricsExporter;
import livefeed.spi.NotificationFeed;
import livefeed.util.DaemonThreadFactory;
import livefeed.util.SerialExecutor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Multiplexes one {@link NotificationFeed} across any number of channel listeners.
 *
 * <p>The feed is opened on the first {@link #listen} call. The store is listening on a
 * channel if and only if that channel has at least one registered listener: the feed's
 * {@code listen} is issued on the 0&rarr;1 transition, before the listener is added, and
 * {@code unlisten} on the 1&rarr;0 transition. Both checks run under the registry lock.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ChannelRegistry registry = ChannelRegistry.builder()
 *     .feed(new InMemoryNotificationFeed())
 *     .build();
 *
 * Unlisten unlisten = registry.listen(COMMENT_INSERT, comment -> ctx.publish(comment));
 * // from a writer's after-commit hook:
 * registry.notify(COMMENT_INSERT, comment);
 * }</pre>
 *
 * <p>Each listener gets its own serial lane on the shared dispatch executor. A failure in one
 * listener is logged and counted, and does not affect the others.
 *
 * @see NotificationFeed
 */
public final class ChannelRegistry implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ChannelRegistry.class.getName());

  private final NotificationFeed feed;
  private final ObjectMapper objectMapper;
  private final ExecutorService dispatchExecutor;
  private final boolean ownsDispatchExecutor;
  private final MetricsExporter metrics;

  private final Object lock = new Object();
  private final Map<String, Set<Registration<?>>> channels = new HashMap<>();
  private boolean opened;
  private boolean closed;

  private ChannelRegistry(Builder builder) {
    this.feed = Objects.requireNonNull(builder.feed, "feed");
    if (builder.dispatchThreads <= 0) {
      throw new IllegalArgumentException("dispatchThreads must be > 0");
    }
    this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.dispatchExecutor != null) {
      this.dispatchExecutor = builder.dispatchExecutor;
      this.ownsDispatchExecutor = false;
    } else {
      this.dispatchExecutor = Executors.newFixedThreadPool(builder.dispatchThreads,
          new DaemonThreadFactory("livefeed-dispatch-"));
      this.ownsDispatchExecutor = true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers {@code listener} on {@code channel}.
   *
   * @return an idempotent handle that removes this registration
   * @throws NotificationException if the store could not start listening; nothing is registered
   * @throws IllegalStateException if the registry has been closed
   */
  public <P> Unlisten listen(Channel<P> channel, NotificationListener<? super P> listener) {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(listener, "listener");
    String name = channel.name();
    Registration<P> registration = new Registration<>(channel, listener);
    synchronized (lock) {
      ensureOpen();
      Set<Registration<?>> listeners = channels.get(name);
      if (listeners == null) {
        startListening(name);
        listeners = new LinkedHashSet<>();
        channels.put(name, listeners);
        metrics.recordActiveChannels(channels.size());
      }
      listeners.add(registration);
    }
    return () -> remove(registration);
  }

  /**
   * Serializes {@code payload} and sends it on {@code channel} through the feed, outside of any
   * caller transaction. Writers call this from an after-commit hook so that the notification is
   * never sent for a write that rolls back.
   *
   * @throws NotificationException if the payload cannot be serialized or sent
   */
  public <P> void notify(Channel<P> channel, P payload) {
    Objects.requireNonNull(channel, "channel");
    synchronized (lock) {
      if (closed) {
        throw new IllegalStateException("ChannelRegistry has been closed");
      }
    }
    String json;
    try {
      json = objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new NotificationException("Failed to serialize payload for channel " + channel.name(), e);
    }
    feed.notify(channel.name(), json);
  }

  /** Returns the number of channels the store is currently listening on. */
  public int activeChannelCount() {
    synchronized (lock) {
      return channels.size();
    }
  }

  /** Returns the number of listeners registered on {@code channelName}. */
  public int listenerCount(String channelName) {
    synchronized (lock) {
      Set<Registration<?>> listeners = channels.get(channelName);
      return listeners == null ? 0 : listeners.size();
    }
  }

  /** Closes the feed and stops the dispatch executor, if the registry created it. */
  @Override
  public void close() {
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      for (Set<Registration<?>> listeners : channels.values()) {
        for (Registration<?> registration : listeners) {
          registration.active = false;
        }
      }
      channels.clear();
      metrics.recordActiveChannels(0);
    }
    try {
      feed.close();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to close notification feed", e);
    }
    if (ownsDispatchExecutor) {
      dispatchExecutor.shutdown();
      try {
        if (!dispatchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
          dispatchExecutor.shutdownNow();
        }
      } catch (InterruptedException e) {
        dispatchExecutor.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("ChannelRegistry has been closed");
    }
    if (!opened) {
      feed.open(this::deliver);
      opened = true;
    }
  }

  private void startListening(String name) {
    try {
      feed.listen(name);
    } catch (NotificationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new NotificationException("Failed to listen on channel " + name, e);
    }
    metrics.incrementChannelListen();
    logger.log(Level.FINE, "Listening on channel {0}", name);
  }

  private void remove(Registration<?> registration) {
    String name = registration.channel.name();
    synchronized (lock) {
      if (!registration.active) {
        return;
      }
      registration.active = false;
      Set<Registration<?>> listeners = channels.get(name);
      if (listeners == null || !listeners.remove(registration) || !listeners.isEmpty()) {
        return;
      }
      // The set is dropped even if the store refuses to stop; strays are discarded in deliver.
      channels.remove(name);
      metrics.recordActiveChannels(channels.size());
      metrics.incrementChannelUnlisten();
      try {
        feed.unlisten(name);
        logger.log(Level.FINE, "Stopped listening on channel {0}", name);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to stop listening on channel " + name, e);
      }
    }
  }

  private void deliver(String channelName, String payload) {
    metrics.incrementNotificationsReceived();
    List<Registration<?>> snapshot;
    synchronized (lock) {
      Set<Registration<?>> listeners = channels.get(channelName);
      if (listeners == null) {
        logger.log(Level.FINE, "Dropping notification for channel {0} with no listeners", channelName);
        return;
      }
      snapshot = new ArrayList<>(listeners);
    }
    JsonNode tree;
    try {
      tree = objectMapper.readTree(payload);
    } catch (JsonProcessingException e) {
      logger.log(Level.WARNING, "Dropping malformed notification on channel " + channelName, e);
      return;
    }
    for (Registration<?> registration : snapshot) {
      registration.dispatch(tree);
    }
  }

  private final class Registration<P> {
    private final Channel<P> channel;
    private final NotificationListener<? super P> listener;
    private final SerialExecutor lane = new SerialExecutor(dispatchExecutor);
    private volatile boolean active = true;

    private Registration(Channel<P> channel, NotificationListener<? super P> listener) {
      this.channel = channel;
      this.listener = listener;
    }

    private void dispatch(JsonNode tree) {
      lane.execute(() -> {
        if (!active) {
          return;
        }
        try {
          P payload = objectMapper.treeToValue(tree, channel.payloadType());
          listener.onNotification(payload);
        } catch (Exception e) {
          metrics.incrementListenerFailures();
          logger.log(Level.WARNING, "Listener failed on channel " + channel.name(), e);
        }
      });
    }
  }

  /** Builder for {@link ChannelRegistry}. */
  public static final class Builder {
    private NotificationFeed feed;
    private ObjectMapper objectMapper;
    private ExecutorService dispatchExecutor;
    private int dispatchThreads = 4;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the store notification feed.
     *
     * <p><b>Required.</b>
     *
     * @param feed the notification feed
     * @return this builder
     */
    public Builder feed(NotificationFeed feed) {
      this.feed = feed;
      return this;
    }

    /**
     * Sets the mapper used to serialize and convert payloads.
     *
     * <p>Optional. Defaults to a plain {@link ObjectMapper}.
     *
     * @param objectMapper the object mapper
     * @return this builder
     */
    public Builder objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    /**
     * Sets an externally managed executor for listener lanes. The registry does not shut it down.
     *
     * <p>Optional. When unset, a fixed pool of {@link #dispatchThreads(int)} daemon threads is
     * created and shut down on {@link ChannelRegistry#close()}.
     *
     * @param dispatchExecutor the executor
     * @return this builder
     */
    public Builder dispatchExecutor(ExecutorService dispatchExecutor) {
      this.dispatchExecutor = dispatchExecutor;
      return this;
    }

    /**
     * Sets the size of the internally created dispatch pool.
     *
     * <p>Optional. Defaults to {@code 4}. Must be &gt; 0.
     *
     * @param dispatchThreads pool size
     * @return this builder
     */
    public Builder dispatchThreads(int dispatchThreads) {
      this.dispatchThreads = dispatchThreads;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @return a new {@link ChannelRegistry}
     * @throws NullPointerException if {@code feed} is null
     * @throws IllegalArgumentException if {@code dispatchThreads <= 0}
     */
    public ChannelRegistry build() {
      return new ChannelRegistry(this);
    }
  }
}
