package livefeed.registry;

import livefeed.NotificationException;
import livefeed.spi.NotificationFeed;
import livefeed.spi.NotificationSink;
import livefeed.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-process loopback feed. Notifications are delivered on one daemon thread in send
 * order, and only for channels currently listened on, as a store would.
 *
 * <p>Suitable for tests, H2-backed deployments and demos. It gives no fan-out across processes.
 */
public final class InMemoryNotificationFeed implements NotificationFeed {
  private static final Logger logger = Logger.getLogger(InMemoryNotificationFeed.class.getName());

  private final Set<String> listening = ConcurrentHashMap.newKeySet();
  private final ExecutorService delivery =
      Executors.newSingleThreadExecutor(new DaemonThreadFactory("livefeed-feed-"));
  private volatile NotificationSink sink;
  private volatile boolean closed;

  @Override
  public synchronized void open(NotificationSink sink) {
    if (this.sink != null) {
      throw new IllegalStateException("Feed already open");
    }
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  @Override
  public void listen(String channel) {
    checkNotClosed();
    listening.add(channel);
  }

  @Override
  public void unlisten(String channel) {
    listening.remove(channel);
  }

  @Override
  public void notify(String channel, String payload) {
    checkNotClosed();
    try {
      delivery.execute(() -> deliver(channel, payload));
    } catch (RejectedExecutionException e) {
      throw new NotificationException("Feed closed while sending on channel " + channel, e);
    }
  }

  public boolean isListening(String channel) {
    return listening.contains(channel);
  }

  @Override
  public void close() {
    closed = true;
    listening.clear();
    delivery.shutdown();
    try {
      if (!delivery.awaitTermination(5, TimeUnit.SECONDS)) {
        delivery.shutdownNow();
      }
    } catch (InterruptedException e) {
      delivery.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private void deliver(String channel, String payload) {
    NotificationSink current = sink;
    if (current == null || !listening.contains(channel)) {
      return;
    }
    try {
      current.onNotification(channel, payload);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Notification sink failed on channel " + channel, e);
    }
  }

  private void checkNotClosed() {
    if (closed) {
      throw new NotificationException("Feed has been closed");
    }
  }
}
