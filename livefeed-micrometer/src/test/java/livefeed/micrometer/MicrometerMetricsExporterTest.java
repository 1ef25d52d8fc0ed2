package livefeed.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void sessionCounters() {
    exporter.incrementSessionsOpened();
    exporter.incrementSessionsOpened();
    exporter.incrementSessionsClosed();
    assertEquals(2.0, counter("livefeed.sessions.opened").count());
    assertEquals(1.0, counter("livefeed.sessions.closed").count());
  }

  @Test
  void subscriptionCounters() {
    exporter.incrementSubscriptionsStarted();
    exporter.incrementSubscriptionsFailed();
    exporter.incrementSubscriptionsFailed();
    exporter.incrementSubscriptionsEnded();
    assertEquals(1.0, counter("livefeed.subscriptions.started").count());
    assertEquals(2.0, counter("livefeed.subscriptions.failed").count());
    assertEquals(1.0, counter("livefeed.subscriptions.ended").count());
  }

  @Test
  void frameCounters() {
    exporter.incrementMessagesPublished();
    exporter.incrementMessagesPublished();
    exporter.incrementMessagesPublished();
    exporter.incrementErrorsSent();
    assertEquals(3.0, counter("livefeed.messages.published").count());
    assertEquals(1.0, counter("livefeed.errors.sent").count());
  }

  @Test
  void channelCounters() {
    exporter.incrementChannelListen();
    exporter.incrementChannelUnlisten();
    exporter.incrementNotificationsReceived();
    exporter.incrementListenerFailures();
    exporter.incrementConnectionsTerminated();
    assertEquals(1.0, counter("livefeed.channel.listen").count());
    assertEquals(1.0, counter("livefeed.channel.unlisten").count());
    assertEquals(1.0, counter("livefeed.notifications.received").count());
    assertEquals(1.0, counter("livefeed.listener.failures").count());
    assertEquals(1.0, counter("livefeed.connections.terminated").count());
  }

  @Test
  void gauges() {
    exporter.recordActiveSessions(12);
    exporter.recordActiveChannels(3);
    assertEquals(12.0, gauge("livefeed.sessions.active").value());
    assertEquals(3.0, gauge("livefeed.channels.active").value());

    exporter.recordActiveSessions(0);
    assertEquals(0.0, gauge("livefeed.sessions.active").value());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry other = new SimpleMeterRegistry();
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(other, "chat.feed");
    custom.incrementSessionsOpened();
    assertEquals(1.0, other.get("chat.feed.sessions.opened").counter().count());
    assertNull(other.find("livefeed.sessions.opened").counter());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "feed."));
  }

  @Test
  void closeRemovesMetersAndStopsRecording() {
    exporter.incrementSessionsOpened();
    exporter.close();

    assertTrue(registry.getMeters().isEmpty());
    exporter.incrementSessionsOpened();
    exporter.recordActiveSessions(5);
    assertNull(registry.find("livefeed.sessions.opened").counter());
  }

  private Counter counter(String name) {
    return registry.get(name).counter();
  }

  private Gauge gauge(String name) {
    return registry.get(name).gauge();
  }
}
